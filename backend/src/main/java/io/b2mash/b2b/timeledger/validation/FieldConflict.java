package io.b2mash.b2b.timeledger.validation;

/**
 * A single invariant violation, tagged with the entity and field that caused it.
 *
 * @param entity record type, e.g. {@code leave_date}
 * @param field offending field, e.g. {@code starts_at}
 */
public record FieldConflict(ConflictKind kind, String entity, String field, String message) {

  static FieldConflict of(ConflictKind kind, String entity, String field, String message) {
    return new FieldConflict(kind, entity, field, message);
  }
}
