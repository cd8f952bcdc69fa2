package io.b2mash.b2b.timeledger.validation;

public enum ConflictKind {
  /** Another record for the same subject covers part of the same interval. */
  OVERLAP,
  /** The record's own bounds are inconsistent. */
  INVALID_INTERVAL,
  /** A value lies outside its allowed range. */
  OUT_OF_RANGE,
  /** A uniqueness constraint is violated. */
  DUPLICATE,
  /** A referenced record is in a state that does not accept the change. */
  INVALID_STATE,
  /** A referenced record does not belong with this one. */
  INVALID_REFERENCE
}
