package io.b2mash.b2b.timeledger.integration.redmine;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/** Redmine issue, reduced to the fields used for attribution and health assessment. */
public record Issue(
    int id,
    String subject,
    Integer projectId,
    Integer parentId,
    Integer statusId,
    String statusName,
    LocalDate startDate,
    LocalDate dueDate,
    Instant updatedOn,
    List<CustomField> customFields) {

  public Issue {
    customFields = customFields == null ? List.of() : List.copyOf(customFields);
  }

  public Optional<String> customFieldValue(String name) {
    return customFields.stream()
        .filter(field -> name.equals(field.name()))
        .map(CustomField::value)
        .filter(value -> value != null && !value.isBlank())
        .findFirst();
  }

  public record CustomField(int id, String name, String value) {}
}
