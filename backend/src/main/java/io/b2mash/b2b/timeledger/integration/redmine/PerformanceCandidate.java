package io.b2mash.b2b.timeledger.integration.redmine;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A Redmine time entry attributed to an internal contract, ready to be committed as an activity
 * performance.
 *
 * @param id id of the performance previously imported from the same entry, {@code null} if new
 * @param redmineId id of the Redmine time entry
 */
public record PerformanceCandidate(
    UUID id,
    UUID contractId,
    String redmineId,
    BigDecimal duration,
    String description,
    LocalDate date) {}
