package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Fields shared by every performance variant.
 *
 * @param contractId may be {@code null} for work not attributed to a contract
 * @param redmineId external time entry this performance was imported from
 */
public record PerformanceDetails(
    UUID id, UUID timesheetId, LocalDate date, UUID contractId, String redmineId) {}
