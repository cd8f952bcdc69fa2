package io.b2mash.b2b.timeledger.availability;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Whether a user can take on internal work on a given day.
 *
 * @param freeHours work hours not committed through contract work schedules
 * @param availableForInternal at least one free hour
 * @param issues open Redmine issues of the user, only looked up for available users from today on
 */
public record InternalAvailabilityInfo(
    UUID userId,
    LocalDate date,
    List<AvailabilityTag> tags,
    BigDecimal workHours,
    BigDecimal scheduledHours,
    BigDecimal freeHours,
    boolean availableForInternal,
    List<IssueAssessment> issues) {}
