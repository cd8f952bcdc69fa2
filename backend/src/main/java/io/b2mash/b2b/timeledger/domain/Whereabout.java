package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDateTime;
import java.util.UUID;

/** Where a user was during part of a day, booked on a timesheet. */
public record Whereabout(
    UUID id,
    UUID timesheetId,
    UUID locationId,
    LocalDateTime startsAt,
    LocalDateTime endsAt,
    String description) {}
