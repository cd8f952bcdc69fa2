package io.b2mash.b2b.timeledger.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/** Part of a leave falling on a single day, booked on the timesheet of that month. */
public record LeaveDate(
    UUID id, UUID leaveId, UUID timesheetId, LocalDateTime startsAt, LocalDateTime endsAt) {

  public LocalDate date() {
    return startsAt.toLocalDate();
  }

  public BigDecimal duration() {
    var seconds = Duration.between(startsAt, endsAt).toSeconds();
    return BigDecimal.valueOf(seconds).divide(BigDecimal.valueOf(3600), 2, RoundingMode.HALF_UP);
  }
}
