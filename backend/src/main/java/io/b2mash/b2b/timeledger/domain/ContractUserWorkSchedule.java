package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDate;
import java.util.UUID;

/** Hours a user is committed to a contract assignment, per weekday, over an inclusive interval. */
public record ContractUserWorkSchedule(
    UUID id, UUID contractUserId, LocalDate startsAt, LocalDate endsAt, WeeklyHours hours) {

  public DateInterval interval() {
    return new DateInterval(startsAt, endsAt);
  }

  public boolean isActiveOn(LocalDate date) {
    return interval().contains(date);
  }
}
