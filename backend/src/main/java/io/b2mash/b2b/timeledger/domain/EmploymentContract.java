package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Employment of a user by a company. Both bounds are inclusive; a {@code null} end means the
 * contract is ongoing.
 */
public record EmploymentContract(
    UUID id,
    UUID userId,
    UUID companyId,
    UUID workScheduleId,
    LocalDate startedAt,
    LocalDate endedAt) {

  public DateInterval interval() {
    return new DateInterval(startedAt, endedAt);
  }

  public boolean isActiveOn(LocalDate date) {
    return interval().contains(date);
  }
}
