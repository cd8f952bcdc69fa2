package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

public record Timesheet(UUID id, UUID userId, int year, int month, TimesheetStatus status) {

  public YearMonth yearMonth() {
    return YearMonth.of(year, month);
  }

  public boolean covers(LocalDate date) {
    return date.getYear() == year && date.getMonthValue() == month;
  }

  public boolean isActive() {
    return status == TimesheetStatus.ACTIVE;
  }
}
