package io.b2mash.b2b.timeledger.availability;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AvailabilityTag {
  WEEKEND,
  HOLIDAY,
  LEAVE,
  SICKNESS,
  /** Has hours committed to a contract through a contract work schedule. */
  SCHEDULED,
  /** Contract work schedules cover the whole day. */
  NOT_AVAILABLE_FOR_INTERNAL_WORK,
  FREE_HOURS_AVAILABLE;

  @JsonValue
  public String code() {
    return name().toLowerCase();
  }
}
