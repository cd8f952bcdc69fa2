package io.b2mash.b2b.timeledger.domain;

import java.util.Set;

public enum TimesheetStatus {
  ACTIVE,
  PENDING,
  CLOSED;

  public boolean canTransitionTo(TimesheetStatus target) {
    if (this == target) {
      return true;
    }
    return switch (this) {
      case ACTIVE -> target == PENDING;
      case PENDING -> Set.of(CLOSED, ACTIVE).contains(target);
      case CLOSED -> false;
    };
  }
}
