package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDate;
import java.util.UUID;

/** Work performed on a single day. Switch on {@link #kind()} for variant-specific fields. */
public sealed interface Performance permits ActivityPerformance, StandbyPerformance {

  PerformanceDetails details();

  PerformanceKind kind();

  default UUID id() {
    return details().id();
  }

  default LocalDate date() {
    return details().date();
  }

  default UUID contractId() {
    return details().contractId();
  }
}
