package io.b2mash.b2b.timeledger.domain;

import java.math.BigDecimal;
import java.util.UUID;

public record ActivityPerformance(
    PerformanceDetails details,
    UUID performanceTypeId,
    UUID contractRoleId,
    String description,
    BigDecimal duration)
    implements Performance {

  public ActivityPerformance {
    duration = Hours.normalize(duration);
  }

  @Override
  public PerformanceKind kind() {
    return PerformanceKind.ACTIVITY;
  }

  public BigDecimal normalizedDuration(PerformanceType type) {
    return Hours.normalize(duration.multiply(type.multiplier()));
  }
}
