package io.b2mash.b2b.timeledger.domain;

/** A day on call. Counted in days rather than hours. */
public record StandbyPerformance(PerformanceDetails details) implements Performance {

  @Override
  public PerformanceKind kind() {
    return PerformanceKind.STANDBY;
  }
}
