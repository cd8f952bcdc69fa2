package io.b2mash.b2b.timeledger.domain;

public enum PerformanceKind {
  ACTIVITY,
  STANDBY
}
