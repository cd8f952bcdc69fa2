package io.b2mash.b2b.timeledger.domain;

public enum LeaveStatus {
  DRAFT,
  PENDING,
  APPROVED,
  REJECTED
}
