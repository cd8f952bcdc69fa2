package io.b2mash.b2b.timeledger.availability;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueHealth {
  GREEN,
  YELLOW,
  RED;

  @JsonValue
  public String code() {
    return name().toLowerCase();
  }
}
