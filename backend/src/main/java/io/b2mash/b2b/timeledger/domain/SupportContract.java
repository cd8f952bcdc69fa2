package io.b2mash.b2b.timeledger.domain;

import java.math.BigDecimal;

public record SupportContract(
    ContractDetails details, BigDecimal dayRate, BigDecimal fixedFee, FeePeriod fixedFeePeriod)
    implements Contract {

  public enum FeePeriod {
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY
  }

  @Override
  public ContractKind kind() {
    return ContractKind.SUPPORT;
  }
}
