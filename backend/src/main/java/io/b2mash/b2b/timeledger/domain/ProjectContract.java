package io.b2mash.b2b.timeledger.domain;

import java.math.BigDecimal;

public record ProjectContract(ContractDetails details, BigDecimal fixedFee) implements Contract {

  @Override
  public ContractKind kind() {
    return ContractKind.PROJECT;
  }
}
