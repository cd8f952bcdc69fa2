package io.b2mash.b2b.timeledger.domain;

import java.math.BigDecimal;

/**
 * @param dayRate price per consulted day
 * @param duration number of hours sold
 */
public record ConsultancyContract(ContractDetails details, BigDecimal dayRate, BigDecimal duration)
    implements Contract {

  @Override
  public ContractKind kind() {
    return ContractKind.CONSULTANCY;
  }
}
