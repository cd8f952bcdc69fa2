package io.b2mash.b2b.timeledger.domain;

import java.util.UUID;

/**
 * A customer contract. The variant is identified by {@link #kind()}; code that needs
 * variant-specific fields switches on the kind.
 */
public sealed interface Contract permits ProjectContract, ConsultancyContract, SupportContract {

  ContractDetails details();

  ContractKind kind();

  default UUID id() {
    return details().id();
  }

  default String name() {
    return details().name();
  }
}
