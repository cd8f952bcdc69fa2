package io.b2mash.b2b.timeledger.domain;

public enum ContractKind {
  PROJECT,
  CONSULTANCY,
  SUPPORT
}
