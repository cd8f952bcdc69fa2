package io.b2mash.b2b.timeledger.domain;

import java.util.UUID;

/** Assignment of a user to a contract in a given role. */
public record ContractUser(UUID id, UUID contractId, UUID userId, UUID contractRoleId) {}
