package io.b2mash.b2b.timeledger.domain;

import java.util.UUID;

/**
 * @param redmineId stored external identity, {@code null} when it has to be looked up by username
 */
public record User(UUID id, String username, String email, Integer redmineId) {}
