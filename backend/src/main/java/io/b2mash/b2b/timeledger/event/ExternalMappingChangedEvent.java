package io.b2mash.b2b.timeledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after a record carrying an external system mapping (a user's Redmine id, a contract's
 * Redmine project) was saved.
 */
public record ExternalMappingChangedEvent(String entityType, UUID entityId, Instant occurredAt) {}
