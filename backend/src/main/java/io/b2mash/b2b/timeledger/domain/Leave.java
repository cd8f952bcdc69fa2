package io.b2mash.b2b.timeledger.domain;

import java.util.UUID;

public record Leave(
    UUID id, UUID userId, UUID leaveTypeId, LeaveStatus status, String description) {}
