package io.b2mash.b2b.timeledger.domain;

import java.util.UUID;

/**
 * @param overtime leave taken from the overtime balance
 * @param sickness sick leave
 */
public record LeaveType(UUID id, String name, boolean overtime, boolean sickness) {}
