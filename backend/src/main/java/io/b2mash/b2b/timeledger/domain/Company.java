package io.b2mash.b2b.timeledger.domain;

import java.util.UUID;

/**
 * @param country ISO country code used to match holidays
 * @param internal whether employees can be contracted by this company
 */
public record Company(UUID id, String name, String country, boolean internal) {}
