package io.b2mash.b2b.timeledger.domain;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param multiplier factor applied to performed durations, e.g. 1.5 for weekend work
 */
public record PerformanceType(UUID id, String name, BigDecimal multiplier) {}
