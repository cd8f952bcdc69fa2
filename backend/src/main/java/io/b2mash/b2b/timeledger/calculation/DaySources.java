package io.b2mash.b2b.timeledger.calculation;

import java.util.List;
import java.util.UUID;

/** Records that contributed to a day detail. */
public record DaySources(
    List<UUID> holidayIds, List<UUID> leaveDateIds, List<UUID> performanceIds) {}
