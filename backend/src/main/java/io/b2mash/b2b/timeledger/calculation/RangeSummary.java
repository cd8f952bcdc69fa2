package io.b2mash.b2b.timeledger.calculation;

import java.util.List;

public record RangeSummary(List<ContractPerformanceTotal> performances) {}
