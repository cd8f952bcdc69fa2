package io.b2mash.b2b.timeledger.calculation;

import io.b2mash.b2b.timeledger.domain.ContractKind;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * @param duration summed normalized duration of activity performances
 * @param standbyDays number of standby performances
 */
public record ContractPerformanceTotal(
    UUID contractId,
    String contractName,
    ContractKind contractKind,
    BigDecimal duration,
    int standbyDays) {}
