package io.b2mash.b2b.timeledger.overtime;

import java.math.BigDecimal;

/**
 * One month of the overtime series.
 *
 * @param overtimeHours overtime earned during the month
 * @param remainingHours obligation left uncovered during the month
 * @param usedOvertimeHours approved leave taken from the overtime balance during the month
 * @param remainingOvertimeHours running balance at the end of the month
 */
public record OvertimeMonth(
    int year,
    int month,
    BigDecimal overtimeHours,
    BigDecimal remainingHours,
    BigDecimal usedOvertimeHours,
    BigDecimal remainingOvertimeHours) {}
