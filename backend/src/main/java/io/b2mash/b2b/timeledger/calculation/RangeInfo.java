package io.b2mash.b2b.timeledger.calculation;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * Totals of one user over an inclusive date range.
 *
 * @param details day details keyed by ISO date, present when daily or detailed output was requested
 * @param summary performed hours per contract, present when requested
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RangeInfo(
    UUID userId,
    LocalDate from,
    LocalDate until,
    BigDecimal workHours,
    BigDecimal performedHours,
    BigDecimal leaveHours,
    BigDecimal holidayHours,
    BigDecimal overtimeHours,
    BigDecimal remainingHours,
    BigDecimal overtimeLeaveHours,
    int standbyDays,
    Map<String, DayDetail> details,
    RangeSummary summary) {}
