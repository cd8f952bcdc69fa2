package io.b2mash.b2b.timeledger.calculation;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Hour breakdown of one user on one day.
 *
 * @param workHours hours the employment contract expects on this weekday, kept on holidays
 * @param scheduledHours hours committed to contracts through contract work schedules
 * @param overtimeLeaveHours part of {@code leaveHours} taken from the overtime balance
 * @param overtimeHours hours performed or covered beyond the day's obligation
 * @param remainingHours obligation left uncovered, never negative
 * @param sources contributing records, only present for detailed requests
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DayDetail(
    LocalDate date,
    BigDecimal workHours,
    BigDecimal scheduledHours,
    BigDecimal holidayHours,
    BigDecimal leaveHours,
    BigDecimal overtimeLeaveHours,
    BigDecimal performedHours,
    BigDecimal overtimeHours,
    BigDecimal remainingHours,
    int standbyDays,
    DaySources sources) {}
