package io.b2mash.b2b.timeledger.overtime;

import io.b2mash.b2b.timeledger.calculation.RangeAggregator;
import io.b2mash.b2b.timeledger.calculation.RangeOptions;
import io.b2mash.b2b.timeledger.domain.EmploymentContract;
import io.b2mash.b2b.timeledger.domain.Hours;
import io.b2mash.b2b.timeledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.timeledger.store.IntervalStore;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Folds monthly range totals into a running overtime balance. Each month covers the full calendar
 * month, whatever day of the month the bounds fall on. The balance starts at zero in the first
 * month and is never persisted, so it is only meaningful when the series starts at a stable epoch.
 */
@Component
public class OvertimeBanker {

  private static final Logger log = LoggerFactory.getLogger(OvertimeBanker.class);

  private final RangeAggregator rangeAggregator;
  private final IntervalStore store;

  public OvertimeBanker(RangeAggregator rangeAggregator, IntervalStore store) {
    this.rangeAggregator = rangeAggregator;
    this.store = store;
  }

  public List<OvertimeMonth> getOvertimeSeries(UUID userId, LocalDate from, LocalDate until) {
    RangeAggregator.requireValidRange(from, until);
    var series = new ArrayList<OvertimeMonth>();
    var balance = Hours.ZERO;

    for (var month = YearMonth.from(from);
        !month.isAfter(YearMonth.from(until));
        month = month.plusMonths(1)) {
      var info =
          rangeAggregator.getRangeInfo(
              userId, month.atDay(1), month.atEndOfMonth(), RangeOptions.TOTALS_ONLY);
      balance =
          balance
              .add(info.overtimeHours())
              .subtract(info.remainingHours())
              .subtract(info.overtimeLeaveHours());
      series.add(
          new OvertimeMonth(
              month.getYear(),
              month.getMonthValue(),
              info.overtimeHours(),
              info.remainingHours(),
              info.overtimeLeaveHours(),
              balance));
    }
    return series;
  }

  /** Series from the month the user's first employment contract started. */
  public List<OvertimeMonth> getOvertimeSeriesSinceEmployment(UUID userId, LocalDate until) {
    store.findUser(userId).orElseThrow(() -> new ResourceNotFoundException("User", userId));
    var epoch =
        store.findEmploymentContracts(userId).stream()
            .map(EmploymentContract::startedAt)
            .min(Comparator.naturalOrder());
    if (epoch.isEmpty() || epoch.get().isAfter(until)) {
      log.debug("User {} has no employment before {}, empty overtime series", userId, until);
      return List.of();
    }
    return getOvertimeSeries(userId, epoch.get(), until);
  }
}
