package io.b2mash.b2b.timeledger.calculation;

import io.b2mash.b2b.timeledger.domain.Contract;
import io.b2mash.b2b.timeledger.domain.Hours;
import io.b2mash.b2b.timeledger.domain.Performance;
import io.b2mash.b2b.timeledger.exception.InvalidStateException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Drives the {@link DailyResolver} over every day of an inclusive range. Users are resolved
 * independently on the engine pool; the days of one user are walked in order.
 */
@Component
public class RangeAggregator {

  private static final Logger log = LoggerFactory.getLogger(RangeAggregator.class);

  private final PeriodSnapshotLoader snapshotLoader;
  private final DailyResolver dailyResolver;
  private final ExecutorService engineExecutor;

  public RangeAggregator(
      PeriodSnapshotLoader snapshotLoader,
      DailyResolver dailyResolver,
      @Qualifier("engineExecutor") ExecutorService engineExecutor) {
    this.snapshotLoader = snapshotLoader;
    this.dailyResolver = dailyResolver;
    this.engineExecutor = engineExecutor;
  }

  /** Range info per user, in the order the users were given. Duplicate ids are resolved once. */
  public Map<UUID, RangeInfo> getRangeInfo(
      List<UUID> userIds, LocalDate from, LocalDate until, RangeOptions options) {
    requireValidRange(from, until);
    var distinctUserIds = new ArrayList<>(new LinkedHashSet<>(userIds));
    var result = new LinkedHashMap<UUID, RangeInfo>();

    if (distinctUserIds.size() <= 1) {
      distinctUserIds.forEach(id -> result.put(id, getRangeInfo(id, from, until, options)));
      return result;
    }

    var futures =
        distinctUserIds.stream()
            .map(
                id ->
                    CompletableFuture.supplyAsync(
                        () -> getRangeInfo(id, from, until, options), engineExecutor))
            .toList();
    for (int i = 0; i < distinctUserIds.size(); i++) {
      result.put(distinctUserIds.get(i), join(futures.get(i)));
    }
    log.debug(
        "Resolved range {}..{} for {} users (options={})",
        from,
        until,
        distinctUserIds.size(),
        options);
    return result;
  }

  public RangeInfo getRangeInfo(
      UUID userId, LocalDate from, LocalDate until, RangeOptions options) {
    requireValidRange(from, until);
    return aggregate(snapshotLoader.load(userId, from, until), options);
  }

  RangeInfo aggregate(PeriodSnapshot snapshot, RangeOptions options) {
    var totals = new Totals();
    Map<String, DayDetail> details = options.retainDays() ? new LinkedHashMap<>() : null;

    for (var date = snapshot.from(); !date.isAfter(snapshot.until()); date = date.plusDays(1)) {
      var day = dailyResolver.resolve(snapshot, date, options.detailed());
      totals.add(day);
      if (details != null) {
        details.put(date.toString(), day);
      }
    }

    return new RangeInfo(
        snapshot.userId(),
        snapshot.from(),
        snapshot.until(),
        totals.workHours,
        totals.performedHours,
        totals.leaveHours,
        totals.holidayHours,
        totals.overtimeHours,
        totals.remainingHours,
        totals.overtimeLeaveHours,
        totals.standbyDays,
        details,
        options.summary() ? summarize(snapshot) : null);
  }

  /** Performances without a contract count toward the totals but are left out of the summary. */
  private RangeSummary summarize(PeriodSnapshot snapshot) {
    var durations = new LinkedHashMap<UUID, BigDecimal>();
    var standbyDays = new LinkedHashMap<UUID, Integer>();
    for (Performance performance : snapshot.performances()) {
      if (performance.contractId() == null) {
        continue;
      }
      var contractId = performance.contractId();
      switch (performance.kind()) {
        case ACTIVITY ->
            durations.merge(
                contractId, DailyResolver.normalized(snapshot, performance), BigDecimal::add);
        case STANDBY -> {
          durations.putIfAbsent(contractId, Hours.ZERO);
          standbyDays.merge(contractId, 1, Integer::sum);
        }
      }
    }

    var totals =
        durations.entrySet().stream()
            .map(
                entry -> {
                  var contract = snapshot.contract(entry.getKey());
                  return new ContractPerformanceTotal(
                      entry.getKey(),
                      contract.map(Contract::name).orElse(null),
                      contract.map(Contract::kind).orElse(null),
                      Hours.normalize(entry.getValue()),
                      standbyDays.getOrDefault(entry.getKey(), 0));
                })
            .sorted(
                Comparator.comparing(
                    ContractPerformanceTotal::contractName,
                    Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
            .toList();
    return new RangeSummary(totals);
  }

  public static void requireValidRange(LocalDate from, LocalDate until) {
    if (from == null || until == null) {
      throw new InvalidStateException("Invalid date range", "Both from and until are required");
    }
    if (until.isBefore(from)) {
      throw new InvalidStateException(
          "Invalid date range", "Until date " + until + " is before from date " + from);
    }
  }

  private static RangeInfo join(CompletableFuture<RangeInfo> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw e;
    }
  }

  private static final class Totals {
    private BigDecimal workHours = Hours.ZERO;
    private BigDecimal performedHours = Hours.ZERO;
    private BigDecimal leaveHours = Hours.ZERO;
    private BigDecimal holidayHours = Hours.ZERO;
    private BigDecimal overtimeHours = Hours.ZERO;
    private BigDecimal remainingHours = Hours.ZERO;
    private BigDecimal overtimeLeaveHours = Hours.ZERO;
    private int standbyDays;

    private void add(DayDetail day) {
      workHours = workHours.add(day.workHours());
      performedHours = performedHours.add(day.performedHours());
      leaveHours = leaveHours.add(day.leaveHours());
      holidayHours = holidayHours.add(day.holidayHours());
      overtimeHours = overtimeHours.add(day.overtimeHours());
      remainingHours = remainingHours.add(day.remainingHours());
      overtimeLeaveHours = overtimeLeaveHours.add(day.overtimeLeaveHours());
      standbyDays += day.standbyDays();
    }
  }
}
