package io.b2mash.b2b.timeledger.calculation;

import io.b2mash.b2b.timeledger.domain.ActivityPerformance;
import io.b2mash.b2b.timeledger.domain.ContractUserWorkSchedule;
import io.b2mash.b2b.timeledger.domain.Holiday;
import io.b2mash.b2b.timeledger.domain.Hours;
import io.b2mash.b2b.timeledger.domain.LeaveDate;
import io.b2mash.b2b.timeledger.domain.LeaveType;
import io.b2mash.b2b.timeledger.domain.Performance;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Merges employment, contract schedules, holidays, approved leave and performances of one user into
 * a {@link DayDetail}. A day without employment contract has no obligation; work performed on it is
 * still reported.
 */
@Component
public class DailyResolver {

  private final PeriodSnapshotLoader snapshotLoader;

  public DailyResolver(PeriodSnapshotLoader snapshotLoader) {
    this.snapshotLoader = snapshotLoader;
  }

  public DayDetail resolveDay(UUID userId, LocalDate date) {
    return resolve(snapshotLoader.load(userId, date, date), date, false);
  }

  public DayDetail resolve(PeriodSnapshot snapshot, LocalDate date, boolean withSources) {
    var dayOfWeek = date.getDayOfWeek();
    var employment = snapshot.employmentContractOn(date);

    var workHours =
        employment
            .flatMap(snapshot::workScheduleOf)
            .map(schedule -> schedule.hours().hoursOn(dayOfWeek))
            .orElse(Hours.ZERO);

    var scheduledHours = Hours.ZERO;
    for (ContractUserWorkSchedule schedule : snapshot.contractUserWorkSchedulesOn(date)) {
      scheduledHours = scheduledHours.add(schedule.hours().hoursOn(dayOfWeek));
    }

    List<Holiday> holidays =
        employment
            .flatMap(snapshot::countryOf)
            .map(country -> snapshot.holidaysOn(date, country))
            .orElse(List.of());
    var holidayHours = holidays.isEmpty() ? Hours.ZERO : workHours;

    var leaveDates = snapshot.leaveDatesOn(date);
    var leaveHours = Hours.ZERO;
    var overtimeLeaveHours = Hours.ZERO;
    for (LeaveDate leaveDate : leaveDates) {
      var duration = leaveDate.duration();
      leaveHours = leaveHours.add(duration);
      if (snapshot.leaveTypeOf(leaveDate).map(LeaveType::overtime).orElse(false)) {
        overtimeLeaveHours = overtimeLeaveHours.add(duration);
      }
    }

    var performances = snapshot.performancesOn(date);
    var performedHours = Hours.ZERO;
    int standbyDays = 0;
    for (Performance performance : performances) {
      switch (performance.kind()) {
        case ACTIVITY -> performedHours = performedHours.add(normalized(snapshot, performance));
        case STANDBY -> standbyDays++;
      }
    }

    var covered = holidayHours.add(leaveHours).add(performedHours);
    var remainingHours = Hours.nonNegative(workHours.subtract(covered));
    var overtimeHours = Hours.nonNegative(covered.subtract(workHours));

    DaySources sources = null;
    if (withSources) {
      sources =
          new DaySources(
              holidays.stream().map(Holiday::id).toList(),
              leaveDates.stream().map(LeaveDate::id).toList(),
              performances.stream().map(Performance::id).toList());
    }

    return new DayDetail(
        date,
        workHours,
        scheduledHours,
        holidayHours,
        leaveHours,
        overtimeLeaveHours,
        performedHours,
        overtimeHours,
        remainingHours,
        standbyDays,
        sources);
  }

  /** Activity duration weighted by its performance type multiplier. */
  static BigDecimal normalized(PeriodSnapshot snapshot, Performance performance) {
    var activity = (ActivityPerformance) performance;
    return snapshot
        .performanceType(activity.performanceTypeId())
        .map(activity::normalizedDuration)
        .orElse(activity.duration());
  }
}
