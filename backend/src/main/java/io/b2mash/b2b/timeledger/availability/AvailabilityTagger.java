package io.b2mash.b2b.timeledger.availability;

import io.b2mash.b2b.timeledger.calculation.DailyResolver;
import io.b2mash.b2b.timeledger.calculation.PeriodSnapshot;
import io.b2mash.b2b.timeledger.calculation.PeriodSnapshotLoader;
import io.b2mash.b2b.timeledger.calculation.RangeAggregator;
import io.b2mash.b2b.timeledger.domain.LeaveDate;
import io.b2mash.b2b.timeledger.domain.LeaveType;
import io.b2mash.b2b.timeledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineConnector;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineException;
import io.b2mash.b2b.timeledger.store.IntervalStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Classifies the days of users with availability tags for resourcing views. */
@Component
public class AvailabilityTagger {

  private static final Logger log = LoggerFactory.getLogger(AvailabilityTagger.class);

  private final PeriodSnapshotLoader snapshotLoader;
  private final DailyResolver dailyResolver;
  private final IntervalStore store;
  private final RedmineConnector redmineConnector;
  private final IssueHealthPolicy issueHealthPolicy;
  private final Clock clock;

  public AvailabilityTagger(
      PeriodSnapshotLoader snapshotLoader,
      DailyResolver dailyResolver,
      IntervalStore store,
      RedmineConnector redmineConnector,
      IssueHealthPolicy issueHealthPolicy,
      Clock clock) {
    this.snapshotLoader = snapshotLoader;
    this.dailyResolver = dailyResolver;
    this.store = store;
    this.redmineConnector = redmineConnector;
    this.issueHealthPolicy = issueHealthPolicy;
    this.clock = clock;
  }

  /** Availability per user, then per ISO date, in the order the users were given. */
  public Map<UUID, Map<String, AvailabilityInfo>> getAvailabilityInfo(
      List<UUID> userIds, LocalDate from, LocalDate until) {
    RangeAggregator.requireValidRange(from, until);
    var result = new LinkedHashMap<UUID, Map<String, AvailabilityInfo>>();
    for (var userId : new LinkedHashSet<>(userIds)) {
      var snapshot = snapshotLoader.load(userId, from, until);
      var days = new LinkedHashMap<String, AvailabilityInfo>();
      for (var date = from; !date.isAfter(until); date = date.plusDays(1)) {
        days.put(date.toString(), tag(snapshot, date));
      }
      result.put(userId, days);
    }
    return result;
  }

  /**
   * Internal availability of the given users on one day. Users fully committed to contracts are
   * left out.
   */
  public Map<UUID, InternalAvailabilityInfo> getInternalAvailabilityInfo(
      List<UUID> userIds, LocalDate date) {
    var now = ZonedDateTime.now(clock);
    var result = new LinkedHashMap<UUID, InternalAvailabilityInfo>();
    for (var userId : new LinkedHashSet<>(userIds)) {
      var day = tag(snapshotLoader.load(userId, date, date), date);
      if (day.isFullyCommitted()) {
        continue;
      }
      var freeHours = day.workHours().subtract(day.scheduledHours());
      boolean available = freeHours.compareTo(BigDecimal.ONE) >= 0;
      List<IssueAssessment> issues =
          available && !date.isBefore(now.toLocalDate())
              ? assessIssues(userId, date, now)
              : List.of();
      result.put(
          userId,
          new InternalAvailabilityInfo(
              userId,
              date,
              day.tags(),
              day.workHours(),
              day.scheduledHours(),
              freeHours,
              available,
              issues));
    }
    return result;
  }

  AvailabilityInfo tag(PeriodSnapshot snapshot, LocalDate date) {
    var day = dailyResolver.resolve(snapshot, date, false);
    var tags = new ArrayList<AvailabilityTag>();

    var dayOfWeek = date.getDayOfWeek();
    if (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY) {
      tags.add(AvailabilityTag.WEEKEND);
    }

    boolean holiday =
        snapshot
            .employmentContractOn(date)
            .flatMap(snapshot::countryOf)
            .map(country -> !snapshot.holidaysOn(date, country).isEmpty())
            .orElse(false);
    if (holiday) {
      tags.add(AvailabilityTag.HOLIDAY);
    }

    var leaveDates = snapshot.leaveDatesOn(date);
    if (!leaveDates.isEmpty()) {
      tags.add(AvailabilityTag.LEAVE);
      boolean sick =
          leaveDates.stream()
              .anyMatch(d -> snapshot.leaveTypeOf(d).map(LeaveType::sickness).orElse(false));
      if (sick) {
        tags.add(AvailabilityTag.SICKNESS);
      }
    }

    var work = day.workHours();
    var scheduled = day.scheduledHours();
    if (scheduled.signum() > 0) {
      tags.add(AvailabilityTag.SCHEDULED);
    }
    if (work.signum() > 0 && !holiday) {
      if (scheduled.compareTo(work) >= 0) {
        tags.add(AvailabilityTag.NOT_AVAILABLE_FOR_INTERNAL_WORK);
      } else if (work.subtract(scheduled).subtract(day.leaveHours()).signum() > 0) {
        tags.add(AvailabilityTag.FREE_HOURS_AVAILABLE);
      }
    }

    return new AvailabilityInfo(
        date, List.copyOf(tags), leaveDates.stream().map(LeaveDate::id).toList(), work, scheduled);
  }

  private List<IssueAssessment> assessIssues(UUID userId, LocalDate date, ZonedDateTime now) {
    if (!redmineConnector.isConfigured()) {
      return List.of();
    }
    var user =
        store.findUser(userId).orElseThrow(() -> new ResourceNotFoundException("User", userId));
    try {
      var redmineUserId = redmineConnector.resolveUserId(user);
      if (redmineUserId.isEmpty()) {
        return List.of();
      }
      return redmineConnector.listUserIssues(redmineUserId.get()).stream()
          .map(
              issue ->
                  new IssueAssessment(
                      issue.id(),
                      issue.subject(),
                      issue.statusName(),
                      issue.startDate(),
                      issue.dueDate(),
                      issue.updatedOn(),
                      issueHealthPolicy.assess(issue, date, now)))
          .toList();
    } catch (RedmineException e) {
      log.warn("Could not fetch Redmine issues of user {}: {}", user.username(), e.getMessage());
      return List.of();
    }
  }
}
