package io.b2mash.b2b.timeledger.validation;

import io.b2mash.b2b.timeledger.domain.ActivityPerformance;
import io.b2mash.b2b.timeledger.domain.Company;
import io.b2mash.b2b.timeledger.domain.Contract;
import io.b2mash.b2b.timeledger.domain.ContractKind;
import io.b2mash.b2b.timeledger.domain.ContractUser;
import io.b2mash.b2b.timeledger.domain.ContractUserWorkSchedule;
import io.b2mash.b2b.timeledger.domain.EmploymentContract;
import io.b2mash.b2b.timeledger.domain.Holiday;
import io.b2mash.b2b.timeledger.domain.Leave;
import io.b2mash.b2b.timeledger.domain.LeaveDate;
import io.b2mash.b2b.timeledger.domain.Performance;
import io.b2mash.b2b.timeledger.domain.PerformanceKind;
import io.b2mash.b2b.timeledger.domain.PerformanceType;
import io.b2mash.b2b.timeledger.domain.SupportContract;
import io.b2mash.b2b.timeledger.domain.Timesheet;
import io.b2mash.b2b.timeledger.domain.TimesheetStatus;
import io.b2mash.b2b.timeledger.domain.WeeklyHours;
import io.b2mash.b2b.timeledger.domain.Whereabout;
import io.b2mash.b2b.timeledger.domain.WorkSchedule;
import io.b2mash.b2b.timeledger.exception.IntervalConflictException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Checks a candidate record against the records already stored for the same subject. Every method
 * is a pure function of its arguments and reports the first violated rule, or empty when the
 * candidate may be committed. Callers are responsible for passing the right subject scope (e.g.
 * all non-rejected leave dates of the user), the candidate itself is excluded by id.
 */
@Component
public class IntervalInvariantValidator {

  private static final BigDecimal MAX_DAY_HOURS = new BigDecimal("24");
  private static final BigDecimal MIN_DURATION = new BigDecimal("0.01");
  private static final BigDecimal MAX_MULTIPLIER = new BigDecimal("5");

  public static void requireValid(Optional<FieldConflict> result) {
    if (result.isPresent()) {
      throw new IntervalConflictException(result.get());
    }
  }

  public Optional<FieldConflict> validateEmploymentContract(
      EmploymentContract candidate, Company company, List<EmploymentContract> existingForUser) {
    if (candidate.endedAt() != null && candidate.endedAt().isBefore(candidate.startedAt())) {
      return conflict(
          ConflictKind.INVALID_INTERVAL,
          "employment_contract",
          "ended_at",
          "The end date should not come before the start date.");
    }
    if (company != null && !company.internal()) {
      return conflict(
          ConflictKind.INVALID_REFERENCE,
          "employment_contract",
          "company",
          "Employment contracts can only be created for internal companies.");
    }
    boolean overlapping =
        existingForUser.stream()
            .filter(other -> !Objects.equals(other.id(), candidate.id()))
            .filter(other -> other.userId().equals(candidate.userId()))
            .filter(other -> other.companyId().equals(candidate.companyId()))
            .anyMatch(other -> other.interval().overlaps(candidate.interval()));
    if (overlapping) {
      return conflict(
          ConflictKind.OVERLAP,
          "employment_contract",
          "user",
          "The selected user already has an active employment contract for this company.");
    }
    return Optional.empty();
  }

  public Optional<FieldConflict> validateWorkSchedule(WorkSchedule candidate) {
    return validateWeeklyHours("work_schedule", candidate.hours());
  }

  public Optional<FieldConflict> validateContractUserWorkSchedule(
      ContractUserWorkSchedule candidate, List<ContractUserWorkSchedule> existingForContractUser) {
    if (candidate.endsAt() != null && candidate.endsAt().isBefore(candidate.startsAt())) {
      return conflict(
          ConflictKind.INVALID_INTERVAL,
          "contract_user_work_schedule",
          "ends_at",
          "The end date should not come before the start date.");
    }
    var hours = validateWeeklyHours("contract_user_work_schedule", candidate.hours());
    if (hours.isPresent()) {
      return hours;
    }
    boolean overlapping =
        existingForContractUser.stream()
            .filter(other -> !Objects.equals(other.id(), candidate.id()))
            .filter(other -> other.contractUserId().equals(candidate.contractUserId()))
            .anyMatch(other -> other.interval().overlaps(candidate.interval()));
    if (overlapping) {
      return conflict(
          ConflictKind.OVERLAP,
          "contract_user_work_schedule",
          "starts_at",
          "The given contract user already has a work schedule for this period.");
    }
    return Optional.empty();
  }

  public Optional<FieldConflict> validateHoliday(Holiday candidate, List<Holiday> existing) {
    boolean duplicate =
        existing.stream()
            .filter(other -> !Objects.equals(other.id(), candidate.id()))
            .anyMatch(
                other ->
                    other.date().equals(candidate.date())
                        && other.name().equalsIgnoreCase(candidate.name())
                        && other.country().equalsIgnoreCase(candidate.country()));
    if (duplicate) {
      return conflict(
          ConflictKind.DUPLICATE,
          "holiday",
          "date",
          "A holiday with this name already exists on this date for this country.");
    }
    return Optional.empty();
  }

  public Optional<FieldConflict> validateTimesheet(
      Timesheet candidate, Optional<Timesheet> previous, List<Timesheet> existingForUser) {
    if (candidate.month() < 1 || candidate.month() > 12) {
      return conflict(
          ConflictKind.OUT_OF_RANGE, "timesheet", "month", "The month should be between 1 and 12.");
    }
    if (previous.isEmpty() && candidate.status() != TimesheetStatus.ACTIVE) {
      return conflict(
          ConflictKind.INVALID_STATE,
          "timesheet",
          "status",
          "Timesheets must be set to active when created.");
    }
    if (previous.isPresent() && !previous.get().status().canTransitionTo(candidate.status())) {
      return conflict(
          ConflictKind.INVALID_STATE,
          "timesheet",
          "status",
          "A "
              + previous.get().status().name().toLowerCase()
              + " timesheet cannot become "
              + candidate.status().name().toLowerCase()
              + ".");
    }
    boolean duplicate =
        existingForUser.stream()
            .filter(other -> !Objects.equals(other.id(), candidate.id()))
            .anyMatch(
                other ->
                    other.userId().equals(candidate.userId())
                        && other.year() == candidate.year()
                        && other.month() == candidate.month());
    if (duplicate) {
      return conflict(
          ConflictKind.DUPLICATE,
          "timesheet",
          "year",
          "A timesheet for this user, year and month already exists.");
    }
    return Optional.empty();
  }

  /**
   * @param existingForUser leave dates of the timesheet's user that belong to non-rejected leaves
   */
  public Optional<FieldConflict> validateLeaveDate(
      LeaveDate candidate, Leave leave, Timesheet timesheet, List<LeaveDate> existingForUser) {
    var bounds = validateSameDayBounds("leave_date", candidate.startsAt(), candidate.endsAt());
    if (bounds.isPresent()) {
      return bounds;
    }
    boolean overlapping =
        existingForUser.stream()
            .filter(other -> !Objects.equals(other.id(), candidate.id()))
            .anyMatch(
                other ->
                    !candidate.startsAt().isAfter(other.endsAt())
                        && !candidate.endsAt().isBefore(other.startsAt()));
    if (overlapping) {
      return conflict(
          ConflictKind.OVERLAP,
          "leave_date",
          "user",
          "User already has leave planned during this time.");
    }
    if (!timesheet.covers(candidate.date())) {
      return conflict(
          ConflictKind.INVALID_REFERENCE,
          "leave_date",
          "timesheet",
          "The selected timesheet is not for the given leave date month/year.");
    }
    if (!timesheet.isActive()) {
      return conflict(
          ConflictKind.INVALID_STATE,
          "leave_date",
          "timesheet",
          "You can only add leave dates to active timesheets.");
    }
    if (!leave.userId().equals(timesheet.userId())) {
      return conflict(
          ConflictKind.INVALID_REFERENCE,
          "leave_date",
          "leave",
          "The selected leave does not belong to the user of the timesheet.");
    }
    return Optional.empty();
  }

  /** Whereabouts may touch each other at their bounds, only strict overlaps conflict. */
  public Optional<FieldConflict> validateWhereabout(
      Whereabout candidate, Timesheet timesheet, List<Whereabout> existingForUser) {
    var bounds = validateSameDayBounds("whereabout", candidate.startsAt(), candidate.endsAt());
    if (bounds.isPresent()) {
      return bounds;
    }
    boolean overlapping =
        existingForUser.stream()
            .filter(other -> !Objects.equals(other.id(), candidate.id()))
            .anyMatch(
                other ->
                    candidate.startsAt().isBefore(other.endsAt())
                        && candidate.endsAt().isAfter(other.startsAt()));
    if (overlapping) {
      return conflict(
          ConflictKind.OVERLAP,
          "whereabout",
          "user",
          "User already has a whereabout during this time.");
    }
    if (!timesheet.covers(candidate.startsAt().toLocalDate())) {
      return conflict(
          ConflictKind.INVALID_REFERENCE,
          "whereabout",
          "timesheet",
          "The selected timesheet is not for the given whereabout month/year.");
    }
    if (!timesheet.isActive()) {
      return conflict(
          ConflictKind.INVALID_STATE,
          "whereabout",
          "timesheet",
          "You can only add whereabouts to active timesheets.");
    }
    return Optional.empty();
  }

  public Optional<FieldConflict> validateContract(Contract candidate) {
    var details = candidate.details();
    if (details.endsAt() != null && !details.startsAt().isBefore(details.endsAt())) {
      return conflict(
          ConflictKind.INVALID_INTERVAL,
          "contract",
          "ends_at",
          "The start date should be set before the end date.");
    }
    if (candidate.kind() == ContractKind.SUPPORT) {
      var support = (SupportContract) candidate;
      if (support.fixedFeePeriod() != null && support.fixedFee() == null) {
        return conflict(
            ConflictKind.INVALID_REFERENCE,
            "contract",
            "fixed_fee",
            "A contract with a fixed fee period requires a fixed fee.");
      }
    }
    return Optional.empty();
  }

  public Optional<FieldConflict> validatePerformanceType(PerformanceType candidate) {
    var multiplier = candidate.multiplier();
    if (multiplier == null || multiplier.signum() < 0 || multiplier.compareTo(MAX_MULTIPLIER) > 0) {
      return conflict(
          ConflictKind.OUT_OF_RANGE,
          "performance_type",
          "multiplier",
          "The multiplier should be between 0 and 5.");
    }
    return Optional.empty();
  }

  /**
   * @param contract the referenced contract, {@code null} when the performance has none
   * @param userAssignments contract assignments of the timesheet's user
   * @param existingOnTimesheet performances already booked on the same timesheet
   */
  public Optional<FieldConflict> validatePerformance(
      Performance candidate,
      Timesheet timesheet,
      Contract contract,
      List<ContractUser> userAssignments,
      List<Performance> existingOnTimesheet) {
    if (!timesheet.isActive()) {
      return conflict(
          ConflictKind.INVALID_STATE,
          "performance",
          "timesheet",
          "Performances can only be attached to active timesheets.");
    }
    if (!timesheet.covers(candidate.date())) {
      return conflict(
          ConflictKind.INVALID_REFERENCE,
          "performance",
          "date",
          "This date is not part of the given timesheet.");
    }
    return switch (candidate.kind()) {
      case ACTIVITY ->
          validateActivity((ActivityPerformance) candidate, timesheet, contract, userAssignments);
      case STANDBY -> validateStandby(candidate, contract, existingOnTimesheet);
    };
  }

  private Optional<FieldConflict> validateActivity(
      ActivityPerformance candidate,
      Timesheet timesheet,
      Contract contract,
      List<ContractUser> userAssignments) {
    var duration = candidate.duration();
    if (duration.compareTo(MIN_DURATION) < 0 || duration.compareTo(MAX_DAY_HOURS) > 0) {
      return conflict(
          ConflictKind.OUT_OF_RANGE,
          "activity_performance",
          "duration",
          "The duration should be between 0.01 and 24 hours.");
    }
    if (contract == null) {
      return Optional.empty();
    }
    if (candidate.contractRoleId() != null) {
      boolean allowed =
          userAssignments.stream()
              .anyMatch(
                  assignment ->
                      assignment.contractId().equals(contract.id())
                          && assignment.userId().equals(timesheet.userId())
                          && candidate.contractRoleId().equals(assignment.contractRoleId()));
      if (!allowed) {
        return conflict(
            ConflictKind.INVALID_REFERENCE,
            "activity_performance",
            "contract_role",
            "The selected contract role is not valid for that user on that contract.");
      }
    }
    var allowedTypes = contract.details().performanceTypeIds();
    if (!allowedTypes.isEmpty() && !allowedTypes.contains(candidate.performanceTypeId())) {
      return conflict(
          ConflictKind.INVALID_REFERENCE,
          "activity_performance",
          "performance_type",
          "The selected performance type is not valid for the selected contract.");
    }
    if (!contract.details().active()) {
      return conflict(
          ConflictKind.INVALID_STATE,
          "activity_performance",
          "contract",
          "Contract is not active.");
    }
    return Optional.empty();
  }

  private Optional<FieldConflict> validateStandby(
      Performance candidate, Contract contract, List<Performance> existingOnTimesheet) {
    boolean duplicate =
        existingOnTimesheet.stream()
            .filter(other -> !Objects.equals(other.id(), candidate.id()))
            .filter(other -> other.kind() == PerformanceKind.STANDBY)
            .anyMatch(
                other ->
                    other.date().equals(candidate.date())
                        && Objects.equals(other.contractId(), candidate.contractId()));
    if (duplicate) {
      return conflict(
          ConflictKind.DUPLICATE,
          "standby_performance",
          "date",
          "The standby performance is already linked to that contract for that date.");
    }
    if (contract != null && contract.kind() != ContractKind.SUPPORT) {
      return conflict(
          ConflictKind.INVALID_REFERENCE,
          "standby_performance",
          "contract",
          "Standby performances can only be created for support contracts.");
    }
    return Optional.empty();
  }

  private Optional<FieldConflict> validateSameDayBounds(
      String entity, LocalDateTime startsAt, LocalDateTime endsAt) {
    if (startsAt == null) {
      return conflict(
          ConflictKind.INVALID_INTERVAL, entity, "starts_at", "The start date/time should be set.");
    }
    if (endsAt == null) {
      return conflict(
          ConflictKind.INVALID_INTERVAL, entity, "ends_at", "The end date/time should be set.");
    }
    if (!startsAt.isBefore(endsAt)) {
      return conflict(
          ConflictKind.INVALID_INTERVAL,
          entity,
          "starts_at",
          "The start date should be set before the end date.");
    }
    if (!startsAt.toLocalDate().equals(endsAt.toLocalDate())) {
      return conflict(
          ConflictKind.INVALID_INTERVAL,
          entity,
          "starts_at",
          "The start date should occur on the same day as the end date.");
    }
    return Optional.empty();
  }

  private Optional<FieldConflict> validateWeeklyHours(String entity, WeeklyHours hours) {
    for (var entry : hours.asMap().entrySet()) {
      var value = entry.getValue();
      if (value.signum() < 0 || value.compareTo(MAX_DAY_HOURS) > 0) {
        return conflict(
            ConflictKind.OUT_OF_RANGE,
            entity,
            entry.getKey().name().toLowerCase(),
            "Hours per day should be between 0 and 24.");
      }
    }
    return Optional.empty();
  }

  private static Optional<FieldConflict> conflict(
      ConflictKind kind, String entity, String field, String message) {
    return Optional.of(FieldConflict.of(kind, entity, field, message));
  }
}
