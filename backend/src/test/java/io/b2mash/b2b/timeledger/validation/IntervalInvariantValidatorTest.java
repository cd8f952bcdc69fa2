package io.b2mash.b2b.timeledger.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.timeledger.domain.ActivityPerformance;
import io.b2mash.b2b.timeledger.domain.Company;
import io.b2mash.b2b.timeledger.domain.ContractDetails;
import io.b2mash.b2b.timeledger.domain.ContractUser;
import io.b2mash.b2b.timeledger.domain.ContractUserWorkSchedule;
import io.b2mash.b2b.timeledger.domain.EmploymentContract;
import io.b2mash.b2b.timeledger.domain.Holiday;
import io.b2mash.b2b.timeledger.domain.Leave;
import io.b2mash.b2b.timeledger.domain.LeaveDate;
import io.b2mash.b2b.timeledger.domain.LeaveStatus;
import io.b2mash.b2b.timeledger.domain.PerformanceDetails;
import io.b2mash.b2b.timeledger.domain.PerformanceType;
import io.b2mash.b2b.timeledger.domain.ProjectContract;
import io.b2mash.b2b.timeledger.domain.StandbyPerformance;
import io.b2mash.b2b.timeledger.domain.SupportContract;
import io.b2mash.b2b.timeledger.domain.Timesheet;
import io.b2mash.b2b.timeledger.domain.TimesheetStatus;
import io.b2mash.b2b.timeledger.domain.WeeklyHours;
import io.b2mash.b2b.timeledger.domain.Whereabout;
import io.b2mash.b2b.timeledger.domain.WorkSchedule;
import io.b2mash.b2b.timeledger.exception.IntervalConflictException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IntervalInvariantValidatorTest {

  private final IntervalInvariantValidator validator = new IntervalInvariantValidator();

  private final UUID userId = UUID.randomUUID();
  private final Timesheet may =
      new Timesheet(UUID.randomUUID(), userId, 2024, 5, TimesheetStatus.ACTIVE);

  private static LocalDateTime at(int day, int hour) {
    return LocalDateTime.of(2024, 5, day, hour, 0);
  }

  @Nested
  class EmploymentContracts {

    private final Company internal = new Company(UUID.randomUUID(), "Acme", "BE", true);

    private EmploymentContract contract(LocalDate start, LocalDate end) {
      return new EmploymentContract(
          UUID.randomUUID(), userId, internal.id(), UUID.randomUUID(), start, end);
    }

    @Test
    void endBeforeStart_flagsEndedAt() {
      var candidate = contract(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1));

      var result = validator.validateEmploymentContract(candidate, internal, List.of());

      assertThat(result).get().extracting(FieldConflict::field).isEqualTo("ended_at");
      assertThat(result.get().kind()).isEqualTo(ConflictKind.INVALID_INTERVAL);
    }

    @Test
    void externalCompany_flagsCompany() {
      var external = new Company(internal.id(), "Customer", "BE", false);

      var result =
          validator.validateEmploymentContract(
              contract(LocalDate.of(2024, 1, 1), null), external, List.of());

      assertThat(result).get().extracting(FieldConflict::field).isEqualTo("company");
    }

    @Test
    void openEndedExistingContract_overlapsLaterStart() {
      var existing = contract(LocalDate.of(2023, 1, 1), null);
      var candidate = contract(LocalDate.of(2030, 1, 1), null);

      var result = validator.validateEmploymentContract(candidate, internal, List.of(existing));

      assertThat(result).get().extracting(FieldConflict::kind).isEqualTo(ConflictKind.OVERLAP);
      assertThat(result.get().field()).isEqualTo("user");
    }

    @Test
    void consecutiveContracts_areAccepted() {
      var existing = contract(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31));
      var candidate = contract(LocalDate.of(2024, 1, 1), null);

      assertThat(validator.validateEmploymentContract(candidate, internal, List.of(existing)))
          .isEmpty();
    }

    @Test
    void updatingItself_isNotAnOverlap() {
      var existing = contract(LocalDate.of(2023, 1, 1), null);
      var updated =
          new EmploymentContract(
              existing.id(),
              userId,
              internal.id(),
              existing.workScheduleId(),
              LocalDate.of(2023, 1, 1),
              LocalDate.of(2024, 6, 30));

      assertThat(validator.validateEmploymentContract(updated, internal, List.of(existing)))
          .isEmpty();
    }
  }

  @Nested
  class LeaveDates {

    private final Leave leave =
        new Leave(UUID.randomUUID(), userId, UUID.randomUUID(), LeaveStatus.APPROVED, null);

    private LeaveDate leaveDate(LocalDateTime start, LocalDateTime end) {
      return new LeaveDate(UUID.randomUUID(), leave.id(), may.id(), start, end);
    }

    @Test
    void overlappingMorningAndAfternoon_isUserScopedConflict() {
      var morning = leaveDate(at(2, 9), at(2, 13));
      var afternoon = leaveDate(at(2, 11), at(2, 15));

      var result = validator.validateLeaveDate(afternoon, leave, may, List.of(morning));

      assertThat(result).isPresent();
      assertThat(result.get().kind()).isEqualTo(ConflictKind.OVERLAP);
      assertThat(result.get().entity()).isEqualTo("leave_date");
      assertThat(result.get().field()).isEqualTo("user");
    }

    @Test
    void touchingBounds_conflict() {
      var morning = leaveDate(at(2, 9), at(2, 13));
      var afternoon = leaveDate(at(2, 13), at(2, 17));

      assertThat(validator.validateLeaveDate(afternoon, leave, may, List.of(morning)))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("user");
    }

    @Test
    void otherDay_isAccepted() {
      var existing = leaveDate(at(2, 9), at(2, 13));
      var candidate = leaveDate(at(3, 9), at(3, 13));

      assertThat(validator.validateLeaveDate(candidate, leave, may, List.of(existing))).isEmpty();
    }

    @Test
    void missingStart_flagsStartsAt() {
      var candidate = leaveDate(null, at(2, 13));

      assertThat(validator.validateLeaveDate(candidate, leave, may, List.of()))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("starts_at");
    }

    @Test
    void spanningTwoDays_flagsStartsAt() {
      var candidate = leaveDate(at(2, 9), at(3, 9));

      var result = validator.validateLeaveDate(candidate, leave, may, List.of());

      assertThat(result).get().extracting(FieldConflict::field).isEqualTo("starts_at");
      assertThat(result.get().message()).contains("same day");
    }

    @Test
    void timesheetOfOtherMonth_flagsTimesheet() {
      var june = new Timesheet(UUID.randomUUID(), userId, 2024, 6, TimesheetStatus.ACTIVE);
      var candidate = leaveDate(at(2, 9), at(2, 13));

      assertThat(validator.validateLeaveDate(candidate, leave, june, List.of()))
          .get()
          .extracting(FieldConflict::kind)
          .isEqualTo(ConflictKind.INVALID_REFERENCE);
    }

    @Test
    void closedTimesheet_flagsTimesheetState() {
      var closed = new Timesheet(may.id(), userId, 2024, 5, TimesheetStatus.CLOSED);
      var candidate = leaveDate(at(2, 9), at(2, 13));

      var result = validator.validateLeaveDate(candidate, leave, closed, List.of());

      assertThat(result)
          .get()
          .extracting(FieldConflict::kind)
          .isEqualTo(ConflictKind.INVALID_STATE);
      assertThat(result.get().field()).isEqualTo("timesheet");
    }

    @Test
    void leaveOfAnotherUser_flagsLeave() {
      var otherUserId = UUID.randomUUID();
      var foreign =
          new Leave(UUID.randomUUID(), otherUserId, UUID.randomUUID(), LeaveStatus.DRAFT, null);
      var candidate = new LeaveDate(UUID.randomUUID(), foreign.id(), may.id(), at(2, 9), at(2, 13));

      assertThat(validator.validateLeaveDate(candidate, foreign, may, List.of()))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("leave");
    }
  }

  @Nested
  class Whereabouts {

    private Whereabout whereabout(LocalDateTime start, LocalDateTime end) {
      return new Whereabout(UUID.randomUUID(), may.id(), UUID.randomUUID(), start, end, null);
    }

    @Test
    void touchingBounds_areAccepted() {
      var morning = whereabout(at(6, 9), at(6, 12));
      var afternoon = whereabout(at(6, 12), at(6, 17));

      assertThat(validator.validateWhereabout(afternoon, may, List.of(morning))).isEmpty();
    }

    @Test
    void strictOverlap_flagsUser() {
      var morning = whereabout(at(6, 9), at(6, 12));
      var lunch = whereabout(at(6, 11), at(6, 13));

      assertThat(validator.validateWhereabout(lunch, may, List.of(morning)))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("user");
    }
  }

  @Nested
  class Schedules {

    @Test
    void dayAbove24Hours_flagsThatWeekday() {
      var hours =
          new WeeklyHours(
              new BigDecimal("8"),
              new BigDecimal("25"),
              BigDecimal.ZERO,
              BigDecimal.ZERO,
              BigDecimal.ZERO,
              BigDecimal.ZERO,
              BigDecimal.ZERO);

      var result = validator.validateWorkSchedule(new WorkSchedule(UUID.randomUUID(), "x", hours));

      assertThat(result).get().extracting(FieldConflict::field).isEqualTo("tuesday");
    }

    @Test
    void overlappingContractUserSchedules_flagStartsAt() {
      var contractUserId = UUID.randomUUID();
      var existing =
          new ContractUserWorkSchedule(
              UUID.randomUUID(),
              contractUserId,
              LocalDate.of(2024, 1, 1),
              LocalDate.of(2024, 6, 30),
              WeeklyHours.weekdays("4"));
      var candidate =
          new ContractUserWorkSchedule(
              UUID.randomUUID(),
              contractUserId,
              LocalDate.of(2024, 6, 30),
              null,
              WeeklyHours.weekdays("4"));

      assertThat(validator.validateContractUserWorkSchedule(candidate, List.of(existing)))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("starts_at");
    }

    @Test
    void schedulesOfDifferentAssignments_doNotConflict() {
      var existing =
          new ContractUserWorkSchedule(
              UUID.randomUUID(),
              UUID.randomUUID(),
              LocalDate.of(2024, 1, 1),
              null,
              WeeklyHours.weekdays("4"));
      var candidate =
          new ContractUserWorkSchedule(
              UUID.randomUUID(),
              UUID.randomUUID(),
              LocalDate.of(2024, 1, 1),
              null,
              WeeklyHours.weekdays("4"));

      assertThat(validator.validateContractUserWorkSchedule(candidate, List.of(existing)))
          .isEmpty();
    }
  }

  @Nested
  class HolidaysAndTimesheets {

    @Test
    void sameHolidayDifferentCase_isDuplicate() {
      var existing = new Holiday(UUID.randomUUID(), "Labour Day", LocalDate.of(2024, 5, 1), "BE");
      var candidate = new Holiday(UUID.randomUUID(), "labour day", LocalDate.of(2024, 5, 1), "be");

      assertThat(validator.validateHoliday(candidate, List.of(existing)))
          .get()
          .extracting(FieldConflict::kind)
          .isEqualTo(ConflictKind.DUPLICATE);
    }

    @Test
    void newTimesheetNotActive_flagsStatus() {
      var pending = new Timesheet(UUID.randomUUID(), userId, 2024, 5, TimesheetStatus.PENDING);

      assertThat(validator.validateTimesheet(pending, Optional.empty(), List.of()))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("status");
    }

    @Test
    void closedTimesheet_cannotBeReopened() {
      var closed = new Timesheet(may.id(), userId, 2024, 5, TimesheetStatus.CLOSED);
      var reopened = new Timesheet(may.id(), userId, 2024, 5, TimesheetStatus.ACTIVE);

      assertThat(validator.validateTimesheet(reopened, Optional.of(closed), List.of(closed)))
          .get()
          .extracting(FieldConflict::kind)
          .isEqualTo(ConflictKind.INVALID_STATE);
    }

    @Test
    void secondTimesheetForSameMonth_flagsYear() {
      var duplicate = new Timesheet(UUID.randomUUID(), userId, 2024, 5, TimesheetStatus.ACTIVE);

      assertThat(validator.validateTimesheet(duplicate, Optional.empty(), List.of(may)))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("year");
    }

    @Test
    void monthThirteen_isOutOfRange() {
      var invalid = new Timesheet(UUID.randomUUID(), userId, 2024, 13, TimesheetStatus.ACTIVE);

      assertThat(validator.validateTimesheet(invalid, Optional.empty(), List.of()))
          .get()
          .extracting(FieldConflict::kind)
          .isEqualTo(ConflictKind.OUT_OF_RANGE);
    }
  }

  @Nested
  class Performances {

    private final PerformanceType regular =
        new PerformanceType(UUID.randomUUID(), "Regular", BigDecimal.ONE);

    private ContractDetails details(boolean active, List<UUID> typeIds) {
      return new ContractDetails(
          UUID.randomUUID(),
          "Contract",
          UUID.randomUUID(),
          UUID.randomUUID(),
          LocalDate.of(2024, 1, 1),
          null,
          active,
          null,
          typeIds);
    }

    private ActivityPerformance activity(UUID contractId, UUID roleId, String hours) {
      return new ActivityPerformance(
          new PerformanceDetails(
              UUID.randomUUID(), may.id(), LocalDate.of(2024, 5, 6), contractId, null),
          regular.id(),
          roleId,
          null,
          new BigDecimal(hours));
    }

    @Test
    void durationAbove24Hours_flagsDuration() {
      var result =
          validator.validatePerformance(
              activity(null, null, "24.5"), may, null, List.of(), List.of());

      assertThat(result).get().extracting(FieldConflict::field).isEqualTo("duration");
    }

    @Test
    void roleNotHeldByUser_flagsContractRole() {
      var contract = new ProjectContract(details(true, List.of()), null);
      var assignment =
          new ContractUser(UUID.randomUUID(), contract.id(), userId, UUID.randomUUID());

      var result =
          validator.validatePerformance(
              activity(contract.id(), UUID.randomUUID(), "4"),
              may,
              contract,
              List.of(assignment),
              List.of());

      assertThat(result).get().extracting(FieldConflict::field).isEqualTo("contract_role");
    }

    @Test
    void typeNotAllowedByContract_flagsPerformanceType() {
      var contract = new ProjectContract(details(true, List.of(UUID.randomUUID())), null);

      var result =
          validator.validatePerformance(
              activity(contract.id(), null, "4"), may, contract, List.of(), List.of());

      assertThat(result).get().extracting(FieldConflict::field).isEqualTo("performance_type");
    }

    @Test
    void inactiveContract_flagsContract() {
      var contract = new ProjectContract(details(false, List.of()), null);

      var result =
          validator.validatePerformance(
              activity(contract.id(), null, "4"), may, contract, List.of(), List.of());

      assertThat(result).get().extracting(FieldConflict::field).isEqualTo("contract");
    }

    @Test
    void dateOutsideTimesheet_flagsDate() {
      var june =
          new ActivityPerformance(
              new PerformanceDetails(
                  UUID.randomUUID(), may.id(), LocalDate.of(2024, 6, 3), null, null),
              regular.id(),
              null,
              null,
              BigDecimal.ONE);

      assertThat(validator.validatePerformance(june, may, null, List.of(), List.of()))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("date");
    }

    @Test
    void standbyOnProjectContract_flagsContract() {
      var contract = new ProjectContract(details(true, List.of()), null);
      var standby =
          new StandbyPerformance(
              new PerformanceDetails(
                  UUID.randomUUID(), may.id(), LocalDate.of(2024, 5, 6), contract.id(), null));

      assertThat(validator.validatePerformance(standby, may, contract, List.of(), List.of()))
          .get()
          .extracting(FieldConflict::entity, FieldConflict::field)
          .containsExactly("standby_performance", "contract");
    }

    @Test
    void secondStandbyOnSameDay_isDuplicate() {
      var contract =
          new SupportContract(details(true, List.of()), BigDecimal.TEN, null, null);
      var first =
          new StandbyPerformance(
              new PerformanceDetails(
                  UUID.randomUUID(), may.id(), LocalDate.of(2024, 5, 6), contract.id(), null));
      var second =
          new StandbyPerformance(
              new PerformanceDetails(
                  UUID.randomUUID(), may.id(), LocalDate.of(2024, 5, 6), contract.id(), null));

      assertThat(validator.validatePerformance(second, may, contract, List.of(), List.of(first)))
          .get()
          .extracting(FieldConflict::kind)
          .isEqualTo(ConflictKind.DUPLICATE);
    }

    @Test
    void supportContractWithPeriodButNoFee_flagsFixedFee() {
      var contract =
          new SupportContract(
              details(true, List.of()), BigDecimal.TEN, null, SupportContract.FeePeriod.MONTHLY);

      assertThat(validator.validateContract(contract))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("fixed_fee");
    }

    @Test
    void multiplierAboveFive_flagsMultiplier() {
      var type = new PerformanceType(UUID.randomUUID(), "Crazy", new BigDecimal("5.5"));

      assertThat(validator.validatePerformanceType(type))
          .get()
          .extracting(FieldConflict::field)
          .isEqualTo("multiplier");
    }
  }

  @Test
  void requireValid_throwsConflictCarryingTheField() {
    var conflict =
        FieldConflict.of(ConflictKind.OVERLAP, "leave_date", "user", "User already has leave.");

    assertThatThrownBy(() -> IntervalInvariantValidator.requireValid(Optional.of(conflict)))
        .isInstanceOf(IntervalConflictException.class)
        .satisfies(
            e -> assertThat(((IntervalConflictException) e).getConflict()).isEqualTo(conflict));
  }
}
