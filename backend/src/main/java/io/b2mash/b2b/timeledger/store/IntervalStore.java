package io.b2mash.b2b.timeledger.store;

import io.b2mash.b2b.timeledger.domain.Company;
import io.b2mash.b2b.timeledger.domain.Contract;
import io.b2mash.b2b.timeledger.domain.ContractUser;
import io.b2mash.b2b.timeledger.domain.ContractUserWorkSchedule;
import io.b2mash.b2b.timeledger.domain.EmploymentContract;
import io.b2mash.b2b.timeledger.domain.Holiday;
import io.b2mash.b2b.timeledger.domain.Leave;
import io.b2mash.b2b.timeledger.domain.LeaveDate;
import io.b2mash.b2b.timeledger.domain.LeaveStatus;
import io.b2mash.b2b.timeledger.domain.LeaveType;
import io.b2mash.b2b.timeledger.domain.Performance;
import io.b2mash.b2b.timeledger.domain.PerformanceType;
import io.b2mash.b2b.timeledger.domain.Timesheet;
import io.b2mash.b2b.timeledger.domain.User;
import io.b2mash.b2b.timeledger.domain.Whereabout;
import io.b2mash.b2b.timeledger.domain.WorkSchedule;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read and write access to the time-bound records the engine derives its views from. Range
 * queries take inclusive bounds and return every record whose interval touches the range.
 *
 * <p>Every {@code save} runs the interval invariants against the records already stored for the
 * same subject and throws {@link io.b2mash.b2b.timeledger.exception.IntervalConflictException}
 * without persisting anything when one is violated. Saving a record whose id already exists
 * replaces it.
 */
public interface IntervalStore {

  // --- Users and organisation ---

  Optional<User> findUser(UUID userId);

  List<User> findUsers();

  Optional<Company> findCompany(UUID companyId);

  Optional<WorkSchedule> findWorkSchedule(UUID workScheduleId);

  // --- Employment ---

  List<EmploymentContract> findEmploymentContracts(UUID userId);

  List<EmploymentContract> findEmploymentContracts(UUID userId, LocalDate from, LocalDate until);

  // --- Contracts ---

  Optional<Contract> findContract(UUID contractId);

  List<Contract> findContracts();

  List<ContractUser> findContractUsers(UUID userId);

  List<ContractUserWorkSchedule> findContractUserWorkSchedules(
      UUID userId, LocalDate from, LocalDate until);

  // --- Calendar ---

  List<Holiday> findHolidays(Collection<String> countries, LocalDate from, LocalDate until);

  default List<Holiday> findHolidays(String country, LocalDate date) {
    return findHolidays(List.of(country), date, date);
  }

  // --- Leave ---

  Optional<Leave> findLeave(UUID leaveId);

  Optional<LeaveType> findLeaveType(UUID leaveTypeId);

  List<LeaveDate> findLeaveDates(
      UUID userId, LocalDate from, LocalDate until, Collection<LeaveStatus> statuses);

  default List<LeaveDate> findApprovedLeaveDates(UUID userId, LocalDate from, LocalDate until) {
    return findLeaveDates(userId, from, until, EnumSet.of(LeaveStatus.APPROVED));
  }

  List<Whereabout> findWhereabouts(UUID userId, LocalDate from, LocalDate until);

  // --- Timesheets and performances ---

  Optional<Timesheet> findTimesheet(UUID timesheetId);

  Optional<Timesheet> findTimesheet(UUID userId, int year, int month);

  List<Performance> findPerformances(UUID userId, LocalDate from, LocalDate until);

  /** Performances of the user imported from the given external entries, at any date. */
  List<Performance> findPerformancesByRedmineIds(UUID userId, Collection<String> redmineIds);

  Optional<PerformanceType> findPerformanceType(UUID performanceTypeId);

  List<PerformanceType> findPerformanceTypes();

  // --- Writes ---

  User save(User user);

  Company save(Company company);

  WorkSchedule save(WorkSchedule workSchedule);

  EmploymentContract save(EmploymentContract employmentContract);

  Contract save(Contract contract);

  ContractUser save(ContractUser contractUser);

  ContractUserWorkSchedule save(ContractUserWorkSchedule schedule);

  Holiday save(Holiday holiday);

  LeaveType save(LeaveType leaveType);

  Leave save(Leave leave);

  LeaveDate save(LeaveDate leaveDate);

  Whereabout save(Whereabout whereabout);

  Timesheet save(Timesheet timesheet);

  PerformanceType save(PerformanceType performanceType);

  Performance save(Performance performance);
}
