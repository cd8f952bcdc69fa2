package io.b2mash.b2b.timeledger.calculation;

import io.b2mash.b2b.timeledger.domain.Company;
import io.b2mash.b2b.timeledger.domain.Contract;
import io.b2mash.b2b.timeledger.domain.ContractUserWorkSchedule;
import io.b2mash.b2b.timeledger.domain.EmploymentContract;
import io.b2mash.b2b.timeledger.domain.Holiday;
import io.b2mash.b2b.timeledger.domain.LeaveDate;
import io.b2mash.b2b.timeledger.domain.LeaveType;
import io.b2mash.b2b.timeledger.domain.Performance;
import io.b2mash.b2b.timeledger.domain.PerformanceType;
import io.b2mash.b2b.timeledger.domain.WorkSchedule;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Every record relevant to one user over a date range, read from the store in one pass. Day-level
 * calculations are pure functions of a snapshot and a date.
 *
 * @param leaveTypesByLeaveDate leave type of each approved leave date, keyed by leave date id
 */
public record PeriodSnapshot(
    UUID userId,
    LocalDate from,
    LocalDate until,
    List<EmploymentContract> employmentContracts,
    Map<UUID, WorkSchedule> workSchedules,
    Map<UUID, Company> companies,
    List<ContractUserWorkSchedule> contractUserWorkSchedules,
    List<Holiday> holidays,
    List<LeaveDate> approvedLeaveDates,
    Map<UUID, LeaveType> leaveTypesByLeaveDate,
    List<Performance> performances,
    Map<UUID, PerformanceType> performanceTypes,
    Map<UUID, Contract> contracts) {

  /** First employment contract, by start date, active on the given day. */
  public Optional<EmploymentContract> employmentContractOn(LocalDate date) {
    return employmentContracts.stream().filter(contract -> contract.isActiveOn(date)).findFirst();
  }

  public Optional<WorkSchedule> workScheduleOf(EmploymentContract contract) {
    return Optional.ofNullable(workSchedules.get(contract.workScheduleId()));
  }

  public Optional<String> countryOf(EmploymentContract contract) {
    return Optional.ofNullable(companies.get(contract.companyId())).map(Company::country);
  }

  public List<ContractUserWorkSchedule> contractUserWorkSchedulesOn(LocalDate date) {
    return contractUserWorkSchedules.stream().filter(s -> s.isActiveOn(date)).toList();
  }

  public List<Holiday> holidaysOn(LocalDate date, String country) {
    return holidays.stream()
        .filter(holiday -> holiday.date().equals(date))
        .filter(holiday -> holiday.country().equalsIgnoreCase(country))
        .toList();
  }

  public List<LeaveDate> leaveDatesOn(LocalDate date) {
    return approvedLeaveDates.stream().filter(leaveDate -> leaveDate.date().equals(date)).toList();
  }

  public Optional<LeaveType> leaveTypeOf(LeaveDate leaveDate) {
    return Optional.ofNullable(leaveTypesByLeaveDate.get(leaveDate.id()));
  }

  public List<Performance> performancesOn(LocalDate date) {
    return performances.stream().filter(performance -> performance.date().equals(date)).toList();
  }

  public Optional<PerformanceType> performanceType(UUID performanceTypeId) {
    return Optional.ofNullable(performanceTypes.get(performanceTypeId));
  }

  public Optional<Contract> contract(UUID contractId) {
    return contractId == null ? Optional.empty() : Optional.ofNullable(contracts.get(contractId));
  }
}
