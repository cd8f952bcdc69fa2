package io.b2mash.b2b.timeledger.calculation;

import io.b2mash.b2b.timeledger.domain.ActivityPerformance;
import io.b2mash.b2b.timeledger.domain.Company;
import io.b2mash.b2b.timeledger.domain.Contract;
import io.b2mash.b2b.timeledger.domain.Holiday;
import io.b2mash.b2b.timeledger.domain.LeaveType;
import io.b2mash.b2b.timeledger.domain.PerformanceKind;
import io.b2mash.b2b.timeledger.domain.PerformanceType;
import io.b2mash.b2b.timeledger.domain.WorkSchedule;
import io.b2mash.b2b.timeledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.timeledger.store.IntervalStore;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Reads a {@link PeriodSnapshot} for one user from the {@link IntervalStore}. */
@Component
public class PeriodSnapshotLoader {

  private final IntervalStore store;

  public PeriodSnapshotLoader(IntervalStore store) {
    this.store = store;
  }

  public PeriodSnapshot load(UUID userId, LocalDate from, LocalDate until) {
    store.findUser(userId).orElseThrow(() -> new ResourceNotFoundException("User", userId));

    var employmentContracts = store.findEmploymentContracts(userId, from, until);
    var workSchedules = new HashMap<UUID, WorkSchedule>();
    var companies = new HashMap<UUID, Company>();
    for (var contract : employmentContracts) {
      store
          .findWorkSchedule(contract.workScheduleId())
          .ifPresent(schedule -> workSchedules.put(schedule.id(), schedule));
      store
          .findCompany(contract.companyId())
          .ifPresent(company -> companies.put(company.id(), company));
    }
    var countries = companies.values().stream().map(Company::country).distinct().toList();
    List<Holiday> holidays =
        countries.isEmpty() ? List.of() : store.findHolidays(countries, from, until);

    var approvedLeaveDates = store.findApprovedLeaveDates(userId, from, until);
    var leaveTypesByLeaveDate = new HashMap<UUID, LeaveType>();
    for (var leaveDate : approvedLeaveDates) {
      store
          .findLeave(leaveDate.leaveId())
          .flatMap(leave -> store.findLeaveType(leave.leaveTypeId()))
          .ifPresent(type -> leaveTypesByLeaveDate.put(leaveDate.id(), type));
    }

    var performances = store.findPerformances(userId, from, until);
    var performanceTypes = new HashMap<UUID, PerformanceType>();
    var contracts = new HashMap<UUID, Contract>();
    for (var performance : performances) {
      if (performance.kind() == PerformanceKind.ACTIVITY) {
        var typeId = ((ActivityPerformance) performance).performanceTypeId();
        store.findPerformanceType(typeId).ifPresent(type -> performanceTypes.put(typeId, type));
      }
      if (performance.contractId() != null) {
        store
            .findContract(performance.contractId())
            .ifPresent(contract -> contracts.put(contract.id(), contract));
      }
    }

    return new PeriodSnapshot(
        userId,
        from,
        until,
        employmentContracts,
        workSchedules,
        companies,
        store.findContractUserWorkSchedules(userId, from, until),
        holidays,
        approvedLeaveDates,
        leaveTypesByLeaveDate,
        performances,
        performanceTypes,
        contracts);
  }
}
