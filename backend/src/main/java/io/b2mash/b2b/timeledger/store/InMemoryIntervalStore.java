package io.b2mash.b2b.timeledger.store;

import static io.b2mash.b2b.timeledger.validation.IntervalInvariantValidator.requireValid;

import io.b2mash.b2b.timeledger.domain.ActivityPerformance;
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
import io.b2mash.b2b.timeledger.domain.PerformanceKind;
import io.b2mash.b2b.timeledger.domain.PerformanceType;
import io.b2mash.b2b.timeledger.domain.Timesheet;
import io.b2mash.b2b.timeledger.domain.User;
import io.b2mash.b2b.timeledger.domain.Whereabout;
import io.b2mash.b2b.timeledger.domain.WorkSchedule;
import io.b2mash.b2b.timeledger.event.ExternalMappingChangedEvent;
import io.b2mash.b2b.timeledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.timeledger.validation.IntervalInvariantValidator;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link IntervalStore}. Reads are lock-free; writes are serialized so that the
 * invariant check and the commit of a record happen atomically.
 */
@Component
public class InMemoryIntervalStore implements IntervalStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryIntervalStore.class);

  private final IntervalInvariantValidator validator;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final Object writeLock = new Object();

  private final Map<UUID, User> users = new ConcurrentHashMap<>();
  private final Map<UUID, Company> companies = new ConcurrentHashMap<>();
  private final Map<UUID, WorkSchedule> workSchedules = new ConcurrentHashMap<>();
  private final Map<UUID, EmploymentContract> employmentContracts = new ConcurrentHashMap<>();
  private final Map<UUID, Contract> contracts = new ConcurrentHashMap<>();
  private final Map<UUID, ContractUser> contractUsers = new ConcurrentHashMap<>();
  private final Map<UUID, ContractUserWorkSchedule> contractUserWorkSchedules =
      new ConcurrentHashMap<>();
  private final Map<UUID, Holiday> holidays = new ConcurrentHashMap<>();
  private final Map<UUID, LeaveType> leaveTypes = new ConcurrentHashMap<>();
  private final Map<UUID, Leave> leaves = new ConcurrentHashMap<>();
  private final Map<UUID, LeaveDate> leaveDates = new ConcurrentHashMap<>();
  private final Map<UUID, Whereabout> whereabouts = new ConcurrentHashMap<>();
  private final Map<UUID, Timesheet> timesheets = new ConcurrentHashMap<>();
  private final Map<UUID, PerformanceType> performanceTypes = new ConcurrentHashMap<>();
  private final Map<UUID, Performance> performances = new ConcurrentHashMap<>();

  public InMemoryIntervalStore(
      IntervalInvariantValidator validator,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.validator = validator;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Override
  public Optional<User> findUser(UUID userId) {
    return Optional.ofNullable(users.get(userId));
  }

  @Override
  public List<User> findUsers() {
    return users.values().stream()
        .sorted(Comparator.comparing(User::username, String.CASE_INSENSITIVE_ORDER))
        .toList();
  }

  @Override
  public Optional<Company> findCompany(UUID companyId) {
    return Optional.ofNullable(companies.get(companyId));
  }

  @Override
  public Optional<WorkSchedule> findWorkSchedule(UUID workScheduleId) {
    return Optional.ofNullable(workSchedules.get(workScheduleId));
  }

  @Override
  public List<EmploymentContract> findEmploymentContracts(UUID userId) {
    return employmentContracts.values().stream()
        .filter(contract -> contract.userId().equals(userId))
        .sorted(Comparator.comparing(EmploymentContract::startedAt))
        .toList();
  }

  @Override
  public List<EmploymentContract> findEmploymentContracts(
      UUID userId, LocalDate from, LocalDate until) {
    return findEmploymentContracts(userId).stream()
        .filter(contract -> contract.interval().overlaps(from, until))
        .toList();
  }

  @Override
  public Optional<Contract> findContract(UUID contractId) {
    return Optional.ofNullable(contracts.get(contractId));
  }

  @Override
  public List<Contract> findContracts() {
    return contracts.values().stream()
        .sorted(Comparator.comparing(Contract::name, String.CASE_INSENSITIVE_ORDER))
        .toList();
  }

  @Override
  public List<ContractUser> findContractUsers(UUID userId) {
    return contractUsers.values().stream()
        .filter(contractUser -> contractUser.userId().equals(userId))
        .toList();
  }

  @Override
  public List<ContractUserWorkSchedule> findContractUserWorkSchedules(
      UUID userId, LocalDate from, LocalDate until) {
    var contractUserIds =
        findContractUsers(userId).stream().map(ContractUser::id).collect(Collectors.toSet());
    return contractUserWorkSchedules.values().stream()
        .filter(schedule -> contractUserIds.contains(schedule.contractUserId()))
        .filter(schedule -> schedule.interval().overlaps(from, until))
        .sorted(Comparator.comparing(ContractUserWorkSchedule::startsAt))
        .toList();
  }

  @Override
  public List<Holiday> findHolidays(Collection<String> countries, LocalDate from, LocalDate until) {
    var normalized =
        countries.stream().map(country -> country.toUpperCase()).collect(Collectors.toSet());
    return holidays.values().stream()
        .filter(holiday -> normalized.contains(holiday.country().toUpperCase()))
        .filter(holiday -> !holiday.date().isBefore(from) && !holiday.date().isAfter(until))
        .sorted(Comparator.comparing(Holiday::date))
        .toList();
  }

  @Override
  public Optional<Leave> findLeave(UUID leaveId) {
    return Optional.ofNullable(leaves.get(leaveId));
  }

  @Override
  public Optional<LeaveType> findLeaveType(UUID leaveTypeId) {
    return Optional.ofNullable(leaveTypes.get(leaveTypeId));
  }

  @Override
  public List<LeaveDate> findLeaveDates(
      UUID userId, LocalDate from, LocalDate until, Collection<LeaveStatus> statuses) {
    return leaveDatesOfUser(userId, Set.copyOf(statuses)).stream()
        .filter(leaveDate -> !leaveDate.date().isBefore(from) && !leaveDate.date().isAfter(until))
        .toList();
  }

  @Override
  public List<Whereabout> findWhereabouts(UUID userId, LocalDate from, LocalDate until) {
    return whereaboutsOfUser(userId).stream()
        .filter(
            whereabout -> {
              var date = whereabout.startsAt().toLocalDate();
              return !date.isBefore(from) && !date.isAfter(until);
            })
        .toList();
  }

  @Override
  public Optional<Timesheet> findTimesheet(UUID timesheetId) {
    return Optional.ofNullable(timesheets.get(timesheetId));
  }

  @Override
  public Optional<Timesheet> findTimesheet(UUID userId, int year, int month) {
    return timesheets.values().stream()
        .filter(t -> t.userId().equals(userId) && t.year() == year && t.month() == month)
        .findFirst();
  }

  @Override
  public List<Performance> findPerformances(UUID userId, LocalDate from, LocalDate until) {
    var timesheetIds = timesheetIdsOf(userId);
    return performances.values().stream()
        .filter(performance -> timesheetIds.contains(performance.details().timesheetId()))
        .filter(performance -> !performance.date().isBefore(from))
        .filter(performance -> !performance.date().isAfter(until))
        .sorted(Comparator.comparing(Performance::date))
        .toList();
  }

  @Override
  public List<Performance> findPerformancesByRedmineIds(
      UUID userId, Collection<String> redmineIds) {
    if (redmineIds.isEmpty()) {
      return List.of();
    }
    var timesheetIds = timesheetIdsOf(userId);
    var wanted = Set.copyOf(redmineIds);
    return performances.values().stream()
        .filter(performance -> timesheetIds.contains(performance.details().timesheetId()))
        .filter(performance -> wanted.contains(performance.details().redmineId()))
        .sorted(Comparator.comparing(Performance::date))
        .toList();
  }

  @Override
  public Optional<PerformanceType> findPerformanceType(UUID performanceTypeId) {
    return Optional.ofNullable(performanceTypes.get(performanceTypeId));
  }

  @Override
  public List<PerformanceType> findPerformanceTypes() {
    return performanceTypes.values().stream()
        .sorted(Comparator.comparing(PerformanceType::name, String.CASE_INSENSITIVE_ORDER))
        .toList();
  }

  // --- Writes ---

  @Override
  public User save(User user) {
    synchronized (writeLock) {
      users.put(requireId(user.id()), user);
    }
    publishMappingChanged("user", user.id());
    return user;
  }

  @Override
  public Company save(Company company) {
    companies.put(requireId(company.id()), company);
    return company;
  }

  @Override
  public WorkSchedule save(WorkSchedule workSchedule) {
    synchronized (writeLock) {
      requireValid(validator.validateWorkSchedule(workSchedule));
      workSchedules.put(requireId(workSchedule.id()), workSchedule);
    }
    return workSchedule;
  }

  @Override
  public EmploymentContract save(EmploymentContract employmentContract) {
    synchronized (writeLock) {
      var company =
          findCompany(employmentContract.companyId())
              .orElseThrow(
                  () -> new ResourceNotFoundException("Company", employmentContract.companyId()));
      requireValid(
          validator.validateEmploymentContract(
              employmentContract,
              company,
              findEmploymentContracts(employmentContract.userId())));
      employmentContracts.put(requireId(employmentContract.id()), employmentContract);
    }
    log.debug(
        "Saved employment contract {} for user {}",
        employmentContract.id(),
        employmentContract.userId());
    return employmentContract;
  }

  @Override
  public Contract save(Contract contract) {
    synchronized (writeLock) {
      requireValid(validator.validateContract(contract));
      contracts.put(requireId(contract.id()), contract);
    }
    publishMappingChanged("contract", contract.id());
    return contract;
  }

  @Override
  public ContractUser save(ContractUser contractUser) {
    contractUsers.put(requireId(contractUser.id()), contractUser);
    return contractUser;
  }

  @Override
  public ContractUserWorkSchedule save(ContractUserWorkSchedule schedule) {
    synchronized (writeLock) {
      var existing =
          contractUserWorkSchedules.values().stream()
              .filter(other -> other.contractUserId().equals(schedule.contractUserId()))
              .toList();
      requireValid(validator.validateContractUserWorkSchedule(schedule, existing));
      contractUserWorkSchedules.put(requireId(schedule.id()), schedule);
    }
    return schedule;
  }

  @Override
  public Holiday save(Holiday holiday) {
    synchronized (writeLock) {
      requireValid(validator.validateHoliday(holiday, List.copyOf(holidays.values())));
      holidays.put(requireId(holiday.id()), holiday);
    }
    return holiday;
  }

  @Override
  public LeaveType save(LeaveType leaveType) {
    leaveTypes.put(requireId(leaveType.id()), leaveType);
    return leaveType;
  }

  @Override
  public Leave save(Leave leave) {
    leaves.put(requireId(leave.id()), leave);
    return leave;
  }

  @Override
  public LeaveDate save(LeaveDate leaveDate) {
    synchronized (writeLock) {
      var leave =
          findLeave(leaveDate.leaveId())
              .orElseThrow(() -> new ResourceNotFoundException("Leave", leaveDate.leaveId()));
      var timesheet =
          findTimesheet(leaveDate.timesheetId())
              .orElseThrow(
                  () -> new ResourceNotFoundException("Timesheet", leaveDate.timesheetId()));
      var existing =
          leaveDatesOfUser(
              leave.userId(),
              Set.of(LeaveStatus.DRAFT, LeaveStatus.PENDING, LeaveStatus.APPROVED));
      requireValid(validator.validateLeaveDate(leaveDate, leave, timesheet, existing));
      leaveDates.put(requireId(leaveDate.id()), leaveDate);
    }
    log.debug("Saved leave date {} for leave {}", leaveDate.id(), leaveDate.leaveId());
    return leaveDate;
  }

  @Override
  public Whereabout save(Whereabout whereabout) {
    synchronized (writeLock) {
      var timesheet =
          findTimesheet(whereabout.timesheetId())
              .orElseThrow(
                  () -> new ResourceNotFoundException("Timesheet", whereabout.timesheetId()));
      requireValid(
          validator.validateWhereabout(
              whereabout, timesheet, whereaboutsOfUser(timesheet.userId())));
      whereabouts.put(requireId(whereabout.id()), whereabout);
    }
    return whereabout;
  }

  @Override
  public Timesheet save(Timesheet timesheet) {
    synchronized (writeLock) {
      var previous = findTimesheet(requireId(timesheet.id()));
      var existing =
          timesheets.values().stream()
              .filter(other -> other.userId().equals(timesheet.userId()))
              .toList();
      requireValid(validator.validateTimesheet(timesheet, previous, existing));
      timesheets.put(timesheet.id(), timesheet);
    }
    return timesheet;
  }

  @Override
  public PerformanceType save(PerformanceType performanceType) {
    synchronized (writeLock) {
      requireValid(validator.validatePerformanceType(performanceType));
      performanceTypes.put(requireId(performanceType.id()), performanceType);
    }
    return performanceType;
  }

  @Override
  public Performance save(Performance performance) {
    var details = performance.details();
    synchronized (writeLock) {
      var timesheet =
          findTimesheet(details.timesheetId())
              .orElseThrow(
                  () -> new ResourceNotFoundException("Timesheet", details.timesheetId()));
      Contract contract = null;
      if (details.contractId() != null) {
        contract =
            findContract(details.contractId())
                .orElseThrow(
                    () -> new ResourceNotFoundException("Contract", details.contractId()));
      }
      if (performance.kind() == PerformanceKind.ACTIVITY) {
        var typeId = ((ActivityPerformance) performance).performanceTypeId();
        findPerformanceType(typeId)
            .orElseThrow(() -> new ResourceNotFoundException("PerformanceType", typeId));
      }
      var onTimesheet =
          performances.values().stream()
              .filter(other -> other.details().timesheetId().equals(timesheet.id()))
              .toList();
      requireValid(
          validator.validatePerformance(
              performance,
              timesheet,
              contract,
              findContractUsers(timesheet.userId()),
              onTimesheet));
      performances.put(requireId(details.id()), performance);
    }
    log.debug("Saved {} performance {} on {}", performance.kind(), details.id(), details.date());
    return performance;
  }

  private List<LeaveDate> leaveDatesOfUser(UUID userId, Set<LeaveStatus> statuses) {
    var leaveIds =
        leaves.values().stream()
            .filter(leave -> leave.userId().equals(userId))
            .filter(leave -> statuses.contains(leave.status()))
            .map(Leave::id)
            .collect(Collectors.toSet());
    return leaveDates.values().stream()
        .filter(leaveDate -> leaveIds.contains(leaveDate.leaveId()))
        .sorted(Comparator.comparing(LeaveDate::startsAt))
        .toList();
  }

  private List<Whereabout> whereaboutsOfUser(UUID userId) {
    var timesheetIds = timesheetIdsOf(userId);
    return whereabouts.values().stream()
        .filter(whereabout -> timesheetIds.contains(whereabout.timesheetId()))
        .sorted(Comparator.comparing(Whereabout::startsAt))
        .toList();
  }

  private Set<UUID> timesheetIdsOf(UUID userId) {
    return timesheets.values().stream()
        .filter(timesheet -> timesheet.userId().equals(userId))
        .map(Timesheet::id)
        .collect(Collectors.toSet());
  }

  private void publishMappingChanged(String entityType, UUID entityId) {
    eventPublisher.publishEvent(
        new ExternalMappingChangedEvent(entityType, entityId, Instant.now(clock)));
  }

  private static UUID requireId(UUID id) {
    return Objects.requireNonNull(id, "records must carry an id before they are saved");
  }
}
