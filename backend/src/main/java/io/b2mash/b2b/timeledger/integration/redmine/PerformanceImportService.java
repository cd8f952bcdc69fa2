package io.b2mash.b2b.timeledger.integration.redmine;

import io.b2mash.b2b.timeledger.domain.ActivityPerformance;
import io.b2mash.b2b.timeledger.domain.ContractUser;
import io.b2mash.b2b.timeledger.domain.PerformanceDetails;
import io.b2mash.b2b.timeledger.domain.PerformanceType;
import io.b2mash.b2b.timeledger.exception.IntervalConflictException;
import io.b2mash.b2b.timeledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.timeledger.store.IntervalStore;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs Redmine reconciliation as an isolated batch per user on its own pool and commits its
 * candidates. Failures of the remote system and timeouts degrade to an empty candidate list; a
 * batch that times out is interrupted.
 */
@Service
public class PerformanceImportService {

  private static final Logger log = LoggerFactory.getLogger(PerformanceImportService.class);

  private final RedmineReconciler reconciler;
  private final IntervalStore store;
  private final ExecutorService importExecutor;
  private final RedmineProperties properties;

  public PerformanceImportService(
      RedmineReconciler reconciler,
      IntervalStore store,
      @Qualifier("redmineImportExecutor") ExecutorService importExecutor,
      RedmineProperties properties) {
    this.reconciler = reconciler;
    this.store = store;
    this.importExecutor = importExecutor;
    this.properties = properties;
  }

  public List<PerformanceCandidate> getUserExternalPerformances(
      UUID userId, LocalDate from, LocalDate until) {
    store.findUser(userId).orElseThrow(() -> new ResourceNotFoundException("User", userId));
    Future<List<PerformanceCandidate>> future =
        importExecutor.submit(() -> reconciler.getUserExternalPerformances(userId, from, until));
    try {
      return future.get(properties.importTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Redmine import for user {} timed out after {}", userId, properties.importTimeout());
      return List.of();
    } catch (ExecutionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      log.warn("Redmine import for user {} failed: {}", userId, cause.getMessage(), cause);
      return List.of();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      log.warn("Redmine import for user {} was interrupted", userId);
      return List.of();
    }
  }

  /**
   * Commits the user's Redmine time entries as activity performances. Entries imported before are
   * updated in place, so repeated imports of the same range do not create duplicates.
   */
  public ImportResult importPerformances(UUID userId, LocalDate from, LocalDate until) {
    var candidates = getUserExternalPerformances(userId, from, until);
    var assignments = store.findContractUsers(userId);
    int created = 0;
    int updated = 0;
    int rejected = 0;

    for (var candidate : candidates) {
      var timesheet =
          store.findTimesheet(
              userId, candidate.date().getYear(), candidate.date().getMonthValue());
      var performanceType = performanceTypeFor(candidate.contractId());
      if (timesheet.isEmpty() || performanceType.isEmpty()) {
        log.debug(
            "Rejecting Redmine entry {}: timesheet present={}, performance type present={}",
            candidate.redmineId(),
            timesheet.isPresent(),
            performanceType.isPresent());
        rejected++;
        continue;
      }
      var contractRoleId =
          assignments.stream()
              .filter(assignment -> assignment.contractId().equals(candidate.contractId()))
              .map(ContractUser::contractRoleId)
              .findFirst()
              .orElse(null);
      var performance =
          new ActivityPerformance(
              new PerformanceDetails(
                  candidate.id() != null ? candidate.id() : UUID.randomUUID(),
                  timesheet.get().id(),
                  candidate.date(),
                  candidate.contractId(),
                  candidate.redmineId()),
              performanceType.get().id(),
              contractRoleId,
              candidate.description(),
              candidate.duration());
      try {
        store.save(performance);
        if (candidate.id() != null) {
          updated++;
        } else {
          created++;
        }
      } catch (IntervalConflictException e) {
        log.warn("Rejecting Redmine entry {}: {}", candidate.redmineId(), e.getMessage());
        rejected++;
      }
    }

    log.info(
        "Imported Redmine performances for user {}: {} created, {} updated, {} rejected",
        userId,
        created,
        updated,
        rejected);
    return new ImportResult(created, updated, rejected);
  }

  /** First type allowed by the contract, or any type with a neutral multiplier. */
  private Optional<PerformanceType> performanceTypeFor(UUID contractId) {
    var allowed =
        store
            .findContract(contractId)
            .map(contract -> contract.details().performanceTypeIds())
            .orElse(List.of());
    if (!allowed.isEmpty()) {
      return store.findPerformanceType(allowed.get(0));
    }
    return store.findPerformanceTypes().stream()
        .filter(type -> type.multiplier().compareTo(BigDecimal.ONE) == 0)
        .findFirst();
  }
}
