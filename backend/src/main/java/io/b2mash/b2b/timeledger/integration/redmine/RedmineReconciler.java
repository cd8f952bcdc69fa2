package io.b2mash.b2b.timeledger.integration.redmine;

import io.b2mash.b2b.timeledger.domain.Contract;
import io.b2mash.b2b.timeledger.domain.ContractUser;
import io.b2mash.b2b.timeledger.domain.Performance;
import io.b2mash.b2b.timeledger.domain.PerformanceKind;
import io.b2mash.b2b.timeledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.timeledger.store.IntervalStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a user's Redmine time entries into performance candidates. An entry is attributed to the
 * contract named by the contract custom field of its issue or the nearest ancestor carrying it,
 * falling back to the contract mapped onto the entry's project. Entries attributed to a contract
 * the user is not assigned to are skipped.
 */
@Component
public class RedmineReconciler {

  private static final Logger log = LoggerFactory.getLogger(RedmineReconciler.class);

  private final RedmineConnector connector;
  private final IntervalStore store;
  private final RedmineProperties properties;
  private final Clock clock;

  public RedmineReconciler(
      RedmineConnector connector, IntervalStore store, RedmineProperties properties, Clock clock) {
    this.connector = connector;
    this.store = store;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * @param from first day, today when {@code null}
   * @param until last day, today when {@code null}
   */
  public List<PerformanceCandidate> getUserExternalPerformances(
      UUID userId, LocalDate from, LocalDate until) {
    var user =
        store.findUser(userId).orElseThrow(() -> new ResourceNotFoundException("User", userId));
    if (!connector.isConfigured()) {
      return List.of();
    }
    var redmineUserId = connector.resolveUserId(user);
    if (redmineUserId.isEmpty()) {
      log.debug("No Redmine account linked to user {}", user.username());
      return List.of();
    }

    var today = LocalDate.now(clock);
    var rangeFrom = from != null ? from : today;
    var rangeUntil = until != null ? until : today;
    var entries = connector.listTimeEntries(redmineUserId.get(), rangeFrom, rangeUntil);
    if (entries.isEmpty()) {
      return List.of();
    }

    var issueIds =
        entries.stream()
            .map(TimeEntry::issueId)
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    var contractByIssue = resolveIssueContracts(issueIds);
    var userContracts = contractsOf(userId);
    var contractByProject = contractsByRedmineProject(userContracts);
    var userContractIds = userContracts.stream().map(Contract::id).collect(Collectors.toSet());
    var existingByRedmineId =
        importedPerformances(
            userId, entries.stream().map(entry -> String.valueOf(entry.id())).toList());

    var candidates = new ArrayList<PerformanceCandidate>();
    for (var entry : entries) {
      UUID contractId = null;
      if (entry.issueId() != null) {
        contractId = contractByIssue.get(entry.issueId());
      }
      if (contractId == null && entry.projectId() != null) {
        contractId = contractByProject.get(entry.projectId());
      }
      if (contractId == null || !userContractIds.contains(contractId)) {
        log.debug(
            "Skipping Redmine time entry {} of user {}: no matching contract (resolved {})",
            entry.id(),
            user.username(),
            contractId);
        continue;
      }
      var redmineId = String.valueOf(entry.id());
      candidates.add(
          new PerformanceCandidate(
              existingByRedmineId.get(redmineId),
              contractId,
              redmineId,
              entry.hours(),
              describe(entry),
              entry.spentOn()));
    }
    log.info(
        "Reconciled {} of {} Redmine time entries for user {} between {} and {}",
        candidates.size(),
        entries.size(),
        user.username(),
        rangeFrom,
        rangeUntil);
    return candidates;
  }

  /**
   * Walks up the parent chain of the given issues one level at a time, fetching each level in a
   * single batch. Every issue is fetched at most once, so cyclic or shared ancestry terminates.
   *
   * @return the contract of every start issue for which one was found
   */
  Map<Integer, UUID> resolveIssueContracts(Collection<Integer> startIssueIds) {
    var fieldContract = new HashMap<Integer, UUID>();
    var parentOf = new HashMap<Integer, Integer>();
    var visited = new HashSet<Integer>();
    Set<Integer> pending = new LinkedHashSet<>(startIssueIds);

    while (!pending.isEmpty()) {
      visited.addAll(pending);
      var next = new LinkedHashSet<Integer>();
      for (var issue : connector.listIssues(pending)) {
        var contractId = parseContractField(issue);
        if (contractId.isPresent()) {
          fieldContract.put(issue.id(), contractId.get());
        } else if (issue.parentId() != null) {
          parentOf.put(issue.id(), issue.parentId());
          if (!visited.contains(issue.parentId())) {
            next.add(issue.parentId());
          }
        }
      }
      pending = next;
    }

    var result = new HashMap<Integer, UUID>();
    for (var issueId : startIssueIds) {
      var seen = new HashSet<Integer>();
      Integer current = issueId;
      while (current != null && seen.add(current)) {
        var contractId = fieldContract.get(current);
        if (contractId != null) {
          result.put(issueId, contractId);
          break;
        }
        current = parentOf.get(current);
      }
    }
    return result;
  }

  /** Field values look like {@code <contract id>|<label>}; only the id part is used. */
  private Optional<UUID> parseContractField(Issue issue) {
    return issue
        .customFieldValue(properties.contractField())
        .map(value -> value.split("\\|")[0].trim())
        .flatMap(
            raw -> {
              try {
                return Optional.of(UUID.fromString(raw));
              } catch (IllegalArgumentException e) {
                log.debug("Issue {} has an unparseable contract field value '{}'", issue.id(), raw);
                return Optional.empty();
              }
            });
  }

  /** Contracts the user is assigned to, ordered by name. */
  private List<Contract> contractsOf(UUID userId) {
    return store.findContractUsers(userId).stream()
        .map(ContractUser::contractId)
        .distinct()
        .map(store::findContract)
        .flatMap(Optional::stream)
        .sorted(
            Comparator.comparing(
                (Contract contract) -> contract.details().name(), String.CASE_INSENSITIVE_ORDER))
        .toList();
  }

  /** Several of the user's contracts may share a project; the first by name wins. */
  private Map<Integer, UUID> contractsByRedmineProject(List<Contract> userContracts) {
    var result = new HashMap<Integer, UUID>();
    for (Contract contract : userContracts) {
      var projectId = contract.details().redmineProjectId();
      if (projectId != null) {
        result.putIfAbsent(projectId, contract.id());
      }
    }
    return result;
  }

  /** Earlier imports of the given entries, whatever date they were booked on. */
  private Map<String, UUID> importedPerformances(UUID userId, Collection<String> redmineIds) {
    var result = new HashMap<String, UUID>();
    for (Performance performance : store.findPerformancesByRedmineIds(userId, redmineIds)) {
      var redmineId = performance.details().redmineId();
      if (performance.kind() == PerformanceKind.ACTIVITY && redmineId != null) {
        result.put(redmineId, performance.id());
      }
    }
    return result;
  }

  private String describe(TimeEntry entry) {
    var comments = entry.comments() != null ? entry.comments() : "";
    if (entry.issueId() == null) {
      return comments + "\n_No issue linked._";
    }
    var baseUrl = properties.url() != null ? properties.url().replaceAll("/+$", "") : "";
    return comments
        + "\n_See [#"
        + entry.issueId()
        + "]("
        + baseUrl
        + "/issues/"
        + entry.issueId()
        + ")._";
  }
}
