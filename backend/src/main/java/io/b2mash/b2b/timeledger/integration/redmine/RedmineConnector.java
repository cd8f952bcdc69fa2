package io.b2mash.b2b.timeledger.integration.redmine;

import io.b2mash.b2b.timeledger.domain.User;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Port to the Redmine ticketing system. Implementations throw {@link RedmineException} when the
 * remote system fails; callers decide how to degrade.
 */
public interface RedmineConnector {

  /** Whether a Redmine instance is configured. Unconfigured connectors return empty results. */
  boolean isConfigured();

  /** Redmine user id for a login, present only when exactly one user matches. */
  Optional<Integer> findUserIdByLogin(String login);

  /** Stored Redmine id of the user, else the account whose login matches the username. */
  default Optional<Integer> resolveUserId(User user) {
    if (user.redmineId() != null) {
      return Optional.of(user.redmineId());
    }
    return findUserIdByLogin(user.username());
  }

  /** Open issues assigned to the user. */
  List<Issue> listUserIssues(int redmineUserId);

  List<TimeEntry> listTimeEntries(int redmineUserId, LocalDate from, LocalDate until);

  Optional<Issue> getIssue(int issueId);

  /** Issues with the given ids, in any status. Unknown ids are absent from the result. */
  List<Issue> listIssues(Collection<Integer> issueIds);

  List<RedmineUser> listUsers();

  List<RedmineProject> listProjects();

  ConnectionTestResult testConnection();
}
