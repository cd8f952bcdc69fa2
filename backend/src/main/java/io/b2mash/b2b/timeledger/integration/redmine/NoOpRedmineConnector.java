package io.b2mash.b2b.timeledger.integration.redmine;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Used when no Redmine instance is configured. Every call answers with an empty result. */
public class NoOpRedmineConnector implements RedmineConnector {

  @Override
  public boolean isConfigured() {
    return false;
  }

  @Override
  public Optional<Integer> findUserIdByLogin(String login) {
    return Optional.empty();
  }

  @Override
  public List<Issue> listUserIssues(int redmineUserId) {
    return List.of();
  }

  @Override
  public List<TimeEntry> listTimeEntries(int redmineUserId, LocalDate from, LocalDate until) {
    return List.of();
  }

  @Override
  public Optional<Issue> getIssue(int issueId) {
    return Optional.empty();
  }

  @Override
  public List<Issue> listIssues(Collection<Integer> issueIds) {
    return List.of();
  }

  @Override
  public List<RedmineUser> listUsers() {
    return List.of();
  }

  @Override
  public List<RedmineProject> listProjects() {
    return List.of();
  }

  @Override
  public ConnectionTestResult testConnection() {
    return new ConnectionTestResult(false, "noop", "Redmine is not configured");
  }
}
