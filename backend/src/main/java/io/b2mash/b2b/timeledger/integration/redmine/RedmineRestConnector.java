package io.b2mash.b2b.timeledger.integration.redmine;

import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.IssueEnvelope;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.IssueJson;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.IssuesPage;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.Page;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.ProjectJson;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.ProjectsPage;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.TimeEntriesPage;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.TimeEntryJson;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.UserJson;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineJson.UsersPage;
import java.net.URI;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

/**
 * Redmine REST API adapter. The {@link RestClient} must be preconfigured with the base URL and the
 * {@code X-Redmine-API-Key} header. List endpoints are paged through with the maximum page size.
 */
public class RedmineRestConnector implements RedmineConnector {

  private static final Logger log = LoggerFactory.getLogger(RedmineRestConnector.class);

  static final int PAGE_SIZE = 100;
  static final int ISSUE_ID_BATCH = 50;

  private final RestClient restClient;

  public RedmineRestConnector(RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public boolean isConfigured() {
    return true;
  }

  @Override
  public Optional<Integer> findUserIdByLogin(String login) {
    var page =
        get(
            uri -> uri.path("/users.json").queryParam("name", login).queryParam("limit", 2).build(),
            UsersPage.class);
    var users = page == null || page.users() == null ? List.<UserJson>of() : page.users();
    if (users.size() != 1) {
      log.debug("Redmine login {} matched {} users, not linking", login, users.size());
      return Optional.empty();
    }
    return Optional.of(users.get(0).id());
  }

  @Override
  public List<Issue> listUserIssues(int redmineUserId) {
    var params = new LinkedHashMap<String, Object>();
    params.put("assigned_to_id", redmineUserId);
    params.put("status_id", "open");
    return fetchAll("/issues.json", params, IssuesPage.class).stream()
        .map(IssueJson::toIssue)
        .toList();
  }

  @Override
  public List<TimeEntry> listTimeEntries(int redmineUserId, LocalDate from, LocalDate until) {
    var params = new LinkedHashMap<String, Object>();
    params.put("user_id", redmineUserId);
    params.put("from", from.toString());
    params.put("to", until.toString());
    return fetchAll("/time_entries.json", params, TimeEntriesPage.class).stream()
        .map(TimeEntryJson::toTimeEntry)
        .toList();
  }

  @Override
  public Optional<Issue> getIssue(int issueId) {
    try {
      var envelope = get(uri -> uri.path("/issues/{id}.json").build(issueId), IssueEnvelope.class);
      return Optional.ofNullable(envelope).map(IssueEnvelope::issue).map(IssueJson::toIssue);
    } catch (RedmineException e) {
      if (e.getCause() instanceof HttpClientErrorException.NotFound) {
        return Optional.empty();
      }
      throw e;
    }
  }

  @Override
  public List<Issue> listIssues(Collection<Integer> issueIds) {
    var ids = List.copyOf(issueIds);
    var issues = new ArrayList<Issue>();
    for (int start = 0; start < ids.size(); start += ISSUE_ID_BATCH) {
      var batch = ids.subList(start, Math.min(start + ISSUE_ID_BATCH, ids.size()));
      var params = new LinkedHashMap<String, Object>();
      params.put(
          "issue_id", batch.stream().map(String::valueOf).collect(Collectors.joining(",")));
      params.put("status_id", "*");
      fetchAll("/issues.json", params, IssuesPage.class).stream()
          .map(IssueJson::toIssue)
          .forEach(issues::add);
    }
    return issues;
  }

  @Override
  public List<RedmineUser> listUsers() {
    return fetchAll("/users.json", Map.of(), UsersPage.class).stream()
        .map(UserJson::toUser)
        .toList();
  }

  @Override
  public List<RedmineProject> listProjects() {
    return fetchAll("/projects.json", Map.of(), ProjectsPage.class).stream()
        .map(ProjectJson::toProject)
        .toList();
  }

  @Override
  public ConnectionTestResult testConnection() {
    try {
      restClient.get().uri("/users/current.json").retrieve().toBodilessEntity();
      return new ConnectionTestResult(true, "redmine", null);
    } catch (RestClientException e) {
      log.warn("Redmine connection test failed: {}", e.getMessage());
      return new ConnectionTestResult(false, "redmine", e.getMessage());
    }
  }

  private <T> List<T> fetchAll(
      String path, Map<String, Object> params, Class<? extends Page<T>> pageType) {
    var items = new ArrayList<T>();
    int offset = 0;
    while (true) {
      int pageOffset = offset;
      var page =
          get(
              uri -> {
                var builder = uri.path(path);
                params.forEach(builder::queryParam);
                return builder
                    .queryParam("limit", PAGE_SIZE)
                    .queryParam("offset", pageOffset)
                    .build();
              },
              pageType);
      if (page == null || page.items() == null || page.items().isEmpty()) {
        break;
      }
      items.addAll(page.items());
      offset += page.items().size();
      if (offset >= page.totalCount()) {
        break;
      }
    }
    return items;
  }

  private <R> R get(Function<UriBuilder, URI> uri, Class<R> responseType) {
    try {
      return restClient.get().uri(uri).retrieve().body(responseType);
    } catch (RestClientException e) {
      throw new RedmineException("Redmine request failed: " + e.getMessage(), e);
    }
  }
}
