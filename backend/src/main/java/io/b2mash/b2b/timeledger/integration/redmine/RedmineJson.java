package io.b2mash.b2b.timeledger.integration.redmine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/** Wire shapes of the Redmine REST API. */
final class RedmineJson {

  private RedmineJson() {}

  interface Page<T> {
    List<T> items();

    int totalCount();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Ref(Integer id, String name) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CustomFieldJson(int id, String name, JsonNode value) {

    Issue.CustomField toCustomField() {
      String text = null;
      if (value != null && !value.isNull()) {
        text = value.isArray() ? (value.isEmpty() ? null : value.get(0).asText()) : value.asText();
      }
      return new Issue.CustomField(id, name, text);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record IssueJson(
      int id,
      String subject,
      Ref project,
      Ref parent,
      Ref status,
      @JsonProperty("start_date") LocalDate startDate,
      @JsonProperty("due_date") LocalDate dueDate,
      @JsonProperty("updated_on") Instant updatedOn,
      @JsonProperty("custom_fields") List<CustomFieldJson> customFields) {

    Issue toIssue() {
      return new Issue(
          id,
          subject,
          project != null ? project.id() : null,
          parent != null ? parent.id() : null,
          status != null ? status.id() : null,
          status != null ? status.name() : null,
          startDate,
          dueDate,
          updatedOn,
          customFields == null
              ? List.of()
              : customFields.stream().map(CustomFieldJson::toCustomField).toList());
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record IssueEnvelope(IssueJson issue) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record IssuesPage(List<IssueJson> issues, @JsonProperty("total_count") int totalCount)
      implements Page<IssueJson> {

    @Override
    public List<IssueJson> items() {
      return issues;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TimeEntryJson(
      int id,
      Ref project,
      Ref issue,
      Ref user,
      BigDecimal hours,
      String comments,
      @JsonProperty("spent_on") LocalDate spentOn) {

    TimeEntry toTimeEntry() {
      return new TimeEntry(
          id,
          issue != null ? issue.id() : null,
          project != null ? project.id() : null,
          user != null && user.id() != null ? user.id() : 0,
          hours,
          comments,
          spentOn);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TimeEntriesPage(
      @JsonProperty("time_entries") List<TimeEntryJson> timeEntries,
      @JsonProperty("total_count") int totalCount)
      implements Page<TimeEntryJson> {

    @Override
    public List<TimeEntryJson> items() {
      return timeEntries;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record UserJson(int id, String login, String firstname, String lastname) {

    RedmineUser toUser() {
      return new RedmineUser(id, login, firstname, lastname);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record UsersPage(List<UserJson> users, @JsonProperty("total_count") int totalCount)
      implements Page<UserJson> {

    @Override
    public List<UserJson> items() {
      return users;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ProjectJson(int id, String name, String identifier) {

    RedmineProject toProject() {
      return new RedmineProject(id, name, identifier);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ProjectsPage(List<ProjectJson> projects, @JsonProperty("total_count") int totalCount)
      implements Page<ProjectJson> {

    @Override
    public List<ProjectJson> items() {
      return projects;
    }
  }
}
