package io.b2mash.b2b.timeledger.availability;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.timeledger.integration.redmine.Issue;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineProperties;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecencyIssueHealthPolicyTest {

  private static final ZonedDateTime NOW =
      ZonedDateTime.of(2024, 5, 15, 12, 0, 0, 0, ZoneOffset.UTC);
  private static final LocalDate TODAY = NOW.toLocalDate();

  private final RecencyIssueHealthPolicy policy =
      new RecencyIssueHealthPolicy(
          new RedmineProperties(null, null, null, null, null, null, null, null, null));

  private static Issue issue(int statusId, LocalDate start, LocalDate due, String updatedOn) {
    return new Issue(
        1, "Issue", 1, null, statusId, "Status", start, due, Instant.parse(updatedOn), List.of());
  }

  @Test
  void today_startedRecentAndActive_isGreen() {
    var issue = issue(2, LocalDate.of(2024, 5, 1), null, "2024-05-15T08:00:00Z");

    assertThat(policy.assess(issue, TODAY, NOW)).isEqualTo(IssueHealth.GREEN);
  }

  @Test
  void today_startedRecentButInactiveStatus_isYellow() {
    var issue = issue(5, LocalDate.of(2024, 5, 1), null, "2024-05-15T08:00:00Z");

    assertThat(policy.assess(issue, TODAY, NOW)).isEqualTo(IssueHealth.YELLOW);
  }

  @Test
  void today_staleIssue_isRed() {
    var issue = issue(2, LocalDate.of(2024, 5, 1), null, "2024-05-13T08:00:00Z");

    assertThat(policy.assess(issue, TODAY, NOW)).isEqualTo(IssueHealth.RED);
  }

  @Test
  void today_notYetStarted_isRed() {
    var issue = issue(2, LocalDate.of(2024, 5, 20), null, "2024-05-15T08:00:00Z");

    assertThat(policy.assess(issue, TODAY, NOW)).isEqualTo(IssueHealth.RED);
  }

  @Test
  void laterDay_dueAfterAndRecentlyUpdated_isGreen() {
    var issue = issue(5, null, LocalDate.of(2024, 5, 31), "2024-05-15T08:00:00Z");

    assertThat(policy.assess(issue, TODAY.plusDays(1), NOW)).isEqualTo(IssueHealth.GREEN);
  }

  @Test
  void laterDay_alreadyDue_isRed() {
    var issue = issue(2, null, LocalDate.of(2024, 5, 10), "2024-05-15T08:00:00Z");

    assertThat(policy.assess(issue, TODAY.plusDays(1), NOW)).isEqualTo(IssueHealth.RED);
  }
}
