package io.b2mash.b2b.timeledger.availability;

import io.b2mash.b2b.timeledger.integration.redmine.Issue;
import io.b2mash.b2b.timeledger.integration.redmine.RedmineProperties;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Component;

/**
 * Today, an issue is green when it has started, was updated recently and is in an active status;
 * yellow when started and recent but not active. On other days an issue is green when it is due no
 * earlier than that day and was updated shortly before it. Everything else is red.
 */
@Component
public class RecencyIssueHealthPolicy implements IssueHealthPolicy {

  private final RedmineProperties properties;

  public RecencyIssueHealthPolicy(RedmineProperties properties) {
    this.properties = properties;
  }

  @Override
  public IssueHealth assess(Issue issue, LocalDate date, ZonedDateTime now) {
    var freshness = properties.freshness();
    if (date.equals(now.toLocalDate())) {
      boolean started = issue.startDate() != null && !issue.startDate().isAfter(date);
      var cutoff = now.minus(freshness).toInstant();
      boolean recent = issue.updatedOn() != null && !issue.updatedOn().isBefore(cutoff);
      if (!started || !recent) {
        return IssueHealth.RED;
      }
      return properties.activeStatusIds().contains(issue.statusId())
          ? IssueHealth.GREEN
          : IssueHealth.YELLOW;
    }

    var dayStart = date.atStartOfDay(now.getZone()).minus(freshness).toInstant();
    boolean due = issue.dueDate() != null && !issue.dueDate().isBefore(date);
    boolean recent = issue.updatedOn() != null && !issue.updatedOn().isBefore(dayStart);
    return due && recent ? IssueHealth.GREEN : IssueHealth.RED;
  }
}
