package io.b2mash.b2b.timeledger.availability;

import io.b2mash.b2b.timeledger.integration.redmine.Issue;
import java.time.LocalDate;
import java.time.ZonedDateTime;

/** Colors an open issue of a user who has free hours on {@code date}. */
public interface IssueHealthPolicy {

  IssueHealth assess(Issue issue, LocalDate date, ZonedDateTime now);
}
