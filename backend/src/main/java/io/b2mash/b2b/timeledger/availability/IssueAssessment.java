package io.b2mash.b2b.timeledger.availability;

import java.time.Instant;
import java.time.LocalDate;

public record IssueAssessment(
    int issueId,
    String subject,
    String statusName,
    LocalDate startDate,
    LocalDate dueDate,
    Instant updatedOn,
    IssueHealth health) {}
