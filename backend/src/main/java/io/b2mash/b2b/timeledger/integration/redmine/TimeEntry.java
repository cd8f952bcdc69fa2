package io.b2mash.b2b.timeledger.integration.redmine;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * @param issueId linked issue, {@code null} when the entry was logged on the project itself
 */
public record TimeEntry(
    int id,
    Integer issueId,
    Integer projectId,
    int userId,
    BigDecimal hours,
    String comments,
    LocalDate spentOn) {}
