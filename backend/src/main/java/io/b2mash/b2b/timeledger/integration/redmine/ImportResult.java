package io.b2mash.b2b.timeledger.integration.redmine;

/**
 * Outcome of committing Redmine performance candidates.
 *
 * @param rejected candidates refused by the interval invariants or lacking a timesheet
 */
public record ImportResult(int created, int updated, int rejected) {}
