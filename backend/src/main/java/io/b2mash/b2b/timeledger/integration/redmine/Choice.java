package io.b2mash.b2b.timeledger.integration.redmine;

/** Option of a selection list, e.g. to map a user or contract onto its Redmine counterpart. */
public record Choice(String value, String label) {}
