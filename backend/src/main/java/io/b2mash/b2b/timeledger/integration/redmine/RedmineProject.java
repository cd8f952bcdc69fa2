package io.b2mash.b2b.timeledger.integration.redmine;

public record RedmineProject(int id, String name, String identifier) {}
