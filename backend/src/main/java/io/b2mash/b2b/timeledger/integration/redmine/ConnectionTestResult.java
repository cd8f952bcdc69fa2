package io.b2mash.b2b.timeledger.integration.redmine;

/** Result of checking connectivity with the configured Redmine instance. */
public record ConnectionTestResult(boolean success, String providerName, String errorMessage) {}
