package io.b2mash.b2b.timeledger.integration.redmine;

/** Thrown when the Redmine API cannot be reached or answers with an error. */
public class RedmineException extends RuntimeException {

  public RedmineException(String message) {
    super(message);
  }

  public RedmineException(String message, Throwable cause) {
    super(message, cause);
  }
}
