package io.b2mash.b2b.timeledger.exception;

import io.b2mash.b2b.timeledger.validation.FieldConflict;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a time-bound record violates an interval or validity invariant. The offending field
 * is exposed as a problem property so callers can point the user at the input to correct.
 */
public class IntervalConflictException extends ErrorResponseException {

  private final FieldConflict conflict;

  public IntervalConflictException(FieldConflict conflict) {
    super(HttpStatus.CONFLICT, createProblem(conflict), null);
    this.conflict = conflict;
  }

  public FieldConflict getConflict() {
    return conflict;
  }

  @Override
  public String getMessage() {
    return conflict.entity() + "." + conflict.field() + ": " + conflict.message();
  }

  private static ProblemDetail createProblem(FieldConflict conflict) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Validation conflict");
    problem.setDetail(conflict.message());
    problem.setProperty("kind", conflict.kind().name());
    problem.setProperty("entity", conflict.entity());
    problem.setProperty("field", conflict.field());
    return problem;
  }
}
