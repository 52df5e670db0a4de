package io.b2mash.worldtax.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base type for failures while evaluating a tax scenario. Subclasses name the configuration entry
 * that is missing so the operator can fix the data; an evaluation never degrades to a zero tax
 * figure instead.
 */
public abstract class TaxProcessingException extends ErrorResponseException {

  protected TaxProcessingException(HttpStatus status, String title, String detail) {
    super(status, createProblem(status, title, detail), null);
  }

  private static ProblemDetail createProblem(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
