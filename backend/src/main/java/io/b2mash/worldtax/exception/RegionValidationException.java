package io.b2mash.worldtax.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a country or subdivision code is not a known ISO-3166 entity. Always a caller input
 * problem; results in HTTP 400.
 */
public class RegionValidationException extends ErrorResponseException {

  public enum Reason {
    INVALID_COUNTRY,
    INVALID_SUBDIVISION,
    UNEXPECTED_SUBDIVISION
  }

  private final Reason reason;
  private final String code;

  public RegionValidationException(Reason reason, String code) {
    super(HttpStatus.BAD_REQUEST, createProblem(reason, code), null);
    this.reason = reason;
    this.code = code;
  }

  public Reason getReason() {
    return reason;
  }

  public String getCode() {
    return code;
  }

  private static ProblemDetail createProblem(Reason reason, String code) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    switch (reason) {
      case INVALID_COUNTRY -> {
        problem.setTitle("Invalid country code");
        problem.setDetail("Invalid country code: " + code);
      }
      case INVALID_SUBDIVISION -> {
        problem.setTitle("Invalid subdivision code");
        problem.setDetail("Invalid subdivision code: " + code);
      }
      case UNEXPECTED_SUBDIVISION -> {
        problem.setTitle("Unexpected subdivision code");
        problem.setDetail(
            "Unexpected subdivision code: " + code + " - country has no subdivisions");
      }
    }
    problem.setProperty("reason", reason.name());
    return problem;
  }
}
