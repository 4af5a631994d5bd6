package io.b2mash.medicaid.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when household input is structurally invalid (unsupported marital status, negative asset
 * values, missing jurisdiction). Results in HTTP 400 Bad Request with the list of violations.
 */
public class InvalidHouseholdInputException extends ErrorResponseException {

  private final List<String> violations;

  public InvalidHouseholdInputException(List<String> violations) {
    super(HttpStatus.BAD_REQUEST, createProblem(violations), null);
    this.violations = List.copyOf(violations);
  }

  public InvalidHouseholdInputException(String violation) {
    this(List.of(violation));
  }

  public List<String> getViolations() {
    return violations;
  }

  private static ProblemDetail createProblem(List<String> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid household input");
    problem.setDetail(String.join("; ", violations));
    problem.setProperty("violations", violations);
    return problem;
  }
}
