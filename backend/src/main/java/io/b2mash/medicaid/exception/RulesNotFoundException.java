package io.b2mash.medicaid.exception;

import io.b2mash.medicaid.rules.Jurisdiction;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when no Medicaid rule set exists for a jurisdiction and rules year. */
public class RulesNotFoundException extends ErrorResponseException {

  private final Jurisdiction jurisdiction;
  private final int year;

  public RulesNotFoundException(Jurisdiction jurisdiction, int year) {
    super(HttpStatus.NOT_FOUND, createProblem(jurisdiction, year), null);
    this.jurisdiction = jurisdiction;
    this.year = year;
  }

  public Jurisdiction getJurisdiction() {
    return jurisdiction;
  }

  public int getYear() {
    return year;
  }

  private static ProblemDetail createProblem(Jurisdiction jurisdiction, int year) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Medicaid rules not found");
    problem.setDetail("No Medicaid rules found for " + jurisdiction.key() + " in " + year);
    problem.setProperty("jurisdiction", jurisdiction.key());
    problem.setProperty("year", year);
    return problem;
  }
}
