package io.b2mash.roaf.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a source payload cannot be read as a JSON object at all. */
public class InvalidRawRecordException extends ErrorResponseException {

  public InvalidRawRecordException(String detail, Throwable cause) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid source record");
    problem.setDetail(detail);
    return problem;
  }
}
