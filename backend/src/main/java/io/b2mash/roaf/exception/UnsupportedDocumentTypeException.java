package io.b2mash.roaf.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class UnsupportedDocumentTypeException extends ErrorResponseException {

  public UnsupportedDocumentTypeException(Object documentType) {
    super(HttpStatus.BAD_REQUEST, createProblem(documentType), null);
  }

  private static ProblemDetail createProblem(Object documentType) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Unsupported document type");
    problem.setDetail("No context builder registered for document type " + documentType);
    return problem;
  }
}
