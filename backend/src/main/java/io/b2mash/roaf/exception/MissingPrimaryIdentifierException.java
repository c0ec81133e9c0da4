package io.b2mash.roaf.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a source record carries no primary identifier. Unlike missing optional fields this
 * aborts the whole projection: downstream consumers key generated documents on the identifier.
 */
public class MissingPrimaryIdentifierException extends ErrorResponseException {

  private final String entityName;
  private final String idField;

  public MissingPrimaryIdentifierException(String entityName, String idField) {
    super(
        HttpStatus.BAD_REQUEST,
        createProblem(
            entityName + " identifier missing",
            "Record for " + entityName + " has no value for required field " + idField),
        null);
    this.entityName = entityName;
    this.idField = idField;
  }

  public String getEntityName() {
    return entityName;
  }

  public String getIdField() {
    return idField;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
