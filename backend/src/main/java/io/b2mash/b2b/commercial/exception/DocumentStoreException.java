package io.b2mash.b2b.commercial.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when the document store cannot be reached or answers with a payload that breaks the
 * document contract (unknown type or status, missing fields, totals that disagree with the lines).
 * Results in HTTP 502 Bad Gateway.
 */
public class DocumentStoreException extends ErrorResponseException {

  public DocumentStoreException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail, List.of()), cause);
  }

  public DocumentStoreException(String detail, List<String> violations) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail, violations), null);
  }

  private static ProblemDetail createProblem(String detail, List<String> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Document store error");
    problem.setDetail(detail);
    if (!violations.isEmpty()) {
      problem.setProperty("violations", violations);
    }
    return problem;
  }
}
