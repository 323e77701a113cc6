package io.b2mash.b2b.commercial.exception;

import io.b2mash.b2b.commercial.engine.DocumentEngineException;
import io.b2mash.b2b.commercial.engine.DocumentValidationException;
import io.b2mash.b2b.commercial.engine.IllegalTransitionException;
import io.b2mash.b2b.commercial.engine.InputRangeException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps engine errors to RFC 7807 problem responses. Spring's own {@code ErrorResponseException}
 * subclasses ({@link ResourceNotFoundException}) are rendered by the base class.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(DocumentValidationException.class)
  public ResponseEntity<ProblemDetail> handleValidation(
      DocumentValidationException ex, HttpServletRequest request) {
    log.warn(
        "Document validation failed: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getDetail());
    var problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    if (!ex.getViolations().isEmpty()) {
      problem.setProperty("violations", ex.getViolations());
    }
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
  }

  @ExceptionHandler(IllegalTransitionException.class)
  public ResponseEntity<ProblemDetail> handleIllegalTransition(
      IllegalTransitionException ex, HttpServletRequest request) {
    log.warn(
        "Illegal transition: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getDetail());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem(HttpStatus.CONFLICT, ex));
  }

  @ExceptionHandler(InputRangeException.class)
  public ResponseEntity<ProblemDetail> handleInputRange(InputRangeException ex) {
    log.warn("Rejected input: field={}, reason={}", ex.getField(), ex.getDetail());
    var problem = problem(HttpStatus.BAD_REQUEST, ex);
    problem.setProperty("field", ex.getField());
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(DocumentStoreException.class)
  public ResponseEntity<ProblemDetail> handleStoreFailure(DocumentStoreException ex) {
    log.error("Document store failure: {}", ex.getBody().getDetail(), ex.getCause());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ex.getBody());
  }

  private static ProblemDetail problem(HttpStatus status, DocumentEngineException ex) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(ex.getTitle());
    problem.setDetail(ex.getDetail());
    return problem;
  }
}
