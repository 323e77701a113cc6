package io.b2mash.b2b.commercial.engine;

import java.util.List;

/**
 * Raised when an edit, validate or transform action is requested while the matching lifecycle
 * predicate is false, e.g. validating a document without lines.
 */
public class DocumentValidationException extends DocumentEngineException {

  private final List<String> violations;

  public DocumentValidationException(String title, String detail) {
    this(title, detail, List.of());
  }

  public DocumentValidationException(String title, String detail, List<String> violations) {
    super(title, detail);
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
