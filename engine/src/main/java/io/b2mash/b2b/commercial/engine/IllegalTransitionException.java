package io.b2mash.b2b.commercial.engine;

/**
 * Raised when a status change or transformation target is not permitted from the document's
 * current type and status.
 */
public class IllegalTransitionException extends DocumentEngineException {

  public IllegalTransitionException(String title, String detail) {
    super(title, detail);
  }
}
