package io.b2mash.b2b.commercial.engine;

/**
 * Base type of all errors raised by the engine. Every engine error is local, synchronous and
 * recoverable: callers report it to the user and carry on.
 */
public abstract class DocumentEngineException extends RuntimeException {

  private final String title;

  protected DocumentEngineException(String title, String detail) {
    super(detail);
    this.title = title;
  }

  /** Short, human-readable summary of the error kind. */
  public String getTitle() {
    return title;
  }

  public String getDetail() {
    return getMessage();
  }
}
