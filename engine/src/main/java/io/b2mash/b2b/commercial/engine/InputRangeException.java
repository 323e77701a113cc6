package io.b2mash.b2b.commercial.engine;

/** Raised for missing, negative or out-of-range monetary input. */
public class InputRangeException extends DocumentEngineException {

  private final String field;

  public InputRangeException(String field, String detail) {
    super("Invalid " + field, detail);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
