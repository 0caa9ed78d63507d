package io.cronmatch;

/** The type of error that occurred while parsing or running an expression. */
public enum ErrorKind {
  /** Lexer error - a field token has no recognised shape. */
  UNKNOWN_TOKEN("unknown-token"),
  /** Validation error - a field value lies outside its domain. */
  OUT_OF_BOUNDS("out-of-bounds"),
  /** Parser error - neither 5 nor 6 fields were supplied. */
  FIELD_COUNT("field-count"),
  /** Execution error - a matching expression had nothing to run. */
  EXECUTION("execution");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
