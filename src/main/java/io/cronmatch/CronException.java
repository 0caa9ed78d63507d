package io.cronmatch;

import java.util.Optional;
import java.util.OptionalInt;

/** Exception thrown for errors in expression parsing, validation, or action execution. */
public final class CronException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span of the offending token, for lexer errors. */
  private final Span span;

  /** The original expression text, for lexer errors. */
  private final String input;

  /** The description of the field that failed validation. */
  private final String field;

  /** The lower bound of the failing field, or {@code null}. */
  private final Integer min;

  /** The upper bound of the failing field, or {@code null}. */
  private final Integer max;

  private CronException(
      ErrorKind kind,
      String message,
      Span span,
      String input,
      String field,
      Integer min,
      Integer max) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.field = field;
    this.min = min;
    this.max = max;
  }

  /**
   * Creates an error for a token that matches none of the field shapes.
   *
   * @param token the offending token
   * @param span the location of the token in the input
   * @param input the original expression text
   * @return a new CronException for an unknown token
   */
  public static CronException unknownToken(String token, Span span, String input) {
    return new CronException(
        ErrorKind.UNKNOWN_TOKEN,
        "syntax error: unknown token: " + token,
        span,
        input,
        null,
        null,
        null);
  }

  /**
   * Creates an error for a field value outside its domain.
   *
   * @param field the human-readable field description, e.g. "minutes"
   * @param min the smallest value the field accepts
   * @param max the largest value the field accepts
   * @return a new CronException for an out-of-bounds value
   */
  public static CronException outOfBounds(String field, int min, int max) {
    return new CronException(
        ErrorKind.OUT_OF_BOUNDS,
        "syntax error: out of bound: " + field + " (" + min + " ~ " + max + ")",
        null,
        null,
        field,
        min,
        max);
  }

  /**
   * Creates an error for an expression with neither 5 nor 6 fields.
   *
   * @param count the number of fields found
   * @return a new CronException for a wrong field count
   */
  public static CronException fieldCount(int count) {
    return new CronException(
        ErrorKind.FIELD_COUNT,
        "syntax error: incorrect field number (" + count + ")",
        null,
        null,
        null,
        null,
        null);
  }

  /**
   * Creates an error raised when a matching expression has no action to run.
   *
   * @return a new CronException for a missing action
   */
  public static CronException noCommand() {
    return new CronException(ErrorKind.EXECUTION, "no command", null, null, null, null, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span of the offending token, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original expression text, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns the description of the field that failed validation, if available.
   *
   * @return the field description, or empty if not available
   */
  public Optional<String> field() {
    return Optional.ofNullable(field);
  }

  /** Returns the lower bound of the failing field, if available. */
  public OptionalInt min() {
    return min == null ? OptionalInt.empty() : OptionalInt.of(min);
  }

  /** Returns the upper bound of the failing field, if available. */
  public OptionalInt max() {
    return max == null ? OptionalInt.empty() : OptionalInt.of(max);
  }

  /**
   * Formats a rich error message with the offending token underlined.
   *
   * <p>For unknown-token errors produces output like:
   *
   * <pre>
   * error: syntax error: unknown token: 5x
   *   1 2 5x * *
   *       ^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (kind == ErrorKind.UNKNOWN_TOKEN && span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");
      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
