package io.cronmatch.lexer;

/** The shape of a field token. */
public enum TokenKind {
  /** An empty token or "*". */
  WILDCARD,
  /** A step over the whole field, e.g. "*&#47;5". */
  PERIOD,
  /** Two numbers joined by a dash, e.g. "9-17". */
  RANGE,
  /** A single number. */
  VALUE,
  /** Two or more numbers joined by commas, e.g. "1,15,30". */
  LIST
}
