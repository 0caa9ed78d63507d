package io.cronmatch.lexer;

import io.cronmatch.Span;
import java.util.List;

/**
 * Represents a lexed field token.
 *
 * @param kind the shape of the token
 * @param span the location in the input
 * @param text the token as written
 * @param numbers the numbers the token carries: the step for PERIOD, begin and end for RANGE, the
 *     value for VALUE, the members for LIST, nothing for WILDCARD
 */
public record Token(TokenKind kind, Span span, String text, List<Integer> numbers) {
  /** Creates a new Token with defensive copy of numbers list. */
  public Token {
    numbers = List.copyOf(numbers);
  }

  /** Creates a wildcard token. */
  public static Token wildcard(String text, Span span) {
    return new Token(TokenKind.WILDCARD, span, text, List.of());
  }

  /** Creates a period token. */
  public static Token period(int step, String text, Span span) {
    return new Token(TokenKind.PERIOD, span, text, List.of(step));
  }

  /** Creates a range token. */
  public static Token range(int begin, int end, String text, Span span) {
    return new Token(TokenKind.RANGE, span, text, List.of(begin, end));
  }

  /** Creates a single value token. */
  public static Token value(int value, String text, Span span) {
    return new Token(TokenKind.VALUE, span, text, List.of(value));
  }

  /** Creates a value list token. */
  public static Token list(List<Integer> values, String text, Span span) {
    return new Token(TokenKind.LIST, span, text, values);
  }
}
