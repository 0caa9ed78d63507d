package io.cronmatch.lexer;

import io.cronmatch.CronException;
import io.cronmatch.Span;
import java.util.ArrayList;
import java.util.List;

/** Splits expression text into field tokens and classifies each one. */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of field tokens.
   *
   * <p>Fields are separated by runs of whitespace; leading and trailing whitespace is ignored.
   * Blank input yields a single empty wildcard token.
   *
   * @param input the expression text
   * @return the tokens, in input order
   * @throws CronException if a field has none of the recognised shapes
   */
  public static List<Token> tokenize(String input) throws CronException {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() throws CronException {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      while (pos < input.length() && !isWhitespace(input.charAt(pos))) {
        pos++;
      }
      tokens.add(classify(input.substring(start, pos), new Span(start, pos), input));
    }

    if (tokens.isEmpty()) {
      tokens.add(Token.wildcard("", new Span(0, 0)));
    }
    return tokens;
  }

  /**
   * Classifies a single field token. The first matching shape wins: wildcard, period, range,
   * value, list.
   *
   * @param text the token text
   * @param span the location of the token in the input
   * @param input the whole expression text, for error reporting
   * @return the classified token
   * @throws CronException if the token has none of the recognised shapes
   */
  public static Token classify(String text, Span span, String input) throws CronException {
    if (text.isEmpty() || text.equals("*")) {
      return Token.wildcard(text, span);
    }

    if (text.startsWith("*/") && isDigits(text, 2, text.length())) {
      return Token.period(parseNumber(text, 2, text.length()), text, span);
    }

    int dash = text.indexOf('-');
    if (dash > 0 && isDigits(text, 0, dash) && isDigits(text, dash + 1, text.length())) {
      return Token.range(
          parseNumber(text, 0, dash), parseNumber(text, dash + 1, text.length()), text, span);
    }

    if (isDigits(text, 0, text.length())) {
      return Token.value(parseNumber(text, 0, text.length()), text, span);
    }

    List<Integer> members = splitList(text);
    if (members != null) {
      return Token.list(members, text, span);
    }

    throw CronException.unknownToken(text, span, input);
  }

  /** Returns the members of a comma list of two or more numbers, or null if text is not one. */
  private static List<Integer> splitList(String text) {
    List<Integer> members = new ArrayList<>();
    int start = 0;
    while (true) {
      int comma = text.indexOf(',', start);
      int end = comma < 0 ? text.length() : comma;
      if (!isDigits(text, start, end)) {
        return null;
      }
      members.add(parseNumber(text, start, end));
      if (comma < 0) {
        break;
      }
      start = comma + 1;
    }
    return members.size() >= 2 ? members : null;
  }

  /** Parses a digit run, saturating at Integer.MAX_VALUE so bound validation rejects it. */
  private static int parseNumber(String text, int start, int end) {
    long value = 0;
    for (int i = start; i < end; i++) {
      value = value * 10 + (text.charAt(i) - '0');
      if (value > Integer.MAX_VALUE) {
        return Integer.MAX_VALUE;
      }
    }
    return (int) value;
  }

  private static boolean isDigits(String text, int start, int end) {
    if (start >= end) {
      return false;
    }
    for (int i = start; i < end; i++) {
      if (!isDigit(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private void skipWhitespace() {
    while (pos < input.length() && isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
  }
}
