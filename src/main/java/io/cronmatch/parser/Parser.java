package io.cronmatch.parser;

import io.cronmatch.CronException;
import io.cronmatch.ast.CronFields;
import io.cronmatch.ast.Exact;
import io.cronmatch.ast.Field;
import io.cronmatch.ast.FieldMatcher;
import io.cronmatch.ast.Period;
import io.cronmatch.ast.Range;
import io.cronmatch.ast.ValueList;
import io.cronmatch.ast.Wildcard;
import io.cronmatch.lexer.Lexer;
import io.cronmatch.lexer.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Builds validated field matchers from expression text. */
public final class Parser {
  private Parser() {}

  /**
   * Parses expression text into its six field matchers.
   *
   * @param input the expression text
   * @return the validated fields
   * @throws CronException if a token is unknown, a value is out of bounds, or the field count is
   *     neither 5 nor 6
   */
  public static CronFields parse(String input) throws CronException {
    Objects.requireNonNull(input, "input");
    List<Token> tokens = Lexer.tokenize(input);
    List<FieldMatcher> matchers = new ArrayList<>(tokens.size());
    for (Token token : tokens) {
      matchers.add(toMatcher(token));
    }
    return build(matchers);
  }

  /**
   * Validates matchers against their fields and resolves the optional year.
   *
   * <p>Matchers are checked in order before the count is, so the first out-of-bounds value is
   * reported even when the count is also wrong.
   *
   * @param matchers 5 or 6 matchers in field order
   * @return the validated fields
   * @throws CronException if a value is out of bounds or the count is neither 5 nor 6
   */
  public static CronFields build(List<FieldMatcher> matchers) throws CronException {
    List<FieldMatcher> checked = new ArrayList<>(Field.COUNT);
    for (int i = 0; i < matchers.size(); i++) {
      FieldMatcher matcher = Objects.requireNonNull(matchers.get(i), "matcher");
      // extra fields beyond the year have no domain; the count check below rejects them
      checked.add(i < Field.COUNT ? matcher.check(Field.at(i)) : matcher);
    }

    if (checked.size() == Field.COUNT) {
      return new CronFields(checked, true);
    }
    if (checked.size() == Field.COUNT - 1) {
      checked.add(Wildcard.any());
      return new CronFields(checked, false);
    }
    throw CronException.fieldCount(checked.size());
  }

  private static FieldMatcher toMatcher(Token token) {
    List<Integer> n = token.numbers();
    return switch (token.kind()) {
      case WILDCARD -> Wildcard.any();
      case PERIOD -> Period.every(n.get(0));
      case RANGE -> new Range(n.get(0), n.get(1));
      case VALUE -> new Exact(n.get(0));
      case LIST -> new ValueList(n.stream().map(Exact::new).toList());
    };
  }
}
