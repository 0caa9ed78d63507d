package io.cronmatch.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The six validated field matchers of an expression.
 *
 * @param matchers the matchers, indexed by {@link Field#ordinal()}
 * @param hasYearField whether the year field is part of the expression text
 */
public record CronFields(List<FieldMatcher> matchers, boolean hasYearField) {
  /** Creates a new CronFields with defensive copy of matchers list. */
  public CronFields {
    if (matchers.size() != Field.COUNT) {
      throw new IllegalArgumentException(
          "expected " + Field.COUNT + " matchers, got " + matchers.size());
    }
    matchers = List.copyOf(matchers);
  }

  /**
   * Returns the matcher bound to a field.
   *
   * @param field the field
   * @return the matcher
   */
  public FieldMatcher get(Field field) {
    return matchers.get(field.ordinal());
  }

  /**
   * Returns a copy with one field replaced. Replacing the year marks the year field as present.
   *
   * @param field the field to replace
   * @param matcher the new matcher, already validated for the field
   * @return a new CronFields with the updated field
   */
  public CronFields with(Field field, FieldMatcher matcher) {
    Objects.requireNonNull(matcher, "matcher");
    List<FieldMatcher> copy = new ArrayList<>(matchers);
    copy.set(field.ordinal(), matcher);
    return new CronFields(copy, hasYearField || field == Field.YEAR);
  }
}
