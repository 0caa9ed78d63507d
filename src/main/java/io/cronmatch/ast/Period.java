package io.cronmatch.ast;

import io.cronmatch.CronException;

/**
 * Matches every {@code step}-th value, counted from {@code phase}.
 *
 * <p>The lexer produces a period with phase 0. Validation aligns the phase to the field's lower
 * bound when that bound is positive, so {@code *}{@code /2} on day of month matches 1, 3, 5, ...
 * and on year matches 1970, 1972, ...
 *
 * @param step the distance between matching values
 * @param phase the value counting starts from
 */
public record Period(int step, int phase) implements FieldMatcher {

  /**
   * Creates an unaligned period as written in an expression.
   *
   * @param step the distance between matching values
   * @return a period with phase 0
   */
  public static Period every(int step) {
    return new Period(step, 0);
  }

  @Override
  public boolean matches(int value) {
    return Math.floorMod(value - phase, step) == 0;
  }

  @Override
  public String rule() {
    return "*/" + step;
  }

  @Override
  public FieldMatcher check(Field field) throws CronException {
    // step 0 would pass the bound test on zero-based fields and divide by zero when matching
    if (step == 0 || step < field.min() || step > field.max()) {
      throw CronException.outOfBounds(field.description(), field.min(), field.max());
    }
    if (field.min() > 0) {
      return new Period(step, field.min());
    }
    return this;
  }
}
