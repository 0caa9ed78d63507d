package io.cronmatch.ast;

import io.cronmatch.CronException;

/**
 * Matches a single value.
 *
 * @param value the value to match
 */
public record Exact(int value) implements FieldMatcher {

  @Override
  public boolean matches(int value) {
    return this.value == value;
  }

  @Override
  public String rule() {
    return Integer.toString(value);
  }

  @Override
  public FieldMatcher check(Field field) throws CronException {
    if (value < field.min() || value > field.max()) {
      throw CronException.outOfBounds(field.description(), field.min(), field.max());
    }
    return this;
  }
}
