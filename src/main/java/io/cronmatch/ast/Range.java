package io.cronmatch.ast;

import io.cronmatch.CronException;

/**
 * Matches an inclusive range of values.
 *
 * <p>Only the ends are validated, not their order: a range whose begin is greater than its end is
 * accepted and matches nothing.
 *
 * @param begin the first value (inclusive)
 * @param end the last value (inclusive)
 */
public record Range(int begin, int end) implements FieldMatcher {

  @Override
  public boolean matches(int value) {
    return value >= begin && value <= end;
  }

  @Override
  public String rule() {
    return begin + "-" + end;
  }

  @Override
  public FieldMatcher check(Field field) throws CronException {
    if (outside(begin, field) || outside(end, field)) {
      throw CronException.outOfBounds(field.description(), field.min(), field.max());
    }
    return this;
  }

  private static boolean outside(int value, Field field) {
    return value < field.min() || value > field.max();
  }
}
