package io.cronmatch.ast;

import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * The six positional fields of an expression, in expression order, with their domains.
 *
 * <p>The ordinal of each constant is its position in the expression text.
 */
public enum Field {
  MINUTE("minutes", 0, 59),
  HOUR("hours", 0, 23),
  DAY_OF_MONTH("day of month", 1, 31),
  MONTH("month", 1, 12),
  DAY_OF_WEEK("day of week", 0, 6),
  YEAR("year", 1970, 2099);

  /** The number of fields an expression carries once the year slot is filled in. */
  public static final int COUNT = 6;

  private final String description;
  private final int min;
  private final int max;

  Field(String description, int min, int max) {
    this.description = description;
    this.min = min;
    this.max = max;
  }

  /**
   * Returns the human-readable name used in error messages.
   *
   * @return the field description
   */
  public String description() {
    return description;
  }

  /**
   * Returns the smallest value this field accepts.
   *
   * @return the lower bound (inclusive)
   */
  public int min() {
    return min;
  }

  /**
   * Returns the largest value this field accepts.
   *
   * @return the upper bound (inclusive)
   */
  public int max() {
    return max;
  }

  /**
   * Extracts this field's component from a calendar point.
   *
   * <p>Day of week uses cron numbering (Sunday=0, Monday=1, ..., Saturday=6).
   *
   * @param temporal a temporal carrying date and time-of-day fields
   * @return the component value
   */
  public int extract(TemporalAccessor temporal) {
    return switch (this) {
      case MINUTE -> temporal.get(ChronoField.MINUTE_OF_HOUR);
      case HOUR -> temporal.get(ChronoField.HOUR_OF_DAY);
      case DAY_OF_MONTH -> temporal.get(ChronoField.DAY_OF_MONTH);
      case MONTH -> temporal.get(ChronoField.MONTH_OF_YEAR);
      case DAY_OF_WEEK -> temporal.get(ChronoField.DAY_OF_WEEK) % 7;
      case YEAR -> temporal.get(ChronoField.YEAR);
    };
  }

  /**
   * Returns the field at the given expression position.
   *
   * @param index the zero-based position
   * @return the field
   * @throws IndexOutOfBoundsException if the index is not in 0-5
   */
  public static Field at(int index) {
    Field[] all = values();
    if (index < 0 || index >= all.length) {
      throw new IndexOutOfBoundsException("no field at position " + index);
    }
    return all[index];
  }
}
