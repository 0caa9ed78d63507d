package io.cronmatch.eval;

import io.cronmatch.ast.CronFields;
import io.cronmatch.ast.Field;
import java.time.temporal.TemporalAccessor;

/** Tests calendar points against expression fields. */
public final class Evaluator {
  private Evaluator() {}

  /**
   * Counts the fields whose matcher accepts the corresponding component of a calendar point.
   *
   * @param fields the expression fields
   * @param temporal the calendar point
   * @return the number of matching fields, 0 to 6
   */
  public static int matchDetail(CronFields fields, TemporalAccessor temporal) {
    int count = 0;
    for (Field field : Field.values()) {
      if (fields.get(field).matches(field.extract(temporal))) {
        count++;
      }
    }
    return count;
  }

  /**
   * Checks whether every field matches. Day of month and day of week must both match; there is
   * no either-or rule between them.
   *
   * @param fields the expression fields
   * @param temporal the calendar point
   * @return true if all six fields match
   */
  public static boolean matches(CronFields fields, TemporalAccessor temporal) {
    return matchDetail(fields, temporal) == Field.COUNT;
  }
}
