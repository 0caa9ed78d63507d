package io.cronmatch.display;

import io.cronmatch.ast.CronFields;
import io.cronmatch.ast.Field;
import java.util.StringJoiner;

/** Renders expression fields as canonical text. */
public final class Display {
  private Display() {}

  /**
   * Renders fields as a canonical expression: the first five fields separated by single spaces,
   * followed by the year only when the expression carries one.
   *
   * @param fields the fields to render
   * @return the canonical string representation
   */
  public static String render(CronFields fields) {
    StringJoiner sj = new StringJoiner(" ");
    for (Field field : Field.values()) {
      if (field == Field.YEAR && !fields.hasYearField()) {
        continue;
      }
      sj.add(fields.get(field).rule());
    }
    return sj.toString();
  }
}
