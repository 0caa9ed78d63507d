package io.cronmatch.ast;

import io.cronmatch.CronException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Matches any of several values.
 *
 * @param values the members, in expression order
 */
public record ValueList(List<Exact> values) implements FieldMatcher {
  /** Creates a new ValueList with defensive copy of values list. */
  public ValueList {
    values = List.copyOf(values);
  }

  @Override
  public boolean matches(int value) {
    for (Exact item : values) {
      if (item.matches(value)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String rule() {
    return values.stream().map(Exact::rule).collect(Collectors.joining(","));
  }

  @Override
  public FieldMatcher check(Field field) throws CronException {
    for (Exact item : values) {
      item.check(field);
    }
    return this;
  }
}
