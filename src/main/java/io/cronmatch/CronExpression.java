package io.cronmatch;

import io.cronmatch.ast.CronFields;
import io.cronmatch.ast.Field;
import io.cronmatch.ast.FieldMatcher;
import io.cronmatch.display.Display;
import io.cronmatch.eval.Evaluator;
import io.cronmatch.parser.Parser;
import io.cronmatch.time.TimestampParser;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for parsing cron expressions, matching them against timestamps, and running
 * the actions registered on them.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CronExpression expr = CronExpression.parse("1 11-12 1-15 * *")
 *     .addAction(() -> System.out.println("job1"))
 *     .addAction(() -> System.out.println("job2"));
 * expr.matchRun(LocalDateTime.of(2020, 8, 1, 11, 1)); // prints job1, job2
 * }</pre>
 *
 * <p>An expression holds five or six fields: minute, hour, day of month, month, day of week and an
 * optional year. Without a year every year matches. Matching reads the calendar fields of the
 * timestamp as given; no timezone conversion is applied.
 */
public final class CronExpression {
  private static final Logger log = LoggerFactory.getLogger(CronExpression.class);

  private volatile CronFields fields;
  private final List<Runnable> actions = new ArrayList<>();

  private CronExpression(CronFields fields) {
    this.fields = fields;
  }

  /**
   * Parses a cron expression.
   *
   * @param input the expression text
   * @return the parsed expression
   * @throws CronException if the input is invalid
   */
  public static CronExpression parse(String input) throws CronException {
    return new CronExpression(Parser.parse(input));
  }

  /**
   * Parses a cron expression read from a character stream. The whole stream is consumed; line
   * breaks separate fields like any other whitespace. The reader is not closed.
   *
   * @param reader the source of the expression text
   * @return the parsed expression
   * @throws CronException if the text is invalid
   * @throws UncheckedIOException if reading fails
   */
  public static CronExpression parse(Reader reader) throws CronException {
    Objects.requireNonNull(reader, "reader");
    StringWriter text = new StringWriter();
    try {
      reader.transferTo(text);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return parse(text.toString());
  }

  /**
   * Builds an expression from matchers in field order.
   *
   * @param matchers 5 or 6 matchers, minute first
   * @return the expression
   * @throws CronException if a value is out of bounds or the count is neither 5 nor 6
   */
  public static CronExpression of(List<FieldMatcher> matchers) throws CronException {
    return new CronExpression(Parser.build(matchers));
  }

  /**
   * Validates a cron expression without throwing.
   *
   * @param input the expression text
   * @return true if the expression is valid
   */
  public static boolean validate(String input) {
    try {
      Parser.parse(input);
      return true;
    } catch (CronException e) {
      return false;
    }
  }

  /**
   * Counts how many of the six fields match a calendar point.
   *
   * @param timestamp a date-time carrying minute, hour, day, month, weekday and year
   * @return the number of matching fields, 0 to 6
   */
  public int matchDetail(TemporalAccessor timestamp) {
    return Evaluator.matchDetail(fields, timestamp);
  }

  /**
   * Counts how many of the six fields match a textual timestamp.
   *
   * @param timestamp the timestamp, in a format {@link TimestampParser#defaults()} accepts
   * @return the number of matching fields, 0 to 6
   */
  public int matchDetail(String timestamp) {
    return matchDetail(TimestampParser.defaults().parse(timestamp));
  }

  /**
   * Checks if a calendar point matches every field.
   *
   * @param timestamp a date-time carrying minute, hour, day, month, weekday and year
   * @return true if the timestamp matches
   */
  public boolean matches(TemporalAccessor timestamp) {
    return Evaluator.matches(fields, timestamp);
  }

  /**
   * Checks if a textual timestamp matches every field.
   *
   * @param timestamp the timestamp, in a format {@link TimestampParser#defaults()} accepts
   * @return true if the timestamp matches
   */
  public boolean matches(String timestamp) {
    return matches(TimestampParser.defaults().parse(timestamp));
  }

  /**
   * Runs the registered actions if the timestamp matches.
   *
   * @param timestamp the calendar point
   * @return true if the timestamp matched and the actions ran
   * @throws CronException if the timestamp matched but no action is registered
   */
  public boolean matchRun(TemporalAccessor timestamp) throws CronException {
    return matchRun(timestamp, null, false);
  }

  /**
   * Runs an immediate action instead of the registered ones if the timestamp matches.
   *
   * @param timestamp the calendar point
   * @param action the action to run, or null to run the registered actions
   * @return true if the timestamp matched
   * @throws CronException if the timestamp matched, no action was given and none is registered
   */
  public boolean matchRun(TemporalAccessor timestamp, Runnable action) throws CronException {
    return matchRun(timestamp, action, false);
  }

  /**
   * Runs actions if the timestamp matches.
   *
   * <p>The immediate action, when given, runs first. The registered actions then run in the order
   * they were added, unless an immediate action was given and {@code also} is false. Without an
   * immediate action {@code also} has no effect.
   *
   * @param timestamp the calendar point
   * @param action the action to run first, or null
   * @param also whether the registered actions run after the immediate one
   * @return true if the timestamp matched, false if nothing ran
   * @throws CronException if registered actions are due but none exists; the expression stays
   *     usable
   */
  public boolean matchRun(TemporalAccessor timestamp, Runnable action, boolean also)
      throws CronException {
    if (!matches(timestamp)) {
      return false;
    }

    if (action != null) {
      action.run();
      if (!also) {
        return true;
      }
    } else {
      also = false;
    }

    List<Runnable> due;
    synchronized (actions) {
      due = List.copyOf(actions);
    }
    if (!also && due.isEmpty()) {
      throw CronException.noCommand();
    }

    if (log.isDebugEnabled()) {
      log.debug("Expression '{}' matched {}; running {} action(s)", rule(), timestamp, due.size());
    }
    for (Runnable registered : due) {
      registered.run();
    }
    return true;
  }

  /**
   * Runs the registered actions if a textual timestamp matches.
   *
   * @param timestamp the timestamp, in a format {@link TimestampParser#defaults()} accepts
   * @return true if the timestamp matched and the actions ran
   * @throws CronException if the timestamp matched but no action is registered
   */
  public boolean matchRun(String timestamp) throws CronException {
    return matchRun(TimestampParser.defaults().parse(timestamp));
  }

  /**
   * Returns the canonical text of this expression.
   *
   * @return the five fields, plus the year when the expression carries one
   */
  public String rule() {
    return Display.render(fields);
  }

  /** Returns the minute matcher. */
  public FieldMatcher minutes() {
    return fields.get(Field.MINUTE);
  }

  /** Returns the hour matcher. */
  public FieldMatcher hours() {
    return fields.get(Field.HOUR);
  }

  /** Returns the day-of-month matcher. */
  public FieldMatcher dayOfMonth() {
    return fields.get(Field.DAY_OF_MONTH);
  }

  /** Returns the month matcher. */
  public FieldMatcher month() {
    return fields.get(Field.MONTH);
  }

  /** Returns the day-of-week matcher. */
  public FieldMatcher dayOfWeek() {
    return fields.get(Field.DAY_OF_WEEK);
  }

  /** Returns the year matcher; a wildcard when the expression has no year field. */
  public FieldMatcher year() {
    return fields.get(Field.YEAR);
  }

  /**
   * Returns whether the expression text includes a year.
   *
   * @return true for six-field expressions
   */
  public boolean hasYearField() {
    return fields.hasYearField();
  }

  /** Replaces the minute matcher. */
  public CronExpression minutes(FieldMatcher matcher) throws CronException {
    return replace(Field.MINUTE, matcher);
  }

  /** Replaces the hour matcher. */
  public CronExpression hours(FieldMatcher matcher) throws CronException {
    return replace(Field.HOUR, matcher);
  }

  /** Replaces the day-of-month matcher. */
  public CronExpression dayOfMonth(FieldMatcher matcher) throws CronException {
    return replace(Field.DAY_OF_MONTH, matcher);
  }

  /** Replaces the month matcher. */
  public CronExpression month(FieldMatcher matcher) throws CronException {
    return replace(Field.MONTH, matcher);
  }

  /** Replaces the day-of-week matcher. */
  public CronExpression dayOfWeek(FieldMatcher matcher) throws CronException {
    return replace(Field.DAY_OF_WEEK, matcher);
  }

  /**
   * Replaces the year matcher. The year becomes part of the expression text even if it was
   * omitted when parsing.
   *
   * @param matcher the new year matcher
   * @return this expression
   * @throws CronException if the matcher is out of bounds for years
   */
  public CronExpression year(FieldMatcher matcher) throws CronException {
    return replace(Field.YEAR, matcher);
  }

  /**
   * Replaces the matcher of one field after validating it.
   *
   * @param field the field to replace
   * @param matcher the new matcher
   * @return this expression
   * @throws CronException if the matcher is out of bounds for the field
   */
  public synchronized CronExpression replace(Field field, FieldMatcher matcher)
      throws CronException {
    Objects.requireNonNull(matcher, "matcher");
    fields = fields.with(field, matcher.check(field));
    return this;
  }

  /**
   * Returns the current fields.
   *
   * @return the field matchers and year flag
   */
  public CronFields fields() {
    return fields;
  }

  /**
   * Registers an action to run when the expression matches. Actions are never removed.
   *
   * @param action the action
   * @return this expression
   */
  public CronExpression addAction(Runnable action) {
    Objects.requireNonNull(action, "action");
    synchronized (actions) {
      actions.add(action);
    }
    return this;
  }

  /**
   * Returns the action at the given registration position.
   *
   * @param index the zero-based position
   * @return the action
   * @throws IndexOutOfBoundsException if no action was registered at that position
   */
  public Runnable action(int index) {
    synchronized (actions) {
      return actions.get(index);
    }
  }

  /**
   * Returns a snapshot of the registered actions in registration order.
   *
   * @return an unmodifiable list of actions
   */
  public List<Runnable> actions() {
    synchronized (actions) {
      return Collections.unmodifiableList(new ArrayList<>(actions));
    }
  }

  /**
   * Returns the number of registered actions.
   *
   * @return the action count
   */
  public int actionCount() {
    synchronized (actions) {
      return actions.size();
    }
  }

  /**
   * Returns the canonical string representation of this expression.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return rule();
  }
}
