package io.cronmatch.ast;

import io.cronmatch.CronException;

/**
 * Sealed interface for the value test bound to one expression field.
 *
 * <p>There are 5 kinds of matcher:
 *
 * <ul>
 *   <li>{@link Wildcard} - "*"
 *   <li>{@link Exact} - "15"
 *   <li>{@link Range} - "9-17"
 *   <li>{@link ValueList} - "1,15,30"
 *   <li>{@link Period} - "*&#47;5"
 * </ul>
 */
public sealed interface FieldMatcher permits Wildcard, Exact, Range, ValueList, Period {

  /**
   * Tests a field component.
   *
   * @param value the component extracted from a timestamp
   * @return true if the value satisfies this matcher
   */
  boolean matches(int value);

  /**
   * Returns the canonical text of this matcher.
   *
   * @return the matcher as it appears in an expression
   */
  String rule();

  /**
   * Validates this matcher against a field's domain.
   *
   * @param field the field this matcher is bound to
   * @return the validated matcher, which may differ from this one
   * @throws CronException of kind OUT_OF_BOUNDS if a value lies outside the field's domain
   */
  FieldMatcher check(Field field) throws CronException;
}
