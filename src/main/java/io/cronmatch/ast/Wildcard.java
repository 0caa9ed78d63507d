package io.cronmatch.ast;

/** Matches every value of a field. */
public record Wildcard() implements FieldMatcher {
  private static final Wildcard INSTANCE = new Wildcard();

  /**
   * Returns the shared wildcard.
   *
   * @return the wildcard matcher
   */
  public static Wildcard any() {
    return INSTANCE;
  }

  @Override
  public boolean matches(int value) {
    return true;
  }

  @Override
  public String rule() {
    return "*";
  }

  @Override
  public FieldMatcher check(Field field) {
    return this;
  }
}
