package io.cronmatch.cache;

import io.cronmatch.CronException;
import io.cronmatch.CronExpression;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes parsed expressions by their normalized text.
 *
 * <p>Runs of whitespace are collapsed to a single space before lookup, so {@code "0  9 * * 1"},
 * {@code "0\t9 * * 1"} and {@code "0 9 * * 1"} share an entry. Entries are never evicted. At most
 * one expression is built per key, even under concurrent lookups. Failed parses are not cached.
 */
public final class ExpressionCache {
  private static final Logger log = LoggerFactory.getLogger(ExpressionCache.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final Map<String, CronExpression> entries = new HashMap<>();

  /**
   * Returns the expression for the given text, parsing it on first use.
   *
   * @param text the expression text
   * @return the cached expression
   * @throws CronException if the text is not a valid expression
   */
  public synchronized CronExpression lookup(String text) throws CronException {
    String key = normalize(text);
    CronExpression cached = entries.get(key);
    if (cached != null) {
      return cached;
    }

    CronExpression parsed = CronExpression.parse(key);
    entries.put(key, parsed);
    log.debug("Cached expression key='{}' rule='{}' size={}", key, parsed.rule(), entries.size());
    return parsed;
  }

  /**
   * Checks whether an expression equivalent to the text is cached.
   *
   * @param text the expression text
   * @return true if a lookup would not parse
   */
  public synchronized boolean contains(String text) {
    return entries.containsKey(normalize(text));
  }

  /**
   * Returns the number of cached expressions.
   *
   * @return the entry count
   */
  public synchronized int size() {
    return entries.size();
  }

  /**
   * Collapses runs of whitespace (spaces, tabs, line breaks) to a single space.
   *
   * @param text the expression text
   * @return the cache key
   */
  static String normalize(String text) {
    Objects.requireNonNull(text, "text");
    return WHITESPACE.matcher(text).replaceAll(" ");
  }
}
