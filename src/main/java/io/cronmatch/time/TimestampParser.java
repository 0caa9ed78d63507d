package io.cronmatch.time;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Objects;

/**
 * Converts textual timestamps into local calendar points.
 *
 * <p>The default instance accepts {@code 2020/08/01 11:01:00}, {@code 2020-08-01 11:01:00} and ISO
 * local date-times such as {@code 2020-08-01T11:01}; seconds are optional in every form.
 */
public final class TimestampParser {
  private static final List<DateTimeFormatter> DEFAULT_FORMATS =
      List.of(
          pattern("uuuu/MM/dd HH:mm[:ss]"),
          pattern("uuuu-MM-dd HH:mm[:ss]"),
          DateTimeFormatter.ISO_LOCAL_DATE_TIME);

  private static final TimestampParser DEFAULT = new TimestampParser(DEFAULT_FORMATS);

  private final List<DateTimeFormatter> formats;

  /**
   * Creates a parser that tries each format in order.
   *
   * @param formats the accepted formats, most specific first
   */
  public TimestampParser(List<DateTimeFormatter> formats) {
    if (formats.isEmpty()) {
      throw new IllegalArgumentException("at least one format is required");
    }
    this.formats = List.copyOf(formats);
  }

  /**
   * Returns the parser for the default formats.
   *
   * @return the shared default parser
   */
  public static TimestampParser defaults() {
    return DEFAULT;
  }

  /**
   * Parses a timestamp.
   *
   * @param text the timestamp text
   * @return the local calendar point
   * @throws DateTimeParseException if no format accepts the text; the failure of the last format
   *     is reported
   */
  public LocalDateTime parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    DateTimeParseException last = null;
    for (DateTimeFormatter format : formats) {
      try {
        return LocalDateTime.parse(trimmed, format);
      } catch (DateTimeParseException e) {
        last = e;
      }
    }
    throw last;
  }

  private static DateTimeFormatter pattern(String pattern) {
    return new DateTimeFormatterBuilder()
        .appendPattern(pattern)
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
