package io.intellixity.paginator.mapping;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.function.Function;

/** ISO-8601 parsing and instant normalization for date-typed values. */
public final class TemporalValues {
  private static final List<Function<String, Object>> PARSERS = List.of(
      Instant::parse,
      OffsetDateTime::parse,
      LocalDateTime::parse,
      LocalDate::parse);

  private TemporalValues() {}

  /** First ISO-8601 form that parses, or the input unchanged. */
  public static Object parse(String s) {
    for (Function<String, Object> p : PARSERS) {
      try {
        return p.apply(s);
      } catch (DateTimeParseException e) {
        // try the next form
      }
    }
    return s;
  }

  /**
   * JDBC date values in their {@code java.time} form: {@code java.sql.Date} becomes
   * {@link LocalDate}, {@code java.sql.Time} becomes {@link LocalTime}, any other {@link Date}
   * (including {@code Timestamp}, nanoseconds kept) becomes {@link Instant}.
   */
  public static Object fromDate(Date d) {
    if (d instanceof java.sql.Date sd) return sd.toLocalDate();
    if (d instanceof java.sql.Time st) return st.toLocalTime();
    return d.toInstant();
  }

  /** Zoned or offset values become {@link Instant}; local dates and times are kept as-is. */
  public static Object toInstantIfZoned(Object v) {
    if (v instanceof Date d) return fromDate(d);
    if (v instanceof OffsetDateTime o) return o.toInstant();
    if (v instanceof ZonedDateTime z) return z.toInstant();
    return v;
  }
}
