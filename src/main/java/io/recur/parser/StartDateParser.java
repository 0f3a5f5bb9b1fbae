package io.recur.parser;

import io.recur.model.StartDate;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses schedule start dates. Unparseable input is kept verbatim instead of being dropped.
 *
 * <p>Strings are tried against these formats in order, first match wins:
 *
 * <ul>
 *   <li>ISO-8601 with offset, e.g. {@code 2024-01-01T12:00:00Z} or {@code +05:30}
 *   <li>ISO-8601 with a compact offset, e.g. {@code 2024-01-01T12:00:00.000+0000}
 *   <li>ISO-8601 local, e.g. {@code 2024-01-01T12:00:00}
 *   <li>{@code 2024-01-01 12:00:00}
 *   <li>ISO date, e.g. {@code 2024-01-01}
 *   <li>{@code 01/31/2024 12:00:00} and {@code 01/31/2024}
 * </ul>
 *
 * <p>Numbers are epoch timestamps in UTC: milliseconds when above 1e10, seconds otherwise.
 */
public final class StartDateParser {
  private static final Logger logger = LoggerFactory.getLogger(StartDateParser.class);

  private static final double MILLIS_THRESHOLD = 1e10;

  private static final DateTimeFormatter COMPACT_OFFSET =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss[.SSS]xx");

  private static final List<DateTimeFormatter> LOCAL_DATE_TIMES =
      List.of(
          DateTimeFormatter.ISO_LOCAL_DATE_TIME,
          DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss"),
          DateTimeFormatter.ofPattern("MM/dd/uuuu HH:mm:ss"));

  private static final List<DateTimeFormatter> LOCAL_DATES =
      List.of(DateTimeFormatter.ISO_LOCAL_DATE, DateTimeFormatter.ofPattern("MM/dd/uuuu"));

  private StartDateParser() {}

  /**
   * Parses a raw start date value. Never throws.
   *
   * @param value a string, an epoch number, or null
   * @return the start date, or null if the value is null or blank
   */
  public static StartDate parse(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return parseEpoch((Number) value);
    }
    String raw = value.toString();
    String text = raw.trim();
    if (text.isEmpty()) {
      return null;
    }

    Optional<StartDate> parsed =
        tryOffset(raw, text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
            .or(() -> tryOffset(raw, text, COMPACT_OFFSET))
            .or(() -> tryLocalDateTimes(raw, text))
            .or(() -> tryLocalDates(raw, text));
    if (parsed.isPresent()) {
      return parsed.get();
    }
    logger.debug("Keeping unparseable start date verbatim: {}", raw);
    return StartDate.unparsed(raw);
  }

  private static Optional<StartDate> tryOffset(String raw, String text, DateTimeFormatter f) {
    try {
      OffsetDateTime odt = OffsetDateTime.parse(text, f);
      return Optional.of(StartDate.parsed(raw, odt.toLocalDateTime(), odt.getOffset()));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<StartDate> tryLocalDateTimes(String raw, String text) {
    for (DateTimeFormatter f : LOCAL_DATE_TIMES) {
      try {
        return Optional.of(StartDate.parsed(raw, LocalDateTime.parse(text, f), null));
      } catch (DateTimeParseException e) {
        logger.trace("{} does not match {}", text, f);
      }
    }
    return Optional.empty();
  }

  private static Optional<StartDate> tryLocalDates(String raw, String text) {
    for (DateTimeFormatter f : LOCAL_DATES) {
      try {
        return Optional.of(StartDate.parsed(raw, LocalDate.parse(text, f).atStartOfDay(), null));
      } catch (DateTimeParseException e) {
        logger.trace("{} does not match {}", text, f);
      }
    }
    return Optional.empty();
  }

  private static StartDate parseEpoch(Number number) {
    String raw = number.toString();
    BigDecimal decimal;
    try {
      decimal = new BigDecimal(raw);
    } catch (NumberFormatException e) {
      logger.debug("Keeping non-finite start date verbatim: {}", raw);
      return StartDate.unparsed(raw);
    }
    raw = decimal.stripTrailingZeros().toPlainString();
    try {
      Instant instant =
          decimal.doubleValue() > MILLIS_THRESHOLD
              ? Instant.ofEpochMilli(decimal.longValue())
              : Instant.ofEpochSecond(decimal.longValue());
      return StartDate.parsed(raw, LocalDateTime.ofInstant(instant, ZoneOffset.UTC), ZoneOffset.UTC);
    } catch (DateTimeException | ArithmeticException e) {
      logger.debug("Keeping out-of-range epoch start date verbatim: {}", raw);
      return StartDate.unparsed(raw);
    }
  }
}
