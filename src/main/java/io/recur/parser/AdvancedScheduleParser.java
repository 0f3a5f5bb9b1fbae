package io.recur.parser;

import io.recur.ValidationIssue;
import io.recur.model.AdvancedSchedule;
import io.recur.model.MonthName;
import io.recur.model.ScheduleFrequency;
import io.recur.model.Weekday;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parses records carrying an {@code advancedScheduleJson} payload. */
public final class AdvancedScheduleParser {
  private static final Logger logger = LoggerFactory.getLogger(AdvancedScheduleParser.class);

  static final String FREQUENCY = "frequency";
  static final String DAYS_OF_WEEK = "daysOfWeek";
  static final String DAYS_OF_MONTH = "daysOfMonth";
  static final String MONTHS = "months";
  static final String HOUR = "hour";
  static final String MINUTE = "minute";
  static final String INTERVAL = "interval";
  static final String TIMEZONE = "timezone";

  private AdvancedScheduleParser() {}

  /**
   * Parses an advanced schedule. Values that cannot be coerced are dropped; values out of range
   * are dropped and reported to the context.
   *
   * @param record the raw record
   * @param ctx the context collecting issues
   * @return the advanced schedule
   */
  public static AdvancedSchedule parse(RawRecord record, ParseContext ctx) {
    PayloadDecoder.Decoded decoded = PayloadDecoder.decode(record.advancedPayload(), ctx);
    Map<String, Object> settings = decoded.settings();

    List<Integer> dayOfWeek = parseWeekdays(settings.get(DAYS_OF_WEEK), ctx);
    List<Integer> dayOfMonth =
        parseIntList(DAYS_OF_MONTH, settings.get(DAYS_OF_MONTH), 1, 31, s -> Optional.empty(), ctx);
    List<Integer> month =
        parseIntList(
            MONTHS, settings.get(MONTHS), 1, 12, s -> MonthName.parse(s).map(MonthName::number), ctx);
    Integer hour = parseBounded(HOUR, settings.get(HOUR), 0, 23, ctx);
    Integer minute = parseBounded(MINUTE, settings.get(MINUTE), 0, 59, ctx);
    Integer interval = parseBounded(INTERVAL, settings.get(INTERVAL), 1, Integer.MAX_VALUE, ctx);

    String timezone = RawRecord.asText(settings.get(TIMEZONE));
    if (timezone == null) {
      timezone = record.timezone();
    }

    ScheduleFrequency frequency;
    String frequencyName = RawRecord.asText(settings.get(FREQUENCY));
    if (frequencyName != null) {
      frequency = ScheduleFrequency.parse(frequencyName).orElse(ScheduleFrequency.CUSTOM);
    } else {
      frequency = inferFrequency(dayOfWeek, dayOfMonth, month, hour, minute);
    }

    return new AdvancedSchedule(
        StartDateParser.parse(record.startDate()),
        record.isActive(),
        frequency,
        dayOfWeek,
        dayOfMonth,
        month,
        hour,
        minute,
        interval,
        timezone,
        settings,
        decoded.undecoded(),
        record.asMap());
  }

  /** Picks the coarsest frequency the present components imply. */
  static ScheduleFrequency inferFrequency(
      List<Integer> dayOfWeek,
      List<Integer> dayOfMonth,
      List<Integer> month,
      Integer hour,
      Integer minute) {
    if (dayOfWeek != null) {
      return ScheduleFrequency.WEEKLY;
    }
    if (dayOfMonth != null) {
      return ScheduleFrequency.MONTHLY;
    }
    if (month != null) {
      return ScheduleFrequency.YEARLY;
    }
    if (hour != null) {
      return ScheduleFrequency.DAILY;
    }
    if (minute != null) {
      return ScheduleFrequency.HOURLY;
    }
    return ScheduleFrequency.CUSTOM;
  }

  // Weekday 0 is the upstream spelling of Sunday.
  private static List<Integer> parseWeekdays(Object value, ParseContext ctx) {
    List<Integer> days =
        parseIntList(
            DAYS_OF_WEEK, value, 0, 7, s -> Weekday.parse(s).map(Weekday::number), ctx);
    if (days == null) {
      return null;
    }
    List<Integer> result = new ArrayList<>(days.size());
    for (Integer d : days) {
      result.add(d == 0 ? Weekday.SUNDAY.number() : d);
    }
    return result;
  }

  private static Integer parseBounded(
      String field, Object value, int min, int max, ParseContext ctx) {
    if (value == null) {
      return null;
    }
    BigDecimal n = RawRecord.asWholeNumber(value);
    if (n == null) {
      logger.debug("Dropping non-integer {}: {}", field, value);
      return null;
    }
    return checkRange(field, value, n, min, max, ctx);
  }

  // Compares before narrowing to int, so 10000000000 is out of range rather than unreadable.
  private static Integer checkRange(
      String field, Object value, BigDecimal n, int min, int max, ParseContext ctx) {
    if (n.compareTo(BigDecimal.valueOf(min)) < 0 || n.compareTo(BigDecimal.valueOf(max)) > 0) {
      ctx.report(ValidationIssue.outOfRange(field, value, min, max));
      return null;
    }
    return n.intValueExact();
  }

  /**
   * Reads a list of integers, accepting a single scalar as a one-element list. Names are resolved
   * with {@code byName} when an entry is not numeric.
   *
   * @return the list, or null if the value is absent or nothing in it was usable
   */
  private static List<Integer> parseIntList(
      String field,
      Object value,
      int min,
      int max,
      Function<String, Optional<Integer>> byName,
      ParseContext ctx) {
    if (value == null) {
      return null;
    }
    Collection<?> entries = value instanceof Collection ? (Collection<?>) value : List.of(value);
    List<Integer> result = new ArrayList<>(entries.size());
    for (Object entry : entries) {
      BigDecimal n = RawRecord.asWholeNumber(entry);
      if (n == null && entry instanceof String) {
        n = byName.apply((String) entry).map(i -> BigDecimal.valueOf(i.longValue())).orElse(null);
      }
      if (n == null) {
        logger.debug("Dropping non-integer {} entry: {}", field, entry);
        continue;
      }
      Integer checked = checkRange(field, entry, n, min, max, ctx);
      if (checked != null) {
        result.add(checked);
      }
    }
    if (result.isEmpty() && !entries.isEmpty()) {
      return null;
    }
    return result;
  }
}
