package io.recur.parser;

import io.recur.model.ScheduleFrequency;
import io.recur.model.SimpleKeyword;
import io.recur.model.SimpleSchedule;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses keyword schedules. Records with no expression at all are MANUAL.
 *
 * <p>An expression outside the keyword vocabulary is kept verbatim. When it names a cadence, such
 * as {@code DAILY} or {@code 2WEEKS}, that cadence becomes the frequency; otherwise it is CUSTOM.
 * A count must be written against the word: {@code 2 WEEKS} has whitespace and a digit, so it is
 * classified as a cron expression and never reaches this parser.
 */
public final class SimpleScheduleParser {
  private static final Logger logger = LoggerFactory.getLogger(SimpleScheduleParser.class);

  private static final Pattern CADENCE = Pattern.compile("^(\\d+)?([A-Z]+)$");

  private static final Map<String, ScheduleFrequency> CADENCE_WORDS =
      Map.ofEntries(
          Map.entry("MINUTELY", ScheduleFrequency.MINUTELY),
          Map.entry("MINUTE", ScheduleFrequency.MINUTELY),
          Map.entry("MINUTES", ScheduleFrequency.MINUTELY),
          Map.entry("HOURLY", ScheduleFrequency.HOURLY),
          Map.entry("HOUR", ScheduleFrequency.HOURLY),
          Map.entry("HOURS", ScheduleFrequency.HOURLY),
          Map.entry("DAILY", ScheduleFrequency.DAILY),
          Map.entry("DAY", ScheduleFrequency.DAILY),
          Map.entry("DAYS", ScheduleFrequency.DAILY),
          Map.entry("WEEKLY", ScheduleFrequency.WEEKLY),
          Map.entry("WEEK", ScheduleFrequency.WEEKLY),
          Map.entry("WEEKS", ScheduleFrequency.WEEKLY),
          Map.entry("MONTHLY", ScheduleFrequency.MONTHLY),
          Map.entry("MONTH", ScheduleFrequency.MONTHLY),
          Map.entry("MONTHS", ScheduleFrequency.MONTHLY),
          Map.entry("YEARLY", ScheduleFrequency.YEARLY),
          Map.entry("YEAR", ScheduleFrequency.YEARLY),
          Map.entry("YEARS", ScheduleFrequency.YEARLY));

  private SimpleScheduleParser() {}

  /**
   * Parses a simple schedule.
   *
   * @param record the raw record
   * @param ctx the context collecting issues
   * @return the simple schedule
   */
  public static SimpleSchedule parse(RawRecord record, ParseContext ctx) {
    Object value = record.expression();
    String expression = value == null ? null : value.toString();

    SimpleKeyword keyword = null;
    ScheduleFrequency frequency = null;
    Integer interval = null;
    if (expression == null) {
      keyword = SimpleKeyword.MANUAL;
    } else {
      Optional<SimpleKeyword> parsed = SimpleKeyword.parse(expression);
      if (parsed.isPresent()) {
        keyword = parsed.get();
      } else {
        Matcher m = CADENCE.matcher(expression.trim().toUpperCase(Locale.ROOT));
        if (m.matches() && CADENCE_WORDS.containsKey(m.group(2))) {
          frequency = CADENCE_WORDS.get(m.group(2));
          interval = m.group(1) == null ? null : RawRecord.asInteger(m.group(1));
          if (interval != null && interval < 1) {
            interval = null;
          }
        } else {
          logger.debug("Unrecognized schedule expression kept as custom: {}", expression);
          frequency = ScheduleFrequency.CUSTOM;
        }
      }
    }

    return new SimpleSchedule(
        StartDateParser.parse(record.startDate()),
        record.isActive(),
        keyword,
        expression,
        frequency,
        interval,
        record.asMap());
  }
}
