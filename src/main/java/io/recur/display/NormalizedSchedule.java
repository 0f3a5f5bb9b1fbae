package io.recur.display;

import io.recur.model.AdvancedSchedule;
import io.recur.model.CronSchedule;
import io.recur.model.Schedule;
import io.recur.model.SimpleSchedule;
import io.recur.model.StartDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a schedule back out as a flat, normalized map.
 *
 * <p>{@code frequency}, {@code scheduleType}, {@code interval} and {@code isActive} are always
 * present. The other keys appear only when the schedule has a value for them.
 */
public final class NormalizedSchedule {
  private NormalizedSchedule() {}

  /**
   * Converts a schedule to its normalized map form.
   *
   * @param schedule the schedule
   * @return an unmodifiable map in a stable key order
   */
  public static Map<String, Object> toMap(Schedule schedule) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("frequency", schedule.frequency().name());
    out.put("scheduleType", schedule.scheduleType().name());
    out.put("interval", 1);
    out.put("isActive", schedule.active());
    if (schedule.startDate() != null) {
      out.put("scheduleStartDate", formatStartDate(schedule.startDate()));
    }

    switch (schedule.scheduleType()) {
      case ADVANCED -> putAdvanced((AdvancedSchedule) schedule, out);
      case CRON -> {
        CronSchedule c = (CronSchedule) schedule;
        putIfPresent(out, "timezone", c.timezone());
        out.put("scheduleExpression", c.cronExpression());
      }
      case SIMPLE -> {
        SimpleSchedule s = (SimpleSchedule) schedule;
        putIfPresent(out, "interval", s.interval());
        putIfPresent(out, "scheduleExpression", s.expression());
      }
    }
    return Collections.unmodifiableMap(out);
  }

  private static void putAdvanced(AdvancedSchedule a, Map<String, Object> out) {
    putIfPresent(out, "interval", a.interval());
    putIfPresent(out, "timezone", a.timezone());
    putIfPresent(out, "minute", a.minute());
    putIfPresent(out, "hour", a.hour());
    putIfPresent(out, "dayOfWeek", a.dayOfWeek());
    putIfPresent(out, "dayOfMonth", a.dayOfMonth());
    putIfPresent(out, "month", a.month());
  }

  private static void putIfPresent(Map<String, Object> out, String key, Object value) {
    if (value != null) {
      out.put(key, value);
    }
  }

  // Unparsed dates are written back verbatim.
  private static String formatStartDate(StartDate date) {
    if (!date.isParsed()) {
      return date.raw();
    }
    return date.toOffsetDateTime()
        .map(DateTimeFormatter.ISO_OFFSET_DATE_TIME::format)
        .orElseGet(() -> DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(date.dateTime()));
  }
}
