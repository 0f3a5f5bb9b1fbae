package io.recur.display;

import io.recur.model.AdvancedSchedule;
import io.recur.model.CronSchedule;
import io.recur.model.MonthName;
import io.recur.model.Schedule;
import io.recur.model.ScheduleFrequency;
import io.recur.model.SimpleSchedule;
import io.recur.model.StartDate;
import io.recur.model.Weekday;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** Renders schedules as human-readable descriptions. Absent fields are left out. */
public final class Description {
  private static final DateTimeFormatter START_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm");

  private Description() {}

  /**
   * Renders a schedule as a human-readable description.
   *
   * @param schedule the schedule to render
   * @return the description
   */
  public static String render(Schedule schedule) {
    String text =
        switch (schedule.scheduleType()) {
          case SIMPLE -> renderSimple((SimpleSchedule) schedule);
          case CRON -> renderCron((CronSchedule) schedule);
          case ADVANCED -> renderAdvanced((AdvancedSchedule) schedule);
        };
    if (!schedule.active()) {
      text += " [inactive]";
    }
    return text;
  }

  private static String renderSimple(SimpleSchedule s) {
    if (s.keyword() != null) {
      return switch (s.keyword()) {
        case MANUAL -> "Manual trigger only";
        case ONCE ->
            s.startDate() == null ? "Runs once" : "Runs once on " + formatStartDate(s.startDate());
      };
    }
    if (s.frequency().isPeriodic()) {
      if (s.interval() != null && s.interval() > 1) {
        return String.format("Runs every %d %s(s)", s.interval(), s.frequency().unit());
      }
      return "Runs " + s.frequency().name().toLowerCase(Locale.ROOT);
    }
    if (s.expression() == null) {
      return "Custom schedule";
    }
    return String.format("Custom schedule '%s'", s.expression());
  }

  private static String renderCron(CronSchedule s) {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("Runs via cron expression '%s'", s.cronExpression()));
    if (s.timezone() != null) {
      sb.append(" (").append(s.timezone()).append(")");
    }
    return sb.toString();
  }

  private static String renderAdvanced(AdvancedSchedule s) {
    StringBuilder sb = new StringBuilder();
    int interval = s.interval() == null ? 1 : s.interval();

    switch (s.frequency()) {
      case MINUTELY -> sb.append(every(interval, s.frequency()));
      case HOURLY -> {
        sb.append(every(interval, s.frequency()));
        if (s.minute() != null) {
          sb.append(" at minute ").append(s.minute());
        }
      }
      case DAILY -> {
        sb.append(interval > 1 ? every(interval, s.frequency()) : "Daily");
        sb.append(formatTime(s));
      }
      case WEEKLY -> {
        sb.append(interval > 1 ? every(interval, s.frequency()) : "Weekly");
        if (!s.weekdays().isEmpty()) {
          sb.append(" on ").append(formatDayList(s.weekdays()));
        }
        sb.append(formatTime(s));
      }
      case MONTHLY -> {
        sb.append(interval > 1 ? every(interval, s.frequency()) : "Monthly");
        sb.append(formatDaysOfMonth(s.dayOfMonth()));
        sb.append(formatTime(s));
      }
      case YEARLY -> {
        sb.append(interval > 1 ? every(interval, s.frequency()) : "Yearly");
        if (!s.months().isEmpty()) {
          sb.append(" in ").append(formatMonthList(s.months()));
        }
        sb.append(formatDaysOfMonth(s.dayOfMonth()));
        sb.append(formatTime(s));
      }
      case MANUAL, ONCE, CRON, CUSTOM -> sb.append(renderCustom(s));
    }

    if (s.timezone() != null) {
      sb.append(" ").append(s.timezone());
    }
    return sb.toString();
  }

  // Lists whichever components are present, e.g. "Custom schedule (hour 9; interval 2)".
  private static String renderCustom(AdvancedSchedule s) {
    List<String> parts = new ArrayList<>();
    if (s.hour() != null) {
      parts.add("hour " + s.hour());
    }
    if (s.minute() != null) {
      parts.add("minute " + s.minute());
    }
    if (!s.weekdays().isEmpty()) {
      parts.add("days " + formatDayList(s.weekdays()));
    }
    if (s.dayOfMonth() != null && !s.dayOfMonth().isEmpty()) {
      parts.add("days of month " + formatIntList(s.dayOfMonth()));
    }
    if (!s.months().isEmpty()) {
      parts.add("months " + formatMonthList(s.months()));
    }
    if (s.interval() != null) {
      parts.add("interval " + s.interval());
    }
    if (parts.isEmpty()) {
      return "Custom schedule";
    }
    return "Custom schedule (" + String.join("; ", parts) + ")";
  }

  private static String every(int interval, ScheduleFrequency frequency) {
    return String.format("Every %d %s(s)", interval, frequency.unit());
  }

  // Only a known hour and minute make a clock time; a missing minute is not assumed to be zero.
  private static String formatTime(AdvancedSchedule s) {
    if (s.hour() != null && s.minute() != null) {
      return String.format(" at %02d:%02d", s.hour(), s.minute());
    }
    if (s.hour() != null) {
      return " at hour " + s.hour();
    }
    if (s.minute() != null) {
      return " at minute " + s.minute();
    }
    return "";
  }

  private static String formatDaysOfMonth(List<Integer> days) {
    if (days == null || days.isEmpty()) {
      return "";
    }
    return " on day(s) " + formatIntList(days);
  }

  private static String formatStartDate(StartDate date) {
    if (date.isParsed()) {
      return date.dateTime().format(START_FORMAT);
    }
    return date.raw();
  }

  private static String formatDayList(List<Weekday> days) {
    return days.stream().map(Weekday::toString).collect(Collectors.joining(", "));
  }

  private static String formatMonthList(List<MonthName> months) {
    return months.stream().map(MonthName::toString).collect(Collectors.joining(", "));
  }

  private static String formatIntList(List<Integer> nums) {
    return nums.stream().map(String::valueOf).collect(Collectors.joining(", "));
  }
}
