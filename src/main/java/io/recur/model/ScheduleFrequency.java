package io.recur.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** The cadence of a schedule, independent of the encoding that produced it. */
public enum ScheduleFrequency {
  MANUAL("manual"),
  ONCE("once"),
  MINUTELY("minute"),
  HOURLY("hour"),
  DAILY("day"),
  WEEKLY("week"),
  MONTHLY("month"),
  YEARLY("year"),
  CRON("cron"),
  CUSTOM("custom");

  private final String unit;

  ScheduleFrequency(String unit) {
    this.unit = unit;
  }

  /**
   * Returns the singular time unit for repeating frequencies, e.g. "hour" for HOURLY.
   *
   * @return the unit name
   */
  public String unit() {
    return unit;
  }

  /**
   * Returns true for frequencies that repeat on a fixed calendar unit.
   *
   * @return whether this frequency has an interval unit
   */
  public boolean isPeriodic() {
    return switch (this) {
      case MINUTELY, HOURLY, DAILY, WEEKLY, MONTHLY, YEARLY -> true;
      case MANUAL, ONCE, CRON, CUSTOM -> false;
    };
  }

  private static final Map<String, ScheduleFrequency> ALIASES =
      Map.of("CUSTOM_CRON", CUSTOM, "RUN_ONCE", ONCE, "NONE", MANUAL);

  /**
   * Parses a frequency name (case insensitive, surrounding whitespace ignored).
   *
   * @param s the string to parse, may be null
   * @return the frequency if recognized
   */
  public static Optional<ScheduleFrequency> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    String name = s.trim().toUpperCase(Locale.ROOT);
    ScheduleFrequency alias = ALIASES.get(name);
    if (alias != null) {
      return Optional.of(alias);
    }
    for (ScheduleFrequency f : values()) {
      if (f.name().equals(name)) {
        return Optional.of(f);
      }
    }
    return Optional.empty();
  }
}
