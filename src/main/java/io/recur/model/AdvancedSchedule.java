package io.recur.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A schedule read from a structured {@code advancedScheduleJson} payload.
 *
 * @param startDate the start date (may be null)
 * @param active whether the schedule is enabled
 * @param frequency the cadence, CUSTOM when the payload named an unknown one
 * @param dayOfWeek ISO weekday numbers, Monday=1 (may be null)
 * @param dayOfMonth days of the month, 1-31 (may be null)
 * @param month months of the year, 1-12 (may be null)
 * @param hour the hour of day, 0-23 (may be null)
 * @param minute the minute of the hour, 0-59 (may be null)
 * @param interval the number of frequency units between runs, positive (may be null)
 * @param timezone the IANA zone name, stored as given (may be null)
 * @param settings the decoded payload, empty when it could not be decoded
 * @param undecodedPayload the payload text when it was not valid JSON, otherwise null
 * @param raw the raw record
 */
public record AdvancedSchedule(
    StartDate startDate,
    boolean active,
    ScheduleFrequency frequency,
    List<Integer> dayOfWeek,
    List<Integer> dayOfMonth,
    List<Integer> month,
    Integer hour,
    Integer minute,
    Integer interval,
    String timezone,
    Map<String, Object> settings,
    String undecodedPayload,
    Map<String, Object> raw)
    implements Schedule {

  /** Validates field ranges and makes defensive copies. */
  public AdvancedSchedule {
    if (frequency == null) {
      frequency = ScheduleFrequency.CUSTOM;
    }
    checkRange("hour", hour, 0, 23);
    checkRange("minute", minute, 0, 59);
    if (interval != null && interval < 1) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
    dayOfWeek = Copies.list(dayOfWeek);
    dayOfMonth = Copies.list(dayOfMonth);
    month = Copies.list(month);
    if (dayOfWeek != null) {
      dayOfWeek.forEach(d -> checkRange("dayOfWeek", d, 1, 7));
    }
    if (dayOfMonth != null) {
      dayOfMonth.forEach(d -> checkRange("dayOfMonth", d, 1, 31));
    }
    if (month != null) {
      month.forEach(m -> checkRange("month", m, 1, 12));
    }
    settings = Copies.map(settings);
    raw = Copies.map(raw);
  }

  @Override
  public ScheduleType scheduleType() {
    return ScheduleType.ADVANCED;
  }

  /**
   * Returns true if the payload was a string that could not be decoded as a JSON object.
   *
   * @return whether the payload was kept undecoded
   */
  public boolean isUndecoded() {
    return undecodedPayload != null;
  }

  /**
   * Returns the weekdays in payload order.
   *
   * @return the weekdays, empty if none were given
   */
  public List<Weekday> weekdays() {
    if (dayOfWeek == null) {
      return List.of();
    }
    return dayOfWeek.stream().map(Weekday::fromNumber).flatMap(Optional::stream).toList();
  }

  /**
   * Returns the months in payload order.
   *
   * @return the months, empty if none were given
   */
  public List<MonthName> months() {
    if (month == null) {
      return List.of();
    }
    return month.stream().map(MonthName::fromNumber).flatMap(Optional::stream).toList();
  }

  private static void checkRange(String field, Integer value, int min, int max) {
    if (value != null && (value < min || value > max)) {
      throw new IllegalArgumentException(
          String.format("%s must be between %d and %d: %d", field, min, max, value));
    }
  }
}
