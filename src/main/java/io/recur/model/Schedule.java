package io.recur.model;

import java.util.Map;

/**
 * A normalized job schedule.
 *
 * <p>There are 3 variants, one per raw encoding:
 *
 * <ul>
 *   <li>{@link AdvancedSchedule} - a structured {@code advancedScheduleJson} payload
 *   <li>{@link CronSchedule} - a cron-style {@code scheduleExpression}
 *   <li>{@link SimpleSchedule} - a MANUAL/ONCE keyword, or nothing at all
 * </ul>
 *
 * <p>Schedules are immutable value objects owned by the entity they were read from. Editing a
 * schedule means building a new raw record and parsing it again.
 */
public sealed interface Schedule permits AdvancedSchedule, CronSchedule, SimpleSchedule {

  /**
   * Returns the start date, or null if the raw record had none.
   *
   * @return the start date
   */
  StartDate startDate();

  /**
   * Returns whether the schedule is enabled upstream.
   *
   * @return true if active
   */
  boolean active();

  /**
   * Returns the encoding this schedule was parsed from. Always matches the concrete record type.
   *
   * @return the schedule type
   */
  ScheduleType scheduleType();

  /**
   * Returns the cadence of this schedule.
   *
   * @return the frequency
   */
  ScheduleFrequency frequency();

  /**
   * Returns an unmodifiable copy of the raw record this schedule was parsed from.
   *
   * @return the raw record
   */
  Map<String, Object> raw();
}
