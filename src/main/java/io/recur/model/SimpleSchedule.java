package io.recur.model;

import java.util.Map;

/**
 * A keyword schedule such as MANUAL or ONCE.
 *
 * <p>Expressions outside the keyword vocabulary keep a null {@code keyword}; their frequency is
 * whatever could be read from the expression text, or CUSTOM.
 *
 * @param startDate the start date (may be null)
 * @param active whether the schedule is enabled
 * @param keyword the recognized keyword (may be null)
 * @param expression the expression as received (may be null)
 * @param frequency the cadence
 * @param interval a count read from the expression, e.g. 2 for "2DAILY" (may be null)
 * @param raw the raw record
 */
public record SimpleSchedule(
    StartDate startDate,
    boolean active,
    SimpleKeyword keyword,
    String expression,
    ScheduleFrequency frequency,
    Integer interval,
    Map<String, Object> raw)
    implements Schedule {

  /**
   * Keeps keyword and frequency consistent and copies the raw record. A MANUAL or ONCE frequency
   * implies its keyword; a frequency no keyword expression can carry, such as CRON, becomes CUSTOM.
   */
  public SimpleSchedule {
    if (keyword == null && frequency == ScheduleFrequency.MANUAL) {
      keyword = SimpleKeyword.MANUAL;
    } else if (keyword == null && frequency == ScheduleFrequency.ONCE) {
      keyword = SimpleKeyword.ONCE;
    }
    if (keyword != null) {
      frequency = keyword.frequency();
    } else if (frequency == null || frequency == ScheduleFrequency.CRON) {
      frequency = ScheduleFrequency.CUSTOM;
    }
    raw = Copies.map(raw);
  }

  /**
   * Creates the schedule used when a record carries no schedule data.
   *
   * @return a manual schedule
   */
  public static SimpleSchedule manual() {
    return new SimpleSchedule(null, true, SimpleKeyword.MANUAL, null, null, null, Map.of());
  }

  @Override
  public ScheduleType scheduleType() {
    return ScheduleType.SIMPLE;
  }
}
