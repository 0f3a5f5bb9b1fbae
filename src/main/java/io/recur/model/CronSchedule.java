package io.recur.model;

import java.util.Map;

/**
 * A schedule given as a cron-style expression. The expression is kept verbatim.
 *
 * @param startDate the start date (may be null)
 * @param active whether the schedule is enabled
 * @param cronExpression the expression exactly as received
 * @param timezone the IANA zone name from the raw record (may be null)
 * @param raw the raw record
 */
public record CronSchedule(
    StartDate startDate,
    boolean active,
    String cronExpression,
    String timezone,
    Map<String, Object> raw)
    implements Schedule {

  /** Makes a defensive copy of the raw record. */
  public CronSchedule {
    raw = Copies.map(raw);
  }

  @Override
  public ScheduleType scheduleType() {
    return ScheduleType.CRON;
  }

  @Override
  public ScheduleFrequency frequency() {
    return ScheduleFrequency.CRON;
  }
}
