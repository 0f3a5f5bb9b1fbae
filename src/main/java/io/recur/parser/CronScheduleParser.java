package io.recur.parser;

import io.recur.model.CronSchedule;

/**
 * Parses records whose expression looks like cron. The expression is stored verbatim; its fields
 * are not interpreted.
 */
public final class CronScheduleParser {
  private CronScheduleParser() {}

  /**
   * Parses a cron schedule.
   *
   * @param record the raw record
   * @param ctx the context collecting issues
   * @return the cron schedule
   */
  public static CronSchedule parse(RawRecord record, ParseContext ctx) {
    Object expression = record.expression();
    return new CronSchedule(
        StartDateParser.parse(record.startDate()),
        record.isActive(),
        expression == null ? "" : expression.toString(),
        record.timezone(),
        record.asMap());
  }
}
