package io.recur.parser;

import io.recur.classify.ScheduleClassifier;
import io.recur.model.Schedule;

/** Classifies a raw record and hands it to the parser for its variant. */
public final class ScheduleParser {
  private ScheduleParser() {}

  /**
   * Parses a raw record into exactly one schedule variant.
   *
   * @param record the raw record
   * @param ctx the context collecting issues
   * @return the schedule
   */
  public static Schedule parse(RawRecord record, ParseContext ctx) {
    return switch (ScheduleClassifier.determineScheduleType(record)) {
      case ADVANCED -> AdvancedScheduleParser.parse(record, ctx);
      case CRON -> CronScheduleParser.parse(record, ctx);
      case SIMPLE -> SimpleScheduleParser.parse(record, ctx);
    };
  }
}
