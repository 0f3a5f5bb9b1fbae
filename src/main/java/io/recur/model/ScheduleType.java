package io.recur.model;

/**
 * Identifies which raw encoding a schedule was parsed from.
 *
 * <p>The type is fixed by the concrete {@link Schedule} record; it is never stored separately.
 */
public enum ScheduleType {
  /** A structured payload under {@code advancedScheduleJson}. */
  ADVANCED,
  /** A cron-style {@code scheduleExpression}. */
  CRON,
  /** A keyword such as MANUAL or ONCE, or no schedule keys at all. */
  SIMPLE
}
