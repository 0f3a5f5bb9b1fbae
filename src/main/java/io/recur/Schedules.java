package io.recur;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur.classify.ScheduleClassifier;
import io.recur.display.Description;
import io.recur.display.NormalizedSchedule;
import io.recur.model.Schedule;
import io.recur.model.ScheduleType;
import io.recur.parser.ParseContext;
import io.recur.parser.RawRecord;
import io.recur.parser.ScheduleParser;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for normalizing raw schedule records.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Map<String, Object> raw = Map.of("scheduleExpression", "0 9 * * *");
 * Schedule schedule = Schedules.parse(raw);
 * System.out.println(Schedules.describe(schedule)); // Runs via cron expression '0 9 * * *'
 * }</pre>
 */
public final class Schedules {
  private static final Logger logger = LoggerFactory.getLogger(Schedules.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Keys whose presence means a record carries schedule data. */
  public static final List<String> SCHEDULE_KEYS =
      List.of(RawRecord.EXPRESSION, RawRecord.START_DATE, RawRecord.ADVANCED);

  private Schedules() {}

  /**
   * Determines which schedule variant a raw record holds. Never throws.
   *
   * @param raw the raw record, may be null
   * @return the schedule type
   */
  public static ScheduleType determineScheduleType(Map<String, ?> raw) {
    return ScheduleClassifier.determineScheduleType(raw);
  }

  /**
   * Parses a raw record leniently. Never throws; problems are recovered from.
   *
   * @param raw the raw record, may be null
   * @return the schedule
   */
  public static Schedule parse(Map<String, ?> raw) {
    return parseLenient(raw).schedule();
  }

  /**
   * Parses a raw record, reporting the problems found.
   *
   * @param raw the raw record, may be null
   * @param options the parse options
   * @return the schedule and its validation issues
   * @throws ScheduleException in strict mode, for the first issue found
   */
  public static ParseResult parse(Map<String, ?> raw, ParseOptions options)
      throws ScheduleException {
    ParseResult result = parseLenient(raw);
    if (options.rejectIssues() && result.hasIssues()) {
      throw ScheduleException.of(result.issues().get(0));
    }
    return result;
  }

  /**
   * Renders a schedule as a human-readable description.
   *
   * @param schedule the schedule
   * @return the description
   */
  public static String describe(Schedule schedule) {
    return Description.render(schedule);
  }

  /**
   * Converts a schedule to a normalized map: frequency, scheduleType, interval and isActive, plus
   * whichever of the start date, timezone, time and day fields the schedule has.
   *
   * @param schedule the schedule
   * @return an unmodifiable map
   */
  public static Map<String, Object> toMap(Schedule schedule) {
    return NormalizedSchedule.toMap(schedule);
  }

  /**
   * Serializes the normalized form of a schedule as JSON.
   *
   * @param schedule the schedule
   * @return the JSON text
   * @throws JsonProcessingException if the map cannot be written
   */
  public static String toJson(Schedule schedule) throws JsonProcessingException {
    return MAPPER.writeValueAsString(toMap(schedule));
  }

  /**
   * Returns true if the record holds any of the {@link #SCHEDULE_KEYS}.
   *
   * @param raw the raw record, may be null
   * @return whether the record carries schedule data
   */
  public static boolean hasScheduleData(Map<String, ?> raw) {
    return raw != null && SCHEDULE_KEYS.stream().anyMatch(raw::containsKey);
  }

  /**
   * Parses the schedule embedded in an entity record, for entities whose contract is "no schedule
   * keys, no schedule".
   *
   * @param raw the entity's raw record, may be null
   * @return the schedule, or empty if the record carries no schedule data
   */
  public static Optional<Schedule> fromEntityRecord(Map<String, ?> raw) {
    if (!hasScheduleData(raw)) {
      return Optional.empty();
    }
    return Optional.of(parse(raw));
  }

  private static ParseResult parseLenient(Map<String, ?> raw) {
    ParseContext ctx = new ParseContext();
    Schedule schedule = ScheduleParser.parse(RawRecord.of(raw), ctx);
    List<ValidationIssue> issues = ctx.issues();
    if (!issues.isEmpty()) {
      logger.debug(
          "Parsed {} schedule with {} issue(s): {}", schedule.scheduleType(), issues.size(), issues);
    }
    return new ParseResult(schedule, issues);
  }
}
