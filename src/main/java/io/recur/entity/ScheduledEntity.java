package io.recur.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur.Schedules;
import io.recur.display.Description;
import io.recur.model.Schedule;
import io.recur.parser.RawRecord;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Base class for platform entities that may run on a schedule.
 *
 * <p>The schedule is parsed once, when the entity is hydrated from its raw record. A record without
 * any schedule key has no schedule; a default MANUAL schedule is never made up for it.
 */
public abstract class ScheduledEntity {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<LinkedHashMap<String, Object>>() {};

  private final String id;
  private final String name;
  private final String description;
  private final Schedule schedule;
  private final Map<String, Object> raw;

  protected ScheduledEntity(Map<String, ?> raw) {
    this.raw = RawRecord.of(raw).asMap();
    this.id = RawRecord.asText(this.raw.get("id"));
    this.name = RawRecord.asText(this.raw.get("name"));
    this.description = RawRecord.asText(this.raw.get("description"));
    this.schedule = Schedules.fromEntityRecord(this.raw).orElse(null);
  }

  /**
   * Reads a JSON object into a raw record.
   *
   * @param json the JSON text
   * @return the raw record
   * @throws IOException if the text is not a JSON object
   */
  protected static Map<String, Object> readRecord(String json) throws IOException {
    Map<String, Object> record = MAPPER.readValue(json, MAP_TYPE);
    if (record == null) {
      throw new IOException("Expected a JSON object but got null");
    }
    return record;
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  /**
   * Returns the description, if the record had one.
   *
   * @return the description
   */
  public Optional<String> description() {
    return Optional.ofNullable(description);
  }

  /**
   * Returns the schedule, or empty if the record carried no schedule data.
   *
   * @return the schedule
   */
  public Optional<Schedule> schedule() {
    return Optional.ofNullable(schedule);
  }

  /**
   * Returns a human-readable description of the schedule, if there is one.
   *
   * @return the schedule description
   */
  public Optional<String> scheduleDescription() {
    return schedule().map(Description::render);
  }

  /**
   * Returns the raw record this entity was hydrated from.
   *
   * @return the unmodifiable raw record
   */
  public Map<String, Object> raw() {
    return raw;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + ", name=" + name + "}";
  }
}
