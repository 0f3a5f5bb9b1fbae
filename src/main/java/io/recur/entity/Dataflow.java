package io.recur.entity;

import java.io.IOException;
import java.util.Map;

/** A dataflow record, with the schedule it executes on. */
public final class Dataflow extends ScheduledEntity {
  private Dataflow(Map<String, ?> raw) {
    super(raw);
  }

  /**
   * Hydrates a dataflow from its raw record.
   *
   * @param raw the raw record
   * @return the dataflow
   */
  public static Dataflow fromRaw(Map<String, ?> raw) {
    return new Dataflow(raw);
  }

  /**
   * Hydrates a dataflow from the JSON the platform returned for it.
   *
   * @param json the JSON object text
   * @return the dataflow
   * @throws IOException if the text is not a JSON object
   */
  public static Dataflow fromJson(String json) throws IOException {
    return new Dataflow(readRecord(json));
  }
}
