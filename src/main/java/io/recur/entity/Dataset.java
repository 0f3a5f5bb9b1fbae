package io.recur.entity;

import io.recur.parser.RawRecord;
import java.io.IOException;
import java.util.Map;

/** A dataset record, with the schedule its connector refreshes on. */
public final class Dataset extends ScheduledEntity {
  private final String displayType;
  private final String dataProviderType;

  private Dataset(Map<String, ?> raw) {
    super(raw);
    this.displayType = RawRecord.asText(raw().get("displayType"));
    this.dataProviderType = RawRecord.asText(raw().get("dataProviderType"));
  }

  /**
   * Hydrates a dataset from its raw record.
   *
   * @param raw the raw record
   * @return the dataset
   */
  public static Dataset fromRaw(Map<String, ?> raw) {
    return new Dataset(raw);
  }

  /**
   * Hydrates a dataset from the JSON the platform returned for it.
   *
   * @param json the JSON object text
   * @return the dataset
   * @throws IOException if the text is not a JSON object
   */
  public static Dataset fromJson(String json) throws IOException {
    return new Dataset(readRecord(json));
  }

  /** The display type, e.g. TABLE; null if absent. */
  public String displayType() {
    return displayType;
  }

  /** The connector type that feeds the dataset, e.g. API; null if absent. */
  public String dataProviderType() {
    return dataProviderType;
  }
}
