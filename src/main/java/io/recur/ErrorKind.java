package io.recur;

/** The type of problem found while normalizing a raw schedule record. */
public enum ErrorKind {
  /** The advanced payload was a string that did not decode to a JSON object. */
  MALFORMED_JSON("malformed_json"),
  /** A numeric field was present but outside its allowed range. */
  OUT_OF_RANGE("out_of_range");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }
}
