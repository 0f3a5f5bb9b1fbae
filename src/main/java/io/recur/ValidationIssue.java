package io.recur;

/**
 * A non-fatal problem found while parsing a raw schedule record.
 *
 * <p>Lenient parsing recovers from every issue; the caller decides whether to reject the record or
 * accept it with a warning.
 *
 * @param kind the kind of problem
 * @param field the raw field the problem was found in
 * @param value the offending value as received (may be null)
 * @param message a human-readable description
 */
public record ValidationIssue(ErrorKind kind, String field, Object value, String message) {

  /**
   * Creates an issue for a field outside its allowed range.
   *
   * @param field the field name
   * @param value the value received
   * @param min the smallest allowed value
   * @param max the largest allowed value
   * @return a new out-of-range issue
   */
  public static ValidationIssue outOfRange(String field, Object value, int min, int max) {
    String message =
        max == Integer.MAX_VALUE
            ? String.format("%s must be at least %d, got %s", field, min, value)
            : String.format("%s must be between %d and %d, got %s", field, min, max, value);
    return new ValidationIssue(ErrorKind.OUT_OF_RANGE, field, value, message);
  }

  /**
   * Creates an issue for a payload that could not be decoded.
   *
   * @param field the field name
   * @param value the payload received
   * @param reason why decoding failed
   * @return a new malformed-JSON issue
   */
  public static ValidationIssue malformedJson(String field, Object value, String reason) {
    return new ValidationIssue(
        ErrorKind.MALFORMED_JSON, field, value, field + " is not a JSON object: " + reason);
  }
}
