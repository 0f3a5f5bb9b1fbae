package io.recur;

import java.util.Optional;

/** Exception thrown by strict parsing for a record lenient parsing would have accepted. */
public final class ScheduleException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The raw field the error was found in. */
  private final String field;

  /** The offending value. */
  private final Object value;

  private ScheduleException(ErrorKind kind, String message, String field, Object value) {
    super(message);
    this.kind = kind;
    this.field = field;
    this.value = value;
  }

  /**
   * Creates an exception from a validation issue.
   *
   * @param issue the issue to raise
   * @return a new ScheduleException
   */
  public static ScheduleException of(ValidationIssue issue) {
    return new ScheduleException(issue.kind(), issue.message(), issue.field(), issue.value());
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the raw field name the error was found in.
   *
   * @return the field name
   */
  public String field() {
    return field;
  }

  /**
   * Returns the offending value, if there was one.
   *
   * @return the value, or empty if it was null
   */
  public Optional<Object> value() {
    return Optional.ofNullable(value);
  }

  /**
   * Formats the error with its kind and field, e.g. {@code error[out_of_range] hour: ...}.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    return "error[" + kind.value() + "] " + field + ": " + getMessage();
  }
}
