package io.recur;

/**
 * Options controlling how raw schedule records are parsed.
 *
 * @param rejectIssues when true, the first validation issue is raised as a {@link
 *     ScheduleException}
 */
public record ParseOptions(boolean rejectIssues) {
  private static final ParseOptions LENIENT = new ParseOptions(false);
  private static final ParseOptions STRICT = new ParseOptions(true);

  /**
   * Returns the default options: every issue is recovered from and reported.
   *
   * @return lenient options
   */
  public static ParseOptions lenient() {
    return LENIENT;
  }

  /**
   * Returns options that reject records with out-of-range values or malformed payloads.
   *
   * @return strict options
   */
  public static ParseOptions strict() {
    return STRICT;
  }
}
