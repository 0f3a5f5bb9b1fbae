package io.recur.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** The keywords a simple schedule expression may carry. */
public enum SimpleKeyword {
  /** Runs only when triggered by hand. */
  MANUAL(ScheduleFrequency.MANUAL),
  /** Runs a single time, usually at the start date. */
  ONCE(ScheduleFrequency.ONCE);

  private final ScheduleFrequency frequency;

  SimpleKeyword(ScheduleFrequency frequency) {
    this.frequency = frequency;
  }

  /**
   * Returns the frequency a schedule with this keyword has.
   *
   * @return the matching frequency
   */
  public ScheduleFrequency frequency() {
    return frequency;
  }

  private static final Map<String, SimpleKeyword> PARSE_MAP =
      Map.of(
          "MANUAL", MANUAL,
          "NONE", MANUAL,
          "", MANUAL,
          "ONCE", ONCE,
          "RUN_ONCE", ONCE);

  /**
   * Parses a keyword, accepting the upstream aliases NONE and RUN_ONCE. A blank string is MANUAL.
   *
   * @param s the expression to parse
   * @return the keyword if recognized
   */
  public static Optional<SimpleKeyword> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toUpperCase(Locale.ROOT)));
  }
}
