package io.recur.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Represents a day of the week, numbered the ISO way (Monday=1, Sunday=7). */
public enum Weekday {
  MONDAY(1, "Monday"),
  TUESDAY(2, "Tuesday"),
  WEDNESDAY(3, "Wednesday"),
  THURSDAY(4, "Thursday"),
  FRIDAY(5, "Friday"),
  SATURDAY(6, "Saturday"),
  SUNDAY(7, "Sunday");

  private final int isoNumber;
  private final String displayName;

  Weekday(int isoNumber, String displayName) {
    this.isoNumber = isoNumber;
    this.displayName = displayName;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.ofEntries(
          Map.entry("monday", MONDAY), Map.entry("mon", MONDAY),
          Map.entry("tuesday", TUESDAY), Map.entry("tue", TUESDAY),
          Map.entry("wednesday", WEDNESDAY), Map.entry("wed", WEDNESDAY),
          Map.entry("thursday", THURSDAY), Map.entry("thu", THURSDAY),
          Map.entry("friday", FRIDAY), Map.entry("fri", FRIDAY),
          Map.entry("saturday", SATURDAY), Map.entry("sat", SATURDAY),
          Map.entry("sunday", SUNDAY), Map.entry("sun", SUNDAY));

  /**
   * Parses a weekday name (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns a Weekday from an ISO 8601 day number.
   *
   * @param n the ISO day number (1-7)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromNumber(int n) {
    if (n < 1 || n > 7) {
      return Optional.empty();
    }
    return Optional.of(values()[n - 1]);
  }
}
