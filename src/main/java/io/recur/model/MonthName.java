package io.recur.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Represents a month of the year. */
public enum MonthName {
  JANUARY(1, "Jan"),
  FEBRUARY(2, "Feb"),
  MARCH(3, "Mar"),
  APRIL(4, "Apr"),
  MAY(5, "May"),
  JUNE(6, "Jun"),
  JULY(7, "Jul"),
  AUGUST(8, "Aug"),
  SEPTEMBER(9, "Sep"),
  OCTOBER(10, "Oct"),
  NOVEMBER(11, "Nov"),
  DECEMBER(12, "Dec");

  private final int monthNumber;
  private final String displayName;

  MonthName(int monthNumber, String displayName) {
    this.monthNumber = monthNumber;
    this.displayName = displayName;
  }

  /**
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return monthNumber;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, MonthName> PARSE_MAP =
      Map.ofEntries(
          Map.entry("january", JANUARY),
          Map.entry("jan", JANUARY),
          Map.entry("february", FEBRUARY),
          Map.entry("feb", FEBRUARY),
          Map.entry("march", MARCH),
          Map.entry("mar", MARCH),
          Map.entry("april", APRIL),
          Map.entry("apr", APRIL),
          Map.entry("may", MAY),
          Map.entry("june", JUNE),
          Map.entry("jun", JUNE),
          Map.entry("july", JULY),
          Map.entry("jul", JULY),
          Map.entry("august", AUGUST),
          Map.entry("aug", AUGUST),
          Map.entry("september", SEPTEMBER),
          Map.entry("sep", SEPTEMBER),
          Map.entry("october", OCTOBER),
          Map.entry("oct", OCTOBER),
          Map.entry("november", NOVEMBER),
          Map.entry("nov", NOVEMBER),
          Map.entry("december", DECEMBER),
          Map.entry("dec", DECEMBER));

  /**
   * Parses a month name (case insensitive).
   *
   * @param s the string to parse
   * @return the month if valid
   */
  public static Optional<MonthName> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns a MonthName from its number.
   *
   * @param n the month number (1-12)
   * @return the month if valid
   */
  public static Optional<MonthName> fromNumber(int n) {
    if (n < 1 || n > 12) {
      return Optional.empty();
    }
    return Optional.of(values()[n - 1]);
  }
}
