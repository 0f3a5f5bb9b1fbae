package io.recur.model;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * The start date of a schedule as received, plus its parsed form when it could be parsed.
 *
 * <p>The raw text is always kept, so a value the parser did not understand is never lost.
 *
 * @param raw the original text (or the decimal form of a numeric epoch timestamp)
 * @param dateTime the parsed local date-time, or null if the raw text was not understood
 * @param offset the UTC offset carried by the raw text, or null if none was given
 */
public record StartDate(String raw, LocalDateTime dateTime, ZoneOffset offset) {

  /**
   * Creates a start date that was parsed successfully.
   *
   * @param raw the original text
   * @param dateTime the parsed date-time
   * @param offset the offset, may be null
   * @return a parsed start date
   */
  public static StartDate parsed(String raw, LocalDateTime dateTime, ZoneOffset offset) {
    return new StartDate(raw, dateTime, offset);
  }

  /**
   * Creates a start date whose raw text could not be parsed.
   *
   * @param raw the original text
   * @return an unparsed start date
   */
  public static StartDate unparsed(String raw) {
    return new StartDate(raw, null, null);
  }

  /**
   * Returns true if the raw text was understood as a date-time.
   *
   * @return whether {@link #dateTime()} is available
   */
  public boolean isParsed() {
    return dateTime != null;
  }

  /**
   * Returns the start date as an instant-bearing value, if it was parsed with an offset.
   *
   * @return the offset date-time, or empty
   */
  public Optional<OffsetDateTime> toOffsetDateTime() {
    if (dateTime == null || offset == null) {
      return Optional.empty();
    }
    return Optional.of(OffsetDateTime.of(dateTime, offset));
  }

  @Override
  public String toString() {
    return raw;
  }
}
