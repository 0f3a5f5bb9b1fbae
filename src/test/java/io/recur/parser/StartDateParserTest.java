package io.recur.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.recur.model.StartDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

public class StartDateParserTest {

  @Test
  void testIsoLocalDateTime() {
    StartDate d = StartDateParser.parse("2024-01-01T12:00:00");
    assertTrue(d.isParsed());
    assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), d.dateTime());
    assertNull(d.offset());
    assertEquals("2024-01-01T12:00:00", d.raw());
  }

  @Test
  void testIsoWithZulu() {
    StartDate d = StartDateParser.parse("2024-01-01T12:00:00Z");
    assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), d.dateTime());
    assertEquals(ZoneOffset.UTC, d.offset());
    assertTrue(d.toOffsetDateTime().isPresent());
  }

  @Test
  void testIsoWithOffset() {
    StartDate d = StartDateParser.parse("2024-06-30T08:45:00+05:30");
    assertEquals(ZoneOffset.ofHoursMinutes(5, 30), d.offset());
    assertEquals(LocalDateTime.of(2024, 6, 30, 8, 45), d.dateTime());
  }

  @Test
  void testCompactOffsetWithMillis() {
    StartDate d = StartDateParser.parse("2024-01-01T12:00:00.000+0000");
    assertTrue(d.isParsed());
    assertEquals(ZoneOffset.UTC, d.offset());
  }

  @Test
  void testSpaceSeparated() {
    StartDate d = StartDateParser.parse("2024-01-01 09:30:00");
    assertEquals(LocalDateTime.of(2024, 1, 1, 9, 30), d.dateTime());
  }

  @Test
  void testDateOnly() {
    assertEquals(
        LocalDateTime.of(2024, 2, 29, 0, 0), StartDateParser.parse("2024-02-29").dateTime());
    assertEquals(
        LocalDateTime.of(2024, 3, 15, 0, 0), StartDateParser.parse("03/15/2024").dateTime());
  }

  @Test
  void testUsDateTime() {
    assertEquals(
        LocalDateTime.of(2024, 3, 15, 17, 5, 9),
        StartDateParser.parse("03/15/2024 17:05:09").dateTime());
  }

  @Test
  void testUnparseableIsKeptVerbatim() {
    StartDate d = StartDateParser.parse("not-a-date");
    assertNotNull(d);
    assertFalse(d.isParsed());
    assertEquals("not-a-date", d.raw());
    assertEquals("not-a-date", d.toString());
    assertTrue(d.toOffsetDateTime().isEmpty());
  }

  @Test
  void testInvalidCalendarDateIsKeptVerbatim() {
    StartDate d = StartDateParser.parse("2024-13-45T00:00:00");
    assertFalse(d.isParsed());
    assertEquals("2024-13-45T00:00:00", d.raw());
  }

  @Test
  void testEpochMillis() {
    StartDate d = StartDateParser.parse(1704110400000L);
    assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), d.dateTime());
    assertEquals(ZoneOffset.UTC, d.offset());
    assertEquals("1704110400000", d.raw());
  }

  @Test
  void testEpochSeconds() {
    StartDate d = StartDateParser.parse(1704110400);
    assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), d.dateTime());
    assertEquals("1704110400", d.raw());
  }

  @Test
  void testNonFiniteNumberIsKeptVerbatim() {
    StartDate d = StartDateParser.parse(Double.NaN);
    assertFalse(d.isParsed());
    assertEquals("NaN", d.raw());
  }

  @Test
  void testMissingOrBlank() {
    assertNull(StartDateParser.parse(null));
    assertNull(StartDateParser.parse(""));
    assertNull(StartDateParser.parse("   "));
  }
}
