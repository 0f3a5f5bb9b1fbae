package io.recur.display;

import static org.junit.jupiter.api.Assertions.*;

import io.recur.model.AdvancedSchedule;
import io.recur.model.CronSchedule;
import io.recur.model.ScheduleFrequency;
import io.recur.model.SimpleKeyword;
import io.recur.model.SimpleSchedule;
import io.recur.model.StartDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class DescriptionTest {

  private static AdvancedSchedule advanced(
      ScheduleFrequency frequency,
      List<Integer> dayOfWeek,
      Integer hour,
      Integer minute,
      Integer interval,
      String timezone) {
    return new AdvancedSchedule(
        null, true, frequency, dayOfWeek, null, null, hour, minute, interval, timezone, Map.of(),
        null, Map.of());
  }

  @Test
  void testManual() {
    assertEquals("Manual trigger only", Description.render(SimpleSchedule.manual()));
  }

  @Test
  void testOnce() {
    SimpleSchedule once =
        new SimpleSchedule(null, true, SimpleKeyword.ONCE, "ONCE", null, null, Map.of());
    assertEquals("Runs once", Description.render(once));
  }

  @Test
  void testOnceWithStartDate() {
    StartDate start =
        StartDate.parsed("2024-07-04T18:30:00", LocalDateTime.of(2024, 7, 4, 18, 30), null);
    SimpleSchedule once =
        new SimpleSchedule(start, true, SimpleKeyword.ONCE, "ONCE", null, null, Map.of());
    assertEquals("Runs once on 2024-07-04 18:30", Description.render(once));
  }

  @Test
  void testSimpleCadence() {
    SimpleSchedule s =
        new SimpleSchedule(null, true, null, "2DAYS", ScheduleFrequency.DAILY, 2, Map.of());
    assertEquals("Runs every 2 day(s)", Description.render(s));
  }

  @Test
  void testSimpleWithoutExpressionOrKeyword() {
    SimpleSchedule s =
        new SimpleSchedule(null, true, null, null, ScheduleFrequency.CUSTOM, null, Map.of());
    assertEquals("Custom schedule", Description.render(s));
  }

  @Test
  void testCron() {
    CronSchedule s = new CronSchedule(null, true, "0 9 * * *", null, Map.of());
    assertEquals("Runs via cron expression '0 9 * * *'", Description.render(s));
  }

  @Test
  void testHourly() {
    assertEquals(
        "Every 1 hour(s) at minute 5",
        Description.render(advanced(ScheduleFrequency.HOURLY, null, null, 5, null, null)));
    assertEquals(
        "Every 3 hour(s)",
        Description.render(advanced(ScheduleFrequency.HOURLY, null, null, null, 3, null)));
  }

  @Test
  void testDaily() {
    assertEquals(
        "Daily at 07:05 Europe/Berlin",
        Description.render(advanced(ScheduleFrequency.DAILY, null, 7, 5, null, "Europe/Berlin")));
    assertEquals(
        "Every 2 day(s) at hour 22",
        Description.render(advanced(ScheduleFrequency.DAILY, null, 22, null, 2, null)));
    assertEquals(
        "Daily at minute 45",
        Description.render(advanced(ScheduleFrequency.DAILY, null, null, 45, null, null)));
  }

  @Test
  void testWeekly() {
    String text =
        Description.render(advanced(ScheduleFrequency.WEEKLY, List.of(1, 3, 5), 14, 30, null, null));
    assertEquals("Weekly on Monday, Wednesday, Friday at 14:30", text);
    assertTrue(text.contains("14:30"));

    assertEquals(
        "Every 2 week(s) on Sunday",
        Description.render(advanced(ScheduleFrequency.WEEKLY, List.of(7), null, null, 2, null)));
  }

  @Test
  void testCustomListsPresentFields() {
    assertEquals(
        "Custom schedule (hour 9; days Tuesday; interval 4)",
        Description.render(advanced(ScheduleFrequency.CUSTOM, List.of(2), 9, null, 4, null)));
    assertEquals(
        "Custom schedule UTC",
        Description.render(advanced(ScheduleFrequency.CUSTOM, null, null, null, null, "UTC")));
  }

  @Test
  void testNoNullPlaceholders() {
    String text =
        Description.render(advanced(ScheduleFrequency.WEEKLY, null, null, null, null, null));
    assertEquals("Weekly", text);
    assertFalse(text.contains("null"));
  }

  @Test
  void testInactiveSuffix() {
    CronSchedule s = new CronSchedule(null, false, "0 9 * * *", "UTC", Map.of());
    assertEquals("Runs via cron expression '0 9 * * *' (UTC) [inactive]", Description.render(s));
  }
}
