package io.recur.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class AdvancedScheduleTest {

  private static AdvancedSchedule withTime(Integer hour, Integer minute) {
    return new AdvancedSchedule(
        null, true, ScheduleFrequency.DAILY, null, null, null, hour, minute, null, null, null, null,
        null);
  }

  @Test
  void testRangesAreEnforced() {
    assertThrows(IllegalArgumentException.class, () -> withTime(24, 0));
    assertThrows(IllegalArgumentException.class, () -> withTime(0, 60));
    assertThrows(IllegalArgumentException.class, () -> withTime(-1, null));
    assertDoesNotThrow(() -> withTime(23, 59));
    assertDoesNotThrow(() -> withTime(null, null));
  }

  @Test
  void testTypeIsFixed() {
    assertEquals(ScheduleType.ADVANCED, withTime(1, 2).scheduleType());
  }

  @Test
  void testDefaults() {
    AdvancedSchedule s =
        new AdvancedSchedule(
            null, true, null, null, null, null, null, null, null, null, null, null, null);
    assertEquals(ScheduleFrequency.CUSTOM, s.frequency());
    assertEquals(Map.of(), s.settings());
    assertEquals(Map.of(), s.raw());
    assertTrue(s.weekdays().isEmpty());
    assertTrue(s.months().isEmpty());
  }

  @Test
  void testListsAreCopied() {
    List<Integer> days = new ArrayList<>(List.of(1, 2));
    AdvancedSchedule s =
        new AdvancedSchedule(
            null, true, ScheduleFrequency.WEEKLY, days, null, null, null, null, null, null, null,
            null, null);
    days.add(3);
    assertEquals(List.of(1, 2), s.dayOfWeek());
    assertThrows(UnsupportedOperationException.class, () -> s.dayOfWeek().add(4));
  }

  @Test
  void testInvalidWeekdayRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new AdvancedSchedule(
                null, true, ScheduleFrequency.WEEKLY, List.of(0), null, null, null, null, null,
                null, null, null, null));
  }
}
