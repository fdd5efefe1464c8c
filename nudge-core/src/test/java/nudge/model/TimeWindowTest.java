package nudge.model;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeWindowTest {

  // 2024-01-01 is a Monday
  private static ZonedDateTime monday(int hour) {
    return ZonedDateTime.of(2024, 1, 1, hour, 30, 0, 0, ZoneOffset.UTC);
  }

  @Test
  void quietHoursWrappingMidnight() {
    QuietHours quiet = new QuietHours(22, 6);

    for (int hour : new int[]{22, 23, 0, 3, 6}) {
      assertTrue(quiet.contains(hour), "hour " + hour);
    }
    for (int hour : new int[]{7, 12, 21}) {
      assertFalse(quiet.contains(hour), "hour " + hour);
    }
  }

  @Test
  void quietHoursWithinOneDay() {
    QuietHours quiet = new QuietHours(12, 14);

    assertTrue(quiet.contains(12));
    assertTrue(quiet.contains(14));
    assertFalse(quiet.contains(11));
    assertFalse(quiet.contains(15));
  }

  @Test
  void quietHoursParseIgnoresMinutes() {
    assertEquals(new QuietHours(22, 6), QuietHours.parse("22:00", "06:45"));
    assertEquals("06:00", QuietHours.format(6));
    assertThrows(IllegalArgumentException.class, () -> QuietHours.parse("late", "06:00"));
    assertThrows(IllegalArgumentException.class, () -> new QuietHours(24, 6));
  }

  @Test
  void windowBlocksQuietHours() {
    TimeWindow window = TimeWindow.quiet(new QuietHours(22, 6));

    assertFalse(window.permits(monday(23)));
    assertFalse(window.permits(monday(3)));
    assertTrue(window.permits(monday(12)));
  }

  @Test
  void windowRestrictsHoursAndDays() {
    TimeWindow window = new TimeWindow(Set.of(9, 10, 11), Set.of(DayOfWeek.MONDAY), null, null);

    assertTrue(window.permits(monday(10)));
    assertFalse(window.permits(monday(12)));
    assertFalse(window.permits(monday(10).plusDays(1)));
  }

  @Test
  void emptyWindowPermitsEverything() {
    TimeWindow window = new TimeWindow(null, null, null, null);

    assertTrue(window.permits(monday(0)));
    assertTrue(window.permits(monday(23).plusDays(5)));
  }

  @Test
  void dayIndexIsSundayBased() {
    assertEquals(0, TimeWindow.dayIndex(DayOfWeek.SUNDAY));
    assertEquals(1, TimeWindow.dayIndex(DayOfWeek.MONDAY));
    assertEquals(6, TimeWindow.dayIndex(DayOfWeek.SATURDAY));
    assertEquals(DayOfWeek.SUNDAY, TimeWindow.dayOf(0));
    assertEquals(DayOfWeek.WEDNESDAY, TimeWindow.dayOf(3));
    assertThrows(IllegalArgumentException.class, () -> TimeWindow.dayOf(7));
  }

  @Test
  void rejectsOutOfRangeHours() {
    assertThrows(IllegalArgumentException.class, () -> new TimeWindow(Set.of(24), null, null, null));
  }

  @Test
  void rejectsNullHourOrDay() {
    Set<Integer> hours = new HashSet<>(Arrays.asList(9, null));
    Set<DayOfWeek> days = new HashSet<>(Arrays.asList(DayOfWeek.MONDAY, null));

    assertThrows(IllegalArgumentException.class, () -> new TimeWindow(hours, null, null, null));
    assertThrows(IllegalArgumentException.class, () -> new TimeWindow(null, days, null, null));
  }
}
