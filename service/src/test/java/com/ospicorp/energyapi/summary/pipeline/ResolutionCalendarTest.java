package com.ospicorp.energyapi.summary.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.model.UnsupportedResolutionException;
import java.time.Instant;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class ResolutionCalendarTest {

  private final ResolutionCalendar calendar = ResolutionCalendar.defaults();

  @Test
  void windowStartsBeforeItStopsForEveryResolution() {
    for (Resolution resolution : Resolution.values()) {
      QueryWindow window = calendar.window(resolution, 2023);
      assertEquals(Instant.parse("2023-01-01T00:00:00Z"), window.start());
      assertTrue(window.start().isBefore(window.stop()), resolution.code());
      assertEquals(resolution.every(), window.every());
    }
  }

  @Test
  void monthlyWindowReachesOneHourIntoNextYear() {
    QueryWindow window = calendar.window("monthly", 2023);
    assertEquals(Instant.parse("2024-01-01T01:00:00Z"), window.stop());
    assertEquals("1mo", window.every());
  }

  @Test
  void weeklyWindowStopsOnSeventhOfJanuaryByDefault() {
    QueryWindow window = calendar.window(Resolution.WEEKLY, 2023);
    assertEquals(Instant.parse("2024-01-07T00:00:00Z"), window.stop());
    assertEquals("1w", window.every());
  }

  @Test
  void weeklyWindowCanStopAtYearBoundary() {
    QueryWindow window = new ResolutionCalendar(WeeklyStopRule.YEAR_BOUNDARY)
        .window(Resolution.WEEKLY, 2023);
    assertEquals(Instant.parse("2024-01-01T01:00:00Z"), window.stop());
  }

  @Test
  void unknownResolutionIsRejected() {
    UnsupportedResolutionException ex = assertThrows(UnsupportedResolutionException.class,
        () -> calendar.window("quarterly", 2023));
    assertEquals("quarterly", ex.resolution());
  }

  @Test
  void resolutionNamesAreCaseInsensitive() {
    assertEquals(Resolution.MONTHLY, Resolution.fromName(" Monthly "));
    assertEquals(Resolution.HOURLY, Resolution.fromName("HOURLY"));
  }

  @Test
  void truncationIsIdempotent() {
    Instant instant = Instant.parse("2023-05-17T13:45:12Z");
    for (Resolution resolution : Resolution.values()) {
      LocalDateTime once = calendar.truncate(resolution, instant);
      assertEquals(once, resolution.truncate(once), resolution.code());
    }
  }

  @Test
  void truncatesToPeriodStart() {
    Instant instant = Instant.parse("2023-05-17T13:45:12Z");
    assertEquals(LocalDateTime.of(2023, 5, 17, 13, 0), calendar.truncate(Resolution.HOURLY, instant));
    assertEquals(LocalDateTime.of(2023, 5, 17, 0, 0), calendar.truncate(Resolution.DAILY, instant));
    assertEquals(LocalDateTime.of(2023, 5, 15, 0, 0), calendar.truncate(Resolution.WEEKLY, instant));
    assertEquals(LocalDateTime.of(2023, 5, 1, 0, 0), calendar.truncate(Resolution.MONTHLY, instant));
    assertEquals(LocalDateTime.of(2023, 1, 1, 0, 0), calendar.truncate(Resolution.YEARLY, instant));
  }

  @Test
  void labelsFollowResolution() {
    LocalDateTime start = LocalDateTime.of(2023, 1, 2, 0, 0);
    assertEquals("2023-01-02 00:00", Resolution.HOURLY.label(start));
    assertEquals("2023-01-02", Resolution.DAILY.label(start));
    assertEquals("2023-01-02/2023-01-08", Resolution.WEEKLY.label(start));
    assertEquals("2023-01", Resolution.MONTHLY.label(start));
    assertEquals("2023", Resolution.YEARLY.label(start));
  }
}
