package com.ospicorp.energyapi.summary.pipeline;

import com.ospicorp.energyapi.summary.model.Resolution;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Query windows for one calendar year at a given resolution.
 *
 * <p>The stop bound is exclusive and lies one hour after the start of the following year, so the
 * reading taken at the year boundary is returned. That reading closes the final period of the
 * year and is what the last delta is taken against.
 */
public final class ResolutionCalendar {

  static final Duration BOUNDARY_GRACE = Duration.ofHours(1);
  static final String AVAILABILITY_STEP = "1mo";

  private static final QueryWindow AVAILABILITY = new QueryWindow(
      yearStart(2022), yearStart(2100), AVAILABILITY_STEP);

  private final WeeklyStopRule weeklyStopRule;

  public ResolutionCalendar(WeeklyStopRule weeklyStopRule) {
    this.weeklyStopRule = Objects.requireNonNull(weeklyStopRule, "weeklyStopRule");
  }

  public static ResolutionCalendar defaults() {
    return new ResolutionCalendar(WeeklyStopRule.FIXED_JANUARY_7);
  }

  /** Range scanned when checking which years hold data; always monthly. */
  public static QueryWindow availabilityWindow() {
    return AVAILABILITY;
  }

  public WeeklyStopRule weeklyStopRule() {
    return weeklyStopRule;
  }

  public QueryWindow window(String resolutionName, int year) {
    return window(Resolution.fromName(resolutionName), year);
  }

  public QueryWindow window(Resolution resolution, int year) {
    Instant start = yearStart(year);
    Instant stop;
    if (resolution == Resolution.WEEKLY && weeklyStopRule == WeeklyStopRule.FIXED_JANUARY_7) {
      stop = LocalDate.of(year + 1, 1, 7).atStartOfDay().toInstant(ZoneOffset.UTC);
    } else {
      stop = yearStart(year + 1).plus(BOUNDARY_GRACE);
    }
    return new QueryWindow(start, stop, resolution.every());
  }

  public LocalDateTime truncate(Resolution resolution, Instant instant) {
    return resolution.truncate(instant);
  }

  private static Instant yearStart(int year) {
    return LocalDate.of(year, 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC);
  }
}
