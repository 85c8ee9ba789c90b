package com.ospicorp.energyapi.summary.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Supported period granularities. Each one knows its Flux aggregation step, how to truncate a
 * UTC timestamp to the start of its period and how to render that period as a label.
 */
public enum Resolution {
  HOURLY("1h"),
  DAILY("1d"),
  WEEKLY("1w"),
  MONTHLY("1mo"),
  YEARLY("1y");

  private static final DateTimeFormatter HOUR_LABEL = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm");
  private static final DateTimeFormatter DAY_LABEL = DateTimeFormatter.ofPattern("uuuu-MM-dd");
  private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("uuuu-MM");
  private static final DateTimeFormatter YEAR_LABEL = DateTimeFormatter.ofPattern("uuuu");

  private final String every;

  Resolution(String every) {
    this.every = every;
  }

  public static Resolution fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toUpperCase(Locale.ROOT);
      for (Resolution resolution : values()) {
        if (resolution.name().equals(normalized)) {
          return resolution;
        }
      }
    }
    throw new UnsupportedResolutionException(name);
  }

  public String every() {
    return every;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public LocalDateTime truncate(Instant instant) {
    return truncate(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
  }

  public LocalDateTime truncate(LocalDateTime time) {
    return switch (this) {
      case HOURLY -> time.truncatedTo(ChronoUnit.HOURS);
      case DAILY -> time.truncatedTo(ChronoUnit.DAYS);
      case WEEKLY -> time.toLocalDate()
          .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
          .atStartOfDay();
      case MONTHLY -> time.toLocalDate().withDayOfMonth(1).atStartOfDay();
      case YEARLY -> time.toLocalDate().withDayOfYear(1).atStartOfDay();
    };
  }

  public String label(LocalDateTime periodStart) {
    return switch (this) {
      case HOURLY -> HOUR_LABEL.format(periodStart);
      case DAILY -> DAY_LABEL.format(periodStart);
      case WEEKLY -> DAY_LABEL.format(periodStart) + "/" + DAY_LABEL.format(periodStart.plusDays(6));
      case MONTHLY -> MONTH_LABEL.format(periodStart);
      case YEARLY -> YEAR_LABEL.format(periodStart);
    };
  }
}
