package com.ospicorp.energyapi.summary.model;

import java.time.LocalDateTime;
import java.util.Objects;

// Start of a truncated period; ordered by start
public record PeriodKey(LocalDateTime start, Resolution resolution) implements Comparable<PeriodKey> {

  public PeriodKey {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(resolution, "resolution");
  }

  public String label() {
    return resolution.label(start);
  }

  @Override
  public int compareTo(PeriodKey other) {
    return start.compareTo(other.start);
  }
}
