package com.ospicorp.energyapi.summary.pipeline;

import java.time.Instant;

// [start, stop) range aggregated every `every` (Flux duration literal)
public record QueryWindow(Instant start, Instant stop, String every) {

  public QueryWindow {
    if (!start.isBefore(stop)) {
      throw new IllegalArgumentException("Window start " + start + " is not before stop " + stop);
    }
  }
}
