package com.ospicorp.energyapi.influx;

import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.pipeline.QueryWindow;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flux for the summary queries. Every query keeps the first reading of each aggregation window,
 * stamped with the window start, which is the cumulative total at the start of that period.
 */
public final class FluxQueryBuilder {
  // Flux windows are aligned to the Unix epoch, a Thursday; shift weekly ones back to Monday
  static final String WEEK_OFFSET = "-3d";

  private FluxQueryBuilder() {
  }

  public static String measured(String bucket, String measurement, String unit,
      List<String> fields, QueryWindow window) {
    return new StringBuilder()
        .append(from(bucket, window))
        .append(filter(column("_measurement") + " == " + literal(measurement)))
        .append(filter(anyOf("_field", fields)))
        .append(filter(column("Units") + " == " + literal(unit)))
        .append(aggregate(window.every()))
        .toString();
  }

  public static String modeled(String bucket, String measurement, String unit,
      List<String> fields, List<String> models, QueryWindow window) {
    return new StringBuilder()
        .append(from(bucket, window))
        .append(filter(column("_measurement") + " == " + literal(measurement)))
        .append(filter(anyOf("_field", fields)))
        .append(filter(anyOf("Model", models)))
        .append(filter(column("Units") + " == " + literal(unit)))
        .append(aggregate(window.every()))
        .toString();
  }

  public static String availability(String bucket, List<String> measurements, String unit,
      QueryWindow window) {
    return new StringBuilder()
        .append(from(bucket, window))
        .append(filter(anyOf("_measurement", measurements)))
        .append(filter(column("Units") + " == " + literal(unit)))
        .append(aggregate(window.every()))
        .toString();
  }

  static String literal(String value) {
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  private static String from(String bucket, QueryWindow window) {
    return "from(bucket: " + literal(bucket) + ")\n"
        + "  |> range(start: " + window.start() + ", stop: " + window.stop() + ")\n";
  }

  private static String filter(String predicate) {
    return "  |> filter(fn: (r) => " + predicate + ")\n";
  }

  private static String aggregate(String every) {
    String offset = Resolution.WEEKLY.every().equals(every) ? ", offset: " + WEEK_OFFSET : "";
    return "  |> aggregateWindow(every: " + every + offset
        + ", fn: first, createEmpty: false, timeSrc: \"_start\")\n";
  }

  private static String column(String name) {
    return "r[" + literal(name) + "]";
  }

  private static String anyOf(String name, List<String> values) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("No values to filter " + name + " on");
    }
    return values.stream()
        .map(value -> column(name) + " == " + literal(value))
        .collect(Collectors.joining(" or "));
  }
}
