package com.ospicorp.energyapi.summary.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryMetadata(
    String measurement,
    List<String> fields,
    List<String> models,
    List<String> carriers,
    List<String> measurements,
    String unit,
    Integer year
) {

  public static SummaryMetadata combined(List<String> fields, List<String> models,
      List<String> carriers, List<String> measurements, String unit, int year) {
    return new SummaryMetadata(null, fields, models, carriers, measurements, unit, year);
  }

  public static SummaryMetadata measured(String measurement, List<String> fields, String unit,
      int year) {
    return new SummaryMetadata(measurement, fields, null, null, null, unit, year);
  }

  public static SummaryMetadata modeled(String measurement, List<String> fields,
      List<String> models, String unit, int year) {
    return new SummaryMetadata(measurement, fields, models, null, null, unit, year);
  }
}
