package com.ospicorp.energyapi.summary.pipeline;

import com.ospicorp.energyapi.summary.model.CarrierValues;
import com.ospicorp.energyapi.summary.model.ColumnKey;
import com.ospicorp.energyapi.summary.model.EnergySummaryDocument;
import com.ospicorp.energyapi.summary.model.PeriodKey;
import com.ospicorp.energyapi.summary.model.PeriodRecord;
import com.ospicorp.energyapi.summary.model.RequestedShape;
import com.ospicorp.energyapi.summary.model.SummaryMetadata;
import com.ospicorp.energyapi.summary.model.WideTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the client documents from synthesized delta tables. Tables are joined on their periods
 * through flattened column keys; a period missing from one side simply has no values for it.
 */
public final class JsonAssembler {
  private JsonAssembler() {
  }

  public static EnergySummaryDocument combined(WideTable measured, WideTable modeled,
      RequestedShape requested, List<String> measurements, String unit, int year) {
    List<String> measuredFields = measured.fields();
    List<String> measuredCarriers = measured.carriers();
    List<String> modeledFields = modeled != null ? modeled.fields() : List.of();
    List<String> modeledCarriers = modeled != null ? modeled.carriers() : List.of();
    boolean withModels = modeled != null && requested.hasModels();

    SortedMap<PeriodKey, Map<String, Double>> rows = modeled != null
        ? merge(measured, modeled)
        : merge(measured);

    List<PeriodRecord> data = new ArrayList<>(rows.size());
    rows.forEach((period, row) -> {
      Map<String, Map<String, CarrierValues>> fields = new LinkedHashMap<>();
      for (String field : requested.fields()) {
        Map<String, CarrierValues> carriers = new LinkedHashMap<>();
        fields.put(field, carriers);
        if (measuredFields.contains(field)) {
          for (String carrier : measuredCarriers) {
            carriers.put(carrier, CarrierValues.ofMeasured(measuredValue(row, field, carrier)));
          }
        }
        if (withModels && modeledFields.contains(field)) {
          for (String carrier : modeledCarriers) {
            carriers.computeIfAbsent(carrier, c -> new CarrierValues())
                .setModeled(modeledValues(row, field, carrier, requested.models()));
          }
        }
      }
      data.add(new PeriodRecord(period.label(), fields));
    });

    Set<String> carriers = new LinkedHashSet<>(measuredCarriers);
    carriers.addAll(modeledCarriers);
    SummaryMetadata metadata = SummaryMetadata.combined(requested.fields(),
        modeled != null ? requested.models() : List.of(), List.copyOf(carriers), measurements,
        unit, year);
    return new EnergySummaryDocument(data, metadata);
  }

  public static EnergySummaryDocument measuredOnly(WideTable measured, RequestedShape requested,
      String measurement, String unit, int year) {
    List<String> measuredFields = measured.fields();
    List<String> measuredCarriers = measured.carriers();

    List<PeriodRecord> data = new ArrayList<>(measured.rowCount());
    merge(measured).forEach((period, row) -> {
      Map<String, Map<String, CarrierValues>> fields = new LinkedHashMap<>();
      for (String field : requested.fields()) {
        if (!measuredFields.contains(field)) {
          continue;
        }
        Map<String, CarrierValues> carriers = new LinkedHashMap<>();
        for (String carrier : measuredCarriers) {
          carriers.put(carrier, CarrierValues.ofMeasured(measuredValue(row, field, carrier)));
        }
        fields.put(field, carriers);
      }
      data.add(new PeriodRecord(period.label(), fields));
    });

    return new EnergySummaryDocument(data,
        SummaryMetadata.measured(measurement, requested.fields(), unit, year));
  }

  public static EnergySummaryDocument modeledOnly(WideTable modeled, RequestedShape requested,
      String measurement, String unit, int year) {
    List<String> modeledFields = modeled.fields();
    List<String> modeledCarriers = modeled.carriers();

    List<PeriodRecord> data = new ArrayList<>(modeled.rowCount());
    merge(modeled).forEach((period, row) -> {
      Map<String, Map<String, CarrierValues>> fields = new LinkedHashMap<>();
      for (String field : requested.fields()) {
        if (!modeledFields.contains(field)) {
          continue;
        }
        Map<String, CarrierValues> carriers = new LinkedHashMap<>();
        for (String carrier : modeledCarriers) {
          carriers.put(carrier,
              CarrierValues.ofModeled(modeledValues(row, field, carrier, requested.models())));
        }
        fields.put(field, carriers);
      }
      data.add(new PeriodRecord(period.label(), fields));
    });

    return new EnergySummaryDocument(data, SummaryMetadata.modeled(measurement,
        requested.fields(), requested.models(), unit, year));
  }

  /** Outer join on period; each row maps flattened column keys to cell values. */
  static SortedMap<PeriodKey, Map<String, Double>> merge(WideTable... tables) {
    SortedMap<PeriodKey, Map<String, Double>> rows = new TreeMap<>();
    for (WideTable table : tables) {
      List<ColumnKey> keys = table.columnKeys();
      for (int i = 0; i < table.rowCount(); i++) {
        Map<String, Double> row = rows.computeIfAbsent(table.periods().get(i),
            p -> new HashMap<>());
        for (ColumnKey key : keys) {
          row.put(key.flatten(), table.value(i, key));
        }
      }
    }
    return rows;
  }

  private static Double measuredValue(Map<String, Double> row, String field, String carrier) {
    return row.get(ColumnKey.of(field, carrier).flatten());
  }

  // null when no requested model has a value
  private static Map<String, Double> modeledValues(Map<String, Double> row, String field,
      String carrier, List<String> models) {
    Map<String, Double> values = new LinkedHashMap<>();
    boolean any = false;
    for (String model : models) {
      Double value = row.get(ColumnKey.of(field, carrier, model).flatten());
      values.put(model, value);
      any |= value != null;
    }
    return any ? values : null;
  }
}
