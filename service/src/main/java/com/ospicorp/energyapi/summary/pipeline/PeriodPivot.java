package com.ospicorp.energyapi.summary.pipeline;

import com.ospicorp.energyapi.summary.model.ColumnKey;
import com.ospicorp.energyapi.summary.model.KeyShape;
import com.ospicorp.energyapi.summary.model.Observation;
import com.ospicorp.energyapi.summary.model.PeriodKey;
import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.model.WideTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public final class PeriodPivot {
  private PeriodPivot() {
  }

  /**
   * Reshapes observations into one row per period and one column per distinct key.
   *
   * <p>The store aggregates to a single reading per field and period, so two observations for the
   * same period and key mean the query was built wrong; they are rejected, not merged.
   */
  public static WideTable pivot(List<Observation> observations, Resolution resolution,
      KeyShape shape) {
    if (observations.isEmpty()) {
      return WideTable.empty(shape);
    }
    SortedMap<PeriodKey, Map<ColumnKey, Double>> cells = new TreeMap<>();
    SortedSet<ColumnKey> keys = new TreeSet<>();
    for (Observation observation : observations) {
      PeriodKey period = new PeriodKey(resolution.truncate(observation.time()), resolution);
      ColumnKey key = shape.keyOf(observation);
      Map<ColumnKey, Double> row = cells.computeIfAbsent(period, p -> new HashMap<>());
      if (row.containsKey(key)) {
        throw new IllegalStateException("Duplicate observation for " + key.flatten()
            + " in period " + period.label());
      }
      row.put(key, observation.value());
      keys.add(key);
    }

    List<PeriodKey> periods = new ArrayList<>(cells.keySet());
    Map<ColumnKey, List<Double>> columns = new LinkedHashMap<>();
    for (ColumnKey key : keys) {
      List<Double> values = new ArrayList<>(periods.size());
      for (PeriodKey period : periods) {
        values.add(cells.get(period).get(key));
      }
      columns.put(key, values);
    }
    return new WideTable(shape, periods, columns);
  }
}
