package com.ospicorp.energyapi.summary.pipeline;

import com.ospicorp.energyapi.summary.model.ColumnKey;
import com.ospicorp.energyapi.summary.model.PeriodKey;
import com.ospicorp.energyapi.summary.model.WideTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DeltaEngine {
  private DeltaEngine() {
  }

  /**
   * Forward differences of cumulative readings, indexed by the earlier period. The last period
   * has no successor and is dropped, so the result has one row fewer than the input (none when
   * the input has fewer than two rows). Columns are kept either way.
   */
  public static WideTable differences(WideTable cumulative) {
    int rows = cumulative.rowCount();
    int out = Math.max(0, rows - 1);
    List<PeriodKey> periods = cumulative.periods().subList(0, out);

    Map<ColumnKey, List<Double>> columns = new LinkedHashMap<>();
    for (ColumnKey key : cumulative.columnKeys()) {
      List<Double> values = cumulative.column(key);
      List<Double> deltas = new ArrayList<>(out);
      for (int i = 0; i < out; i++) {
        Double current = values.get(i);
        Double next = values.get(i + 1);
        deltas.add((current == null || next == null) ? null : next - current);
      }
      columns.put(key, deltas);
    }
    return new WideTable(cumulative.shape(), periods, columns);
  }
}
