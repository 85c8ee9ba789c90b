package com.ospicorp.energyapi.summary.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.energyapi.summary.model.ColumnKey;
import com.ospicorp.energyapi.summary.model.KeyShape;
import com.ospicorp.energyapi.summary.model.PeriodKey;
import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.model.WideTable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DeltaEngineTest {

  private static final ColumnKey HEATING = ColumnKey.of("Heating", "Electric");
  private static final ColumnKey COOLING = ColumnKey.of("Cooling", "Electric");

  private static List<PeriodKey> months(int n) {
    List<PeriodKey> periods = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      periods.add(new PeriodKey(LocalDateTime.of(2023, 1, 1, 0, 0).plusMonths(i),
          Resolution.MONTHLY));
    }
    return periods;
  }

  private static WideTable table(List<Double> heating, List<Double> cooling) {
    Map<ColumnKey, List<Double>> columns = new LinkedHashMap<>();
    columns.put(HEATING, heating);
    columns.put(COOLING, cooling);
    return new WideTable(KeyShape.FIELD_CARRIER, months(heating.size()), columns);
  }

  @Test
  void forwardDifferencesDropTheLastPeriod() {
    WideTable cumulative = table(List.of(0d, 10d, 25d, 45d, 70d), List.of(0d, 0d, 0d, 0d, 0d));

    WideTable deltas = DeltaEngine.differences(cumulative);

    assertEquals(List.of(10d, 15d, 20d, 25d), deltas.column(HEATING));
    assertEquals(cumulative.periods().subList(0, 4), deltas.periods());
  }

  @Test
  void columnsAreDifferencedIndependently() {
    WideTable deltas = DeltaEngine.differences(table(List.of(1d, 2d, 4d), List.of(100d, 90d, 95d)));

    assertEquals(List.of(1d, 2d), deltas.column(HEATING));
    assertEquals(List.of(-10d, 5d), deltas.column(COOLING));
  }

  @Test
  void nullOperandGivesNull() {
    WideTable deltas = DeltaEngine.differences(
        table(Arrays.asList(1d, null, 4d, 6d), List.of(0d, 1d, 2d, 3d)));

    assertEquals(Arrays.asList(null, null, 2d), deltas.column(HEATING));
  }

  @Test
  void singleRowKeepsColumnsButHasNoRows() {
    WideTable deltas = DeltaEngine.differences(table(List.of(5d), List.of(7d)));

    assertEquals(0, deltas.rowCount());
    assertEquals(List.of(HEATING, COOLING), deltas.columnKeys());
  }

  @Test
  void emptyTableStaysEmpty() {
    WideTable deltas = DeltaEngine.differences(WideTable.empty(KeyShape.FIELD_CARRIER));
    assertTrue(deltas.isEmpty());
  }
}
