package com.ospicorp.energyapi.summary.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.energyapi.summary.model.ColumnKey;
import com.ospicorp.energyapi.summary.model.KeyShape;
import com.ospicorp.energyapi.summary.model.Observation;
import com.ospicorp.energyapi.summary.model.PeriodKey;
import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.model.WideTable;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class PeriodPivotTest {

  private static Observation obs(String time, String field, Double value, String carrier) {
    return new Observation(Instant.parse(time), field, value, null, carrier);
  }

  @Test
  void pivotsRowsIntoAscendingPeriodsAndSortedColumns() {
    List<Observation> input = List.of(
        obs("2023-02-01T00:00:00Z", "Heating", 20d, "Gas"),
        obs("2023-01-01T00:00:00Z", "Heating", 10d, "Gas"),
        obs("2023-01-01T00:00:00Z", "Cooling", 1d, "Electric"),
        obs("2023-02-01T00:00:00Z", "Cooling", 3d, "Electric"));

    WideTable table = PeriodPivot.pivot(input, Resolution.MONTHLY, KeyShape.FIELD_CARRIER);

    assertEquals(List.of("2023-01", "2023-02"),
        table.periods().stream().map(PeriodKey::label).toList());
    assertEquals(List.of(ColumnKey.of("Cooling", "Electric"), ColumnKey.of("Heating", "Gas")),
        table.columnKeys());
    assertEquals(List.of(10d, 20d), table.column(ColumnKey.of("Heating", "Gas")));
    assertEquals(List.of(1d, 3d), table.column(ColumnKey.of("Cooling", "Electric")));
  }

  @Test
  void missingCellIsNull() {
    List<Observation> input = List.of(
        obs("2023-01-01T00:00:00Z", "Heating", 10d, "Gas"),
        obs("2023-02-01T00:00:00Z", "Cooling", 3d, "Electric"));

    WideTable table = PeriodPivot.pivot(input, Resolution.MONTHLY, KeyShape.FIELD_CARRIER);

    assertEquals(Arrays.asList(10d, null), table.column(ColumnKey.of("Heating", "Gas")));
    assertEquals(Arrays.asList(null, 3d), table.column(ColumnKey.of("Cooling", "Electric")));
  }

  @Test
  void duplicateReadingForPeriodAndKeyIsRejected() {
    List<Observation> input = List.of(
        obs("2023-01-01T00:00:00Z", "Heating", 10d, "Gas"),
        obs("2023-01-15T00:00:00Z", "Heating", 11d, "Gas"));

    assertThrows(IllegalStateException.class,
        () -> PeriodPivot.pivot(input, Resolution.MONTHLY, KeyShape.FIELD_CARRIER));
  }

  @Test
  void modeledShapeSplitsColumnsByModel() {
    List<Observation> input = List.of(
        new Observation(Instant.parse("2023-01-01T00:00:00Z"), "Heating", 5d, "modelB", "Unknown"),
        new Observation(Instant.parse("2023-01-01T00:00:00Z"), "Heating", 4d, "modelA", "Unknown"));

    WideTable table = PeriodPivot.pivot(input, Resolution.MONTHLY, KeyShape.FIELD_CARRIER_MODEL);

    assertEquals(List.of(ColumnKey.of("Heating", "Unknown", "modelA"),
        ColumnKey.of("Heating", "Unknown", "modelB")), table.columnKeys());
    assertEquals(List.of("modelA", "modelB"), table.models());
  }

  @Test
  void modeledShapeRequiresModel() {
    List<Observation> input = List.of(obs("2023-01-01T00:00:00Z", "Heating", 10d, "Unknown"));

    assertThrows(IllegalStateException.class,
        () -> PeriodPivot.pivot(input, Resolution.MONTHLY, KeyShape.FIELD_CARRIER_MODEL));
  }

  @Test
  void emptyInputGivesEmptyTable() {
    WideTable table = PeriodPivot.pivot(List.of(), Resolution.DAILY, KeyShape.FIELD_CARRIER);
    assertTrue(table.isEmpty());
    assertTrue(table.columnKeys().isEmpty());
  }
}
