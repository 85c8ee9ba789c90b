package com.ospicorp.energyapi.summary.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.energyapi.summary.model.ColumnKey;
import com.ospicorp.energyapi.summary.model.KeyShape;
import com.ospicorp.energyapi.summary.model.PeriodKey;
import com.ospicorp.energyapi.summary.model.RequestedShape;
import com.ospicorp.energyapi.summary.model.Resolution;
import com.ospicorp.energyapi.summary.model.WideTable;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ShapeSynthesizerTest {

  private static final List<PeriodKey> PERIODS = List.of(
      new PeriodKey(LocalDateTime.of(2023, 1, 1, 0, 0), Resolution.MONTHLY),
      new PeriodKey(LocalDateTime.of(2023, 2, 1, 0, 0), Resolution.MONTHLY));

  @Test
  void measuredGetsNullColumnForMissingField() {
    WideTable table = new WideTable(KeyShape.FIELD_CARRIER, PERIODS,
        Map.of(ColumnKey.of("Heating", "Gas"), List.of(1d, 2d)));

    WideTable out = ShapeSynthesizer.synthesizeMeasured(table,
        RequestedShape.of(List.of("Heating", "Cooling")));

    assertEquals(List.of(ColumnKey.of("Heating", "Gas"), ColumnKey.of("Cooling", "Unknown")),
        out.columnKeys());
    assertEquals(Arrays.asList(null, null), out.column(ColumnKey.of("Cooling", "Unknown")));
    assertEquals(List.of(1d, 2d), out.column(ColumnKey.of("Heating", "Gas")));
  }

  @Test
  void measuredTableWithAllFieldsIsUnchanged() {
    WideTable table = new WideTable(KeyShape.FIELD_CARRIER, PERIODS,
        Map.of(ColumnKey.of("Heating", "Gas"), List.of(1d, 2d)));

    assertEquals(table, ShapeSynthesizer.synthesizeMeasured(table,
        RequestedShape.of(List.of("Heating"))));
  }

  @Test
  void modeledGetsColumnForEveryMissingFieldAndModel() {
    WideTable table = new WideTable(KeyShape.FIELD_CARRIER_MODEL, PERIODS,
        Map.of(ColumnKey.of("Heating", "Unknown", "modelA"), List.of(1d, 2d)));
    RequestedShape requested = new RequestedShape(List.of("Heating", "Cooling"),
        List.of("modelA", "modelB"));

    WideTable out = ShapeSynthesizer.synthesizeModeled(table, requested);

    for (String field : requested.fields()) {
      for (String model : requested.models()) {
        assertTrue(out.hasColumn(ColumnKey.of(field, "Unknown", model)), field + "/" + model);
      }
    }
    assertEquals(4, out.columnKeys().size());
    assertEquals(List.of(1d, 2d), out.column(ColumnKey.of("Heating", "Unknown", "modelA")));
  }

  @Test
  void emptyModeledHasFullColumnSetAndNoRows() {
    WideTable out = ShapeSynthesizer.emptyModeled(
        new RequestedShape(List.of("Heating"), List.of("modelA", "modelB")));

    assertEquals(0, out.rowCount());
    assertEquals(List.of(ColumnKey.of("Heating", "Unknown", "modelA"),
        ColumnKey.of("Heating", "Unknown", "modelB")), out.columnKeys());
  }
}
