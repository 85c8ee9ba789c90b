package com.ospicorp.energyapi.summary.pipeline;

import com.ospicorp.energyapi.summary.model.ColumnKey;
import com.ospicorp.energyapi.summary.model.KeyShape;
import com.ospicorp.energyapi.summary.model.RequestedShape;
import com.ospicorp.energyapi.summary.model.WideTable;
import java.util.HashSet;
import java.util.Set;

/**
 * Adds null columns so every requested field (and model) can be looked up in a table, whatever
 * the store returned.
 */
public final class ShapeSynthesizer {
  public static final String UNKNOWN_CARRIER = "Unknown";

  private ShapeSynthesizer() {
  }

  public static WideTable synthesizeMeasured(WideTable table, RequestedShape requested) {
    Set<String> present = new HashSet<>(table.fields());
    WideTable out = table;
    for (String field : requested.fields()) {
      if (present.add(field)) {
        out = out.withNullColumn(ColumnKey.of(field, UNKNOWN_CARRIER));
      }
    }
    return out;
  }

  public static WideTable synthesizeModeled(WideTable table, RequestedShape requested) {
    WideTable out = table;
    for (String field : requested.fields()) {
      for (String model : requested.models()) {
        ColumnKey key = ColumnKey.of(field, UNKNOWN_CARRIER, model);
        if (!out.hasColumn(key)) {
          out = out.withNullColumn(key);
        }
      }
    }
    return out;
  }

  /** Zero rows, one column per requested field and model under the unknown carrier. */
  public static WideTable emptyModeled(RequestedShape requested) {
    return synthesizeModeled(WideTable.empty(KeyShape.FIELD_CARRIER_MODEL), requested);
  }
}
