package com.ospicorp.energyapi.summary.pipeline;

import com.ospicorp.energyapi.summary.model.Observation;
import com.ospicorp.energyapi.summary.model.RawTable;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Projects raw store rows onto the canonical observation schema, dropping every other column.
 */
public final class RowNormalizer {
  static final String TIME = "_time";
  static final String FIELD = "_field";
  static final String VALUE = "_value";
  static final String MODEL = "Model";
  static final String CARRIER = "Carrier";

  private RowNormalizer() {
  }

  public static List<Observation> normalize(RawTable table, String defaultCarrier) {
    List<Observation> out = new ArrayList<>(table.size());
    for (Map<String, String> row : table.rows()) {
      String carrier = row.get(CARRIER);
      out.add(new Observation(
          parseTime(row.get(TIME)),
          row.get(FIELD),
          parseValue(row.get(VALUE)),
          StringUtils.hasText(row.get(MODEL)) ? row.get(MODEL) : null,
          StringUtils.hasText(carrier) ? carrier : defaultCarrier));
    }
    return out;
  }

  static Instant parseTime(String text) {
    if (!StringUtils.hasText(text)) {
      throw new IllegalArgumentException("Row has no " + TIME + " value");
    }
    try {
      return OffsetDateTime.parse(text.trim()).toInstant();
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("Unparseable " + TIME + " value: " + text, ex);
    }
  }

  static Double parseValue(String text) {
    if (!StringUtils.hasText(text)) {
      return null;
    }
    try {
      double value = Double.parseDouble(text.trim());
      return Double.isNaN(value) ? null : value;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Non-numeric " + VALUE + " value: " + text, ex);
    }
  }
}
