package com.ospicorp.energyapi.influx;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ospicorp.energyapi.summary.model.RawTable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Reads the CSV returned by the InfluxDB query endpoint with headers on and annotations off.
 * Each result table starts with its own header row and tables are separated by an empty line;
 * the unnamed leading column is dropped.
 */
final class FluxCsvParser {
  private static final CsvMapper MAPPER = new CsvMapper();

  private FluxCsvParser() {
  }

  static RawTable parse(String body) throws IOException {
    if (!StringUtils.hasText(body)) {
      return RawTable.empty();
    }
    List<Map<String, String>> rows = new ArrayList<>();
    String[] header = null;
    try (MappingIterator<String[]> lines = MAPPER.readerFor(String[].class)
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .readValues(body)) {
      while (lines.hasNextValue()) {
        String[] cells = lines.nextValue();
        if (isBlank(cells)) {
          header = null;
          continue;
        }
        if (header == null || isHeader(cells)) {
          header = cells;
          continue;
        }
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < header.length && i < cells.length; i++) {
          if (!header[i].isEmpty()) {
            row.put(header[i], cells[i]);
          }
        }
        rows.add(row);
      }
    }
    return new RawTable(rows);
  }

  private static boolean isBlank(String[] cells) {
    for (String cell : cells) {
      if (StringUtils.hasText(cell)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isHeader(String[] cells) {
    return cells.length > 2 && "result".equals(cells[1]) && "table".equals(cells[2]);
  }
}
