package com.ospicorp.energyapi.summary.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows exactly as the time-series store returned them, one map of column name to textual cell
 * per row. Flux names its columns {@code _time}, {@code _field}, {@code _value} and so on, while
 * tags keep the names they were written with ({@code Model}, {@code Carrier}, {@code Units}).
 */
public record RawTable(List<Map<String, String>> rows) {

  public RawTable {
    List<Map<String, String>> copy = new ArrayList<>(rows.size());
    for (Map<String, String> row : rows) {
      copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }
    rows = Collections.unmodifiableList(copy);
  }

  public static RawTable empty() {
    return new RawTable(List.of());
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }

  public boolean hasColumn(String column) {
    return rows.stream().anyMatch(row -> row.containsKey(column));
  }

  /** Splits the table by the value of {@code column}, preserving first-seen order. */
  public Map<String, RawTable> groupBy(String column) {
    Map<String, List<Map<String, String>>> groups = new LinkedHashMap<>();
    for (Map<String, String> row : rows) {
      groups.computeIfAbsent(row.getOrDefault(column, ""), key -> new ArrayList<>()).add(row);
    }
    Map<String, RawTable> out = new LinkedHashMap<>();
    groups.forEach((key, groupRows) -> out.put(key, new RawTable(groupRows)));
    return out;
  }
}
