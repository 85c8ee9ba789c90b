package com.ospicorp.energyapi.summary.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable period-by-column table. Rows are distinct periods in strictly ascending order;
 * columns are unique {@link ColumnKey}s that all share the table's {@link KeyShape}. Cells are
 * {@code Double} values or null when there is no data.
 */
public final class WideTable {

  private final KeyShape shape;
  private final List<PeriodKey> periods;
  private final Map<ColumnKey, List<Double>> columns;

  public WideTable(KeyShape shape, List<PeriodKey> periods, Map<ColumnKey, List<Double>> columns) {
    this.shape = Objects.requireNonNull(shape, "shape");
    this.periods = List.copyOf(periods);
    for (int i = 1; i < this.periods.size(); i++) {
      if (this.periods.get(i - 1).compareTo(this.periods.get(i)) >= 0) {
        throw new IllegalArgumentException("Periods must be strictly ascending at row " + i);
      }
    }
    Map<ColumnKey, List<Double>> copy = new LinkedHashMap<>();
    columns.forEach((key, values) -> {
      if (key.shape() != shape) {
        throw new IllegalArgumentException(
            "Column " + key.flatten() + " does not have shape " + shape);
      }
      if (values.size() != this.periods.size()) {
        throw new IllegalArgumentException("Column " + key.flatten() + " has " + values.size()
            + " cells for " + this.periods.size() + " periods");
      }
      copy.put(key, Collections.unmodifiableList(new ArrayList<>(values)));
    });
    this.columns = Collections.unmodifiableMap(copy);
  }

  public static WideTable empty(KeyShape shape) {
    return new WideTable(shape, List.of(), Map.of());
  }

  public KeyShape shape() {
    return shape;
  }

  public List<PeriodKey> periods() {
    return periods;
  }

  public int rowCount() {
    return periods.size();
  }

  public boolean isEmpty() {
    return periods.isEmpty();
  }

  public List<ColumnKey> columnKeys() {
    return List.copyOf(columns.keySet());
  }

  public boolean hasColumn(ColumnKey key) {
    return columns.containsKey(key);
  }

  public List<Double> column(ColumnKey key) {
    List<Double> values = columns.get(key);
    if (values == null) {
      throw new IllegalArgumentException("No column " + key.flatten());
    }
    return values;
  }

  /** Cell at {@code row}; null when the column does not exist or holds no value. */
  public Double value(int row, ColumnKey key) {
    List<Double> values = columns.get(key);
    return values == null ? null : values.get(row);
  }

  public List<String> fields() {
    return distinct(ColumnKey::field);
  }

  public List<String> carriers() {
    return distinct(ColumnKey::carrier);
  }

  public List<String> models() {
    return distinct(ColumnKey::model);
  }

  public WideTable withColumn(ColumnKey key, List<Double> values) {
    if (columns.containsKey(key)) {
      throw new IllegalArgumentException("Column " + key.flatten() + " already exists");
    }
    Map<ColumnKey, List<Double>> next = new LinkedHashMap<>(columns);
    next.put(key, values);
    return new WideTable(shape, periods, next);
  }

  public WideTable withNullColumn(ColumnKey key) {
    return withColumn(key, Collections.nCopies(periods.size(), null));
  }

  private List<String> distinct(Function<ColumnKey, String> component) {
    Set<String> seen = new LinkedHashSet<>();
    for (ColumnKey key : columns.keySet()) {
      String value = component.apply(key);
      if (value != null) {
        seen.add(value);
      }
    }
    return List.copyOf(seen);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WideTable other)) {
      return false;
    }
    return shape == other.shape && periods.equals(other.periods) && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(shape, periods, columns);
  }

  @Override
  public String toString() {
    return "WideTable{shape=" + shape + ", rows=" + periods.size() + ", columns="
        + columns.keySet() + "}";
  }
}
