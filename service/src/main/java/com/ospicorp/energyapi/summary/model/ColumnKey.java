package com.ospicorp.energyapi.summary.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Composite column key of a {@link WideTable}: a field, optionally qualified by a carrier and,
 * when a carrier is present, by a model.
 *
 * <p>Keys flatten to a single string joined by {@link #DELIMITER}. Components may not contain the
 * delimiter, so {@link #parse(String, KeyShape)} always recovers the same key.
 */
public record ColumnKey(String field, String carrier, String model) implements Comparable<ColumnKey> {

  public static final String DELIMITER = "|";

  private static final Pattern SPLITTER = Pattern.compile(Pattern.quote(DELIMITER));
  private static final Comparator<ColumnKey> ORDER = Comparator
      .comparing(ColumnKey::field)
      .thenComparing(ColumnKey::carrier, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(ColumnKey::model, Comparator.nullsFirst(Comparator.naturalOrder()));

  public ColumnKey {
    Objects.requireNonNull(field, "field");
    if (model != null && carrier == null) {
      throw new IllegalArgumentException("A model column needs a carrier: " + field + "/" + model);
    }
    requireNoDelimiter(field);
    requireNoDelimiter(carrier);
    requireNoDelimiter(model);
  }

  public static ColumnKey of(String field) {
    return new ColumnKey(field, null, null);
  }

  public static ColumnKey of(String field, String carrier) {
    return new ColumnKey(field, Objects.requireNonNull(carrier, "carrier"), null);
  }

  public static ColumnKey of(String field, String carrier, String model) {
    return new ColumnKey(field, Objects.requireNonNull(carrier, "carrier"),
        Objects.requireNonNull(model, "model"));
  }

  public static ColumnKey parse(String flattened, KeyShape shape) {
    String[] parts = SPLITTER.split(flattened, -1);
    if (parts.length != shape.arity()) {
      throw new IllegalArgumentException(
          "Expected " + shape.arity() + " components in column key '" + flattened + "'");
    }
    return switch (shape) {
      case FIELD -> of(parts[0]);
      case FIELD_CARRIER -> of(parts[0], parts[1]);
      case FIELD_CARRIER_MODEL -> of(parts[0], parts[1], parts[2]);
    };
  }

  public static boolean isValidComponent(String component) {
    return component != null && !component.contains(DELIMITER);
  }

  public KeyShape shape() {
    if (model != null) {
      return KeyShape.FIELD_CARRIER_MODEL;
    }
    return carrier != null ? KeyShape.FIELD_CARRIER : KeyShape.FIELD;
  }

  public String flatten() {
    List<String> parts = new ArrayList<>(3);
    parts.add(field);
    if (carrier != null) {
      parts.add(carrier);
    }
    if (model != null) {
      parts.add(model);
    }
    return String.join(DELIMITER, parts);
  }

  @Override
  public int compareTo(ColumnKey other) {
    return ORDER.compare(this, other);
  }

  private static void requireNoDelimiter(String component) {
    if (component != null && component.contains(DELIMITER)) {
      throw new IllegalArgumentException(
          "Column key component '" + component + "' contains the reserved delimiter " + DELIMITER);
    }
  }
}
