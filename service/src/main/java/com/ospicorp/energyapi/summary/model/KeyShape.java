package com.ospicorp.energyapi.summary.model;

public enum KeyShape {
  FIELD(1),
  FIELD_CARRIER(2),
  FIELD_CARRIER_MODEL(3);

  private final int arity;

  KeyShape(int arity) {
    this.arity = arity;
  }

  public int arity() {
    return arity;
  }

  public ColumnKey keyOf(Observation observation) {
    return switch (this) {
      case FIELD -> ColumnKey.of(observation.field());
      case FIELD_CARRIER -> ColumnKey.of(observation.field(), observation.carrier());
      case FIELD_CARRIER_MODEL -> {
        if (observation.model() == null) {
          throw new IllegalStateException(
              "Observation for field " + observation.field() + " carries no model");
        }
        yield ColumnKey.of(observation.field(), observation.carrier(), observation.model());
      }
    };
  }
}
