package com.ospicorp.energyapi.summary.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Values reported for one field and carrier in one period.
 *
 * <p>A null reference means the key is left out of the document, {@code Optional.empty()} means
 * the key is written with a JSON null. Modeled maps may hold null values for individual models.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CarrierValues {

  private Optional<Double> measured;
  private Optional<Map<String, Double>> modeled;

  public static CarrierValues ofMeasured(Double value) {
    CarrierValues values = new CarrierValues();
    values.setMeasured(value);
    return values;
  }

  public static CarrierValues ofModeled(Map<String, Double> valuesByModel) {
    CarrierValues values = new CarrierValues();
    values.setModeled(valuesByModel);
    return values;
  }

  @JsonProperty("measured")
  public Optional<Double> getMeasured() {
    return measured;
  }

  @JsonProperty("modeled")
  public Optional<Map<String, Double>> getModeled() {
    return modeled;
  }

  public void setMeasured(Double value) {
    this.measured = Optional.ofNullable(value);
  }

  public void setModeled(Map<String, Double> valuesByModel) {
    this.modeled = valuesByModel == null
        ? Optional.empty()
        : Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(valuesByModel)));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CarrierValues other)) {
      return false;
    }
    return Objects.equals(measured, other.measured)
        && Objects.equals(modeled, other.modeled);
  }

  @Override
  public int hashCode() {
    return Objects.hash(measured, modeled);
  }

  @Override
  public String toString() {
    return "CarrierValues{measured=" + measured + ", modeled=" + modeled + "}";
  }
}
