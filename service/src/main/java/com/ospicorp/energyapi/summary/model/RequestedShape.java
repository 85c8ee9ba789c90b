package com.ospicorp.energyapi.summary.model;

import java.util.List;

/**
 * Fields, and for modeled output the models, that every document must expose whether or not the
 * store returned data for them.
 */
public record RequestedShape(List<String> fields, List<String> models) {

  public RequestedShape {
    if (fields == null || fields.isEmpty()) {
      throw new IllegalArgumentException("At least one field must be requested");
    }
    fields = List.copyOf(fields);
    models = models == null ? List.of() : List.copyOf(models);
  }

  public static RequestedShape of(List<String> fields) {
    return new RequestedShape(fields, List.of());
  }

  public boolean hasModels() {
    return !models.isEmpty();
  }
}
