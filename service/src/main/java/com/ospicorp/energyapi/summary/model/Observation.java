package com.ospicorp.energyapi.summary.model;

import java.time.Instant;

// One normalized reading; model is null for measured data
public record Observation(Instant time, String field, Double value, String model, String carrier) {}
