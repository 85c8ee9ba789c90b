package com.ospicorp.energyapi.summary.model;

import java.util.Map;

// fields: field -> carrier -> values
public record PeriodRecord(String time, Map<String, Map<String, CarrierValues>> fields) {}
