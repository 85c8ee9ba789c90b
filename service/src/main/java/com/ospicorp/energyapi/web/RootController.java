package com.ospicorp.energyapi.web;

import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {
  private final String unit;

  public RootController(@Value("${energy.unit:kilowattHours}") String unit) {
    this.unit = unit;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of("service", "energy-summary-api", "status", "ok", "unit", unit);
  }

  @GetMapping("/api/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
