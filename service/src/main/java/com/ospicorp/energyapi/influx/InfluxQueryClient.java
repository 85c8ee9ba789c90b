package com.ospicorp.energyapi.influx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.energyapi.summary.model.RawTable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class InfluxQueryClient {
  private static final Logger log = LoggerFactory.getLogger(InfluxQueryClient.class);
  static final MediaType APPLICATION_CSV = MediaType.valueOf("application/csv");

  private final RestTemplate restTemplate;
  private final ObjectMapper mapper;
  private final String baseUrl;
  private final String org;
  private final String token;

  public InfluxQueryClient(RestTemplate restTemplate,
      ObjectMapper mapper,
      @Value("${influxdb.url:http://localhost:8086}") String baseUrl,
      @Value("${influxdb.org:}") String org,
      @Value("${influxdb.token:}") String token) {
    this.restTemplate = restTemplate;
    this.mapper = mapper;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.org = org;
    this.token = token;
  }

  public RawTable query(String flux) {
    String url = baseUrl + "/api/v2/query?org={org}";
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("query", flux);
    body.put("type", "flux");
    body.put("dialect", Map.of("header", true, "annotations", List.of()));

    String payload;
    try {
      payload = mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new TimeSeriesStoreException("Unable to encode Flux query request", e);
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setAccept(List.of(APPLICATION_CSV));
    headers.set(HttpHeaders.AUTHORIZATION, "Token " + token);
    HttpEntity<String> entity = new HttpEntity<>(payload, headers);

    long startTime = System.currentTimeMillis();
    try {
      ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, entity,
          String.class, org);
      RawTable table = FluxCsvParser.parse(response.getBody());
      log.debug("Flux query returned {} rows in {} ms", table.size(),
          System.currentTimeMillis() - startTime);
      return table;
    } catch (RestClientException e) {
      throw new TimeSeriesStoreException("InfluxDB query failed: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new TimeSeriesStoreException("Unreadable InfluxDB query response", e);
    }
  }
}
