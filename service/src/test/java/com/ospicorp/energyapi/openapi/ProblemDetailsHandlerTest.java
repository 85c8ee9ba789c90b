package com.ospicorp.energyapi.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ProblemDetailsHandlerTest {

  @Autowired
  private TestRestTemplate rest;

  private ResponseEntity<Map<String, Object>> get(String url) {
    return rest.exchange(url, HttpMethod.GET, null, new ParameterizedTypeReference<>() {});
  }

  @Test
  void mistypedYearReturnsProblemDetail() {
    ResponseEntity<Map<String, Object>> response = get(
        "/api/energy-summary-measured-field-data?measurement=measured&fields=Heating&year=last");
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType()).isNotNull();
    assertThat(response.getHeaders().getContentType().toString()).contains("application/problem+json");
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(body.get("type")).isEqualTo("https://docs.energy-summary-api.dev/problems/invalid-parameter");
  }

  @Test
  void unknownPathReturnsNotFoundProblem() {
    ResponseEntity<Map<String, Object>> response = get("/api/no-such-endpoint");
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).containsEntry("path", "/api/no-such-endpoint");
  }
}
