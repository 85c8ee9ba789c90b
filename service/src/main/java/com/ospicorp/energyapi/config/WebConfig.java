package com.ospicorp.energyapi.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.filter.ShallowEtagHeaderFilter;

@Configuration
public class WebConfig {

  // Used by the InfluxDB query client
  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${influxdb.connect-timeout:5s}") Duration connectTimeout,
      @Value("${influxdb.read-timeout:60s}") Duration readTimeout) {
    return builder
        .setConnectTimeout(connectTimeout)
        .setReadTimeout(readTimeout)
        .build();
  }

  // ETag on every GET response
  @Bean
  ShallowEtagHeaderFilter shallowEtagHeaderFilter() {
    return new ShallowEtagHeaderFilter();
  }
}
