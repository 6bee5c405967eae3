package com.example.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scheduler.api")
public record SchedulerApiProperties(String headerName, String token) {

  public SchedulerApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "Authorization" : headerName;
    token = token == null ? "" : token;
  }
}
