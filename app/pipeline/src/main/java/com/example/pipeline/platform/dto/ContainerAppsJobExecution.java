package com.example.pipeline.platform.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ContainerAppsJobExecution(String id, String name, Properties properties) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Properties(String status) {}

  public String status() {
    return properties == null ? null : properties.status();
  }
}
