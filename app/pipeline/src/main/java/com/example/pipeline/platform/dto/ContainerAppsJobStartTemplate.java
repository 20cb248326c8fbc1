package com.example.pipeline.platform.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Start-call body; the platform replaces the container's env with exactly this list. */
public record ContainerAppsJobStartTemplate(List<Container> containers) {

  public record Container(String name, String image, List<EnvVar> env) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record EnvVar(String name, String value, String secretRef) {}
}
