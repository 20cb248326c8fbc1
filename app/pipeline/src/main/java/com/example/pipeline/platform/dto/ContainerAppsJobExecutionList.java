package com.example.pipeline.platform.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ContainerAppsJobExecutionList(List<ContainerAppsJobExecution> value) {}
