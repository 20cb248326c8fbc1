/*
 * Where: pipeline platform layer
 * What: Container Apps Jobs REST client (start / get execution / stop / list executions)
 * Why: dispatch and cancellation only need these four management calls
 */
package com.example.pipeline.platform;

import com.example.pipeline.config.JobPlatformProperties;
import com.example.pipeline.model.JobExecution;
import com.example.pipeline.model.JobParameter;
import com.example.pipeline.model.JobStartRequest;
import com.example.pipeline.platform.dto.ContainerAppsJobExecution;
import com.example.pipeline.platform.dto.ContainerAppsJobExecutionList;
import com.example.pipeline.platform.dto.ContainerAppsJobStartTemplate;
import com.example.pipeline.service.PipelineConfigurationException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class ContainerAppsJobPlatformClient implements JobPlatformClient {

  private static final Logger logger =
      LoggerFactory.getLogger(ContainerAppsJobPlatformClient.class);

  private static final String JOB_PATH =
      "/subscriptions/{subscriptionId}/resourceGroups/{resourceGroup}"
          + "/providers/Microsoft.App/jobs/{jobName}";

  private final RestClient jobPlatformRestClient;
  private final AccessTokenClient accessTokenClient;
  private final JobPlatformProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a Spring-managed shared component and cannot be copied")
  public ContainerAppsJobPlatformClient(
      @Qualifier("jobPlatformRestClient") RestClient jobPlatformRestClient,
      AccessTokenClient accessTokenClient,
      JobPlatformProperties properties) {
    this.jobPlatformRestClient = jobPlatformRestClient;
    this.accessTokenClient = accessTokenClient;
    this.properties = properties;
  }

  @Override
  public String start(JobStartRequest request) {
    final ContainerAppsJobStartTemplate body = toTemplate(request);
    final ContainerAppsJobExecution response =
        call(
            "start",
            () ->
                jobPlatformRestClient
                    .post()
                    .uri(JOB_PATH + "/start?api-version={apiVersion}", variables(request.jobName()))
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .body(body)
                    .retrieve()
                    .body(ContainerAppsJobExecution.class));
    if (response == null || isBlank(response.name())) {
      throw new JobPlatformException(
          JobPlatformException.Reason.INVALID_RESPONSE, "start response has no execution name");
    }
    return response.name();
  }

  @Override
  public JobExecution getExecution(String jobName, String executionName) {
    final Map<String, String> variables = variables(jobName);
    variables.put("executionName", executionName);
    final ContainerAppsJobExecution response =
        call(
            "getExecution",
            () ->
                jobPlatformRestClient
                    .get()
                    .uri(
                        JOB_PATH + "/executions/{executionName}?api-version={apiVersion}",
                        variables)
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .retrieve()
                    .body(ContainerAppsJobExecution.class));
    if (response == null) {
      throw new JobPlatformException(
          JobPlatformException.Reason.INVALID_RESPONSE, "execution response is empty");
    }
    return new JobExecution(isBlank(response.name()) ? executionName : response.name(),
        response.status());
  }

  @Override
  public void stop(String jobName, String executionName) {
    final Map<String, String> variables = variables(jobName);
    variables.put("executionName", executionName);
    call(
        "stop",
        () ->
            jobPlatformRestClient
                .post()
                .uri(
                    JOB_PATH + "/executions/{executionName}/stop?api-version={apiVersion}",
                    variables)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .toBodilessEntity());
  }

  @Override
  public List<JobExecution> listExecutions(String jobName) {
    final ContainerAppsJobExecutionList response =
        call(
            "listExecutions",
            () ->
                jobPlatformRestClient
                    .get()
                    .uri(JOB_PATH + "/executions?api-version={apiVersion}", variables(jobName))
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .retrieve()
                    .body(ContainerAppsJobExecutionList.class));
    if (response == null || response.value() == null) {
      return List.of();
    }
    return response.value().stream()
        .map(execution -> new JobExecution(execution.name(), execution.status()))
        .toList();
  }

  private ContainerAppsJobStartTemplate toTemplate(JobStartRequest request) {
    final List<ContainerAppsJobStartTemplate.EnvVar> env =
        request.parameters().stream().map(this::toEnvVar).toList();
    return new ContainerAppsJobStartTemplate(
        List.of(
            new ContainerAppsJobStartTemplate.Container(
                request.containerName(), request.image(), env)));
  }

  private ContainerAppsJobStartTemplate.EnvVar toEnvVar(JobParameter parameter) {
    return parameter.isSecret()
        ? new ContainerAppsJobStartTemplate.EnvVar(parameter.name(), null, parameter.secretRef())
        : new ContainerAppsJobStartTemplate.EnvVar(parameter.name(), parameter.value(), null);
  }

  private Map<String, String> variables(String jobName) {
    final List<String> missing = properties.missingPlatformKeys();
    if (!missing.isEmpty()) {
      throw new PipelineConfigurationException(missing);
    }
    final Map<String, String> variables = new HashMap<>();
    variables.put("subscriptionId", properties.subscriptionId());
    variables.put("resourceGroup", properties.resourceGroup());
    variables.put("jobName", jobName);
    variables.put("apiVersion", properties.apiVersion());
    return variables;
  }

  private String bearer() {
    try {
      return "Bearer " + accessTokenClient.acquire(properties.tokenScope());
    } catch (RestClientException | IllegalStateException ex) {
      logger.warn("job platform token acquisition failed", ex);
      throw new JobPlatformException(
          JobPlatformException.Reason.AUTHENTICATION, "job platform token acquisition failed", ex);
    }
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (JobPlatformException | PipelineConfigurationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("job platform {} response parse failed", operation, ex);
      throw new JobPlatformException(
          JobPlatformException.Reason.INVALID_RESPONSE,
          "job platform " + operation + " response parse failed",
          ex);
    }
  }

  private JobPlatformException mapResponseException(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "job platform {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 404) {
      return new JobPlatformException(
          JobPlatformException.Reason.NOT_FOUND, "job platform resource not found", ex);
    }
    if (status == 401 || status == 403) {
      return new JobPlatformException(
          JobPlatformException.Reason.AUTHENTICATION, "job platform rejected credentials", ex);
    }
    return new JobPlatformException(
        JobPlatformException.Reason.BAD_GATEWAY,
        "job platform " + operation + " failed with status " + status,
        ex);
  }

  private JobPlatformException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("job platform {} timed out", operation);
      return new JobPlatformException(
          JobPlatformException.Reason.TIMEOUT, "job platform " + operation + " timeout", ex);
    }
    logger.warn("job platform {} connection failed", operation, ex);
    return new JobPlatformException(
        JobPlatformException.Reason.BAD_GATEWAY,
        "job platform " + operation + " connection failed",
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
