/*
 * Where: pipeline job side
 * What: one-shot runner inside the dispatched job: feeds the prompt to the agent and reports
 * Why: exit code 0 only when the agent produced a result token
 */
package com.example.pipeline.job;

import com.example.pipeline.config.RunnerProperties;
import com.example.pipeline.service.ChatNotifier;
import com.example.pipeline.supervisor.SubprocessSupervisor;
import com.example.pipeline.supervisor.SupervisionResult;
import com.example.pipeline.supervisor.SupervisorState;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.runner.enabled", havingValue = "true")
public class TranscriptJobRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger logger = LoggerFactory.getLogger(TranscriptJobRunner.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_NO_RESULT = 2;
  static final int EXIT_TIMED_OUT = 3;
  static final int EXIT_CANCELLED = 4;

  private final RunnerProperties properties;
  private final SubprocessSupervisor supervisor;
  private final CancellationCheckClient cancellationCheckClient;
  private final ChatNotifier chatNotifier;

  private volatile int exitCode = EXIT_FAILED;

  @Override
  public void run(ApplicationArguments args) {
    final String executionId = properties.executionId();
    if (executionId != null) {
      MDC.put("execution_id", executionId);
    }
    try {
      exitCode = execute(executionId);
    } finally {
      MDC.remove("execution_id");
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private int execute(String executionId) {
    if (properties.command().isEmpty()) {
      logger.error("pipeline.runner.command is not configured");
      notifyFailed(executionId, "runner command is not configured");
      return EXIT_FAILED;
    }
    final String prompt;
    try {
      prompt = readPrompt();
    } catch (IOException ex) {
      logger.error("failed to read prompt file {}", properties.promptFile(), ex);
      notifyFailed(executionId, "prompt file could not be read");
      return EXIT_FAILED;
    }

    final Path workingDirectory =
        properties.workingDirectory() == null || properties.workingDirectory().isBlank()
            ? null
            : Path.of(properties.workingDirectory());
    final SupervisionResult result =
        supervisor.run(
            properties.command(),
            prompt,
            workingDirectory,
            () -> cancellationCheckClient.isCancelled(properties.checkCancelledUrl()));

    logger.info(
        "agent finished state={} exitCode={} elapsed={}s",
        result.state(),
        result.exitCode(),
        result.elapsed().toSeconds());
    if (result.state() == SupervisorState.SUCCEEDED && result.hasResultToken()) {
      notifyCompleted(executionId, result.resultToken());
      return EXIT_OK;
    }
    return switch (result.state()) {
      case SUCCEEDED -> {
        notifyFailed(executionId, "agent finished without producing a result");
        yield EXIT_NO_RESULT;
      }
      case TIMED_OUT -> {
        notifyFailed(executionId, "agent stopped responding: " + result.message());
        yield EXIT_TIMED_OUT;
      }
      // the cancel endpoint already told the chat side
      case CANCELLED -> EXIT_CANCELLED;
      default -> {
        notifyFailed(executionId, failureMessage(result));
        yield EXIT_FAILED;
      }
    };
  }

  private String readPrompt() throws IOException {
    if (properties.promptFile() == null || properties.promptFile().isBlank()) {
      throw new IOException("pipeline.runner.prompt-file is not configured");
    }
    return Files.readString(Path.of(properties.promptFile()), StandardCharsets.UTF_8);
  }

  private String failureMessage(SupervisionResult result) {
    final String stderr = result.stderr() == null ? "" : result.stderr().strip();
    final String tail = stderr.length() > 500 ? stderr.substring(stderr.length() - 500) : stderr;
    return tail.isEmpty() ? result.message() : result.message() + ": " + tail;
  }

  private void notifyCompleted(String executionId, String resultUrl) {
    try {
      chatNotifier.notifyCompleted(executionId, resultUrl);
    } catch (RuntimeException ex) {
      logger.warn("completed notification failed", ex);
    }
  }

  private void notifyFailed(String executionId, String reason) {
    try {
      chatNotifier.notifyFailed(executionId, reason);
    } catch (RuntimeException ex) {
      logger.warn("failed notification could not be sent", ex);
    }
  }
}
