package com.example.pipeline.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.pipeline.config.RunnerProperties;
import com.example.pipeline.service.ChatNotificationException;
import com.example.pipeline.service.ChatNotifier;
import com.example.pipeline.supervisor.SubprocessSupervisor;
import com.example.pipeline.supervisor.SupervisionResult;
import com.example.pipeline.supervisor.SupervisorState;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class TranscriptJobRunnerTest {

  private static final String EXECUTION_ID = "m1-t1-1";
  private static final String CHECK_URL =
      "https://pipeline.test/api/check-cancelled?executionId=m1-t1-1";
  private static final List<String> COMMAND = List.of("agent", "-p");

  @Mock private SubprocessSupervisor supervisor;
  @Mock private CancellationCheckClient cancellationCheckClient;
  @Mock private ChatNotifier chatNotifier;
  @Captor private ArgumentCaptor<BooleanSupplier> cancelledCaptor;

  @TempDir Path tempDir;

  @Test
  void resultTokenMeansSuccessAndCompletedNotification() throws IOException {
    final TranscriptJobRunner runner = runner(promptFile("summarize"));
    when(supervisor.run(eq(COMMAND), eq("summarize"), isNull(), any()))
        .thenReturn(result(SupervisorState.SUCCEEDED, 0, "https://site.test/m1", null));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(TranscriptJobRunner.EXIT_OK);
    verify(chatNotifier).notifyCompleted(EXECUTION_ID, "https://site.test/m1");
  }

  @Test
  void successWithoutTokenIsNoResult() throws IOException {
    final TranscriptJobRunner runner = runner(promptFile("summarize"));
    when(supervisor.run(eq(COMMAND), anyString(), isNull(), any()))
        .thenReturn(result(SupervisorState.SUCCEEDED, 0, null, null));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(TranscriptJobRunner.EXIT_NO_RESULT);
    verify(chatNotifier).notifyFailed(eq(EXECUTION_ID), contains("without producing a result"));
  }

  @Test
  void timeoutReportsInactivityReason() throws IOException {
    final TranscriptJobRunner runner = runner(promptFile("summarize"));
    when(supervisor.run(eq(COMMAND), anyString(), isNull(), any()))
        .thenReturn(
            result(SupervisorState.TIMED_OUT, 137, null, "no output for 901s (limit 900s)"));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(TranscriptJobRunner.EXIT_TIMED_OUT);
    verify(chatNotifier).notifyFailed(eq(EXECUTION_ID), contains("no output for 901s"));
  }

  @Test
  void cancelledRunSendsNoNotification() throws IOException {
    final TranscriptJobRunner runner = runner(promptFile("summarize"));
    when(supervisor.run(eq(COMMAND), anyString(), isNull(), any()))
        .thenReturn(result(SupervisorState.CANCELLED, 137, null, "cancellation requested"));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(TranscriptJobRunner.EXIT_CANCELLED);
    verifyNoInteractions(chatNotifier);
  }

  @Test
  void failedRunIncludesStderrTail() throws IOException {
    final TranscriptJobRunner runner = runner(promptFile("summarize"));
    when(supervisor.run(eq(COMMAND), anyString(), isNull(), any()))
        .thenReturn(
            new SupervisionResult(
                SupervisorState.FAILED,
                1,
                null,
                "rate limited\n",
                "process exited with code 1",
                Duration.ofSeconds(3)));

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(TranscriptJobRunner.EXIT_FAILED);
    verify(chatNotifier)
        .notifyFailed(EXECUTION_ID, "process exited with code 1: rate limited");
  }

  @Test
  void cancellationCheckPollsConfiguredUrl() throws IOException {
    final TranscriptJobRunner runner = runner(promptFile("summarize"));
    when(supervisor.run(eq(COMMAND), anyString(), isNull(), cancelledCaptor.capture()))
        .thenReturn(result(SupervisorState.SUCCEEDED, 0, "https://site.test/m1", null));
    when(cancellationCheckClient.isCancelled(CHECK_URL)).thenReturn(true);

    runner.run(new DefaultApplicationArguments());

    assertThat(cancelledCaptor.getValue().getAsBoolean()).isTrue();
  }

  @Test
  void missingPromptFileFailsWithoutStartingAgent() {
    final TranscriptJobRunner runner = runner(tempDir.resolve("missing.md").toString());

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(TranscriptJobRunner.EXIT_FAILED);
    verifyNoInteractions(supervisor);
    verify(chatNotifier).notifyFailed(EXECUTION_ID, "prompt file could not be read");
  }

  @Test
  void chatFailureDoesNotChangeExitCode() throws IOException {
    final TranscriptJobRunner runner = runner(promptFile("summarize"));
    when(supervisor.run(eq(COMMAND), anyString(), isNull(), any()))
        .thenReturn(result(SupervisorState.SUCCEEDED, 0, "https://site.test/m1", null));
    doThrow(new ChatNotificationException("chat down", null))
        .when(chatNotifier)
        .notifyCompleted(anyString(), anyString());

    runner.run(new DefaultApplicationArguments());

    assertThat(runner.getExitCode()).isEqualTo(TranscriptJobRunner.EXIT_OK);
    verify(chatNotifier, never()).notifyFailed(anyString(), anyString());
  }

  private TranscriptJobRunner runner(String promptFile) {
    return new TranscriptJobRunner(
        new RunnerProperties(true, COMMAND, promptFile, null, EXECUTION_ID, CHECK_URL),
        supervisor,
        cancellationCheckClient,
        chatNotifier);
  }

  private String promptFile(String content) throws IOException {
    final Path file = tempDir.resolve("prompt.md");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file.toString();
  }

  private static SupervisionResult result(
      SupervisorState state, Integer exitCode, String token, String message) {
    return new SupervisionResult(state, exitCode, token, "", message, Duration.ofSeconds(5));
  }
}
