/*
 * Where: pipeline subprocess supervisor
 * What: runs one external process, streams its output, enforces the inactivity watchdog
 * Why: the agent can run for many minutes; silence, not runtime, is what signals a hang
 */
package com.example.pipeline.supervisor;

import com.example.pipeline.config.SupervisorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SubprocessSupervisor {

  private static final Logger logger = LoggerFactory.getLogger(SubprocessSupervisor.class);

  private final SupervisorProperties properties;
  private final OutputLineParser lineParser;
  private final ResultTokenExtractor tokenExtractor;
  private final Clock clock;

  public SubprocessSupervisor(
      SupervisorProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.properties = properties;
    this.lineParser = new OutputLineParser(objectMapper, properties.previewMaxLength());
    this.tokenExtractor = new ResultTokenExtractor(properties.resultTokenKey());
    this.clock = clock;
  }

  /** One supervised process; state only moves forward, terminal states are set once. */
  private final class Session {
    private final Instant startedAt;
    private final AtomicReference<SupervisorState> state =
        new AtomicReference<>(SupervisorState.STARTING);
    private final AtomicReference<Instant> lastOutputAt;
    private final AtomicInteger lines = new AtomicInteger();
    private final StringBuffer stdout = new StringBuffer();
    private final StringBuffer stderr = new StringBuffer();
    private volatile String lastPreview = "";
    private volatile String message;
    private long pid = -1L;

    Session(Instant startedAt) {
      this.startedAt = startedAt;
      this.lastOutputAt = new AtomicReference<>(startedAt);
    }

    void touch() {
      lastOutputAt.set(clock.instant());
    }

    boolean transition(SupervisorState next) {
      return state.compareAndSet(SupervisorState.RUNNING, next);
    }

    Duration elapsed() {
      return Duration.between(startedAt, clock.instant());
    }

    Duration silence() {
      return Duration.between(lastOutputAt.get(), clock.instant());
    }
  }

  public SupervisionResult run(List<String> command, String input, BooleanSupplier cancelled) {
    return run(command, input, null, cancelled);
  }

  /**
   * Runs the command to completion, feeding {@code input} on stdin.
   *
   * @param cancelled polled on every watchdog tick; {@code true} kills the process
   */
  public SupervisionResult run(
      List<String> command, String input, Path workingDirectory, BooleanSupplier cancelled) {
    final Session session = new Session(clock.instant());
    final Process process;
    try {
      final ProcessBuilder builder = new ProcessBuilder(command);
      if (workingDirectory != null) {
        builder.directory(workingDirectory.toFile());
      }
      process = builder.start();
    } catch (IOException ex) {
      logger.error("failed to spawn process command={}", command.get(0), ex);
      return new SupervisionResult(
          SupervisorState.FAILED,
          null,
          null,
          "",
          "failed to spawn process: " + ex.getMessage(),
          session.elapsed());
    }
    session.pid = process.pid();
    session.state.set(SupervisorState.RUNNING);
    logger.info("process started pid={} command={}", session.pid, command.get(0));

    final ExecutorService readers =
        Executors.newFixedThreadPool(
            2, new ThreadFactoryBuilder().setNameFormat("supervisor-reader-%d").setDaemon(true).build());
    final ScheduledExecutorService timers =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("supervisor-timer-%d").setDaemon(true).build());
    try {
      final Future<?> stdoutReader =
          readers.submit(
              () -> pump(process.getInputStream(), session, session.stdout, this.stdoutLine(session)));
      final Future<?> stderrReader =
          readers.submit(
              () ->
                  pump(
                      process.getErrorStream(),
                      session,
                      session.stderr,
                      line -> logger.info("[stderr] {}", line)));
      final long watchdogMillis = properties.watchdogInterval().toMillis();
      timers.scheduleAtFixedRate(
          () -> watchdogTick(process, session, cancelled),
          watchdogMillis,
          watchdogMillis,
          TimeUnit.MILLISECONDS);
      final long progressMillis = properties.progressInterval().toMillis();
      timers.scheduleAtFixedRate(
          () -> progressTick(session), progressMillis, progressMillis, TimeUnit.MILLISECONDS);

      writeInput(process, input);
      final int exitCode = process.waitFor();
      timers.shutdownNow();
      session.transition(exitCode == 0 ? SupervisorState.SUCCEEDED : SupervisorState.FAILED);
      awaitReader(stdoutReader, "stdout");
      awaitReader(stderrReader, "stderr");
      return finish(session, exitCode);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      session.transition(SupervisorState.FAILED);
      terminate(process);
      return new SupervisionResult(
          SupervisorState.FAILED,
          null,
          null,
          session.stderr.toString(),
          "supervisor interrupted",
          session.elapsed());
    } finally {
      timers.shutdownNow();
      readers.shutdownNow();
    }
  }

  private Consumer<String> stdoutLine(Session session) {
    return line -> {
      session.lines.incrementAndGet();
      final String preview = lineParser.preview(line);
      if (!preview.isEmpty()) {
        session.lastPreview = preview;
        logger.debug("[agent] {}", preview);
      }
      if (tokenExtractor.extract(line).isPresent()) {
        logger.info("result token observed in output pid={}", session.pid);
      }
    };
  }

  private void pump(
      InputStream stream, Session session, StringBuffer accumulator, Consumer<String> onLine) {
    final LineAssembler assembler = new LineAssembler();
    final char[] buffer = new char[4096];
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      int read;
      while ((read = reader.read(buffer)) != -1) {
        session.touch();
        final String chunk = new String(buffer, 0, read);
        accumulator.append(chunk);
        for (String line : assembler.append(chunk)) {
          handleLine(onLine, line);
        }
      }
    } catch (IOException ex) {
      // the stream closes under us when the process is killed
      logger.debug("process output stream closed pid={}", session.pid, ex);
    }
    assembler.flush().ifPresent(line -> handleLine(onLine, line));
  }

  private void handleLine(Consumer<String> onLine, String line) {
    try {
      onLine.accept(line);
    } catch (RuntimeException ex) {
      logger.warn("output line handler failed", ex);
    }
  }

  private void writeInput(Process process, String input) {
    try (OutputStream stdin = process.getOutputStream()) {
      if (input != null) {
        stdin.write(input.getBytes(StandardCharsets.UTF_8));
      }
    } catch (IOException ex) {
      logger.warn("failed to write process input pid={}", process.pid(), ex);
    }
  }

  private void watchdogTick(Process process, Session session, BooleanSupplier cancelled) {
    try {
      if (cancelled != null && cancelled.getAsBoolean()
          && session.transition(SupervisorState.CANCELLED)) {
        session.message = "cancellation requested";
        logger.warn("cancellation requested, killing process pid={}", session.pid);
        terminate(process);
        return;
      }
      final Duration silence = session.silence();
      if (silence.compareTo(properties.inactivityTimeout()) > 0
          && session.transition(SupervisorState.TIMED_OUT)) {
        session.message =
            "no output for "
                + silence.toSeconds()
                + "s (limit "
                + properties.inactivityTimeout().toSeconds()
                + "s); last activity: "
                + (session.lastPreview.isEmpty() ? "none" : session.lastPreview);
        logger.error("inactivity timeout, killing process pid={} {}", session.pid, session.message);
        terminate(process);
      }
    } catch (RuntimeException ex) {
      // a throwing tick would cancel the schedule
      logger.warn("watchdog tick failed pid={}", session.pid, ex);
    }
  }

  private void progressTick(Session session) {
    logger.info(
        "process still running pid={} elapsed={}s lines={} silentFor={}s last={}",
        session.pid,
        session.elapsed().toSeconds(),
        session.lines.get(),
        session.silence().toSeconds(),
        session.lastPreview);
  }

  private void terminate(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private void awaitReader(Future<?> reader, String name) throws InterruptedException {
    try {
      reader.get(properties.readerJoinTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      logger.warn("{} reader did not finish in time, output may be truncated", name);
      reader.cancel(true);
    } catch (ExecutionException ex) {
      logger.warn("{} reader failed", name, ex.getCause());
    }
  }

  private SupervisionResult finish(Session session, int exitCode) {
    final SupervisorState state = session.state.get();
    final String stderr = session.stderr.toString();
    final Duration elapsed = session.elapsed();
    switch (state) {
      case SUCCEEDED -> {
        final String token = tokenExtractor.extract(session.stdout).orElse(null);
        if (token == null) {
          logger.warn(
              "process succeeded without {} in output pid={}", properties.resultTokenKey(),
              session.pid);
        }
        logger.info("process succeeded pid={} elapsed={}s", session.pid, elapsed.toSeconds());
        return new SupervisionResult(state, exitCode, token, stderr, null, elapsed);
      }
      case FAILED -> {
        logger.error("process failed pid={} exitCode={}", session.pid, exitCode);
        return new SupervisionResult(
            state, exitCode, null, stderr, "process exited with code " + exitCode, elapsed);
      }
      default -> {
        return new SupervisionResult(state, exitCode, null, stderr, session.message, elapsed);
      }
    }
  }
}
