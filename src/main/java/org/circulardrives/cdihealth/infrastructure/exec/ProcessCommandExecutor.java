package org.circulardrives.cdihealth.infrastructure.exec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.circulardrives.cdihealth.application.port.CommandExecutionException;
import org.circulardrives.cdihealth.application.port.CommandExecutor;
import org.circulardrives.cdihealth.domain.command.CommandResult;
import org.circulardrives.cdihealth.domain.command.DiagnosticCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CommandExecutor} that launches an operating-system process.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drain stdout and stderr concurrently so chatty tools never block on a full pipe.</li>
 *   <li>Destroy the process tree when the calling worker is interrupted.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; each call owns its process.</p>
 *
 * @since 0.1.0
 */
public final class ProcessCommandExecutor implements CommandExecutor {
  private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);
  private static final long DESTROY_GRACE_MILLIS = 500L;
  private static final AtomicInteger DRAIN_INDEX = new AtomicInteger();
  private static final ExecutorService DRAINERS = Executors.newCachedThreadPool(runnable -> {
    Thread thread = new Thread(runnable, "cdi-drain-" + DRAIN_INDEX.getAndIncrement());
    thread.setDaemon(true);
    return thread;
  });

  @Override
  public CommandResult execute(DiagnosticCommand command) throws CommandExecutionException, InterruptedException {
    Objects.requireNonNull(command, "command");
    ProcessBuilder builder = new ProcessBuilder(command.commandLine());
    builder.redirectInput(ProcessBuilder.Redirect.PIPE);
    long start = System.nanoTime();
    Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      throw new CommandExecutionException("Unable to start " + command.program() + ": " + ex.getMessage(), ex);
    }
    log.debug("Started {} (pid {})", command, process.pid());
    try {
      process.getOutputStream().close();
    } catch (IOException ex) {
      log.debug("Closing stdin of {} failed: {}", command.program(), ex.getMessage());
    }
    CompletableFuture<byte[]> stdout = drain(process.getInputStream());
    CompletableFuture<byte[]> stderr = drain(process.getErrorStream());
    try {
      int exit = process.waitFor();
      Duration duration = Duration.ofNanos(System.nanoTime() - start);
      return new CommandResult(exit, stdout.get(), stderr.get(), duration);
    } catch (InterruptedException ex) {
      destroy(process);
      throw ex;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new CommandExecutionException("Reading output of " + command.program() + " failed: " + cause.getMessage(), cause);
    }
  }

  private static CompletableFuture<byte[]> drain(InputStream stream) {
    return CompletableFuture.supplyAsync(() -> {
      try (InputStream in = stream; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
        in.transferTo(out);
        return out.toByteArray();
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    }, DRAINERS);
  }

  private static void destroy(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroy();
    try {
      if (!process.waitFor(DESTROY_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
      }
    } catch (InterruptedException ex) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
    }
    log.debug("Destroyed interrupted process {}", process.pid());
  }
}
