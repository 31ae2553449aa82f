package com.hatcherdx.terminal.process;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shell controller backed by {@link ProcessBuilder} with all three standard streams piped.
 *
 * <p>Resizing sends SIGWINCH to the shell's pid through the system {@code kill} command; the
 * signal is fire-and-forget and its outcome is only logged. Termination maps to
 * {@link Process#destroy()} (SIGTERM) and {@link Process#destroyForcibly()} (SIGKILL).
 *
 * @since 1.0
 */
public final class ShellProcessControllerPiped implements ShellProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShellProcessControllerPiped.class);

  private final Process process;
  private final CompletableFuture<Integer> exitFuture;

  /**
   * Starts the shell.
   *
   * @param config process configuration
   * @throws IOException if the process cannot be started
   */
  public ShellProcessControllerPiped(final ShellProcessConfig config) throws IOException {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.command(), "command must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");
    Validate.notNull(config.workingDirectory(), "workingDirectory must not be null");

    final ProcessBuilder builder = new ProcessBuilder(config.command())
        .directory(config.workingDirectory().toFile())
        .redirectInput(ProcessBuilder.Redirect.PIPE)
        .redirectOutput(ProcessBuilder.Redirect.PIPE)
        .redirectError(ProcessBuilder.Redirect.PIPE);
    if (config.environment() != null) {
      builder.environment().putAll(config.environment());
    }

    this.process = builder.start();
    this.exitFuture = this.process.onExit().thenApply(Process::exitValue);
  }

  @Override
  public InputStream getStdout() {
    return this.process.getInputStream();
  }

  @Override
  public InputStream getStderr() {
    return this.process.getErrorStream();
  }

  @Override
  public OutputStream getStdin() {
    return this.process.getOutputStream();
  }

  @Override
  public void resize(final int columns, final int rows) throws IOException {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");

    final long pid = this.process.pid();
    sendWindowChange(pid).onExit().thenAccept(p -> {
      if (p.exitValue() != 0) {
        LOGGER.warn("SIGWINCH to pid {} exited with {}", pid, p.exitValue());
      }
    });
  }

  /**
   * Starts {@code kill -WINCH <pid>}. The helper's output is discarded and its stdin closed, so
   * it holds no pipes once started.
   */
  static Process sendWindowChange(final long pid) throws IOException {
    final Process signal = new ProcessBuilder(List.of("kill", "-WINCH", Long.toString(pid)))
        .redirectErrorStream(true)
        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
        .start();
    signal.getOutputStream().close();
    return signal;
  }

  @Override
  public void terminate(final boolean forcibly) {
    if (forcibly) {
      this.process.destroyForcibly();
    } else {
      this.process.destroy();
    }
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return this.exitFuture;
  }

  @Override
  public long pid() {
    return this.process.pid();
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  @Override
  public void close() {
    if (this.process.isAlive()) {
      this.process.destroyForcibly();
    }
  }
}
