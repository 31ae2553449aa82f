package com.hatcherdx.terminal.process;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shell controller implemented with pty4j.
 *
 * <p>The shell runs attached to a pseudo-terminal, with stderr kept on its own stream so the
 * session can tell the two apart. Resizing sets the PTY window size, which delivers SIGWINCH to
 * the foreground process group.
 *
 * @since 1.0
 */
public final class ShellProcessControllerPty4j implements ShellProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShellProcessControllerPty4j.class);

  private static final boolean IS_WINDOWS =
      System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

  private final PtyProcess process;
  private final CompletableFuture<Integer> exitFuture;

  /**
   * Spawns a PTY-attached shell.
   *
   * @param config process configuration (command, working directory, environment, initial size)
   * @throws Exception if the process cannot be started
   */
  public ShellProcessControllerPty4j(final ShellProcessConfig config) throws Exception {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.command(), "command must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");
    Validate.notNull(config.workingDirectory(), "workingDirectory must not be null");
    Validate.isTrue(config.columns() > 0, "columns must be positive");
    Validate.isTrue(config.rows() > 0, "rows must be positive");

    final Map<String, String> env = new HashMap<>(config.environment() != null ? config.environment() : System.getenv());

    final PtyProcessBuilder builder = new PtyProcessBuilder(config.command().toArray(new String[0]))
        .setDirectory(config.workingDirectory().toString())
        .setEnvironment(env)
        .setInitialColumns(config.columns())
        .setInitialRows(config.rows())
        .setRedirectErrorStream(false)
        .setConsole(false)
        .setUseWinConPty(IS_WINDOWS);

    this.process = builder.start();
    this.exitFuture = new CompletableFuture<>();
    startExitMonitorThread();
    LOGGER.debug("PTY shell {} started with PID {} ({}x{})", config.command().get(0), this.process.pid(),
        config.columns(), config.rows());
  }

  @Override
  public InputStream getStdout() throws Exception {
    return this.process.getInputStream();
  }

  @Override
  public InputStream getStderr() throws Exception {
    return this.process.getErrorStream();
  }

  @Override
  public OutputStream getStdin() throws Exception {
    return this.process.getOutputStream();
  }

  @Override
  public void resize(final int columns, final int rows) throws Exception {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");

    if (!this.process.isAlive()) {
      LOGGER.debug("Ignoring resize of exited PTY shell {}", this.process.pid());
      return;
    }
    this.process.setWinSize(new WinSize(columns, rows));
  }

  @Override
  public void terminate(final boolean forcibly) throws Exception {
    if (forcibly) {
      this.process.destroyForcibly();
    } else {
      this.process.destroy();
    }
  }

  @Override
  public CompletableFuture<Integer> onExit() throws Exception {
    return this.exitFuture;
  }

  @Override
  public long pid() throws Exception {
    return this.process.pid();
  }

  @Override
  public boolean isAlive() throws Exception {
    return this.process.isAlive();
  }

  @Override
  public void close() throws Exception {
    if (this.process.isAlive()) {
      this.process.destroyForcibly();
    }
  }

  /** Completes the exit future from a daemon thread blocked in {@link PtyProcess#waitFor()}. */
  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      try {
        final int code = this.process.waitFor();
        this.exitFuture.complete(code);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        this.exitFuture.completeExceptionally(e);
      } catch (final RuntimeException e) {
        this.exitFuture.completeExceptionally(e);
      }
    }, "PtyShellExitMonitor-" + this.process.pid());
    monitor.setDaemon(true);
    monitor.start();
  }
}
