package com.hatcherdx.terminal.session;

import com.hatcherdx.terminal.buffer.BufferHealth;
import com.hatcherdx.terminal.buffer.BufferMetrics;
import com.hatcherdx.terminal.buffer.DroppedChunks;
import com.hatcherdx.terminal.buffer.OutputBufferConfig;
import com.hatcherdx.terminal.buffer.OutputBufferListener;
import com.hatcherdx.terminal.buffer.OutputBufferManager;
import com.hatcherdx.terminal.buffer.OutputSource;
import com.hatcherdx.terminal.loop.EventLoop;
import com.hatcherdx.terminal.loop.ListenerList;
import com.hatcherdx.terminal.loop.ScheduledTask;
import com.hatcherdx.terminal.process.ShellProcessConfig;
import com.hatcherdx.terminal.process.ShellProcessController;
import com.hatcherdx.terminal.process.ShellProcessLauncher;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.OptionalLong;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents a single interactive shell session.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the shell process controller (exclusively)</li>
 * <li>an {@link OutputBufferManager} that coalesces filtered stdout/stderr</li>
 * <li>the deferred tasks of the session: initial banner, health tick, kill escalation</li>
 * </ul>
 * </p>
 *
 * <p>
 * Output path: reader threads hand raw text to the event loop, the {@link OutputFilter} cleans
 * it, non-empty results go to the buffer, and the buffer's {@code dataReady} payloads become
 * {@code data} events. Keystrokes written with {@link #write(String)} are echoed as
 * {@code data} events directly, since a piped shell does not echo.
 * </p>
 *
 * <p>Public methods must be called on the session's {@link EventLoop}.
 */
public final class TerminalSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalSession.class);

  static final String PRODUCT_NAME = "DX Engine";
  static final long INITIAL_PROMPT_DELAY_MILLIS = 500L;
  static final long HEALTH_TICK_MILLIS = 10_000L;
  static final long KILL_ESCALATION_MILLIS = 5_000L;
  static final long READER_CLOSE_GRACE_MILLIS = 2_000L;

  private final String id;
  private final String name;
  private final String shell;
  private final Path cwd;
  private final Map<String, String> envOverlay;
  private final Instant createdAt;

  private final EventLoop loop;
  private final HostEnvironment host;
  private final ShellProcessLauncher launcher;
  private final OutputFilter filter;
  private final OutputBufferManager bufferManager;
  private final ListenerList<TerminalSessionListener> listeners = new ListenerList<>();

  private int cols;
  private int rows;
  private SessionState state = SessionState.IDLE;
  private ShellProcessController process;
  private OutputStream stdin;
  private long pid = -1L;
  private Integer exitCode;
  private int openReaders;
  private ExitStatus pendingExit;

  private ScheduledTask initialPromptTask;
  private ScheduledTask healthTask;
  private ScheduledTask killEscalationTask;
  private ScheduledTask readerGraceTask;

  /**
   * Creates a session using the host environment and the backend named in the options.
   *
   * @param id session id
   * @param options session options
   * @param loop owning event loop
   */
  public TerminalSession(final String id, final TerminalSessionOptions options, final EventLoop loop) {
    this(id, options, loop, HostEnvironment.current(), options.getBackend(), new TerminalOutputFilter());
  }

  /**
   * Creates a session. The output buffer is created here; a failure to create it propagates.
   *
   * @param id session id
   * @param options session options
   * @param loop owning event loop
   * @param host host environment queries
   * @param launcher process-spawning primitive
   * @param filter output pre-filter
   */
  public TerminalSession(
      final String id,
      final TerminalSessionOptions options,
      final EventLoop loop,
      final HostEnvironment host,
      final ShellProcessLauncher launcher,
      final OutputFilter filter) {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(options, "options must not be null");
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(host, "host must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(filter, "filter must not be null");

    this.id = id;
    this.name = StringUtils.isNotBlank(options.getName()) ? options.getName() : "Terminal " + id;
    this.shell = StringUtils.isNotBlank(options.getShell()) ? options.getShell() : ShellResolver.resolve(host);
    this.cwd = options.getCwd() != null ? options.getCwd() : host.workingDirectory();
    this.envOverlay = options.getEnv();
    this.cols = options.getCols();
    this.rows = options.getRows();
    this.createdAt = Instant.ofEpochMilli(loop.currentTimeMillis());
    this.loop = loop;
    this.host = host;
    this.launcher = launcher;
    this.filter = filter;

    this.bufferManager = new OutputBufferManager(id, OutputBufferConfig.subprocessDefaults(), loop);
    this.bufferManager.addListener(new OutputBufferListener() {
      @Override
      public void onDataReady(final String payload) {
        emitData(payload);
      }

      @Override
      public void onChunksDropped(final DroppedChunks dropped) {
        LOGGER.warn("Terminal {} buffer dropped {} chunks due to high load", TerminalSession.this.id,
            dropped.droppedCount());
      }
    });
  }

  public void addListener(final TerminalSessionListener listener) {
    this.listeners.add(listener);
  }

  public void removeListener(final TerminalSessionListener listener) {
    this.listeners.remove(listener);
  }

  /**
   * Launches the shell. Failures are reported through {@code error} events, never thrown.
   */
  public void spawn() {
    if (this.state != SessionState.IDLE) {
      LOGGER.warn("Terminal {} already spawned (state {})", this.id, this.state);
      return;
    }

    LOGGER.info("Spawning shell {} for terminal {} in {}", this.shell, this.id, this.cwd);
    final ShellProcessConfig config = new ShellProcessConfig(
        List.of(this.shell), this.cwd, buildEnvironment(), this.cols, this.rows);

    final ShellProcessController launched;
    try {
      launched = this.launcher.launch(config);
    } catch (final Exception e) {
      LOGGER.error("Failed to spawn terminal {}: {}", this.id, e.getMessage(), e);
      emitError(e);
      return;
    }

    InputStream stdout;
    InputStream stderr;
    OutputStream input;
    try {
      stdout = launched.getStdout();
      stderr = launched.getStderr();
      input = launched.getStdin();
    } catch (final Exception e) {
      LOGGER.warn("Stdio lookup failed for terminal {}: {}", this.id, e.getMessage(), e);
      stdout = null;
      stderr = null;
      input = null;
    }
    if (stdout == null || stderr == null || input == null) {
      final TerminalSetupException error =
          new TerminalSetupException("Failed to create stdio streams for terminal " + this.id);
      LOGGER.error(error.getMessage());
      closeQuietly(launched);
      emitError(error);
      return;
    }

    this.process = launched;
    this.stdin = input;
    this.state = SessionState.RUNNING;
    try {
      this.pid = launched.pid();
    } catch (final Exception e) {
      LOGGER.debug("PID unavailable for terminal {}: {}", this.id, e.getMessage());
    }

    this.openReaders = 2;
    startReader(launched, stdout, OutputSource.STDOUT);
    startReader(launched, stderr, OutputSource.STDERR);
    try {
      launched.onExit().whenComplete((code, error) -> this.loop.execute(() -> handleExit(launched, code, error)));
    } catch (final Exception e) {
      LOGGER.warn("Exit monitoring unavailable for terminal {}: {}", this.id, e.getMessage(), e);
    }

    this.initialPromptTask = this.loop.schedule(this::sendInitialPrompt, INITIAL_PROMPT_DELAY_MILLIS);
    this.healthTask = this.loop.scheduleAtFixedRate(this::logHealth, HEALTH_TICK_MILLIS, HEALTH_TICK_MILLIS);

    LOGGER.info("Spawned terminal {} with PID {}", this.id, this.pid);
  }

  /**
   * Sends keyboard input. Enter is echoed as CRLF and forwarded as LF; backspace/delete is echoed
   * as an erase and not forwarded; anything else is echoed and forwarded verbatim.
   *
   * @param data input text
   */
  public void write(final String data) {
    if (this.state != SessionState.RUNNING || this.stdin == null) {
      LOGGER.error("Cannot write - no running process for terminal {}", this.id);
      return;
    }
    if (data == null || data.isEmpty()) {
      return;
    }

    if ("\r".equals(data)) {
      emitData("\r\n");
      forward("\n");
    } else if ("\u007f".equals(data) || "\b".equals(data)) {
      emitData("\b \b");
    } else {
      emitData(data);
      forward(data);
    }
  }

  /**
   * Records the new geometry and signals the process on Unix-like hosts.
   *
   * @param columns column count
   * @param rowCount row count
   */
  public void resize(final int columns, final int rowCount) {
    Validate.isTrue(columns > 0 && rowCount > 0, "cols/rows must be positive");
    this.cols = columns;
    this.rows = rowCount;

    if (this.state != SessionState.RUNNING) {
      LOGGER.debug("Terminal {} is not running; resize recorded only", this.id);
      return;
    }
    if (!this.host.platform().isUnixLike()) {
      return;
    }
    try {
      this.process.resize(columns, rowCount);
    } catch (final Exception e) {
      LOGGER.warn("Failed to send resize signal to terminal {}: {}", this.id, e.getMessage(), e);
    }
  }

  /**
   * Requests graceful termination and escalates to a forceful one after
   * {@value #KILL_ESCALATION_MILLIS} ms unless the process has exited by then.
   */
  public void kill() {
    if (this.state != SessionState.RUNNING || this.pendingExit != null) {
      LOGGER.debug("Terminal {} is not running; kill ignored", this.id);
      return;
    }

    LOGGER.info("Killing terminal {}", this.id);
    this.state = SessionState.TERMINATING;
    this.bufferManager.destroy();

    final ShellProcessController target = this.process;
    try {
      target.terminate(false);
    } catch (final Exception e) {
      LOGGER.warn("Graceful termination of terminal {} failed: {}", this.id, e.getMessage(), e);
    }
    this.killEscalationTask = this.loop.schedule(() -> escalate(target), KILL_ESCALATION_MILLIS);
  }

  public String getId() {
    return this.id;
  }

  public String getName() {
    return this.name;
  }

  public String getShell() {
    return this.shell;
  }

  public Path getCwd() {
    return this.cwd;
  }

  public int getCols() {
    return this.cols;
  }

  public int getRows() {
    return this.rows;
  }

  public Instant getCreatedAt() {
    return this.createdAt;
  }

  public SessionState getState() {
    return this.state;
  }

  public boolean isRunning() {
    return this.state == SessionState.RUNNING;
  }

  public OptionalLong pid() {
    return this.pid >= 0 ? OptionalLong.of(this.pid) : OptionalLong.empty();
  }

  public OptionalInt exitCode() {
    return this.exitCode != null ? OptionalInt.of(this.exitCode) : OptionalInt.empty();
  }

  public BufferMetrics getBufferMetrics() {
    return this.bufferManager.getMetrics();
  }

  public BufferHealth getBufferHealth() {
    return this.bufferManager.getHealthStatus();
  }

  public void pauseBuffer() {
    this.bufferManager.pause();
  }

  public void resumeBuffer() {
    this.bufferManager.resume();
  }

  /**
   * Filters raw output and hands non-empty results to the buffer.
   *
   * @param raw raw text read from the process
   * @param source stream it was read from
   */
  void handleOutput(final String raw, final OutputSource source) {
    LOGGER.debug("Raw {} received for terminal {} ({} chars)", source, this.id, raw.length());
    final String filtered = this.filter.filter(raw);
    if (filtered.isEmpty()) {
      LOGGER.debug("{} data for terminal {} was completely filtered out", source, this.id);
      return;
    }
    this.bufferManager.write(filtered, source);
  }

  /**
   * Handles the process exit. The exit is reported once both output streams reached end of
   * stream, so output still in the pipes is delivered first; streams still open after
   * {@value #READER_CLOSE_GRACE_MILLIS} ms no longer hold the report back.
   */
  void handleExit(final ShellProcessController source, final Integer code, final Throwable error) {
    if (source != this.process || this.state == SessionState.EXITED || this.pendingExit != null) {
      return;
    }
    this.stdin = null;
    cancel(this.killEscalationTask);
    cancel(this.initialPromptTask);

    if (error != null) {
      LOGGER.error("Exit monitoring failed for terminal {}: {}", this.id, error.getMessage(), error);
      this.state = SessionState.EXITED;
      release();
      emitError(error);
      return;
    }

    final ExitStatus status = ExitStatus.of(code, this.host.platform());
    if (this.openReaders > 0) {
      LOGGER.debug("Terminal {} exited; waiting for {} output streams to close", this.id, this.openReaders);
      this.pendingExit = status;
      this.readerGraceTask = this.loop.schedule(this::readerGraceExpired, READER_CLOSE_GRACE_MILLIS);
      return;
    }
    completeExit(status);
  }

  void readerClosed(final ShellProcessController source, final OutputSource stream) {
    if (source != this.process) {
      return;
    }
    this.openReaders = Math.max(0, this.openReaders - 1);
    LOGGER.debug("{} of terminal {} reached end of stream", stream, this.id);
    if (this.openReaders == 0 && this.pendingExit != null) {
      completeExit(this.pendingExit);
    }
  }

  private void readerGraceExpired() {
    if (this.pendingExit == null) {
      return;
    }
    LOGGER.warn("Terminal {} still has {} open output streams {} ms after exit; reporting exit", this.id,
        this.openReaders, READER_CLOSE_GRACE_MILLIS);
    completeExit(this.pendingExit);
  }

  private void completeExit(final ExitStatus status) {
    LOGGER.info("Terminal {} exited with code {}, signal {}", this.id, status.code(), status.signal());
    this.pendingExit = null;
    this.state = SessionState.EXITED;
    this.exitCode = status.code();
    release();
    this.listeners.fire(l -> l.onExit(status));
  }

  private void release() {
    cancel(this.killEscalationTask);
    cancel(this.healthTask);
    cancel(this.initialPromptTask);
    cancel(this.readerGraceTask);
    this.bufferManager.drain();
    this.bufferManager.destroy();
  }

  String welcomeBanner() {
    return "\r\nWelcome to " + PRODUCT_NAME + " Terminal\r\n"
        + this.host.userName() + "@" + this.host.hostName() + ":" + this.cwd + "$ ";
  }

  private Map<String, String> buildEnvironment() {
    final Map<String, String> env = new LinkedHashMap<>(this.host.variables());
    env.putAll(this.envOverlay);
    env.put("TERM", "xterm-256color");
    env.put("COLORTERM", "truecolor");
    env.put("COLUMNS", Integer.toString(this.cols));
    env.put("LINES", Integer.toString(this.rows));
    return env;
  }

  private void startReader(final ShellProcessController owner, final InputStream stream, final OutputSource source) {
    final Thread reader = new Thread(() -> {
      final char[] buffer = new char[8192];
      try (Reader in = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
        int n;
        while ((n = in.read(buffer)) >= 0) {
          if (n > 0) {
            final String text = new String(buffer, 0, n);
            this.loop.execute(() -> handleOutput(text, source));
          }
        }
      } catch (final IOException e) {
        this.loop.execute(() -> handleReadFailure(source, e));
      } finally {
        this.loop.execute(() -> readerClosed(owner, source));
      }
    }, "TerminalReader-" + this.id + "-" + source.name().toLowerCase(Locale.ROOT));
    reader.setDaemon(true);
    reader.start();
  }

  private void handleReadFailure(final OutputSource source, final IOException error) {
    if (this.state == SessionState.RUNNING) {
      LOGGER.warn("Reading {} of terminal {} failed: {}", source, this.id, error.getMessage(), error);
    } else {
      LOGGER.debug("{} of terminal {} closed: {}", source, this.id, error.getMessage());
    }
  }

  private void forward(final String text) {
    try {
      this.stdin.write(text.getBytes(StandardCharsets.UTF_8));
      this.stdin.flush();
    } catch (final IOException e) {
      LOGGER.error("Failed writing to terminal {}: {}", this.id, e.getMessage(), e);
    }
  }

  private void escalate(final ShellProcessController target) {
    if (this.state == SessionState.EXITED || this.pendingExit != null || target != this.process) {
      return;
    }
    LOGGER.info("Force killing terminal {}", this.id);
    try {
      target.terminate(true);
    } catch (final Exception e) {
      LOGGER.warn("Forceful termination of terminal {} failed: {}", this.id, e.getMessage(), e);
    }
  }

  private void sendInitialPrompt() {
    if (this.state != SessionState.RUNNING) {
      return;
    }
    LOGGER.debug("Sending initial prompt for terminal {}", this.id);
    emitData(welcomeBanner());
  }

  private void logHealth() {
    try {
      final BufferHealth health = this.bufferManager.getHealthStatus();
      LOGGER.debug("Terminal {} is running with PID {} (backpressure {}, warnings {})",
          this.id, this.pid, health.backpressure(), health.warnings());
    } catch (final RuntimeException e) {
      LOGGER.warn("Health check for terminal {} failed: {}", this.id, e.getMessage());
    }
  }

  private void emitData(final String data) {
    this.listeners.fire(l -> l.onData(data));
  }

  private void emitError(final Throwable error) {
    this.listeners.fire(l -> l.onError(error));
  }

  private static void cancel(final ScheduledTask task) {
    if (task != null) {
      task.cancel();
    }
  }

  private void closeQuietly(final ShellProcessController controller) {
    try {
      controller.close();
    } catch (final Exception e) {
      LOGGER.warn("Closing half-started process of terminal {} failed: {}", this.id, e.getMessage());
    }
  }
}
