package com.hatcherdx.terminal.session;

import com.hatcherdx.terminal.buffer.OutputSource;
import com.hatcherdx.terminal.loop.ManualEventLoop;
import com.hatcherdx.terminal.process.ShellProcessConfig;
import com.hatcherdx.terminal.process.ShellProcessController;
import com.hatcherdx.terminal.process.ShellProcessLauncher;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Session lifecycle against a mocked process primitive and a virtual clock.
 *
 * <p>The mocked streams are empty, so the reader threads finish without posting output; output
 * is fed through {@code handleOutput} directly.
 *
 * @since 1.0
 */
public class TerminalSessionTest {

  private static final String BANNER = "\r\nWelcome to DX Engine Terminal\r\ndev@devbox:/work$ ";

  private ManualEventLoop loop;
  private ShellProcessLauncher launcher;
  private ShellProcessController controller;
  private CompletableFuture<Integer> exitFuture;
  private ByteArrayOutputStream stdin;
  private RecordingListener events;

  @BeforeEach
  void setUp() throws Exception {
    this.loop = new ManualEventLoop();
    this.launcher = mock(ShellProcessLauncher.class);
    this.controller = mock(ShellProcessController.class);
    this.exitFuture = new CompletableFuture<>();
    this.stdin = new ByteArrayOutputStream();
    this.events = new RecordingListener();

    when(this.launcher.launch(any())).thenReturn(this.controller);
    when(this.controller.getStdout()).thenReturn(new ByteArrayInputStream(new byte[0]));
    when(this.controller.getStderr()).thenReturn(new ByteArrayInputStream(new byte[0]));
    when(this.controller.getStdin()).thenReturn(this.stdin);
    when(this.controller.onExit()).thenReturn(this.exitFuture);
    when(this.controller.pid()).thenReturn(4242L);
  }

  private TerminalSession session(final Platform platform, final Map<String, String> env) {
    final HostEnvironment host = new HostEnvironment(platform, env, Path.of("/work"), "devbox", "dev");
    final TerminalSession session = new TerminalSession(
        "t1", TerminalSessionOptions.defaults(), this.loop, host, this.launcher, new TerminalOutputFilter());
    session.addListener(this.events);
    return session;
  }

  private TerminalSession spawned() {
    final TerminalSession session = session(Platform.UNIX, Map.of("HOME", "/home/dev"));
    session.spawn();
    return session;
  }

  @Test
  @DisplayName("Should launch /bin/bash with the terminal environment when SHELL is unset on Linux")
  void spawn_ShellUnsetOnLinux_LaunchesBash() throws Exception {
    final TerminalSession session = spawned();

    final ArgumentCaptor<ShellProcessConfig> config = ArgumentCaptor.forClass(ShellProcessConfig.class);
    verify(this.launcher).launch(config.capture());
    assertThat(config.getValue().command()).containsExactly("/bin/bash");
    assertThat(config.getValue().workingDirectory()).isEqualTo(Path.of("/work"));
    assertThat(config.getValue().environment())
        .containsEntry("HOME", "/home/dev")
        .containsEntry("TERM", "xterm-256color")
        .containsEntry("COLORTERM", "truecolor")
        .containsEntry("COLUMNS", "80")
        .containsEntry("LINES", "24");
    assertThat(session.isRunning()).isTrue();
    assertThat(session.getState()).isEqualTo(SessionState.RUNNING);
    assertThat(session.pid()).hasValue(4242L);
  }

  @Test
  @DisplayName("Should ignore a second spawn")
  void spawn_Twice_LaunchesOnce() throws Exception {
    final TerminalSession session = spawned();

    session.spawn();

    verify(this.launcher, times(1)).launch(any());
  }

  @Test
  @DisplayName("Should report a launch failure as an error event and stay idle")
  void spawn_LaunchFails_EmitsError() throws Exception {
    final IOException failure = new IOException("no such shell");
    when(this.launcher.launch(any())).thenThrow(failure);
    final TerminalSession session = session(Platform.UNIX, Map.of());

    session.spawn();

    assertThat(this.events.errors).containsExactly(failure);
    assertThat(session.isRunning()).isFalse();
    assertThat(session.getState()).isEqualTo(SessionState.IDLE);
    assertThat(session.pid()).isEmpty();
  }

  @Test
  @DisplayName("Should report missing stdio as a setup failure without wiring I/O")
  void spawn_MissingStdout_EmitsSetupFailure() throws Exception {
    when(this.controller.getStdout()).thenReturn(null);
    final TerminalSession session = session(Platform.UNIX, Map.of());

    session.spawn();

    assertThat(this.events.errors).hasSize(1);
    assertThat(this.events.errors.get(0)).isInstanceOf(TerminalSetupException.class);
    assertThat(session.isRunning()).isFalse();
    verify(this.controller).close();
    verify(this.controller, never()).onExit();
  }

  @Test
  @DisplayName("Should echo CR as CRLF and forward LF")
  void write_CarriageReturn_EchoesCrLfForwardsLf() {
    final TerminalSession session = spawned();

    session.write("\r");

    assertThat(this.events.data).containsExactly("\r\n");
    assertThat(this.stdin.toString(StandardCharsets.UTF_8)).isEqualTo("\n");
  }

  @Test
  @DisplayName("Should echo an erase for backspace without forwarding it")
  void write_Backspace_EchoesEraseOnly() {
    final TerminalSession session = spawned();

    session.write("\u007f");
    session.write("ls");

    assertThat(this.events.data).containsExactly("\b \b", "ls");
    assertThat(this.stdin.toString(StandardCharsets.UTF_8)).isEqualTo("ls");
  }

  @Test
  @DisplayName("Should ignore writes when nothing is running")
  void write_NotSpawned_NoOp() {
    final TerminalSession session = session(Platform.UNIX, Map.of());

    session.write("ls");

    assertThat(this.events.data).isEmpty();
    assertThat(this.stdin.size()).isZero();
  }

  @Test
  @DisplayName("Should never hand whitespace-only output to the buffer")
  void handleOutput_FilteredEmpty_NotBuffered() {
    final TerminalSession session = spawned();

    session.handleOutput("   \n\n   ", OutputSource.STDOUT);
    this.loop.advance(100);

    assertThat(session.getBufferMetrics().totalWrites()).isZero();
    assertThat(this.events.data).isEmpty();
  }

  @Test
  @DisplayName("Should deliver filtered output through the buffer")
  void handleOutput_Text_DeliveredAfterFlush() {
    final TerminalSession session = spawned();

    session.handleOutput("\u001b[32mok\u001b[0m\n", OutputSource.STDOUT);
    session.handleOutput("warn\n", OutputSource.STDERR);
    assertThat(this.events.data).isEmpty();

    this.loop.advance(16);

    assertThat(this.events.data).containsExactly("ok\nwarn\n");
    assertThat(session.getBufferMetrics().totalWrites()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should emit the welcome banner 500 ms after spawn")
  void spawn_After500ms_EmitsBanner() {
    spawned();

    this.loop.advance(499);
    assertThat(this.events.data).isEmpty();

    this.loop.advance(1);
    assertThat(this.events.data).containsExactly(BANNER);
  }

  @Test
  @DisplayName("Should flush pending output before reporting exit and skip the banner afterwards")
  void exit_PendingOutput_DeliveredBeforeExit() {
    final TerminalSession session = spawned();
    session.handleOutput("tail", OutputSource.STDOUT);

    this.exitFuture.complete(null);
    this.loop.runPending();
    this.loop.advance(TerminalSession.READER_CLOSE_GRACE_MILLIS);

    assertThat(this.events.order).containsExactly("data:tail", "exit:0:none");
    assertThat(session.getState()).isEqualTo(SessionState.EXITED);
    assertThat(session.exitCode()).hasValue(0);
    assertThat(session.isRunning()).isFalse();
  }

  @Test
  @DisplayName("Should hold the exit report while stdout is open and report it once the grace period ends")
  void exit_StdoutStillOpen_ReportedAfterGrace() throws Exception {
    final PipedOutputStream feed = new PipedOutputStream();
    when(this.controller.getStdout()).thenReturn(new PipedInputStream(feed));
    final TerminalSession session = spawned();
    try {
      this.exitFuture.complete(2);
      this.loop.runPending();
      this.loop.advance(TerminalSession.READER_CLOSE_GRACE_MILLIS - 1);

      assertThat(this.events.exits).isEmpty();
      assertThat(this.events.data).isEmpty();
      session.write("ls");
      assertThat(this.stdin.size()).isZero();

      this.loop.advance(1);

      assertThat(this.events.exits).containsExactly(new ExitStatus(2, "none"));
      assertThat(session.getState()).isEqualTo(SessionState.EXITED);
      assertThat(session.exitCode()).hasValue(2);
    } finally {
      feed.close();
    }
  }

  @Test
  @DisplayName("Should stop running and cancel escalation when exit monitoring fails")
  void exit_MonitoringFails_SessionStopsWithError() throws Exception {
    final TerminalSession session = spawned();
    final IllegalStateException failure = new IllegalStateException("wait failed");

    session.kill();
    this.exitFuture.completeExceptionally(failure);
    this.loop.runPending();
    this.loop.advance(10_000);

    assertThat(this.events.errors).hasSize(1);
    assertThat(this.events.errors.get(0)).isSameAs(failure);
    assertThat(this.events.exits).isEmpty();
    assertThat(session.isRunning()).isFalse();
    assertThat(session.getState()).isEqualTo(SessionState.EXITED);
    verify(this.controller, never()).terminate(true);
  }

  @Test
  @DisplayName("Should not escalate when the process exits within the grace period")
  void kill_ExitBeforeGrace_NoForcefulSignal() throws Exception {
    final TerminalSession session = spawned();

    session.kill();
    verify(this.controller).terminate(false);
    assertThat(session.getState()).isEqualTo(SessionState.TERMINATING);

    this.loop.advance(1000);
    this.exitFuture.complete(143);
    this.loop.runPending();
    this.loop.advance(10_000);

    verify(this.controller, never()).terminate(true);
    assertThat(this.events.exits).containsExactly(new ExitStatus(143, "SIGTERM"));
    assertThat(session.getState()).isEqualTo(SessionState.EXITED);
  }

  @Test
  @DisplayName("Should escalate exactly once after five seconds without exit")
  void kill_NoExit_ForcefulAfterGrace() throws Exception {
    final TerminalSession session = spawned();

    session.kill();
    this.loop.advance(4999);
    verify(this.controller, never()).terminate(true);

    this.loop.advance(1);
    verify(this.controller, times(1)).terminate(true);

    this.loop.advance(20_000);
    verify(this.controller, times(1)).terminate(true);
    assertThat(session.isRunning()).isFalse();
  }

  @Test
  @DisplayName("Should stop buffered delivery once killed")
  void kill_ReleasesBuffer() {
    final TerminalSession session = spawned();
    session.handleOutput("late", OutputSource.STDOUT);

    session.kill();
    this.loop.advance(100);

    assertThat(this.events.data).isEmpty();
  }

  @Test
  @DisplayName("Should record geometry but send no signal on Windows")
  void resize_Windows_NoSignal() throws Exception {
    final TerminalSession session = session(Platform.WINDOWS, Map.of());
    session.spawn();

    session.resize(120, 40);

    verify(this.controller, never()).resize(anyInt(), anyInt());
    assertThat(session.getCols()).isEqualTo(120);
    assertThat(session.getRows()).isEqualTo(40);
  }

  @Test
  @DisplayName("Should signal the process on Unix-like hosts and swallow signal failures")
  void resize_Unix_SignalsAndSwallowsFailure() throws Exception {
    final TerminalSession session = spawned();
    doThrow(new IOException("kill failed")).when(this.controller).resize(100, 30);

    session.resize(100, 30);

    verify(this.controller).resize(100, 30);
    assertThat(this.events.errors).isEmpty();
  }

  @Test
  @DisplayName("Should name an unnamed session after its id")
  void getName_Unnamed_DefaultsToId() {
    assertThat(session(Platform.UNIX, Map.of()).getName()).isEqualTo("Terminal t1");
  }

  private static final class RecordingListener implements TerminalSessionListener {

    private final List<String> data = new ArrayList<>();
    private final List<Throwable> errors = new ArrayList<>();
    private final List<ExitStatus> exits = new ArrayList<>();
    private final List<String> order = new ArrayList<>();

    @Override
    public void onData(final String text) {
      this.data.add(text);
      this.order.add("data:" + text);
    }

    @Override
    public void onError(final Throwable error) {
      this.errors.add(error);
      this.order.add("error:" + error.getMessage());
    }

    @Override
    public void onExit(final ExitStatus status) {
      this.exits.add(status);
      this.order.add("exit:" + status.code() + ":" + status.signal());
    }
  }
}
