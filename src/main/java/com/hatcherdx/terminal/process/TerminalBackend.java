package com.hatcherdx.terminal.process;

/**
 * Available process backends.
 *
 * <p>{@link #SUBPROCESS} pipes stdin/stdout/stderr and works everywhere a JVM can start a
 * process. {@link #PTY} attaches the shell to a pseudo-terminal through pty4j, which gives the
 * shell a real TTY (prompt, echo control, window size).
 *
 * @since 1.0
 */
public enum TerminalBackend implements ShellProcessLauncher {

  SUBPROCESS {
    @Override
    public ShellProcessController launch(final ShellProcessConfig config) throws Exception {
      return new ShellProcessControllerPiped(config);
    }
  },

  PTY {
    @Override
    public ShellProcessController launch(final ShellProcessConfig config) throws Exception {
      return new ShellProcessControllerPty4j(config);
    }
  }
}
