package com.hatcherdx.terminal.session;

/**
 * Lifecycle of a {@link TerminalSession}.
 *
 * @since 1.0
 */
public enum SessionState {
  /** Created, no process launched yet (or the launch failed). */
  IDLE,
  /** Process running and accepting input. */
  RUNNING,
  /** Termination requested, exit not yet reported. */
  TERMINATING,
  /** Process exited; last-known state is retained. */
  EXITED
}
