package com.hatcherdx.terminal.session;

/**
 * Listener for session events. All callbacks run on the session's event loop.
 *
 * @since 1.0
 */
public interface TerminalSessionListener {

  default void onData(String data) {
  }

  default void onError(Throwable error) {
  }

  default void onExit(ExitStatus status) {
  }
}
