package com.hatcherdx.terminal.session;

/**
 * A shell process launched but could not be wired up (e.g., a standard stream is missing).
 *
 * @since 1.0
 */
public class TerminalSetupException extends Exception {

  private static final long serialVersionUID = 1L;

  public TerminalSetupException(final String message) {
    super(message);
  }

  public TerminalSetupException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
