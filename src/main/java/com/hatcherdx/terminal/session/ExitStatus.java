package com.hatcherdx.terminal.session;

import java.util.Map;

/**
 * How a shell process ended.
 *
 * @param code exit code (0 when the process reported none)
 * @param signal terminating signal name, {@link #NO_SIGNAL} when not signalled
 * @since 1.0
 */
public record ExitStatus(int code, String signal) {

  public static final String NO_SIGNAL = "none";

  private static final int SIGNAL_EXIT_BASE = 128;
  private static final Map<Integer, String> SIGNAL_NAMES = Map.of(
      1, "SIGHUP",
      2, "SIGINT",
      9, "SIGKILL",
      15, "SIGTERM");

  public ExitStatus {
    signal = signal == null ? NO_SIGNAL : signal;
  }

  /**
   * Normalizes a raw exit code. On Unix-like hosts the JVM reports death by signal N as 128+N.
   *
   * @param rawCode raw code, may be null
   * @param platform host platform
   * @return normalized status
   */
  public static ExitStatus of(final Integer rawCode, final Platform platform) {
    final int code = rawCode == null ? 0 : rawCode;
    String signal = NO_SIGNAL;
    if (platform != null && platform.isUnixLike() && code > SIGNAL_EXIT_BASE) {
      signal = SIGNAL_NAMES.getOrDefault(code - SIGNAL_EXIT_BASE, NO_SIGNAL);
    }
    return new ExitStatus(code, signal);
  }

  public boolean signalled() {
    return !NO_SIGNAL.equals(this.signal);
  }
}
