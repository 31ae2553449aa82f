package com.hatcherdx.terminal.channel;

import org.apache.commons.lang3.Validate;

/**
 * Exponential backoff for automatic reconnection.
 *
 * @param maxAttempts attempts before giving up
 * @param baseDelayMillis delay unit
 * @param maxDelayMillis delay cap
 * @since 1.0
 */
public record ReconnectPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis) {

  public ReconnectPolicy {
    Validate.isTrue(maxAttempts >= 0, "maxAttempts must not be negative");
    Validate.isTrue(baseDelayMillis > 0, "baseDelayMillis must be positive");
    Validate.isTrue(maxDelayMillis >= baseDelayMillis, "maxDelayMillis must be >= baseDelayMillis");
  }

  public static ReconnectPolicy defaults() {
    return new ReconnectPolicy(5, 1000L, 10_000L);
  }

  /**
   * Returns {@code min(base × 2^attempt, max)}.
   *
   * @param attempt attempt number (the first retry is attempt 1)
   * @return delay in milliseconds
   */
  public long delayForAttempt(final int attempt) {
    Validate.isTrue(attempt >= 0, "attempt must not be negative");
    if (attempt >= 62) {
      return this.maxDelayMillis;
    }
    final long factor = 1L << attempt;
    if (this.baseDelayMillis > this.maxDelayMillis / factor) {
      return this.maxDelayMillis;
    }
    return Math.min(this.baseDelayMillis * factor, this.maxDelayMillis);
  }
}
