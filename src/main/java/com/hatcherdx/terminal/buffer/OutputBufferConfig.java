package com.hatcherdx.terminal.buffer;

/**
 * Thresholds for one {@link OutputBufferManager}.
 *
 * @param maxBufferSize hard limit for pending bytes
 * @param chunkSize largest fragment, in characters, stored as a single chunk
 * @param maxChunksPerFlush most chunks coalesced into one delivery
 * @param flushIntervalMillis flush timer period
 * @param dropThreshold occupancy fraction to unload down to once the limit is exceeded
 * @since 1.0
 */
public record OutputBufferConfig(
    long maxBufferSize,
    int chunkSize,
    int maxChunksPerFlush,
    long flushIntervalMillis,
    double dropThreshold) {

  private static final long MIB = 1024L * 1024L;

  public static OutputBufferConfig defaults() {
    return new OutputBufferConfig(10 * MIB, 64 * 1024, 50, 16L, 0.8);
  }

  /**
   * Smaller buffer and chunk sizes used for piped shell subprocesses.
   *
   * @return subprocess buffer configuration
   */
  public static OutputBufferConfig subprocessDefaults() {
    return new OutputBufferConfig(8 * MIB, 32 * 1024, 50, 16L, 0.75);
  }
}
