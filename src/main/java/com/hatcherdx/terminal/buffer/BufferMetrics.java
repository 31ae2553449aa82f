package com.hatcherdx.terminal.buffer;

/**
 * Point-in-time counters of an {@link OutputBufferManager}.
 *
 * @param totalWrites number of accepted write calls
 * @param totalBytes bytes accepted by writes
 * @param chunksProcessed chunks delivered through flushes
 * @param averageChunkSize average delivered chunk size in bytes
 * @param flushCount number of non-empty flushes
 * @param droppedChunks chunks discarded under pressure
 * @param pendingChunks chunks waiting for delivery
 * @param pendingBytes bytes waiting for delivery
 * @since 1.0
 */
public record BufferMetrics(
    long totalWrites,
    long totalBytes,
    long chunksProcessed,
    double averageChunkSize,
    long flushCount,
    long droppedChunks,
    int pendingChunks,
    long pendingBytes) {
}
