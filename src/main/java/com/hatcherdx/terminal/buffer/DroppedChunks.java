package com.hatcherdx.terminal.buffer;

/**
 * Outcome of one drop episode.
 *
 * @param droppedCount chunks discarded
 * @param droppedBytes bytes discarded
 * @param remainingChunks chunks still pending afterwards
 * @since 1.0
 */
public record DroppedChunks(
    int droppedCount,
    long droppedBytes,
    int remainingChunks) {
}
