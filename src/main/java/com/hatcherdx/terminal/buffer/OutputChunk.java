package com.hatcherdx.terminal.buffer;

/**
 * One pending output fragment.
 *
 * @param text fragment text
 * @param size UTF-8 encoded size in bytes
 * @param timestamp arrival time in epoch milliseconds
 * @param source stream the fragment came from
 * @since 1.0
 */
public record OutputChunk(
    String text,
    long size,
    long timestamp,
    OutputSource source) {
}
