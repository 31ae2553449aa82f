package com.hatcherdx.terminal.buffer;

import java.util.List;

/**
 * Health summary of an {@link OutputBufferManager}.
 *
 * @param healthy false once backpressure exceeds the drop threshold or any warning is present
 * @param backpressure pending bytes as a fraction of the buffer limit (0..1)
 * @param bufferUtilization pending chunks as a fraction of one flush batch (0..1)
 * @param lastFlushMs milliseconds since the last delivery, 0 before the first one
 * @param warnings human-readable warnings
 * @since 1.0
 */
public record BufferHealth(
    boolean healthy,
    double backpressure,
    double bufferUtilization,
    long lastFlushMs,
    List<String> warnings) {
}
