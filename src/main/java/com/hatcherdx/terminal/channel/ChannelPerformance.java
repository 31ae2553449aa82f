package com.hatcherdx.terminal.channel;

/**
 * Cumulative bridge counters.
 *
 * @param messageCount requests posted to the host
 * @param avgLatency mean latency over responses that echoed a timestamp, 0 when none
 * @param maxLatency largest observed latency
 * @param channelsActive currently active channels
 * @since 1.0
 */
public record ChannelPerformance(long messageCount, double avgLatency, long maxLatency, int channelsActive) {
}
