package com.hatcherdx.terminal.channel;

/**
 * Snapshot returned by {@link SessionChannelBridge#getConnectionStatus()}.
 *
 * @param connected true in {@link ConnectionState#CONNECTED}
 * @param state connection state
 * @param reconnectAttempts automatic attempts since the last successful connection
 * @param queuedMessages requests waiting for a connection
 * @param performance counters
 * @since 1.0
 */
public record ConnectionStatus(
    boolean connected,
    ConnectionState state,
    int reconnectAttempts,
    int queuedMessages,
    ChannelPerformance performance) {
}
