package com.hatcherdx.terminal.channel;

/**
 * Connection state of a {@link SessionChannelBridge}.
 *
 * @since 1.0
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
