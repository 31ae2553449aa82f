package com.hatcherdx.terminal.channel;

/**
 * Listener for bridge events. All callbacks run on the bridge's event loop.
 *
 * @since 1.0
 */
public interface ChannelBridgeListener {

  default void onConnected() {
  }

  default void onDisconnected() {
  }

  /**
   * Terminal output carried by a host response.
   *
   * @param output output text
   */
  default void onData(String output) {
  }

  default void onError(Throwable error) {
  }

  default void onResponse(ChannelResponse response) {
  }

  default void onCleanup() {
  }

  default void onMaxReconnectAttemptsReached() {
  }
}
