package com.hatcherdx.terminal.channel;

/**
 * Opens the endpoints a {@link SessionChannelBridge} talks through.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface EndpointConnector {

  /**
   * Creates a fresh connection for a channel.
   *
   * @param channelId channel id
   * @return bridge-side endpoints, not yet started
   * @throws Exception if the connection cannot be set up
   */
  EndpointPair connect(String channelId) throws Exception;
}
