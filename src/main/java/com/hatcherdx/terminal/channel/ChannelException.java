package com.hatcherdx.terminal.channel;

/**
 * Channel-level failure: connection setup, serialization, or a send while disconnected.
 *
 * @since 1.0
 */
public class ChannelException extends Exception {

  private static final long serialVersionUID = 1L;

  public ChannelException(final String message) {
    super(message);
  }

  public ChannelException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
