package com.hatcherdx.terminal.channel;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * One side of a linked, message-oriented channel.
 *
 * <p>Messages posted on one endpoint arrive at its peer. Inbound messages are held until
 * {@link #start()} is called. Closing either side closes both, and each side reports a close
 * event.
 *
 * @since 1.0
 */
public interface MessageEndpoint {

  /**
   * Begins delivering inbound messages, including any held since creation.
   */
  void start();

  /**
   * Sends a message to the peer.
   *
   * @param message text frame
   * @throws IOException if this endpoint or its peer is closed
   */
  void post(String message) throws IOException;

  void addMessageListener(Consumer<String> listener);

  void addCloseListener(Runnable listener);

  /**
   * Closes this endpoint and its peer. Idempotent.
   */
  void close();

  boolean isClosed();
}
