package com.hatcherdx.terminal.buffer;

/**
 * Receives coalesced output and drop notifications from an {@link OutputBufferManager}.
 *
 * @since 1.0
 */
public interface OutputBufferListener {

  /**
   * Called with one coalesced payload, in arrival order.
   *
   * @param payload concatenated chunk text
   */
  void onDataReady(String payload);

  default void onChunksDropped(DroppedChunks dropped) {
  }
}
