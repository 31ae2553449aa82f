package com.hatcherdx.terminal.session;

/**
 * Pre-filter applied to raw subprocess output before it is buffered.
 *
 * @since 1.0
 */
public interface OutputFilter {

  /**
   * Returns the text to keep. An empty result means the chunk is discarded.
   *
   * @param text raw output text
   * @return filtered text, never null
   */
  String filter(final String text);
}
