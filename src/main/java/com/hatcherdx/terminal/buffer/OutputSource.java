package com.hatcherdx.terminal.buffer;

/**
 * Stream an output chunk was read from.
 *
 * @since 1.0
 */
public enum OutputSource {
  STDOUT,
  STDERR
}
