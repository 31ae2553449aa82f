package com.hatcherdx.terminal.channel;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Operation-specific request payload. Only the fields of the operation are set.
 *
 * @param text input text (write)
 * @param cols column count (resize)
 * @param rows row count (resize)
 * @param options creation options (create)
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestData(String text, Integer cols, Integer rows, TerminalOptions options) {

  public static RequestData text(final String text) {
    return new RequestData(text, null, null, null);
  }

  public static RequestData size(final int cols, final int rows) {
    return new RequestData(null, cols, rows, null);
  }

  public static RequestData options(final TerminalOptions options) {
    return new RequestData(null, null, null, options);
  }
}
