package com.hatcherdx.terminal.channel;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Terminal creation options as sent over the wire.
 *
 * @param name display name
 * @param cwd working directory
 * @param shell shell executable
 * @param env environment overlay
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TerminalOptions(String name, String cwd, String shell, Map<String, String> env) {

  public static TerminalOptions empty() {
    return new TerminalOptions(null, null, null, null);
  }
}
