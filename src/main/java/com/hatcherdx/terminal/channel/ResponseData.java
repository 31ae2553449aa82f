package com.hatcherdx.terminal.channel;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Response payload.
 *
 * @param id terminal id
 * @param name terminal display name
 * @param pid process id
 * @param output terminal output
 * @param terminals terminal listing
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseData(
    String id,
    String name,
    Long pid,
    String output,
    List<TerminalSummary> terminals) {

  public static ResponseData ofId(final String id) {
    return new ResponseData(id, null, null, null, null);
  }

  public static ResponseData output(final String id, final String output) {
    return new ResponseData(id, null, null, output, null);
  }

  public static ResponseData listing(final List<TerminalSummary> terminals) {
    return new ResponseData(null, null, null, null, List.copyOf(terminals));
  }
}
