package com.hatcherdx.terminal.channel;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Host reply. Replies to a request echo its {@code requestId} and {@code timestamp};
 * unsolicited output and exit notices carry neither.
 *
 * @param success whether the operation succeeded
 * @param data payload, may be null
 * @param error error message, may be null
 * @param timestamp echoed request timestamp
 * @param requestId echoed request id
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelResponse(
    boolean success,
    ResponseData data,
    String error,
    Long timestamp,
    String requestId) {

  public static ChannelResponse ok(final ResponseData data) {
    return new ChannelResponse(true, data, null, null, null);
  }

  public static ChannelResponse failure(final ResponseData data, final String error) {
    return new ChannelResponse(false, data, error, null, null);
  }

  /**
   * Returns a copy correlated with the given request.
   *
   * @param request request being answered
   * @return correlated response
   */
  public ChannelResponse answering(final ChannelRequest request) {
    return new ChannelResponse(this.success, this.data, this.error, request.timestamp(), request.requestId());
  }
}
