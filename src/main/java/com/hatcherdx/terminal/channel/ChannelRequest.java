package com.hatcherdx.terminal.channel;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Session-control request sent from the front end to the host.
 *
 * @param type operation
 * @param terminalId target terminal
 * @param data operation payload, may be null
 * @param timestamp send time in epoch milliseconds, echoed by the response
 * @param requestId correlation id, echoed by the response
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelRequest(
    RequestType type,
    String terminalId,
    RequestData data,
    Long timestamp,
    String requestId) {
}
