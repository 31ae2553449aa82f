package com.hatcherdx.terminal.channel;

import java.util.Objects;

/**
 * The bridge-side endpoints of one connection.
 *
 * @param frontEnd endpoint facing the front end (inbound requests)
 * @param host endpoint facing the host (outbound requests, inbound responses)
 * @since 1.0
 */
public record EndpointPair(MessageEndpoint frontEnd, MessageEndpoint host) {

  public EndpointPair {
    Objects.requireNonNull(frontEnd, "frontEnd");
    Objects.requireNonNull(host, "host");
  }
}
