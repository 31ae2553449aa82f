package com.hatcherdx.terminal.channel;

import com.hatcherdx.terminal.loop.EventLoop;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects a bridge to in-process peers through two {@link LocalMessageChannel}s.
 *
 * <p>On every connect the far port of the front-end channel is handed to the front-end peer and
 * the far port of the host channel to the host peer (for example {@code TerminalHost::attach}).
 *
 * @since 1.0
 */
public final class LocalEndpointConnector implements EndpointConnector {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalEndpointConnector.class);

  private final EventLoop loop;
  private final Consumer<MessageEndpoint> frontEndPeer;
  private final Consumer<MessageEndpoint> hostPeer;

  public LocalEndpointConnector(
      final EventLoop loop,
      final Consumer<MessageEndpoint> frontEndPeer,
      final Consumer<MessageEndpoint> hostPeer) {
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(frontEndPeer, "frontEndPeer must not be null");
    Validate.notNull(hostPeer, "hostPeer must not be null");
    this.loop = loop;
    this.frontEndPeer = frontEndPeer;
    this.hostPeer = hostPeer;
  }

  @Override
  public EndpointPair connect(final String channelId) {
    final LocalMessageChannel frontEndChannel = new LocalMessageChannel(this.loop, channelId + "/front-end");
    final LocalMessageChannel hostChannel = new LocalMessageChannel(this.loop, channelId + "/host");

    this.frontEndPeer.accept(frontEndChannel.port2());
    this.hostPeer.accept(hostChannel.port2());

    LOGGER.debug("Local channels created for {}", channelId);
    return new EndpointPair(frontEndChannel.port1(), hostChannel.port1());
  }
}
