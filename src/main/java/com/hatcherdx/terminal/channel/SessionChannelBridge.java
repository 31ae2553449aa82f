package com.hatcherdx.terminal.channel;

import com.hatcherdx.terminal.loop.EventLoop;
import com.hatcherdx.terminal.loop.ListenerList;
import com.hatcherdx.terminal.loop.ScheduledTask;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request/response bridge between a front-end endpoint and a host endpoint.
 *
 * <p>
 * Behaviour:
 * <ul>
 * <li>Requests issued while disconnected are queued and the send fails with "not connected".
 * The queue is replayed in enqueue order during the next successful {@link #initialize()},
 * before {@code connected} is reported.</li>
 * <li>Requests arriving on the front-end endpoint are forwarded to the host endpoint.</li>
 * <li>Host responses feed the latency counters, output is re-emitted as {@code data}, and every
 * response is emitted as {@code response}.</li>
 * <li>A close on either endpoint, or a failed connect, schedules a reconnect with exponential
 * backoff until {@link ReconnectPolicy#maxAttempts()} is exhausted.</li>
 * </ul>
 * </p>
 *
 * <p>Must be used from its {@link EventLoop}.
 */
public final class SessionChannelBridge {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionChannelBridge.class);

  private final String channelId;
  private final EventLoop loop;
  private final EndpointConnector connector;
  private final ChannelMessageCodec codec;
  private final ReconnectPolicy reconnectPolicy;
  private final ListenerList<ChannelBridgeListener> listeners = new ListenerList<>();

  private final Deque<ChannelRequest> queue = new ArrayDeque<>();
  private ConnectionState state = ConnectionState.DISCONNECTED;
  private int reconnectAttempts;
  private ScheduledTask reconnectTask;
  private MessageEndpoint frontEndEndpoint;
  private MessageEndpoint hostEndpoint;
  private boolean cleanedUp;
  private long sequence;

  private long messageCount;
  private long timedResponses;
  private long totalLatency;
  private long maxLatency;
  private int channelsActive;

  public SessionChannelBridge(final String channelId, final EventLoop loop, final EndpointConnector connector) {
    this(channelId, loop, connector, new ChannelMessageCodec(), ReconnectPolicy.defaults());
  }

  public SessionChannelBridge(
      final String channelId,
      final EventLoop loop,
      final EndpointConnector connector,
      final ChannelMessageCodec codec,
      final ReconnectPolicy reconnectPolicy) {
    Validate.notBlank(channelId, "channelId must not be blank");
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(connector, "connector must not be null");
    Validate.notNull(codec, "codec must not be null");
    Validate.notNull(reconnectPolicy, "reconnectPolicy must not be null");
    this.channelId = channelId;
    this.loop = loop;
    this.connector = connector;
    this.codec = codec;
    this.reconnectPolicy = reconnectPolicy;
  }

  public String getChannelId() {
    return this.channelId;
  }

  public void addListener(final ChannelBridgeListener listener) {
    this.listeners.add(listener);
  }

  public void removeListener(final ChannelBridgeListener listener) {
    this.listeners.remove(listener);
  }

  /**
   * Opens a fresh endpoint pair, replays queued requests and reports {@code connected}.
   *
   * @throws ChannelException if the connection cannot be set up; a retry has been scheduled
   *     unless the attempts are exhausted
   */
  public void initialize() throws ChannelException {
    cancelReconnect();
    if (detachEndpoints()) {
      this.channelsActive = Math.max(0, this.channelsActive - 1);
    }
    this.cleanedUp = false;
    this.state = ConnectionState.CONNECTING;
    LOGGER.info("Setting up connection: {}", this.channelId);

    EndpointPair pair = null;
    try {
      pair = this.connector.connect(this.channelId);
      wire(pair);
    } catch (final Exception e) {
      LOGGER.error("Failed to set up connection {}: {}", this.channelId, e.getMessage(), e);
      if (pair != null) {
        pair.frontEnd().close();
        pair.host().close();
      }
      final ChannelException failure = e instanceof ChannelException
          ? (ChannelException) e
          : new ChannelException("Failed to set up connection " + this.channelId, e);
      handleConnectionError(failure);
      throw failure;
    }

    this.frontEndEndpoint = pair.frontEnd();
    this.hostEndpoint = pair.host();
    this.state = ConnectionState.CONNECTED;
    this.reconnectAttempts = 0;
    this.channelsActive++;

    processQueue();

    LOGGER.info("Connection established: {}", this.channelId);
    this.listeners.fire(ChannelBridgeListener::onConnected);
  }

  public CompletableFuture<Void> createTerminal(final TerminalOptions options) {
    return send(request(RequestType.CREATE, RequestData.options(options != null ? options : TerminalOptions.empty())));
  }

  public CompletableFuture<Void> write(final String text) {
    return send(request(RequestType.WRITE, RequestData.text(text)));
  }

  public CompletableFuture<Void> resize(final int cols, final int rows) {
    return send(request(RequestType.RESIZE, RequestData.size(cols, rows)));
  }

  public CompletableFuture<Void> kill() {
    return send(request(RequestType.KILL, null));
  }

  public CompletableFuture<Void> list() {
    return send(request(RequestType.LIST, null));
  }

  /**
   * Resets the attempt counter and connects immediately. Failures are reported through
   * {@code error} events.
   */
  public void reconnect() {
    LOGGER.info("Manual reconnection requested: {}", this.channelId);
    this.state = ConnectionState.DISCONNECTED;
    this.reconnectAttempts = 0;
    try {
      initialize();
    } catch (final ChannelException e) {
      LOGGER.error("Manual reconnection of {} failed: {}", this.channelId, e.getMessage());
    }
  }

  /**
   * Disconnects, drops queued requests and closes both endpoints. Idempotent.
   */
  public void cleanup() {
    if (this.cleanedUp) {
      return;
    }
    this.cleanedUp = true;
    cancelReconnect();
    this.state = ConnectionState.DISCONNECTED;
    this.queue.clear();
    detachEndpoints();
    this.channelsActive = 0;
    LOGGER.info("Bridge cleaned up: {}", this.channelId);
    this.listeners.fire(ChannelBridgeListener::onCleanup);
  }

  public ConnectionStatus getConnectionStatus() {
    final double avgLatency = this.timedResponses > 0 ? (double) this.totalLatency / this.timedResponses : 0.0;
    return new ConnectionStatus(
        this.state == ConnectionState.CONNECTED,
        this.state,
        this.reconnectAttempts,
        this.queue.size(),
        new ChannelPerformance(this.messageCount, avgLatency, this.maxLatency, this.channelsActive));
  }

  private ChannelRequest request(final RequestType type, final RequestData data) {
    final long now = this.loop.currentTimeMillis();
    final String requestId = type.wireName() + "-" + this.channelId + "-" + now + "-" + (++this.sequence);
    return new ChannelRequest(type, this.channelId, data, now, requestId);
  }

  private CompletableFuture<Void> send(final ChannelRequest request) {
    if (this.state != ConnectionState.CONNECTED || this.hostEndpoint == null) {
      LOGGER.warn("Queuing {} request - channel {} not connected", request.type().wireName(), this.channelId);
      this.queue.addLast(request);
      return CompletableFuture.failedFuture(new ChannelException("Channel " + this.channelId + " not connected"));
    }

    try {
      this.hostEndpoint.post(this.codec.encodeRequest(request));
    } catch (final IOException | ChannelException e) {
      LOGGER.error("Failed to send {} request {}: {}", request.type().wireName(), request.requestId(),
          e.getMessage(), e);
      return CompletableFuture.failedFuture(e);
    }
    this.messageCount++;
    LOGGER.debug("Sent request: {} ({})", request.type().wireName(), request.requestId());
    return CompletableFuture.completedFuture(null);
  }

  private void processQueue() {
    if (this.queue.isEmpty()) {
      return;
    }
    LOGGER.info("Processing {} queued messages for {}", this.queue.size(), this.channelId);
    final List<ChannelRequest> replay = new ArrayList<>(this.queue);
    this.queue.clear();
    for (final ChannelRequest request : replay) {
      send(request).whenComplete((ignored, error) -> {
        if (error != null) {
          LOGGER.error("Failed to process queued message {}: {}", request.requestId(), error.getMessage());
          this.listeners.fire(l -> l.onError(error));
        }
      });
    }
  }

  private void wire(final EndpointPair pair) {
    final MessageEndpoint frontEnd = pair.frontEnd();
    final MessageEndpoint host = pair.host();

    frontEnd.addMessageListener(this::handleFrontEndMessage);
    frontEnd.addCloseListener(() -> {
      if (frontEnd == this.frontEndEndpoint) {
        LOGGER.warn("Front-end endpoint closed: {}", this.channelId);
        handleDisconnection();
      }
    });
    host.addMessageListener(this::handleHostMessage);
    host.addCloseListener(() -> {
      if (host == this.hostEndpoint) {
        LOGGER.warn("Host endpoint closed: {}", this.channelId);
        handleDisconnection();
      }
    });

    frontEnd.start();
    host.start();
  }

  private void handleFrontEndMessage(final String frame) {
    final ChannelRequest request;
    try {
      request = this.codec.decodeRequest(frame);
    } catch (final ChannelException e) {
      LOGGER.warn("Discarding malformed front-end request on {}: {}", this.channelId, e.getMessage());
      this.listeners.fire(l -> l.onError(e));
      return;
    }
    LOGGER.debug("Forwarding front-end request: {}", request.type());
    send(request).whenComplete((ignored, error) -> {
      if (error != null) {
        LOGGER.error("Failed to forward request {}: {}", request.requestId(), error.getMessage());
        this.listeners.fire(l -> l.onError(error));
      }
    });
  }

  private void handleHostMessage(final String frame) {
    final ChannelResponse response;
    try {
      response = this.codec.decodeResponse(frame);
    } catch (final ChannelException e) {
      LOGGER.warn("Discarding malformed host response on {}: {}", this.channelId, e.getMessage());
      this.listeners.fire(l -> l.onError(e));
      return;
    }
    LOGGER.debug("Received host response: {}", response.requestId());

    if (response.timestamp() != null && response.requestId() != null) {
      final long latency = Math.max(0L, this.loop.currentTimeMillis() - response.timestamp());
      this.totalLatency += latency;
      this.timedResponses++;
      this.maxLatency = Math.max(this.maxLatency, latency);
    }

    if (response.data() != null && StringUtils.isNotEmpty(response.data().output())) {
      final String output = response.data().output();
      this.listeners.fire(l -> l.onData(output));
    }
    this.listeners.fire(l -> l.onResponse(response));
  }

  private void handleDisconnection() {
    detachEndpoints();
    this.state = ConnectionState.DISCONNECTED;
    this.channelsActive = Math.max(0, this.channelsActive - 1);
    this.listeners.fire(ChannelBridgeListener::onDisconnected);
    handleConnectionError(new ChannelException("Channel " + this.channelId + " disconnected"));
  }

  private void handleConnectionError(final ChannelException error) {
    this.state = ConnectionState.DISCONNECTED;
    this.listeners.fire(l -> l.onError(error));

    if (this.reconnectAttempts < this.reconnectPolicy.maxAttempts()) {
      this.reconnectAttempts++;
      final long delay = this.reconnectPolicy.delayForAttempt(this.reconnectAttempts);
      LOGGER.info("Attempting reconnection {}/{} of {} in {}ms", this.reconnectAttempts,
          this.reconnectPolicy.maxAttempts(), this.channelId, delay);
      this.reconnectTask = this.loop.schedule(this::retry, delay);
    } else {
      LOGGER.error("Max reconnection attempts reached for {}", this.channelId);
      this.listeners.fire(ChannelBridgeListener::onMaxReconnectAttemptsReached);
    }
  }

  private void retry() {
    this.reconnectTask = null;
    try {
      initialize();
    } catch (final ChannelException e) {
      LOGGER.debug("Reconnection of {} failed: {}", this.channelId, e.getMessage());
    }
  }

  private void cancelReconnect() {
    if (this.reconnectTask != null) {
      this.reconnectTask.cancel();
      this.reconnectTask = null;
    }
  }

  /** Closes the current pair, if any. Returns whether a pair was attached. */
  private boolean detachEndpoints() {
    final MessageEndpoint frontEnd = this.frontEndEndpoint;
    final MessageEndpoint host = this.hostEndpoint;
    this.frontEndEndpoint = null;
    this.hostEndpoint = null;
    if (frontEnd != null) {
      frontEnd.close();
    }
    if (host != null) {
      host.close();
    }
    return frontEnd != null || host != null;
  }
}
