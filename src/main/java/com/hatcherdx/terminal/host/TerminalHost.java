package com.hatcherdx.terminal.host;

import com.hatcherdx.terminal.channel.ChannelException;
import com.hatcherdx.terminal.channel.ChannelMessageCodec;
import com.hatcherdx.terminal.channel.ChannelRequest;
import com.hatcherdx.terminal.channel.ChannelResponse;
import com.hatcherdx.terminal.channel.MessageEndpoint;
import com.hatcherdx.terminal.channel.RequestData;
import com.hatcherdx.terminal.channel.ResponseData;
import com.hatcherdx.terminal.channel.TerminalOptions;
import com.hatcherdx.terminal.channel.TerminalSummary;
import com.hatcherdx.terminal.loop.EventLoop;
import com.hatcherdx.terminal.session.ExitStatus;
import com.hatcherdx.terminal.session.TerminalSession;
import com.hatcherdx.terminal.session.TerminalSessionListener;
import com.hatcherdx.terminal.session.TerminalSessionOptions;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host-side coordinator: owns terminal sessions and serves channel requests for them.
 *
 * <p>
 * Protocol:
 * <ul>
 * <li>Each decoded request gets exactly one response on the endpoint it arrived on, echoing
 * its {@code requestId} and {@code timestamp}.</li>
 * <li>Session output, errors and exits are pushed to every attached endpoint as uncorrelated
 * responses.</li>
 * </ul>
 * </p>
 *
 * <p>Must be used from its {@link EventLoop}.
 *
 * @since 1.0
 */
public final class TerminalHost {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalHost.class);

  private final EventLoop loop;
  private final TerminalSessionFactory sessionFactory;
  private final ChannelMessageCodec codec;
  private final OutputThrottle throttle = new OutputThrottle();

  private final Map<String, TerminalSession> sessions = new LinkedHashMap<>();
  private final Set<MessageEndpoint> endpoints = new LinkedHashSet<>();

  public TerminalHost(final EventLoop loop) {
    this(loop, new DefaultTerminalSessionFactory(loop), new ChannelMessageCodec());
  }

  public TerminalHost(final EventLoop loop, final TerminalSessionFactory sessionFactory, final ChannelMessageCodec codec) {
    Validate.notNull(loop, "loop must not be null");
    Validate.notNull(sessionFactory, "sessionFactory must not be null");
    Validate.notNull(codec, "codec must not be null");
    this.loop = loop;
    this.sessionFactory = sessionFactory;
    this.codec = codec;
  }

  /**
   * Starts serving requests arriving on an endpoint. The endpoint is detached when it closes.
   *
   * @param endpoint host-side endpoint
   */
  public void attach(final MessageEndpoint endpoint) {
    Validate.notNull(endpoint, "endpoint must not be null");
    endpoint.addMessageListener(frame -> handleFrame(endpoint, frame));
    endpoint.addCloseListener(() -> {
      if (this.endpoints.remove(endpoint)) {
        LOGGER.debug("Host endpoint detached ({} remaining)", this.endpoints.size());
      }
    });
    this.endpoints.add(endpoint);
    endpoint.start();
    LOGGER.debug("Host endpoint attached ({} total)", this.endpoints.size());
  }

  public Optional<TerminalSession> session(final String terminalId) {
    return Optional.ofNullable(this.sessions.get(terminalId));
  }

  public int sessionCount() {
    return this.sessions.size();
  }

  /**
   * Kills every session and clears the registry.
   */
  public void shutdown() {
    LOGGER.info("Shutting down terminal host with {} sessions", this.sessions.size());
    for (final TerminalSession session : new ArrayList<>(this.sessions.values())) {
      session.kill();
    }
    this.sessions.clear();
    this.throttle.clear();
  }

  private void handleFrame(final MessageEndpoint endpoint, final String frame) {
    final ChannelRequest request;
    try {
      request = this.codec.decodeRequest(frame);
    } catch (final ChannelException e) {
      LOGGER.warn("Rejecting malformed request: {}", e.getMessage());
      reply(endpoint, ChannelResponse.failure(null, e.getMessage()));
      return;
    }
    if (request.type() == null) {
      reply(endpoint, failure(request.terminalId(), "Request type missing").answering(request));
      return;
    }

    LOGGER.debug("Handling {} request {} for terminal {}", request.type().wireName(), request.requestId(),
        request.terminalId());
    ChannelResponse response;
    try {
      response = dispatch(request);
    } catch (final RuntimeException e) {
      LOGGER.error("{} request for terminal {} failed: {}", request.type().wireName(), request.terminalId(),
          e.getMessage(), e);
      response = failure(request.terminalId(), e.getMessage());
    }
    reply(endpoint, response.answering(request));
  }

  private ChannelResponse dispatch(final ChannelRequest request) {
    switch (request.type()) {
      case CREATE:
        return create(request);
      case WRITE:
        return withRunningSession(request, session -> {
          final String text = request.data() != null ? request.data().text() : null;
          if (text == null) {
            return failure(session.getId(), "Write request carries no text");
          }
          session.write(text);
          return ChannelResponse.ok(ResponseData.ofId(session.getId()));
        });
      case RESIZE:
        return withRunningSession(request, session -> {
          final RequestData data = request.data();
          if (data == null || data.cols() == null || data.rows() == null || data.cols() <= 0 || data.rows() <= 0) {
            return failure(session.getId(), "Resize request needs positive cols and rows");
          }
          session.resize(data.cols(), data.rows());
          return ChannelResponse.ok(ResponseData.ofId(session.getId()));
        });
      case KILL:
        return withRunningSession(request, session -> {
          session.kill();
          return ChannelResponse.ok(ResponseData.ofId(session.getId()));
        });
      case LIST:
        return ChannelResponse.ok(ResponseData.listing(summaries()));
      default:
        return failure(request.terminalId(), "Unsupported request type: " + request.type().wireName());
    }
  }

  private ChannelResponse create(final ChannelRequest request) {
    final String id = request.terminalId();
    if (StringUtils.isBlank(id)) {
      return failure(id, "Create request needs a terminal id");
    }
    if (this.sessions.containsKey(id)) {
      return failure(id, "Terminal " + id + " already exists");
    }

    final TerminalOptions wire = request.data() != null ? request.data().options() : null;
    final TerminalSession session = this.sessionFactory.create(id, toSessionOptions(wire));
    session.addListener(new ForwardingListener(session));
    this.sessions.put(id, session);
    session.spawn();

    if (!session.isRunning()) {
      this.sessions.remove(id);
      return failure(id, "Failed to spawn terminal " + id);
    }
    LOGGER.info("Created terminal {} ({}) with PID {}", id, session.getName(), pidOf(session));
    return ChannelResponse.ok(new ResponseData(id, session.getName(), pidOf(session), null, null));
  }

  private ChannelResponse withRunningSession(
      final ChannelRequest request, final Function<TerminalSession, ChannelResponse> action) {
    final TerminalSession session = this.sessions.get(request.terminalId());
    if (session == null) {
      return failure(request.terminalId(), "Terminal " + request.terminalId() + " not found");
    }
    if (!session.isRunning()) {
      return failure(session.getId(), "Terminal " + session.getId() + " is not running");
    }
    return action.apply(session);
  }

  private List<TerminalSummary> summaries() {
    final List<TerminalSummary> summaries = new ArrayList<>(this.sessions.size());
    for (final TerminalSession session : this.sessions.values()) {
      summaries.add(new TerminalSummary(session.getId(), session.getName(), pidOf(session), session.isRunning()));
    }
    return summaries;
  }

  private static TerminalSessionOptions toSessionOptions(final TerminalOptions wire) {
    final TerminalSessionOptions.Builder builder = TerminalSessionOptions.builder();
    if (wire != null) {
      builder.name(wire.name())
          .shell(wire.shell())
          .env(wire.env());
      if (StringUtils.isNotBlank(wire.cwd())) {
        builder.cwd(Path.of(wire.cwd()));
      }
    }
    return builder.build();
  }

  private static Long pidOf(final TerminalSession session) {
    return session.pid().isPresent() ? session.pid().getAsLong() : null;
  }

  private static ChannelResponse failure(final String terminalId, final String error) {
    return ChannelResponse.failure(terminalId != null ? ResponseData.ofId(terminalId) : null, error);
  }

  private void reply(final MessageEndpoint endpoint, final ChannelResponse response) {
    try {
      endpoint.post(this.codec.encodeResponse(response));
    } catch (final IOException | ChannelException e) {
      LOGGER.warn("Failed to deliver response {}: {}", response.requestId(), e.getMessage());
    }
  }

  private void broadcast(final ChannelResponse response) {
    final String frame;
    try {
      frame = this.codec.encodeResponse(response);
    } catch (final ChannelException e) {
      LOGGER.error("Failed to encode host notice: {}", e.getMessage(), e);
      return;
    }
    for (final MessageEndpoint endpoint : new ArrayList<>(this.endpoints)) {
      if (endpoint.isClosed()) {
        this.endpoints.remove(endpoint);
        continue;
      }
      try {
        endpoint.post(frame);
      } catch (final IOException e) {
        LOGGER.warn("Failed to push host notice: {}", e.getMessage());
      }
    }
  }

  /**
   * Pushes one session's events to the attached endpoints.
   */
  private final class ForwardingListener implements TerminalSessionListener {

    private final TerminalSession session;

    private ForwardingListener(final TerminalSession session) {
      this.session = session;
    }

    @Override
    public void onData(final String data) {
      final String id = this.session.getId();
      if (throttle.shouldSuppress(id, data, loop.currentTimeMillis())) {
        LOGGER.debug("Throttling duplicate output for terminal {}", id);
        return;
      }
      broadcast(ChannelResponse.ok(ResponseData.output(id, data)));
    }

    @Override
    public void onError(final Throwable error) {
      broadcast(failure(this.session.getId(), error.getMessage()));
    }

    @Override
    public void onExit(final ExitStatus status) {
      final String id = this.session.getId();
      LOGGER.info("Terminal {} exited with code {}, signal {}", id, status.code(), status.signal());
      broadcast(ChannelResponse.failure(
          new ResponseData(id, null, pidOf(this.session), null, null),
          "Terminal " + id + " exited with code " + status.code() + ", signal " + status.signal()));
      if (sessions.get(id) == this.session) {
        sessions.remove(id);
      }
      throttle.forget(id);
    }
  }
}
