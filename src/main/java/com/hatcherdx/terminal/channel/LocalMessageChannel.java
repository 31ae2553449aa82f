package com.hatcherdx.terminal.channel;

import com.hatcherdx.terminal.loop.EventLoop;
import com.hatcherdx.terminal.loop.ListenerList;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process pair of linked {@link MessageEndpoint}s.
 *
 * <p>Delivery is asynchronous: a post queues the message on the event loop, so a sender never
 * re-enters the receiver. Close notifications are also dispatched through the loop.
 *
 * @since 1.0
 */
public final class LocalMessageChannel {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalMessageChannel.class);

  private final Port port1;
  private final Port port2;

  public LocalMessageChannel(final EventLoop loop, final String name) {
    Validate.notNull(loop, "loop must not be null");
    Validate.notBlank(name, "name must not be blank");
    this.port1 = new Port(loop, name + "#1");
    this.port2 = new Port(loop, name + "#2");
    this.port1.peer = this.port2;
    this.port2.peer = this.port1;
  }

  public MessageEndpoint port1() {
    return this.port1;
  }

  public MessageEndpoint port2() {
    return this.port2;
  }

  private static final class Port implements MessageEndpoint {

    private final EventLoop loop;
    private final String name;
    private final ListenerList<Consumer<String>> messageListeners = new ListenerList<>();
    private final ListenerList<Runnable> closeListeners = new ListenerList<>();
    private final Deque<String> held = new ArrayDeque<>();
    private Port peer;
    private volatile boolean started;
    private volatile boolean closed;

    private Port(final EventLoop loop, final String name) {
      this.loop = loop;
      this.name = name;
    }

    @Override
    public void start() {
      if (this.closed || this.started) {
        return;
      }
      this.started = true;
      // Held messages were queued on the loop earlier, so draining them keeps arrival order.
      this.loop.execute(() -> {
        while (!this.closed && !this.held.isEmpty()) {
          dispatch(this.held.pollFirst());
        }
      });
    }

    @Override
    public void post(final String message) throws IOException {
      Validate.notNull(message, "message must not be null");
      if (this.closed || this.peer.closed) {
        throw new IOException("Port " + this.name + " is closed");
      }
      this.loop.execute(() -> this.peer.receive(message));
    }

    @Override
    public void addMessageListener(final Consumer<String> listener) {
      this.messageListeners.add(listener);
    }

    @Override
    public void addCloseListener(final Runnable listener) {
      this.closeListeners.add(listener);
    }

    @Override
    public void close() {
      if (this.closed) {
        return;
      }
      this.closed = true;
      LOGGER.debug("Port {} closed", this.name);
      this.loop.execute(() -> {
        this.held.clear();
        this.closeListeners.fire(Runnable::run);
      });
      this.peer.close();
    }

    @Override
    public boolean isClosed() {
      return this.closed;
    }

    private void receive(final String message) {
      if (this.closed) {
        return;
      }
      if (!this.started || !this.held.isEmpty()) {
        this.held.addLast(message);
        return;
      }
      dispatch(message);
    }

    private void dispatch(final String message) {
      this.messageListeners.fire(listener -> listener.accept(message));
    }
  }
}
