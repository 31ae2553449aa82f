package com.hatcherdx.terminal.loop;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered observer list used by every component to publish its fixed event set.
 *
 * <p>Listeners are notified in registration order. A listener that throws is logged and skipped
 * so one faulty subscriber cannot break delivery to the others or unwind the event loop.
 *
 * @param <L> listener type
 * @since 1.0
 */
public final class ListenerList<L> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ListenerList.class);

  private final List<L> listeners = new CopyOnWriteArrayList<>();

  public void add(final L listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public boolean remove(final L listener) {
    return this.listeners.remove(listener);
  }

  public void clear() {
    this.listeners.clear();
  }

  public int size() {
    return this.listeners.size();
  }

  /**
   * Delivers an event to every registered listener.
   *
   * @param event callback invoked once per listener
   */
  public void fire(final Consumer<? super L> event) {
    for (final L listener : this.listeners) {
      try {
        event.accept(listener);
      } catch (final RuntimeException e) {
        LOGGER.warn("Listener {} failed: {}", listener.getClass().getName(), e.getMessage(), e);
      }
    }
  }
}
