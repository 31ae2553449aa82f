package com.hatcherdx.terminal.buffer;

import com.hatcherdx.terminal.loop.EventLoop;
import com.hatcherdx.terminal.loop.ListenerList;
import com.hatcherdx.terminal.loop.ScheduledTask;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalescing output buffer that sits between a subprocess and its consumers.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Writes are stored as timestamped chunks; nothing is delivered synchronously.</li>
 * <li>A flush timer (and a full batch) concatenates up to {@code maxChunksPerFlush} oldest chunks
 * into one {@code dataReady} payload.</li>
 * <li>When pending bytes exceed {@code maxBufferSize}, oldest chunks are discarded down to
 * {@code dropThreshold × maxBufferSize} and a {@code chunksDropped} event reports the loss.</li>
 * <li>Pausing suspends delivery only; writes and drops continue.</li>
 * </ul>
 * </p>
 *
 * <p>Instances are confined to their {@link EventLoop}.
 */
public final class OutputBufferManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputBufferManager.class);

  static final double HIGH_UTILIZATION = 0.70;
  static final double DROPPED_WARNING_RATIO = 0.01;
  static final long STALLED_OUTPUT_MILLIS = 1000L;

  private final String sessionId;
  private final OutputBufferConfig config;
  private final EventLoop loop;
  private final ListenerList<OutputBufferListener> listeners = new ListenerList<>();

  private final Deque<OutputChunk> pending = new ArrayDeque<>();
  private long pendingBytes;
  private boolean paused;
  private boolean destroyed;
  private final ScheduledTask flushTimer;

  private long totalWrites;
  private long totalBytes;
  private long chunksWritten;
  private long chunksProcessed;
  private long bytesDelivered;
  private long flushCount;
  private long droppedChunks;
  private long lastFlushAt = -1L;

  /**
   * Creates a buffer and starts its flush timer.
   *
   * @param sessionId owning session id (used for logging)
   * @param config thresholds
   * @param loop loop that runs the flush timer
   * @throws IllegalArgumentException if the configuration is invalid
   */
  public OutputBufferManager(final String sessionId, final OutputBufferConfig config, final EventLoop loop) {
    Validate.notBlank(sessionId, "sessionId must not be blank");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(loop, "loop must not be null");
    Validate.isTrue(config.maxBufferSize() > 0, "maxBufferSize must be positive");
    Validate.isTrue(config.chunkSize() > 0, "chunkSize must be positive");
    Validate.isTrue(config.maxChunksPerFlush() > 0, "maxChunksPerFlush must be positive");
    Validate.isTrue(config.flushIntervalMillis() > 0, "flushIntervalMillis must be positive");
    Validate.isTrue(config.dropThreshold() > 0.0 && config.dropThreshold() <= 1.0,
        "dropThreshold must be in (0, 1]");

    this.sessionId = sessionId;
    this.config = config;
    this.loop = loop;
    this.flushTimer = loop.scheduleAtFixedRate(
        this::flush, config.flushIntervalMillis(), config.flushIntervalMillis());

    LOGGER.debug("Output buffer for {} initialized with {}", sessionId, config);
  }

  public void addListener(final OutputBufferListener listener) {
    this.listeners.add(listener);
  }

  public void removeListener(final OutputBufferListener listener) {
    this.listeners.remove(listener);
  }

  public OutputBufferConfig config() {
    return this.config;
  }

  public void write(final String text) {
    write(text, OutputSource.STDOUT);
  }

  /**
   * Appends output. Never throws and never blocks.
   *
   * @param text output text
   * @param source stream the text came from
   */
  public void write(final String text, final OutputSource source) {
    if (this.destroyed) {
      LOGGER.debug("Ignoring write to destroyed buffer of {}", this.sessionId);
      return;
    }
    if (text == null || text.isEmpty()) {
      return;
    }

    final long now = this.loop.currentTimeMillis();
    final OutputSource src = source != null ? source : OutputSource.STDOUT;
    this.totalWrites++;
    for (final String piece : split(text)) {
      final long size = piece.getBytes(StandardCharsets.UTF_8).length;
      this.pending.addLast(new OutputChunk(piece, size, now, src));
      this.pendingBytes += size;
      this.totalBytes += size;
      this.chunksWritten++;
    }

    if (this.pendingBytes > this.config.maxBufferSize()) {
      dropOldest();
    }
    if (!this.paused && this.pending.size() >= this.config.maxChunksPerFlush()) {
      flush();
    }
  }

  /**
   * Delivers up to {@code maxChunksPerFlush} oldest chunks as one payload. Does nothing while
   * paused, after destroy, or when nothing is pending.
   */
  public void flush() {
    if (this.destroyed || this.paused || this.pending.isEmpty()) {
      return;
    }

    final int count = Math.min(this.pending.size(), this.config.maxChunksPerFlush());
    final StringBuilder payload = new StringBuilder();
    long bytes = 0;
    for (int i = 0; i < count; i++) {
      final OutputChunk chunk = this.pending.removeFirst();
      payload.append(chunk.text());
      bytes += chunk.size();
    }

    this.pendingBytes -= bytes;
    this.chunksProcessed += count;
    this.bytesDelivered += bytes;
    this.flushCount++;
    this.lastFlushAt = this.loop.currentTimeMillis();

    final String data = payload.toString();
    this.listeners.fire(l -> l.onDataReady(data));
  }

  /**
   * Flushes batch after batch until nothing is pending (or delivery is paused).
   */
  public void drain() {
    while (!this.destroyed && !this.paused && !this.pending.isEmpty()) {
      flush();
    }
  }

  public void pause() {
    this.paused = true;
    LOGGER.debug("Output delivery paused for {}", this.sessionId);
  }

  public void resume() {
    this.paused = false;
    LOGGER.debug("Output delivery resumed for {}", this.sessionId);
  }

  public boolean isPaused() {
    return this.paused;
  }

  public boolean isDestroyed() {
    return this.destroyed;
  }

  /**
   * Cancels the flush timer, discards pending output and detaches listeners. Idempotent.
   */
  public void destroy() {
    if (this.destroyed) {
      return;
    }
    this.destroyed = true;
    this.flushTimer.cancel();
    this.pending.clear();
    this.pendingBytes = 0;
    this.listeners.clear();
    LOGGER.debug("Output buffer for {} destroyed", this.sessionId);
  }

  public BufferMetrics getMetrics() {
    final double average = this.chunksProcessed > 0 ? (double) this.bytesDelivered / this.chunksProcessed : 0.0;
    return new BufferMetrics(
        this.totalWrites,
        this.totalBytes,
        this.chunksProcessed,
        average,
        this.flushCount,
        this.droppedChunks,
        this.pending.size(),
        this.pendingBytes);
  }

  public BufferHealth getHealthStatus() {
    final long now = this.loop.currentTimeMillis();
    final double backpressure = Math.min(1.0, (double) this.pendingBytes / this.config.maxBufferSize());
    final double utilization = Math.min(1.0, (double) this.pending.size() / this.config.maxChunksPerFlush());
    final long sinceFlush = this.lastFlushAt < 0 ? 0L : now - this.lastFlushAt;

    final List<String> warnings = new ArrayList<>(4);
    if (backpressure >= HIGH_UTILIZATION) {
      warnings.add(String.format("Buffer utilization high: %.0f%%", backpressure * 100.0));
    }
    if (this.chunksWritten > 0 && (double) this.droppedChunks / this.chunksWritten > DROPPED_WARNING_RATIO) {
      warnings.add("Dropped " + this.droppedChunks + " of " + this.chunksWritten + " chunks");
    }
    if (!this.pending.isEmpty()) {
      if (this.paused) {
        warnings.add("Delivery paused with " + this.pending.size() + " chunks pending");
      } else {
        final long oldestAge = now - this.pending.peekFirst().timestamp();
        if (oldestAge > STALLED_OUTPUT_MILLIS) {
          warnings.add("Output pending for " + oldestAge + " ms");
        }
      }
    }

    final boolean healthy = backpressure <= this.config.dropThreshold() && warnings.isEmpty();
    return new BufferHealth(healthy, backpressure, utilization, sinceFlush, List.copyOf(warnings));
  }

  private void dropOldest() {
    final long target = (long) Math.floor(this.config.maxBufferSize() * this.config.dropThreshold());
    int count = 0;
    long bytes = 0;
    while (this.pendingBytes > target && !this.pending.isEmpty()) {
      final OutputChunk chunk = this.pending.removeFirst();
      this.pendingBytes -= chunk.size();
      bytes += chunk.size();
      count++;
    }
    this.droppedChunks += count;

    LOGGER.warn("Dropped {} chunks ({} bytes) for {} due to memory pressure", count, bytes, this.sessionId);
    final DroppedChunks dropped = new DroppedChunks(count, bytes, this.pending.size());
    this.listeners.fire(l -> l.onChunksDropped(dropped));
  }

  private List<String> split(final String text) {
    final int size = this.config.chunkSize();
    if (text.length() <= size) {
      return List.of(text);
    }
    final List<String> pieces = new ArrayList<>(text.length() / size + 1);
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(start + size, text.length());
      // Keep surrogate pairs together.
      if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
        end = end - 1 > start ? end - 1 : Math.min(end + 1, text.length());
      }
      pieces.add(text.substring(start, end));
      start = end;
    }
    return pieces;
  }
}
