package com.hatcherdx.terminal.loop;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Virtual-clock {@link EventLoop} for tests. Nothing runs until the test calls
 * {@link #runPending()} or {@link #advance(long)}.
 *
 * <p>{@link #execute(Runnable)} may be called from any thread; tasks always run on the thread
 * that drives the loop.
 */
public final class ManualEventLoop implements EventLoop {

  public static final long START_MILLIS = 1_700_000_000_000L;

  private final Object lock = new Object();
  private final PriorityQueue<Entry> queue = new PriorityQueue<>(
      Comparator.comparingLong((Entry e) -> e.dueAt).thenComparingLong(e -> e.sequence));
  private final List<Long> oneShotDelays = new ArrayList<>();
  private long now = START_MILLIS;
  private long sequence;

  @Override
  public void execute(final Runnable task) {
    enqueue(task, 0L, 0L);
  }

  @Override
  public ScheduledTask schedule(final Runnable task, final long delayMillis) {
    synchronized (this.lock) {
      this.oneShotDelays.add(delayMillis);
    }
    return enqueue(task, delayMillis, 0L);
  }

  @Override
  public ScheduledTask scheduleAtFixedRate(final Runnable task, final long initialDelayMillis, final long periodMillis) {
    return enqueue(task, initialDelayMillis, periodMillis);
  }

  @Override
  public long currentTimeMillis() {
    synchronized (this.lock) {
      return this.now;
    }
  }

  /**
   * Runs every task that is due at the current virtual time, including tasks they queue.
   */
  public void runPending() {
    runUntil(currentTimeMillis());
  }

  /**
   * Moves the clock forward, running tasks in due order at their due times.
   *
   * @param millis time to advance
   */
  public void advance(final long millis) {
    runUntil(currentTimeMillis() + millis);
  }

  /**
   * Delays passed to {@link #schedule(Runnable, long)}, in call order.
   *
   * @return copy of the recorded delays
   */
  public List<Long> oneShotDelays() {
    synchronized (this.lock) {
      return List.copyOf(this.oneShotDelays);
    }
  }

  /**
   * Counts tasks that are neither cancelled nor finished.
   *
   * @return live task count
   */
  public int liveTaskCount() {
    synchronized (this.lock) {
      int count = 0;
      for (final Entry entry : this.queue) {
        if (!entry.cancelled) {
          count++;
        }
      }
      return count;
    }
  }

  private void runUntil(final long target) {
    while (true) {
      final Entry entry;
      synchronized (this.lock) {
        final Entry head = this.queue.peek();
        if (head == null || head.dueAt > target) {
          this.now = Math.max(this.now, target);
          return;
        }
        entry = this.queue.poll();
        this.now = Math.max(this.now, entry.dueAt);
      }
      if (entry.cancelled) {
        continue;
      }
      entry.task.run();
      synchronized (this.lock) {
        if (entry.period > 0 && !entry.cancelled) {
          entry.dueAt += entry.period;
          entry.sequence = this.sequence++;
          this.queue.add(entry);
        } else {
          entry.done = true;
        }
      }
    }
  }

  private Entry enqueue(final Runnable task, final long delayMillis, final long periodMillis) {
    synchronized (this.lock) {
      final Entry entry = new Entry(task, this.now + delayMillis, periodMillis, this.sequence++);
      this.queue.add(entry);
      return entry;
    }
  }

  private final class Entry implements ScheduledTask {

    private final Runnable task;
    private final long period;
    private long dueAt;
    private long sequence;
    private volatile boolean cancelled;
    private volatile boolean done;

    private Entry(final Runnable task, final long dueAt, final long period, final long sequence) {
      this.task = task;
      this.dueAt = dueAt;
      this.period = period;
      this.sequence = sequence;
    }

    @Override
    public boolean cancel() {
      synchronized (lock) {
        if (this.cancelled || this.done) {
          return false;
        }
        this.cancelled = true;
        queue.remove(this);
        return true;
      }
    }

    @Override
    public boolean isCancelled() {
      return this.cancelled;
    }

    @Override
    public boolean isDone() {
      return this.done || this.cancelled;
    }
  }
}
