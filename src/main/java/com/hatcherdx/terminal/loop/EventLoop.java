package com.hatcherdx.terminal.loop;

/**
 * Single-threaded cooperative scheduler that drives terminal sessions, buffers and bridges.
 *
 * <p>All component logic runs as short, non-blocking callbacks on the loop. Background threads
 * (stream readers, exit monitors) never touch component state directly; they hand their results
 * over with {@link #execute(Runnable)}.
 *
 * @since 1.0
 */
public interface EventLoop {

  /**
   * Queues a task to run on the loop as soon as possible.
   *
   * @param task task to run
   */
  void execute(Runnable task);

  /**
   * Runs a task once after the given delay.
   *
   * @param task task to run
   * @param delayMillis delay in milliseconds
   * @return cancellable handle
   */
  ScheduledTask schedule(Runnable task, long delayMillis);

  /**
   * Runs a task periodically until cancelled.
   *
   * @param task task to run
   * @param initialDelayMillis delay before the first run
   * @param periodMillis period between runs
   * @return cancellable handle
   */
  ScheduledTask scheduleAtFixedRate(Runnable task, long initialDelayMillis, long periodMillis);

  /**
   * Returns the loop's notion of wall-clock time in epoch milliseconds.
   *
   * @return current time
   */
  long currentTimeMillis();
}
