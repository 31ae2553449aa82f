package com.hatcherdx.terminal.loop;

/**
 * Handle to a deferred or periodic task scheduled on an {@link EventLoop}.
 *
 * @since 1.0
 */
public interface ScheduledTask {

  /**
   * Cancels the task if it has not run yet (or stops a periodic task).
   *
   * @return true if this call cancelled the task
   */
  boolean cancel();

  boolean isCancelled();

  /**
   * Returns true once a one-shot task has run or the task was cancelled.
   *
   * @return true if done
   */
  boolean isDone();
}
