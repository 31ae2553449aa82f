package com.hatcherdx.terminal.loop;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventLoop} backed by a single daemon thread.
 *
 * <p>Every task is guarded: an exception thrown by a callback is logged and the loop keeps
 * running.
 *
 * @since 1.0
 */
public final class ExecutorEventLoop implements EventLoop, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorEventLoop.class);

  private final ScheduledThreadPoolExecutor executor;

  /**
   * Creates a loop whose thread carries the given name.
   *
   * @param threadName loop thread name
   */
  public ExecutorEventLoop(final String threadName) {
    Validate.notBlank(threadName, "threadName must not be blank");
    this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
      final Thread thread = new Thread(runnable, threadName);
      thread.setDaemon(true);
      return thread;
    });
    this.executor.setRemoveOnCancelPolicy(true);
  }

  @Override
  public void execute(final Runnable task) {
    this.executor.execute(guard(task));
  }

  @Override
  public ScheduledTask schedule(final Runnable task, final long delayMillis) {
    return new FutureTask(this.executor.schedule(guard(task), delayMillis, TimeUnit.MILLISECONDS));
  }

  @Override
  public ScheduledTask scheduleAtFixedRate(final Runnable task, final long initialDelayMillis, final long periodMillis) {
    return new FutureTask(this.executor.scheduleAtFixedRate(
        guard(task), initialDelayMillis, periodMillis, TimeUnit.MILLISECONDS));
  }

  @Override
  public long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public void close() {
    this.executor.shutdownNow();
  }

  private static Runnable guard(final Runnable task) {
    Validate.notNull(task, "task must not be null");
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException e) {
        LOGGER.error("Event loop task failed: {}", e.getMessage(), e);
      }
    };
  }

  private static final class FutureTask implements ScheduledTask {

    private final ScheduledFuture<?> future;

    private FutureTask(final ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public boolean cancel() {
      return this.future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return this.future.isCancelled();
    }

    @Override
    public boolean isDone() {
      return this.future.isDone();
    }
  }
}
