package com.hatcherdx.terminal.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to one launched shell process.
 *
 * <p>Implementations must provide:
 * - writable stdin and readable stdout/stderr (a stream may be null when the backend could not
 *   set it up)
 * - resize and termination signals
 * - exit monitoring
 *
 * @since 1.0
 */
public interface ShellProcessController extends AutoCloseable {

  InputStream getStdout() throws Exception;

  InputStream getStderr() throws Exception;

  OutputStream getStdin() throws Exception;

  /**
   * Notifies the process that the terminal geometry changed.
   *
   * @param columns new column count
   * @param rows new row count
   * @throws Exception if the notification cannot be delivered
   */
  void resize(final int columns, final int rows) throws Exception;

  /**
   * Requests termination.
   *
   * @param forcibly false for a graceful request (SIGTERM), true for a forceful one (SIGKILL)
   * @throws Exception if the signal cannot be delivered
   */
  void terminate(final boolean forcibly) throws Exception;

  /**
   * Completes with the raw exit code once the process has terminated.
   *
   * @return exit future
   * @throws Exception if exit monitoring is unavailable
   */
  CompletableFuture<Integer> onExit() throws Exception;

  long pid() throws Exception;

  boolean isAlive() throws Exception;

  @Override
  void close() throws Exception;
}
