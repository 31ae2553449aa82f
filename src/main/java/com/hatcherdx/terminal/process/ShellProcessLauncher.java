package com.hatcherdx.terminal.process;

/**
 * Process-spawning primitive used by terminal sessions.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ShellProcessLauncher {

  /**
   * Launches a process.
   *
   * @param config launch configuration
   * @return controller for the running process
   * @throws Exception if the process cannot be started
   */
  ShellProcessController launch(final ShellProcessConfig config) throws Exception;
}
