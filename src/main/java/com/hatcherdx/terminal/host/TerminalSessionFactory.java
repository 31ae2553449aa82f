package com.hatcherdx.terminal.host;

import com.hatcherdx.terminal.session.TerminalSession;
import com.hatcherdx.terminal.session.TerminalSessionOptions;

/**
 * Creates the sessions a {@link TerminalHost} owns.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface TerminalSessionFactory {

  /**
   * Creates an unspawned session.
   *
   * @param id terminal id
   * @param options session options
   * @return new session
   */
  TerminalSession create(String id, TerminalSessionOptions options);
}
