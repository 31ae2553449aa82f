package com.hatcherdx.terminal.host;

import com.hatcherdx.terminal.loop.EventLoop;
import com.hatcherdx.terminal.session.TerminalSession;
import com.hatcherdx.terminal.session.TerminalSessionOptions;
import org.apache.commons.lang3.Validate;

/**
 * Creates sessions on one event loop, querying the running JVM for the host environment and
 * launching through the backend named in the options.
 */
public final class DefaultTerminalSessionFactory implements TerminalSessionFactory {

  private final EventLoop loop;

  public DefaultTerminalSessionFactory(final EventLoop loop) {
    Validate.notNull(loop, "loop must not be null");
    this.loop = loop;
  }

  @Override
  public TerminalSession create(final String id, final TerminalSessionOptions options) {
    return new TerminalSession(id, options, this.loop);
  }
}
