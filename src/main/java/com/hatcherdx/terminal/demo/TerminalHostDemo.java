package com.hatcherdx.terminal.demo;

import com.hatcherdx.terminal.channel.ChannelBridgeListener;
import com.hatcherdx.terminal.channel.ChannelException;
import com.hatcherdx.terminal.channel.ChannelResponse;
import com.hatcherdx.terminal.channel.LocalEndpointConnector;
import com.hatcherdx.terminal.channel.SessionChannelBridge;
import com.hatcherdx.terminal.channel.TerminalOptions;
import com.hatcherdx.terminal.host.TerminalHost;
import com.hatcherdx.terminal.loop.ExecutorEventLoop;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal end-to-end demo: a bridge talks to an in-process terminal host, creates a shell,
 * types a command, prints the bridged output and tears everything down.
 *
 * @since 1.0
 */
public final class TerminalHostDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalHostDemo.class);

  private static final String CHANNEL_ID = "demo-terminal";

  private TerminalHostDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional command to type (defaults to an echo)
   * @throws Exception if the demo fails
   */
  public static void main(final String[] args) throws Exception {
    final String command = args.length > 0 ? String.join(" ", args) : "echo 'hello from the host'";

    try (ExecutorEventLoop loop = new ExecutorEventLoop("terminal-host-loop")) {
      final TerminalHost host = new TerminalHost(loop);
      final LocalEndpointConnector connector = new LocalEndpointConnector(
          loop,
          frontEnd -> frontEnd.start(),
          host::attach);
      final SessionChannelBridge bridge = new SessionChannelBridge(CHANNEL_ID, loop, connector);

      final CountDownLatch created = new CountDownLatch(1);
      final CountDownLatch exited = new CountDownLatch(1);
      bridge.addListener(new ChannelBridgeListener() {
        @Override
        public void onData(final String output) {
          System.out.print(output);
        }

        @Override
        public void onResponse(final ChannelResponse response) {
          if (response.requestId() != null && response.requestId().startsWith("create-")) {
            LOGGER.info("Create answered: success={} pid={}", response.success(),
                response.data() != null ? response.data().pid() : null);
            created.countDown();
          } else if (!response.success() && response.error() != null && response.error().contains("exited")) {
            LOGGER.info(response.error());
            exited.countDown();
          }
        }

        @Override
        public void onError(final Throwable error) {
          LOGGER.warn("Bridge error: {}", error.getMessage());
        }
      });

      loop.execute(() -> {
        try {
          bridge.initialize();
        } catch (final ChannelException e) {
          LOGGER.error("Bridge failed to connect: {}", e.getMessage());
          return;
        }
        bridge.createTerminal(new TerminalOptions("Demo", null, null, null));
      });

      if (!created.await(5, TimeUnit.SECONDS)) {
        LOGGER.error("Terminal was not created in time");
        return;
      }

      System.out.println("=== Bridged Output ===");
      loop.execute(() -> bridge.write(command + "\n"));
      Thread.sleep(1500L);

      loop.execute(bridge::kill);
      if (!exited.await(7, TimeUnit.SECONDS)) {
        LOGGER.warn("Terminal did not report exit in time");
      }
      System.out.println();
      System.out.println("=== End Bridged Output ===");

      final CountDownLatch done = new CountDownLatch(1);
      loop.execute(() -> {
        LOGGER.info("Final status: {}", bridge.getConnectionStatus());
        bridge.cleanup();
        host.shutdown();
        done.countDown();
      });
      done.await(2, TimeUnit.SECONDS);
      LOGGER.info("Demo completed");
    }
  }
}
