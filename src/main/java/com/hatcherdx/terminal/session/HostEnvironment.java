package com.hatcherdx.terminal.session;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host facts a session needs: platform, environment variables, working directory, and the host
 * and user names shown in the initial banner.
 *
 * @param platform operating system family
 * @param variables environment variables
 * @param workingDirectory current working directory
 * @param hostName host name
 * @param userName user name
 * @since 1.0
 */
public record HostEnvironment(
    Platform platform,
    Map<String, String> variables,
    Path workingDirectory,
    String hostName,
    String userName) {

  private static final Logger LOGGER = LoggerFactory.getLogger(HostEnvironment.class);

  public HostEnvironment {
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }

  /**
   * Queries the running JVM.
   *
   * @return environment of this process
   */
  public static HostEnvironment current() {
    return new HostEnvironment(
        Platform.detect(System.getProperty("os.name")),
        System.getenv(),
        Path.of("").toAbsolutePath().normalize(),
        localHostName(),
        System.getProperty("user.name", "user"));
  }

  /**
   * Returns an environment variable.
   *
   * @param name variable name
   * @return value, or null when unset
   */
  public String variable(final String name) {
    return this.variables.get(name);
  }

  private static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (final UnknownHostException e) {
      LOGGER.debug("Host name lookup failed: {}", e.getMessage());
      return "localhost";
    }
  }
}
