package com.hatcherdx.terminal.session;

import java.util.Locale;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Picks the shell a session launches when none was requested.
 *
 * <p>Windows: PowerShell when COMSPEC points at it, otherwise COMSPEC, otherwise cmd.exe.
 * Unix-like: SHELL when set, otherwise zsh on macOS and bash elsewhere.
 *
 * @since 1.0
 */
public final class ShellResolver {

  static final String POWERSHELL = "powershell.exe";
  static final String WINDOWS_FALLBACK = "cmd.exe";
  static final String MAC_DEFAULT = "/bin/zsh";
  static final String UNIX_DEFAULT = "/bin/bash";

  private ShellResolver() {
  }

  public static String resolve(final HostEnvironment host) {
    Validate.notNull(host, "host must not be null");

    if (host.platform() == Platform.WINDOWS) {
      final String comspec = host.variable("COMSPEC");
      if (StringUtils.isBlank(comspec)) {
        return WINDOWS_FALLBACK;
      }
      if (comspec.toLowerCase(Locale.ROOT).contains("powershell")) {
        return POWERSHELL;
      }
      return comspec;
    }

    final String shell = host.variable("SHELL");
    if (StringUtils.isNotBlank(shell)) {
      return shell;
    }
    return host.platform() == Platform.MAC ? MAC_DEFAULT : UNIX_DEFAULT;
  }
}
