package com.hatcherdx.terminal.session;

import java.util.Locale;

/**
 * Host operating system family.
 *
 * @since 1.0
 */
public enum Platform {
  WINDOWS,
  MAC,
  UNIX;

  /**
   * Maps an {@code os.name} value to a platform.
   *
   * @param osName operating system name (may be null)
   * @return platform, {@link #UNIX} when unknown
   */
  public static Platform detect(final String osName) {
    if (osName == null) {
      return UNIX;
    }
    final String name = osName.toLowerCase(Locale.ROOT);
    if (name.startsWith("windows")) {
      return WINDOWS;
    }
    if (name.contains("mac") || name.contains("darwin")) {
      return MAC;
    }
    return UNIX;
  }

  public boolean isUnixLike() {
    return this != WINDOWS;
  }
}
