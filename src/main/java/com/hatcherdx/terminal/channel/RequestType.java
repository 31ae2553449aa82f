package com.hatcherdx.terminal.channel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Operation carried by a {@link ChannelRequest}. Serialized in lower case.
 *
 * @since 1.0
 */
public enum RequestType {
  CREATE,
  WRITE,
  RESIZE,
  KILL,
  LIST,
  /** Reserved on the wire; not handled by the host. */
  DATA;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static RequestType fromWireName(final String value) {
    for (final RequestType type : values()) {
      if (type.wireName().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown request type: " + value);
  }
}
