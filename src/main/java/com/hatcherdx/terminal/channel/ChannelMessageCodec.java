package com.hatcherdx.terminal.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON text codec for channel frames. Thread-safe.
 *
 * @since 1.0
 */
public final class ChannelMessageCodec {

  private final ObjectMapper objectMapper;

  public ChannelMessageCodec() {
    this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
  }

  public ChannelMessageCodec(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encodeRequest(final ChannelRequest request) throws ChannelException {
    return write(request, "request");
  }

  public ChannelRequest decodeRequest(final String frame) throws ChannelException {
    return read(frame, ChannelRequest.class, "request");
  }

  public String encodeResponse(final ChannelResponse response) throws ChannelException {
    return write(response, "response");
  }

  public ChannelResponse decodeResponse(final String frame) throws ChannelException {
    return read(frame, ChannelResponse.class, "response");
  }

  private String write(final Object value, final String kind) throws ChannelException {
    try {
      return this.objectMapper.writeValueAsString(value);
    } catch (final JsonProcessingException e) {
      throw new ChannelException("Failed to encode " + kind + ": " + e.getOriginalMessage(), e);
    }
  }

  private <T> T read(final String frame, final Class<T> type, final String kind) throws ChannelException {
    if (frame == null || frame.isEmpty()) {
      throw new ChannelException("Empty " + kind + " frame");
    }
    try {
      return this.objectMapper.readValue(frame, type);
    } catch (final JsonProcessingException e) {
      throw new ChannelException("Failed to decode " + kind + ": " + e.getOriginalMessage(), e);
    }
  }
}
