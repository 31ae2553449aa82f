package com.hatcherdx.terminal.channel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a {@code list} response.
 *
 * @param id terminal id
 * @param name display name
 * @param pid process id, null when not spawned
 * @param active whether the session is running
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TerminalSummary(
    String id,
    String name,
    Long pid,
    @JsonProperty("isActive") boolean active) {
}
