package com.roomchat.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Human readable join/leave notice.
 */
@JsonPropertyOrder({"type", "message"})
public record SystemEvent(String message) implements ServerEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "system";
    }
}
