package com.roomchat.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "message"})
public record MessageEvent(ChatMessage message) implements ServerEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "message";
    }
}
