package com.roomchat.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Full snapshot sent only to the connection that just joined {@code room}.
 */
@JsonPropertyOrder({"type", "room", "rooms", "users", "messages"})
public record InitEvent(String room, List<String> rooms, List<String> users, List<ChatMessage> messages)
        implements ServerEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "init";
    }
}
