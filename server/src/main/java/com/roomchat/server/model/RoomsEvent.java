package com.roomchat.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"type", "rooms"})
public record RoomsEvent(List<String> rooms) implements ServerEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "rooms";
    }
}
