package com.roomchat.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"type", "users"})
public record UsersEvent(List<String> users) implements ServerEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "users";
    }
}
