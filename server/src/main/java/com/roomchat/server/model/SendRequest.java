package com.roomchat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

/**
 * {@code message} frame. {@code room} and {@code username} are carried by the client but the
 * server uses the identity it tracks for the connection.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendRequest implements InboundEvent {
    public String room;

    public String username;

    @NotBlank
    public String text;
}
