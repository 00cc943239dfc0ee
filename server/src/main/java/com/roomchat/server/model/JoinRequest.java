package com.roomchat.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

/**
 * {@code join} and {@code switch_room} frames.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JoinRequest implements InboundEvent {
    @NotBlank
    public String username;

    // blank means the default room
    public String room;
}
