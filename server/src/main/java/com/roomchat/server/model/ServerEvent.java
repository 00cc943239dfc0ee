package com.roomchat.server.model;

/**
 * Server to client frame. Implementations serialize their discriminator as {@code type}.
 */
public interface ServerEvent {

    String type();
}
