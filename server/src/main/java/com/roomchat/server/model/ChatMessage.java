package com.roomchat.server.model;

/**
 * One entry of a room's history. The username is the sender's name at the time of sending.
 */
public record ChatMessage(String username, String text) {
}
