package com.roomchat.server.model;

/**
 * Marker for a decoded client frame.
 */
public interface InboundEvent {
}
