package com.roomchat.server.model;

import java.util.List;

/**
 * Read-only view of a room for the status endpoint.
 */
public record RoomSnapshot(String name, List<String> users, int messageCount) {
}
