package com.roomchat.server.room;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named group of connections with a shared history. Not thread-safe; guarded by
 * {@link RoomManager}.
 */
public class Room {

    private final String name;
    private final Set<Connection> members = new LinkedHashSet<>();
    private final MessageHistory history;

    Room(String name, int historyLimit) {
        this.name = name;
        this.history = new MessageHistory(historyLimit);
    }

    public String name() {
        return name;
    }

    boolean add(Connection conn) {
        return members.add(conn);
    }

    boolean remove(Connection conn) {
        return members.remove(conn);
    }

    boolean contains(Connection conn) {
        return members.contains(conn);
    }

    /** Members in join order. */
    List<Connection> members() {
        return List.copyOf(members);
    }

    List<String> usernames() {
        return members.stream().map(Connection::username).toList();
    }

    MessageHistory history() {
        return history;
    }
}
