package com.roomchat.server.room;

import com.roomchat.server.model.ServerEvent;

import java.util.Objects;

/**
 * One live client. State is only changed by {@link RoomManager} while holding its lock.
 */
public class Connection {

    private final String id;
    private final EventSink sink;

    private String username = "";
    private String currentRoom;
    private boolean closed;

    public Connection(String id, EventSink sink) {
        this.id = Objects.requireNonNull(id, "id");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public String id() {
        return id;
    }

    public synchronized String username() {
        return username;
    }

    /**
     * @return the joined room's name, or {@code null} when not in a room
     */
    public synchronized String currentRoom() {
        return currentRoom;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    void deliver(ServerEvent event) {
        sink.deliver(event);
    }

    synchronized void attach(String username, String room) {
        this.username = username;
        this.currentRoom = room;
    }

    synchronized void detach() {
        this.currentRoom = null;
    }

    synchronized void markClosed() {
        this.closed = true;
    }

    @Override
    public String toString() {
        return "Connection[" + id + "]";
    }
}
