package com.roomchat.server.room;

import com.roomchat.server.model.ChatMessage;
import com.roomchat.server.model.InitEvent;
import com.roomchat.server.model.MessageEvent;
import com.roomchat.server.model.RoomSnapshot;
import com.roomchat.server.model.RoomsEvent;
import com.roomchat.server.model.ServerEvent;
import com.roomchat.server.model.SystemEvent;
import com.roomchat.server.model.UsersEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rooms and their members, all changes under one lock:
 * - join / leave / send / disconnect are applied one at a time, events are queued in that order
 * - rooms are created on first join and never removed
 */
@Component
public class RoomManager {
    private static final Logger log = LoggerFactory.getLogger(RoomManager.class);

    private final String defaultRoom;
    private final int historyLimit;

    // insertion order doubles as room creation order
    private final Map<String, Room> rooms = new LinkedHashMap<>();
    private final Map<String, Connection> connections = new LinkedHashMap<>();

    public RoomManager(@Value("${roomchat.default-room:general}") String defaultRoom,
                       @Value("${roomchat.history-limit:100}") int historyLimit) {
        if (defaultRoom == null || defaultRoom.isBlank()) {
            throw new IllegalArgumentException("default room must not be blank");
        }
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("history limit must be positive: " + historyLimit);
        }
        this.defaultRoom = defaultRoom;
        this.historyLimit = historyLimit;
    }

    /**
     * Tracks a freshly accepted connection so it receives room list refreshes before it joins.
     */
    public synchronized void register(Connection conn) {
        Objects.requireNonNull(conn, "conn");
        if (conn.isClosed()) {
            return;
        }
        connections.putIfAbsent(conn.id(), conn);
    }

    /**
     * Moves {@code conn} into {@code roomName}, creating the room if needed. A blank room name
     * selects the default room. The caller receives an {@code init} snapshot; the old room (if any)
     * and the new room's other members are notified.
     */
    public synchronized void join(Connection conn, String username, String roomName) {
        Objects.requireNonNull(conn, "conn");
        if (conn.isClosed()) {
            log.debug("[DROP] join on closed conn={}", conn.id());
            return;
        }
        String target = (roomName == null || roomName.isBlank()) ? defaultRoom : roomName;
        connections.putIfAbsent(conn.id(), conn);

        Room current = roomOf(conn);
        if (current != null && current.name().equals(target)) {
            rejoin(conn, current, username);
            return;
        }
        if (current != null) {
            detach(conn, current);
        }

        Room room = rooms.get(target);
        boolean created = room == null;
        if (created) {
            room = new Room(target, historyLimit);
            rooms.put(target, room);
            log.info("[ROOM] created room={} total={}", target, rooms.size());
        }

        room.add(conn);
        conn.attach(username, target);

        if (created) {
            RoomsEvent refresh = new RoomsEvent(roomNamesLocked());
            for (Connection each : List.copyOf(connections.values())) {
                each.deliver(refresh);
            }
        }
        conn.deliver(initFor(room));
        broadcastExcept(room, conn, new UsersEvent(room.usernames()));
        broadcastExcept(room, conn, new SystemEvent(username + " joined the room"));
        log.info("[JOIN] room={} user={} conn={} members={}", target, username, conn.id(), room.members().size());
    }

    /**
     * Removes {@code conn} from its room. Does nothing when it is not in one.
     */
    public synchronized void leave(Connection conn) {
        Objects.requireNonNull(conn, "conn");
        Room room = roomOf(conn);
        if (room == null) {
            return;
        }
        detach(conn, room);
    }

    /**
     * Appends {@code text} to the sender's room history and broadcasts it to every member,
     * sender included. Does nothing when {@code conn} is not in a room.
     */
    public synchronized void send(Connection conn, String text) {
        Objects.requireNonNull(conn, "conn");
        Room room = roomOf(conn);
        if (room == null || conn.isClosed()) {
            log.debug("[DROP] send without room conn={}", conn.id());
            return;
        }
        ChatMessage message = new ChatMessage(conn.username(), text == null ? "" : text);
        room.history().append(message);
        broadcast(room, new MessageEvent(message));
        log.debug("[SEND] room={} user={} history={}", room.name(), message.username(), room.history().size());
    }

    /**
     * Leaves the current room and forgets the connection. Safe to call more than once.
     */
    public synchronized void disconnect(Connection conn) {
        Objects.requireNonNull(conn, "conn");
        conn.markClosed();
        leave(conn);
        if (connections.remove(conn.id(), conn)) {
            log.info("[CLOSE] conn={} remaining={}", conn.id(), connections.size());
        }
    }

    /** Room names in creation order. */
    public synchronized List<String> roomNames() {
        return roomNamesLocked();
    }

    public synchronized List<RoomSnapshot> snapshot() {
        List<RoomSnapshot> out = new ArrayList<>(rooms.size());
        for (Room room : rooms.values()) {
            out.add(new RoomSnapshot(room.name(), room.usernames(), room.history().size()));
        }
        return out;
    }

    public synchronized int connectionCount() {
        return connections.size();
    }

    private void rejoin(Connection conn, Room room, String username) {
        String previous = conn.username();
        conn.attach(username, room.name());
        conn.deliver(initFor(room));
        if (!Objects.equals(previous, username)) {
            broadcastExcept(room, conn, new UsersEvent(room.usernames()));
        }
        log.info("[JOIN] rejoin room={} user={} conn={}", room.name(), username, conn.id());
    }

    private void detach(Connection conn, Room room) {
        room.remove(conn);
        conn.detach();
        broadcast(room, new UsersEvent(room.usernames()));
        broadcast(room, new SystemEvent(conn.username() + " left the room"));
        log.info("[LEAVE] room={} user={} conn={} remaining={}",
                room.name(), conn.username(), conn.id(), room.members().size());
    }

    private Room roomOf(Connection conn) {
        String name = conn.currentRoom();
        if (name == null) {
            return null;
        }
        Room room = rooms.get(name);
        return room != null && room.contains(conn) ? room : null;
    }

    private InitEvent initFor(Room room) {
        return new InitEvent(room.name(), roomNamesLocked(), room.usernames(), room.history().snapshot());
    }

    private List<String> roomNamesLocked() {
        return List.copyOf(rooms.keySet());
    }

    private void broadcast(Room room, ServerEvent event) {
        for (Connection member : room.members()) {
            member.deliver(event);
        }
    }

    private void broadcastExcept(Room room, Connection excluded, ServerEvent event) {
        for (Connection member : room.members()) {
            if (member != excluded) {
                member.deliver(event);
            }
        }
    }
}
