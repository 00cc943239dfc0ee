package com.roomchat.server.room;

import com.roomchat.server.model.ServerEvent;

/**
 * Outbound side of a connection.
 *
 * <p>Called from inside the {@link RoomManager} critical section, so implementations must only
 * enqueue: no blocking I/O and no calls back into the manager on the calling thread.
 */
public interface EventSink {

    void deliver(ServerEvent event);
}
