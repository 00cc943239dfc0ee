package com.roomchat.server.room;

import com.roomchat.server.model.ServerEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Sink that keeps everything delivered to it.
 */
class RecordingSink implements EventSink {

    private final List<ServerEvent> events = new ArrayList<>();

    @Override
    public synchronized void deliver(ServerEvent event) {
        events.add(event);
    }

    synchronized List<ServerEvent> events() {
        return List.copyOf(events);
    }

    synchronized <T extends ServerEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    synchronized ServerEvent last() {
        return events.get(events.size() - 1);
    }

    synchronized void clear() {
        events.clear();
    }
}
