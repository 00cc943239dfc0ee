package com.roomchat.server.room;

import com.roomchat.server.model.ChatMessage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Fixed capacity message log. Appending to a full history evicts the oldest entry.
 */
public class MessageHistory {

    private final int capacity;
    private final Deque<ChatMessage> entries;

    public MessageHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("history capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public void append(ChatMessage message) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(message);
    }

    /** Oldest first. */
    public List<ChatMessage> snapshot() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
