package com.roomchat.server.ws;

import com.roomchat.server.model.InboundEvent;
import com.roomchat.server.model.JoinRequest;
import com.roomchat.server.model.SendRequest;
import com.roomchat.server.room.Connection;
import com.roomchat.server.room.RoomManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * - open: outbox + register with RoomManager
 * - text frame: join / switch_room / message
 * - error or close: disconnect
 */
@Component
public class ChatHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatHandler.class);

    private final RoomManager roomManager;
    private final EventCodec codec;
    private final Executor outboundExecutor;
    private final int maxPending;
    private final long sendTimeLimitMs;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, SessionOutbox> outboxes = new ConcurrentHashMap<>();

    public ChatHandler(RoomManager roomManager,
                       EventCodec codec,
                       @Qualifier("outboundExecutor") Executor outboundExecutor,
                       @Value("${roomchat.outbox.max-pending:1000}") int maxPending,
                       @Value("${roomchat.outbox.send-time-limit-ms:5000}") long sendTimeLimitMs) {
        this.roomManager = roomManager;
        this.codec = codec;
        this.outboundExecutor = outboundExecutor;
        this.maxPending = maxPending;
        this.sendTimeLimitMs = sendTimeLimitMs;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        SessionOutbox outbox = new SessionOutbox(session, codec, outboundExecutor, maxPending, sendTimeLimitMs);
        Connection conn = new Connection(session.getId(), outbox);
        outbox.onFailure(() -> disconnect(session.getId()));

        outboxes.put(session.getId(), outbox);
        connections.put(session.getId(), conn);
        roomManager.register(conn);
        log.info("[OPEN] conn={} remote={} total={}", session.getId(), session.getRemoteAddress(), connections.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Connection conn = connections.get(session.getId());
        if (conn == null) {
            log.debug("[DROP] frame for unknown conn={}", session.getId());
            return;
        }

        InboundEvent event = codec.decode(message.getPayload());
        if (event instanceof JoinRequest join) {
            String room = join.room == null ? null : join.room.trim();
            roomManager.join(conn, join.username.trim(), room);
        } else if (event instanceof SendRequest send) {
            roomManager.send(conn, send.text.trim());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WARN] transport error conn={}: {}", session.getId(), exception.toString());
        disconnect(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        disconnect(session.getId());
        log.info("[CLOSED] conn={} status={}", session.getId(), status);
    }

    /**
     * Fails every outbox whose current send is over the time limit.
     *
     * @return number of sessions given up on
     */
    public int expireStalledSends() {
        int expired = 0;
        for (SessionOutbox outbox : outboxes.values()) {
            if (outbox.checkSendTimeout()) {
                expired++;
            }
        }
        return expired;
    }

    int openConnections() {
        return connections.size();
    }

    private void disconnect(String sessionId) {
        outboxes.remove(sessionId);
        Connection conn = connections.remove(sessionId);
        if (conn != null) {
            roomManager.disconnect(conn);
        }
    }
}
