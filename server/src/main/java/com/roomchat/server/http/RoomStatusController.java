package com.roomchat.server.http;

import com.roomchat.server.model.RoomSnapshot;
import com.roomchat.server.room.RoomManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the rooms, for operators.
 */
@RestController
@RequestMapping("/api")
public class RoomStatusController {
    private static final Logger log = LoggerFactory.getLogger(RoomStatusController.class);

    private final RoomManager roomManager;

    public RoomStatusController(RoomManager roomManager) {
        this.roomManager = roomManager;
    }

    @GetMapping("/rooms")
    public List<RoomSnapshot> rooms() {
        List<RoomSnapshot> rooms = roomManager.snapshot();
        log.debug("[STATUS] rooms={} connections={}", rooms.size(), roomManager.connectionCount());
        return rooms;
    }
}
