package com.roomchat.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoomChatServerApplication {
    private static final Logger log = LoggerFactory.getLogger(RoomChatServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RoomChatServerApplication.class, args);
        log.info("[BOOT] roomchat server started");
    }
}
