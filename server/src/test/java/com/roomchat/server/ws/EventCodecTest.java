package com.roomchat.server.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.server.model.ChatMessage;
import com.roomchat.server.model.InitEvent;
import com.roomchat.server.model.InboundEvent;
import com.roomchat.server.model.JoinRequest;
import com.roomchat.server.model.MessageEvent;
import com.roomchat.server.model.RoomsEvent;
import com.roomchat.server.model.SendRequest;
import com.roomchat.server.model.SystemEvent;
import com.roomchat.server.model.UsersEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventCodecTest {

    private final EventCodec codec = new EventCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void decodesJoin() {
        InboundEvent event = codec.decode("{\"type\":\"join\",\"username\":\"alice\",\"room\":\"general\"}");

        assertThat(event).isInstanceOf(JoinRequest.class);
        JoinRequest join = (JoinRequest) event;
        assertThat(join.username).isEqualTo("alice");
        assertThat(join.room).isEqualTo("general");
    }

    @Test
    void decodesSwitchRoomAsJoin() {
        InboundEvent event = codec.decode("{\"type\":\"switch_room\",\"username\":\"alice\",\"room\":\"team\"}");

        assertThat(event).isInstanceOf(JoinRequest.class);
        assertThat(((JoinRequest) event).room).isEqualTo("team");
    }

    @Test
    void joinWithoutRoomIsAccepted() {
        InboundEvent event = codec.decode("{\"type\":\"join\",\"username\":\"alice\"}");

        assertThat(event).isInstanceOf(JoinRequest.class);
        assertThat(((JoinRequest) event).room).isNull();
    }

    @Test
    void decodesMessageAndIgnoresExtraFields() {
        InboundEvent event = codec.decode(
                "{\"type\":\"message\",\"room\":\"general\",\"username\":\"alice\",\"text\":\"hi\",\"extra\":1}");

        assertThat(event).isInstanceOf(SendRequest.class);
        assertThat(((SendRequest) event).text).isEqualTo("hi");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "",
            "[1,2,3]",
            "\"join\"",
            "{\"username\":\"alice\"}",
            "{\"type\":\"dance\",\"username\":\"alice\"}",
            "{\"type\":\"join\",\"username\":\"   \"}",
            "{\"type\":\"join\",\"room\":\"general\"}",
            "{\"type\":\"join\",\"username\":{\"first\":\"alice\"}}",
            "{\"type\":\"message\",\"text\":\"\"}",
            "{\"type\":\"message\",\"room\":\"general\"}"
    })
    void dropsFramesItCannotUse(String payload) {
        assertThat(codec.decode(payload)).isNull();
    }

    @Test
    void encodesInitWithExactFieldNames() throws Exception {
        String json = codec.encode(new InitEvent("general", List.of("general"), List.of("alice"),
                List.of(new ChatMessage("alice", "hi")))).getPayload();

        assertThat(mapper.readTree(json)).isEqualTo(mapper.readTree(
                "{\"type\":\"init\",\"room\":\"general\",\"rooms\":[\"general\"],\"users\":[\"alice\"],"
                        + "\"messages\":[{\"username\":\"alice\",\"text\":\"hi\"}]}"));
    }

    @Test
    void encodesBroadcastEvents() throws Exception {
        assertThat(mapper.readTree(codec.encode(new RoomsEvent(List.of("general", "team"))).getPayload()))
                .isEqualTo(mapper.readTree("{\"type\":\"rooms\",\"rooms\":[\"general\",\"team\"]}"));
        assertThat(mapper.readTree(codec.encode(new UsersEvent(List.of("alice", "bob"))).getPayload()))
                .isEqualTo(mapper.readTree("{\"type\":\"users\",\"users\":[\"alice\",\"bob\"]}"));
        assertThat(mapper.readTree(codec.encode(new MessageEvent(new ChatMessage("alice", "hi"))).getPayload()))
                .isEqualTo(mapper.readTree("{\"type\":\"message\",\"message\":{\"username\":\"alice\",\"text\":\"hi\"}}"));
        assertThat(mapper.readTree(codec.encode(new SystemEvent("bob joined the room")).getPayload()))
                .isEqualTo(mapper.readTree("{\"type\":\"system\",\"message\":\"bob joined the room\"}"));
    }

    @Test
    void typeComesFirstOnTheWire() {
        String json = codec.encode(new SystemEvent("x")).getPayload();

        assertThat(json).startsWith("{\"type\":\"system\"");
    }
}
