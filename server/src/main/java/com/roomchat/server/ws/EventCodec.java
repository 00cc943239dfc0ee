package com.roomchat.server.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.server.model.InboundEvent;
import com.roomchat.server.model.JoinRequest;
import com.roomchat.server.model.SendRequest;
import com.roomchat.server.model.ServerEvent;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.util.Set;

/**
 * JSON wire format of the chat endpoint.
 *
 * <p>Inbound frames are discriminated by {@code type}:
 * {@code join} and {@code switch_room} decode to {@link JoinRequest}, {@code message} to
 * {@link SendRequest}. Anything else (non-JSON, unknown type, failed validation) decodes to
 * {@code null} and is logged.
 */
@Component
public class EventCodec {
    private static final Logger log = LoggerFactory.getLogger(EventCodec.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    public InboundEvent decode(String payload) {
        JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[WARN] invalid json: {}", e.getOriginalMessage());
            return null;
        }
        if (node == null || !node.isObject()) {
            log.warn("[WARN] frame is not a json object");
            return null;
        }

        String type = node.path("type").asText("");
        InboundEvent event;
        try {
            event = switch (type) {
                case "join", "switch_room" -> mapper.treeToValue(node, JoinRequest.class);
                case "message" -> mapper.treeToValue(node, SendRequest.class);
                default -> null;
            };
        } catch (JsonProcessingException e) {
            log.warn("[WARN] cannot bind type={}: {}", type, e.getOriginalMessage());
            return null;
        }
        if (event == null) {
            log.warn("[WARN] ignoring unknown type={}", type);
            return null;
        }

        Set<ConstraintViolation<InboundEvent>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            log.warn("[WARN] validation failed type={}: {}", type, violations);
            return null;
        }
        return event;
    }

    public TextMessage encode(ServerEvent event) {
        try {
            return new TextMessage(mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + event.type() + " event", e);
        }
    }
}
