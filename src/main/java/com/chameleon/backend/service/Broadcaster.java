package com.chameleon.backend.service;

import com.chameleon.backend.dto.MessageType;
import com.chameleon.backend.dto.OutboundMessage;
import com.chameleon.backend.exception.ErrorCode;
import com.chameleon.backend.model.Connection;
import com.chameleon.backend.model.Room;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Set;

/**
 * Outbound delivery. {@link #broadcast} serializes a frame once and hands the same bytes to every
 * connection in the room; {@link #send} is for one recipient only.
 * Closed connections are skipped without complaint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Broadcaster {

    private final ConnectionRegistry connectionRegistry;
    private final ObjectMapper objectMapper;

    public void broadcast(Room room, MessageType type, Object data) {
        Set<String> recipients = room.recipientIds();
        TextMessage frame = frame(type, data);
        if (frame == null) {
            return;
        }
        for (String connectionId : recipients) {
            deliver(connectionRegistry.get(connectionId), frame);
        }
    }

    public void send(String connectionId, MessageType type, Object data) {
        TextMessage frame = frame(type, data);
        if (frame != null) {
            deliver(connectionRegistry.get(connectionId), frame);
        }
    }

    public void sendError(String connectionId, ErrorCode errorCode) {
        send(connectionId, MessageType.ERROR, errorCode.getCode());
    }

    private TextMessage frame(MessageType type, Object data) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(new OutboundMessage(type.getWireName(), data)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} frame", type.getWireName(), e);
            return null;
        }
    }

    private void deliver(Connection connection, TextMessage frame) {
        if (connection == null || !connection.isOpen()) {
            return;
        }
        try {
            connection.getSession().sendMessage(frame);
        } catch (IOException | SessionLimitExceededException e) {
            log.warn("Delivery to {} failed: {}", connection.getId(), e.getMessage());
        }
    }
}
