package com.chameleon.backend.controller;

import com.chameleon.backend.dto.AccuseDTO;
import com.chameleon.backend.dto.ConnectedDTO;
import com.chameleon.backend.dto.GuessDTO;
import com.chameleon.backend.dto.HintDTO;
import com.chameleon.backend.dto.InboundMessage;
import com.chameleon.backend.dto.JoinRoomDTO;
import com.chameleon.backend.dto.MessageType;
import com.chameleon.backend.dto.VoteDTO;
import com.chameleon.backend.exception.ErrorCode;
import com.chameleon.backend.exception.GameException;
import com.chameleon.backend.model.Connection;
import com.chameleon.backend.service.Broadcaster;
import com.chameleon.backend.service.ConnectionRegistry;
import com.chameleon.backend.service.GameService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Entry point for every client frame. Resolves the sender, binds the payload and hands off to
 * {@link GameService}. Any rejection becomes a single {@code error} frame back to the sender.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ID = "connectionId";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final ConnectionRegistry connectionRegistry;
    private final GameService gameService;
    private final Broadcaster broadcaster;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Connection connection = connectionRegistry.register(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT));
        session.getAttributes().put(CONNECTION_ID, connection.getId());
        broadcaster.send(connection.getId(), MessageType.CONNECTED, new ConnectedDTO(connection.getId()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = connectionId(session);
        if (connectionId == null) {
            return;
        }
        try {
            InboundMessage inbound = objectMapper.readValue(message.getPayload(), InboundMessage.class);
            if (inbound == null) {
                throw new GameException(ErrorCode.INVALID_JSON);
            }
            dispatch(connectionId, inbound);
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame from {}: {}", connectionId, e.getOriginalMessage());
            broadcaster.sendError(connectionId, ErrorCode.INVALID_JSON);
        } catch (GameException e) {
            log.debug("Rejected action from {}: {}", connectionId, e.getErrorCode().getCode());
            broadcaster.sendError(connectionId, e.getErrorCode());
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling frame from {}", connectionId, e);
            broadcaster.sendError(connectionId, ErrorCode.INTERNAL_ERROR);
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        connectionRegistry.markAlive(connectionId(session));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on {}: {}", connectionId(session), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = connectionId(session);
        log.debug("Connection {} closed: {}", connectionId, status);
        gameService.disconnect(connectionId);
    }

    private void dispatch(String connectionId, InboundMessage inbound) {
        MessageType type = MessageType.inbound(inbound.getType())
                .orElseThrow(() -> new GameException(ErrorCode.UNKNOWN_TYPE));
        switch (type) {
            case CREATE_ROOM -> gameService.createRoom(connectionId);
            case JOIN_ROOM -> {
                JoinRoomDTO join = payload(inbound, JoinRoomDTO.class);
                gameService.joinRoom(connectionId, join.getCode(), join.getName());
            }
            case HOST_START_GAME -> gameService.startGame(connectionId);
            case SUBMIT_HINT -> gameService.submitHint(connectionId, payload(inbound, HintDTO.class).getHint());
            case ACCUSE -> gameService.accuse(connectionId, payload(inbound, AccuseDTO.class).getAccusedId());
            case VOTE -> gameService.vote(connectionId, payload(inbound, VoteDTO.class).getTargetId());
            case CHAMELEON_GUESS -> gameService.guess(connectionId, payload(inbound, GuessDTO.class).getGuess());
            case HOST_RESET -> gameService.resetRoom(connectionId);
            default -> throw new GameException(ErrorCode.UNKNOWN_TYPE);
        }
    }

    private <T> T payload(InboundMessage inbound, Class<T> type) {
        JsonNode data = inbound.getData();
        if (data == null || data.isNull()) {
            data = objectMapper.createObjectNode();
        }
        if (!data.isObject()) {
            throw new GameException(ErrorCode.INVALID_PAYLOAD);
        }
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new GameException(ErrorCode.INVALID_PAYLOAD);
        }
    }

    private static String connectionId(WebSocketSession session) {
        Object id = session.getAttributes().get(CONNECTION_ID);
        return id != null ? id.toString() : null;
    }
}
