package com.chameleon.backend.service;

import com.chameleon.backend.dto.MessageType;
import com.chameleon.backend.dto.ProgressDTO;
import com.chameleon.backend.exception.ErrorCode;
import com.chameleon.backend.model.Player;
import com.chameleon.backend.model.Room;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BroadcasterTest {

    @Mock
    private WebSocketSession hostSession;

    @Mock
    private WebSocketSession annSession;

    @Mock
    private WebSocketSession benSession;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConnectionRegistry registry;
    private Broadcaster broadcaster;
    private Room room;
    private String hostId, annId, benId;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        broadcaster = new Broadcaster(registry, objectMapper);
        hostId = registry.register(hostSession).getId();
        annId = registry.register(annSession).getId();
        benId = registry.register(benSession).getId();

        room = new Room("K7PQ", hostId, 8, 3);
        room.getPlayers().add(new Player(annId, "Ann"));
        room.getPlayers().add(new Player(benId, "Ben"));
    }

    @Test
    void testBroadcastSendsIdenticalFrameToEveryOpenConnection() throws Exception {
        when(hostSession.isOpen()).thenReturn(true);
        when(annSession.isOpen()).thenReturn(true);
        when(benSession.isOpen()).thenReturn(true);

        broadcaster.broadcast(room, MessageType.HINT_PROGRESS, new ProgressDTO(1, 2));

        ArgumentCaptor<TextMessage> toHost = ArgumentCaptor.forClass(TextMessage.class);
        ArgumentCaptor<TextMessage> toAnn = ArgumentCaptor.forClass(TextMessage.class);
        ArgumentCaptor<TextMessage> toBen = ArgumentCaptor.forClass(TextMessage.class);
        verify(hostSession).sendMessage(toHost.capture());
        verify(annSession).sendMessage(toAnn.capture());
        verify(benSession).sendMessage(toBen.capture());
        assertSame(toAnn.getValue(), toHost.getValue());
        assertSame(toAnn.getValue(), toBen.getValue());

        assertEquals(objectMapper.readTree("{\"type\":\"hint_progress\",\"data\":{\"submitted\":1,\"total\":2}}"),
                objectMapper.readTree(toAnn.getValue().getPayload()));
    }

    @Test
    void testClosedConnectionsAreSkipped() throws Exception {
        when(hostSession.isOpen()).thenReturn(true);
        when(annSession.isOpen()).thenReturn(false);
        when(benSession.isOpen()).thenReturn(true);

        broadcaster.broadcast(room, MessageType.ROOM_CLOSED, Map.of());

        verify(annSession, never()).sendMessage(any());
        verify(hostSession).sendMessage(any(TextMessage.class));
        verify(benSession).sendMessage(any(TextMessage.class));
    }

    @Test
    void testHostSeatedAsPlayerReceivesOneCopy() throws Exception {
        room.getPlayers().add(new Player(hostId, "Host"));
        when(hostSession.isOpen()).thenReturn(true);
        when(annSession.isOpen()).thenReturn(true);
        when(benSession.isOpen()).thenReturn(true);

        broadcaster.broadcast(room, MessageType.ROOM_UPDATE, Map.of());

        verify(hostSession, times(1)).sendMessage(any(TextMessage.class));
    }

    @Test
    void testFailedDeliveryDoesNotStopTheRest() throws Exception {
        when(hostSession.isOpen()).thenReturn(true);
        when(annSession.isOpen()).thenReturn(true);
        when(benSession.isOpen()).thenReturn(true);
        doThrow(new IOException("broken pipe")).when(annSession).sendMessage(any());

        broadcaster.broadcast(room, MessageType.ROOM_UPDATE, Map.of());

        verify(benSession).sendMessage(any(TextMessage.class));
        verify(hostSession).sendMessage(any(TextMessage.class));
    }

    @Test
    void testSendReachesOnlyOneRecipient() throws Exception {
        when(annSession.isOpen()).thenReturn(true);

        broadcaster.sendError(annId, ErrorCode.ROOM_FULL);

        ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
        verify(annSession).sendMessage(frame.capture());
        assertEquals(objectMapper.readTree("{\"type\":\"error\",\"data\":\"room_full\"}"),
                objectMapper.readTree(frame.getValue().getPayload()));
        verify(hostSession, never()).sendMessage(any());
        verify(benSession, never()).sendMessage(any());
    }
}
