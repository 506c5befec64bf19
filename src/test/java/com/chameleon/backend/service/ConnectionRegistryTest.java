package com.chameleon.backend.service;

import com.chameleon.backend.model.Connection;
import com.chameleon.backend.model.Role;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    void testIdsAreSequentialAndNeverReused() {
        Connection a = registry.register(mock(WebSocketSession.class));
        Connection b = registry.register(mock(WebSocketSession.class));
        registry.remove(a.getId());
        Connection c = registry.register(mock(WebSocketSession.class));

        assertEquals("p1", a.getId());
        assertEquals("p2", b.getId());
        assertEquals("p3", c.getId());
        assertEquals(2, registry.size());
    }

    @Test
    void testRemoveReturnsConnectionOnlyOnce() {
        Connection a = registry.register(mock(WebSocketSession.class));

        assertSame(a, registry.remove(a.getId()));
        assertNull(registry.remove(a.getId()));
        assertNull(registry.get(a.getId()));
    }

    @Test
    void testBindingAndAcknowledgement() {
        Connection a = registry.register(mock(WebSocketSession.class));
        assertFalse(a.isBound());

        a.bind("K7PQ", Role.HOST);
        assertTrue(a.isBound());
        assertTrue(a.isHost());
        assertEquals("K7PQ", a.getRoomCode());

        assertTrue(a.clearAlive());
        assertFalse(a.clearAlive());
        registry.markAlive(a.getId());
        assertTrue(a.clearAlive());
    }
}
