package com.chameleon.backend.service;

import com.chameleon.backend.model.Connection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class ConnectionRegistry {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public Connection register(WebSocketSession session) {
        Connection connection = new Connection("p" + sequence.incrementAndGet(), session);
        connections.put(connection.getId(), connection);
        log.debug("Connection {} registered ({} live)", connection.getId(), connections.size());
        return connection;
    }

    public Connection get(String connectionId) {
        return connectionId == null ? null : connections.get(connectionId);
    }

    /**
     * @return the removed connection, or null if it was already gone
     */
    public Connection remove(String connectionId) {
        return connectionId == null ? null : connections.remove(connectionId);
    }

    public void markAlive(String connectionId) {
        Connection connection = get(connectionId);
        if (connection != null) {
            connection.markAlive();
        }
    }

    /**
     * Snapshot of the live connections, safe to iterate while others connect or leave.
     */
    public Collection<Connection> getAll() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }
}
