package com.chameleon.backend.model;

import lombok.Getter;
import org.springframework.web.socket.WebSocketSession;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live transport connection and what it is currently bound to.
 * The room code and role are set once, on create or join, and only released when the room closes.
 */
@Getter
public class Connection {
    private final String id;
    private final WebSocketSession session;
    private volatile String roomCode;
    private volatile Role role;
    private final AtomicBoolean alive = new AtomicBoolean(true);

    public Connection(String id, WebSocketSession session) {
        this.id = id;
        this.session = session;
    }

    public boolean isOpen() {
        return session != null && session.isOpen();
    }

    public boolean isBound() {
        return roomCode != null;
    }

    public void bind(String roomCode, Role role) {
        this.roomCode = roomCode;
        this.role = role;
    }

    public void unbind() {
        this.roomCode = null;
        this.role = null;
    }

    public boolean isHost() {
        return role == Role.HOST;
    }

    public void markAlive() {
        alive.set(true);
    }

    /**
     * Clears the acknowledgement flag for the next probe.
     *
     * @return whether the previous probe was acknowledged
     */
    public boolean clearAlive() {
        return alive.getAndSet(false);
    }
}
