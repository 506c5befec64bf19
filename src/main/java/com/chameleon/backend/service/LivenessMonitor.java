package com.chameleon.backend.service;

import com.chameleon.backend.config.GameProperties;
import com.chameleon.backend.model.Connection;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;

import java.io.IOException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Periodic ping sweep. A connection that has not answered the previous ping by the next sweep is
 * closed and cleaned up exactly as if it had disconnected.
 *
 * <p>This is the only timer-driven mutation in the server; everything else happens while
 * handling an inbound frame.
 */
@Slf4j
@Component
public class LivenessMonitor {

    private final ConnectionRegistry connectionRegistry;
    private final GameService gameService;
    private final ScheduledThreadPoolExecutor scheduler;
    private final GameProperties properties;

    private ScheduledFuture<?> task;

    public LivenessMonitor(ConnectionRegistry connectionRegistry,
                           GameService gameService,
                           @Qualifier("livenessScheduler") ScheduledThreadPoolExecutor scheduler,
                           GameProperties properties) {
        this.connectionRegistry = connectionRegistry;
        this.gameService = gameService;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        long interval = properties.getLiveness().getIntervalMs();
        task = scheduler.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Liveness sweep every {} ms", interval);
    }

    @PreDestroy
    public void stop() {
        if (task != null) {
            task.cancel(false);
        }
    }

    public void sweep() {
        for (Connection connection : connectionRegistry.getAll()) {
            try {
                if (connection.clearAlive()) {
                    probe(connection);
                } else {
                    terminate(connection);
                }
            } catch (RuntimeException e) {
                // keep sweeping the rest; a throw here would also cancel the scheduled task
                log.error("Liveness check failed for {}", connection.getId(), e);
            }
        }
    }

    private void probe(Connection connection) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.getSession().sendMessage(new PingMessage());
        } catch (IOException e) {
            log.debug("Ping to {} failed: {}", connection.getId(), e.getMessage());
        }
    }

    private void terminate(Connection connection) {
        log.warn("Connection {} missed its ping, terminating", connection.getId());
        try {
            if (connection.isOpen()) {
                connection.getSession().close(CloseStatus.SESSION_NOT_RELIABLE);
            }
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", connection.getId(), e.getMessage());
        }
        gameService.disconnect(connection.getId());
    }
}
