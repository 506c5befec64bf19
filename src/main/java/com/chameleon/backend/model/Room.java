package com.chameleon.backend.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A single game room. Not thread-safe: callers hold the room's monitor while reading or mutating it.
 */
@Data
public class Room {
    private final String code;
    private final int capacity;
    private final int minPlayers;
    private final Instant createdAt = Instant.now();

    // Join order is display order
    private List<Player> players = new ArrayList<>();
    private String hostId;
    private GamePhase phase = GamePhase.LOBBY;

    private Category category;
    private Coordinate coordinate;
    private String chameleonId;

    // Map<PlayerId, Hint>
    private Map<String, String> hints = new LinkedHashMap<>();
    // Map<VoterId, AccusedId>
    private Map<String, String> votes = new LinkedHashMap<>();
    private List<Accusation> accusations = new ArrayList<>();

    // Set when the chameleon leaves mid-round; only a host reset clears it
    private boolean stalled;

    public Room(String code, String hostId, int capacity, int minPlayers) {
        this.code = code;
        this.hostId = hostId;
        this.capacity = capacity;
        this.minPlayers = minPlayers;
    }

    public boolean isFull() {
        return players.size() >= capacity;
    }

    public boolean hasHost() {
        return hostId != null;
    }

    public boolean isHost(String connectionId) {
        return hostId != null && hostId.equals(connectionId);
    }

    public boolean hasPlayer(String playerId) {
        return findPlayer(playerId).isPresent();
    }

    public Optional<Player> findPlayer(String playerId) {
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public String getSecretWord() {
        return category == null || coordinate == null ? null : category.wordAt(coordinate);
    }

    /**
     * Every connection that should see room-wide traffic: players in join order, then the host.
     */
    public Set<String> recipientIds() {
        Set<String> ids = new LinkedHashSet<>();
        players.forEach(p -> ids.add(p.getId()));
        if (hostId != null) {
            ids.add(hostId);
        }
        return ids;
    }

    /**
     * Removes a player and every round entry that refers to them.
     *
     * @return whether the player was seated in this room
     */
    public boolean removePlayer(String playerId) {
        boolean removed = players.removeIf(p -> p.getId().equals(playerId));
        if (removed) {
            hints.remove(playerId);
            votes.remove(playerId);
            votes.values().removeIf(playerId::equals);
            accusations.removeIf(a -> a.involves(playerId));
            if (playerId.equals(chameleonId)) {
                chameleonId = null;
            }
        }
        return removed;
    }

    public void clearRound() {
        this.category = null;
        this.coordinate = null;
        this.chameleonId = null;
        this.hints.clear();
        this.votes.clear();
        this.accusations.clear();
        this.stalled = false;
    }

    public void reset() {
        clearRound();
        this.phase = GamePhase.LOBBY;
    }
}
