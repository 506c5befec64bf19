package com.chameleon.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GamePhase {
    LOBBY("lobby"),
    HINT("hint"),
    ACCUSATION("accusation"),
    VOTING("voting"),
    CHAMELEON_GUESS("chameleon_guess"),
    REVEAL("reveal"),
    FINISHED("finished");

    private final String wireName;

    GamePhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Phases in which a round is in progress and players may still act on it.
     */
    public boolean isRoundActive() {
        return this == HINT || this == ACCUSATION || this == VOTING || this == CHAMELEON_GUESS;
    }
}
