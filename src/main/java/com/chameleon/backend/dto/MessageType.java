package com.chameleon.backend.dto;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
public enum MessageType {
    // client -> server
    CREATE_ROOM("create_room", true),
    JOIN_ROOM("join_room", true),
    HOST_START_GAME("host_start_game", true),
    SUBMIT_HINT("submit_hint", true),
    ACCUSE("accuse", true),
    VOTE("vote", true),
    CHAMELEON_GUESS("chameleon_guess", true),
    HOST_RESET("host_reset", true),

    // server -> client
    CONNECTED("connected", false),
    ROOM_CREATED("room_created", false),
    ROOM_UPDATE("room_update", false),
    GAME_START_PLAYER("game_start_player", false),
    GAME_START_HOST("game_start_host", false),
    HINT_PROGRESS("hint_progress", false),
    HINTS_REVEALED("hints_revealed", false),
    VOTING_START("voting_start", false),
    VOTE_PROGRESS("vote_progress", false),
    CHAMELEON_CAUGHT("chameleon_caught", false),
    ROUND_RESULT("round_result", false),
    ROOM_CLOSED("room_closed", false),
    ERROR("error", false);

    private final String wireName;
    private final boolean inbound;

    MessageType(String wireName, boolean inbound) {
        this.wireName = wireName;
        this.inbound = inbound;
    }

    public static Optional<MessageType> inbound(String wireName) {
        return Arrays.stream(values())
                .filter(MessageType::isInbound)
                .filter(t -> t.wireName.equals(wireName))
                .findFirst();
    }
}
