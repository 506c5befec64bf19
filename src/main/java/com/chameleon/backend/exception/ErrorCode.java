package com.chameleon.backend.exception;

import lombok.Getter;

/**
 * Reasons an inbound action is rejected. The code string is what the client receives as error data.
 */
@Getter
public enum ErrorCode {
    // envelope
    INVALID_JSON("invalid_json"),
    UNKNOWN_TYPE("unknown_type"),
    INVALID_PAYLOAD("invalid_payload"),

    // room membership
    MISSING_CODE_OR_NAME("missing_code_or_name"),
    ROOM_NOT_FOUND("room_not_found"),
    NOT_IN_ROOM("not_in_room"),
    ALREADY_IN_ROOM("already_in_room"),

    // roles
    NOT_HOST("not_host"),
    NOT_A_PLAYER("not_a_player"),
    NOT_CHAMELEON("not_chameleon"),

    // preconditions
    ROOM_FULL("room_full"),
    GAME_ALREADY_STARTED("game_already_started"),
    NOT_ENOUGH_PLAYERS("not_enough_players"),
    ROUND_STALLED("round_stalled"),

    // phases
    NOT_IN_HINT("not_in_hint"),
    NOT_IN_ACCUSATION("not_in_accusation"),
    NOT_IN_VOTING("not_in_voting"),
    NOT_IN_GUESS("not_in_guess"),

    // payload
    INVALID_HINT("invalid_hint"),
    INVALID_TARGET("invalid_target"),
    INVALID_GUESS("invalid_guess"),

    INTERNAL_ERROR("internal_error");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }
}
