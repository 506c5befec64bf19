package com.chameleon.backend.exception;

import lombok.Getter;

/**
 * A rejected action. Thrown before any state is touched, so the room is left exactly as it was.
 */
@Getter
public class GameException extends RuntimeException {
    private final ErrorCode errorCode;

    public GameException(ErrorCode errorCode) {
        super(errorCode.getCode());
        this.errorCode = errorCode;
    }
}
