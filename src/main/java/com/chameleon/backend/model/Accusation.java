package com.chameleon.backend.model;

import lombok.Value;

@Value
public class Accusation {
    String accuserId;
    String accusedId;

    public boolean involves(String playerId) {
        return accuserId.equals(playerId) || accusedId.equals(playerId);
    }
}
