package com.chameleon.backend.model;

public enum Role {
    HOST,
    PLAYER
}
