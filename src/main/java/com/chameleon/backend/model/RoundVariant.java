package com.chameleon.backend.model;

public enum RoundVariant {
    ACCUSATION,
    DIRECT
}
