package com.chameleon.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode
public final class Coordinate {
    private final int row;
    private final int col;

    public Coordinate(int row, int col) {
        this.row = row;
        this.col = col;
    }

    @JsonProperty("r")
    public int getRow() {
        return row;
    }

    @JsonProperty("c")
    public int getCol() {
        return col;
    }
}
