package com.chameleon.backend.model;

import lombok.Value;

import java.util.List;

@Value
public class Category {
    String name;
    List<List<String>> grid;

    public int size() {
        return grid.size();
    }

    public String wordAt(Coordinate coordinate) {
        return grid.get(coordinate.getRow()).get(coordinate.getCol());
    }
}
