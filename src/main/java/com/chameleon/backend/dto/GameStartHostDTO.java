package com.chameleon.backend.dto;

import com.chameleon.backend.model.Coordinate;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class GameStartHostDTO {
    private Coordinate coord;
    private List<List<String>> grid;
    private String category;
    private String chameleonId;
}
