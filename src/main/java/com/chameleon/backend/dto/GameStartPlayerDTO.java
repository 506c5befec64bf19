package com.chameleon.backend.dto;

import com.chameleon.backend.model.Coordinate;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class GameStartPlayerDTO {
    public static final String ROLE_CHAMELEON = "chameleon";
    public static final String ROLE_NOT_CHAMELEON = "not_chameleon";

    private String role;
    private Coordinate coord;
    private List<List<String>> grid;
    private String category;

    public static GameStartPlayerDTO chameleon() {
        return new GameStartPlayerDTO(ROLE_CHAMELEON, null, null, null);
    }
}
