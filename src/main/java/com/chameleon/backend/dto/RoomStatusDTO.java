package com.chameleon.backend.dto;

import com.chameleon.backend.model.GamePhase;
import com.chameleon.backend.model.Player;
import com.chameleon.backend.model.Room;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RoomStatusDTO {
    private String code;
    private List<Player> players;
    private GamePhase state;
    private String category;
    private int playerCount;
    private boolean stalled;

    public static RoomStatusDTO of(Room room) {
        return new RoomStatusDTO(
                room.getCode(),
                new ArrayList<>(room.getPlayers()),
                room.getPhase(),
                room.getCategory() != null ? room.getCategory().getName() : null,
                room.getPlayers().size(),
                room.isStalled());
    }
}
