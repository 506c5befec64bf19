package com.chameleon.backend.service;

import com.chameleon.backend.config.GameProperties;
import com.chameleon.backend.model.Room;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    private final CodeGenerator codeGenerator;
    private final GameProperties properties;

    public Room createRoom(String hostId) {
        while (true) {
            String code = codeGenerator.generate(rooms::containsKey);
            Room room = new Room(code, hostId,
                    properties.getRoom().getCapacity(), properties.getRoom().getMinPlayers());
            // Another thread may have claimed the code between generate and put
            if (rooms.putIfAbsent(code, room) == null) {
                log.info("Room created: {} (host {})", code, hostId);
                return room;
            }
        }
    }

    public Room getRoom(String roomCode) {
        return roomCode == null ? null : rooms.get(roomCode);
    }

    public boolean isLive(Room room) {
        return rooms.get(room.getCode()) == room;
    }

    public void removeRoom(String roomCode) {
        if (rooms.remove(roomCode) != null) {
            log.info("Room removed: {}", roomCode);
        }
    }

    public int size() {
        return rooms.size();
    }
}
