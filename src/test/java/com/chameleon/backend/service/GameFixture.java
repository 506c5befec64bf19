package com.chameleon.backend.service;

import com.chameleon.backend.config.GameProperties;
import com.chameleon.backend.model.Player;
import com.chameleon.backend.model.Room;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.List;

import static org.mockito.Mockito.mock;

/**
 * Real room store, registry and state machine around a mocked broadcaster and random source.
 */
class GameFixture {
    final GameProperties properties = new GameProperties();
    final ConnectionRegistry registry = new ConnectionRegistry();
    final CategoryCatalog catalog = new CategoryCatalog();
    final RoomService roomService;
    final GameService gameService;

    GameFixture(RandomSource random, Broadcaster broadcaster) {
        this.roomService = new RoomService(new CodeGenerator(random, properties), properties);
        this.gameService = new GameService(roomService, registry, broadcaster, catalog, random, properties);
    }

    String connect() {
        return registry.register(mock(WebSocketSession.class)).getId();
    }

    List<String> join(Room room, String... names) {
        List<String> ids = new ArrayList<>();
        for (String name : names) {
            String id = connect();
            Player player = gameService.joinRoom(id, room.getCode(), name);
            ids.add(player.getId());
        }
        return ids;
    }
}
