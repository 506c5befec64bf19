package com.chameleon.backend.service;

import com.chameleon.backend.config.GameProperties;
import com.chameleon.backend.dto.ChameleonCaughtDTO;
import com.chameleon.backend.dto.GameStartHostDTO;
import com.chameleon.backend.dto.GameStartPlayerDTO;
import com.chameleon.backend.dto.HintsRevealedDTO;
import com.chameleon.backend.dto.MessageType;
import com.chameleon.backend.dto.ProgressDTO;
import com.chameleon.backend.dto.RoomCreatedDTO;
import com.chameleon.backend.dto.RoomStatusDTO;
import com.chameleon.backend.dto.RoundResultDTO;
import com.chameleon.backend.dto.VotingStartDTO;
import com.chameleon.backend.exception.ErrorCode;
import com.chameleon.backend.exception.GameException;
import com.chameleon.backend.model.Accusation;
import com.chameleon.backend.model.Category;
import com.chameleon.backend.model.Connection;
import com.chameleon.backend.model.Coordinate;
import com.chameleon.backend.model.GamePhase;
import com.chameleon.backend.model.Player;
import com.chameleon.backend.model.Role;
import com.chameleon.backend.model.Room;
import com.chameleon.backend.model.RoundVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-room phase state machine.
 *
 * <p>Every action runs its guards and its effects while holding the room's monitor, so a
 * check such as "all hints are in" can never interleave with another submission for the same
 * room. Rooms never lock each other. A failed guard throws {@link GameException} before anything
 * is mutated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final RoomService roomService;
    private final ConnectionRegistry connectionRegistry;
    private final Broadcaster broadcaster;
    private final CategoryCatalog categoryCatalog;
    private final RandomSource random;
    private final GameProperties properties;

    public Room createRoom(String connectionId) {
        Connection connection = requireConnection(connectionId);
        if (connection.isBound()) {
            throw new GameException(ErrorCode.ALREADY_IN_ROOM);
        }
        Room room = roomService.createRoom(connectionId);
        connection.bind(room.getCode(), Role.HOST);
        if (connectionRegistry.get(connectionId) != connection) {
            // closed meanwhile; disconnect cleanup ran before the binding
            connection.unbind();
            roomService.removeRoom(room.getCode());
            throw new GameException(ErrorCode.NOT_IN_ROOM);
        }
        broadcaster.send(connectionId, MessageType.ROOM_CREATED, new RoomCreatedDTO(room.getCode()));
        return room;
    }

    public Player joinRoom(String connectionId, String roomCode, String name) {
        if (isBlank(roomCode) || isBlank(name)) {
            throw new GameException(ErrorCode.MISSING_CODE_OR_NAME);
        }
        Connection connection = requireConnection(connectionId);
        if (connection.isBound()) {
            throw new GameException(ErrorCode.ALREADY_IN_ROOM);
        }
        Room room = roomService.getRoom(roomCode.trim().toUpperCase());
        if (room == null) {
            throw new GameException(ErrorCode.ROOM_NOT_FOUND);
        }
        synchronized (room) {
            requireLive(room);
            if (room.isFull()) {
                throw new GameException(ErrorCode.ROOM_FULL);
            }
            if (room.getPhase() != GamePhase.LOBBY) {
                throw new GameException(ErrorCode.GAME_ALREADY_STARTED);
            }
            // bind first: a racing disconnect either sees the binding or its removal is seen here
            connection.bind(room.getCode(), Role.PLAYER);
            if (connectionRegistry.get(connectionId) != connection) {
                connection.unbind();
                throw new GameException(ErrorCode.NOT_IN_ROOM);
            }
            Player player = new Player(connectionId, truncate(name.trim(), properties.getRoom().getMaxNameLength()));
            room.getPlayers().add(player);
            log.info("{} joined room {} ({}/{})", player.getName(), room.getCode(),
                    room.getPlayers().size(), room.getCapacity());
            broadcastRoomUpdate(room);
            return player;
        }
    }

    public void startGame(String connectionId) {
        Room room = requireRoom(connectionId);
        synchronized (room) {
            requireLive(room);
            requireHost(room, connectionId);
            if (room.getPhase() != GamePhase.LOBBY) {
                throw new GameException(ErrorCode.GAME_ALREADY_STARTED);
            }
            List<Player> players = room.getPlayers();
            if (players.size() < room.getMinPlayers()) {
                throw new GameException(ErrorCode.NOT_ENOUGH_PLAYERS);
            }

            Category category = categoryCatalog.get(random.nextInt(categoryCatalog.size()));
            int row = random.nextInt(category.size());
            int col = random.nextInt(category.size());
            Player chameleon = players.get(random.nextInt(players.size()));

            room.clearRound();
            room.setCategory(category);
            room.setCoordinate(new Coordinate(row, col));
            room.setChameleonId(chameleon.getId());
            room.setPhase(GamePhase.HINT);

            for (Player p : players) {
                GameStartPlayerDTO dto = p.getId().equals(chameleon.getId())
                        ? GameStartPlayerDTO.chameleon()
                        : new GameStartPlayerDTO(GameStartPlayerDTO.ROLE_NOT_CHAMELEON,
                                room.getCoordinate(), category.getGrid(), category.getName());
                broadcaster.send(p.getId(), MessageType.GAME_START_PLAYER, dto);
            }
            if (room.hasHost()) {
                broadcaster.send(room.getHostId(), MessageType.GAME_START_HOST, new GameStartHostDTO(
                        room.getCoordinate(), category.getGrid(), category.getName(), chameleon.getId()));
            }
            log.info("Game started in room {}: category {}, chameleon {}",
                    room.getCode(), category.getName(), chameleon.getName());
            broadcastRoomUpdate(room);
        }
    }

    public void submitHint(String connectionId, String hint) {
        Room room = requireRoom(connectionId);
        synchronized (room) {
            requireLive(room);
            requirePhase(room, GamePhase.HINT, ErrorCode.NOT_IN_HINT);
            requirePlayer(room, connectionId);
            if (isBlank(hint) || hint.trim().length() > properties.getGame().getMaxHintLength()) {
                throw new GameException(ErrorCode.INVALID_HINT);
            }

            room.getHints().put(connectionId, hint.trim());
            log.debug("Hint submitted by {} in room {}", connectionId, room.getCode());

            int submitted = room.getHints().size();
            int total = room.getPlayers().size();
            if (submitted < total) {
                broadcaster.broadcast(room, MessageType.HINT_PROGRESS, new ProgressDTO(submitted, total));
                return;
            }

            if (properties.getGame().getVariant() == RoundVariant.ACCUSATION) {
                room.setPhase(GamePhase.ACCUSATION);
            } else {
                room.getVotes().clear();
                room.setPhase(GamePhase.VOTING);
            }
            broadcaster.broadcast(room, MessageType.HINTS_REVEALED,
                    new HintsRevealedDTO(new LinkedHashMap<>(room.getHints())));
            broadcastRoomUpdate(room);
        }
    }

    public void accuse(String connectionId, String accusedId) {
        Room room = requireRoom(connectionId);
        synchronized (room) {
            requireLive(room);
            requirePhase(room, GamePhase.ACCUSATION, ErrorCode.NOT_IN_ACCUSATION);
            requirePlayer(room, connectionId);
            requireTarget(room, accusedId);

            room.getAccusations().add(new Accusation(connectionId, accusedId));
            room.getVotes().clear();
            room.setPhase(GamePhase.VOTING);
            log.debug("{} accused {} in room {}", connectionId, accusedId, room.getCode());

            broadcaster.broadcast(room, MessageType.VOTING_START, new VotingStartDTO(accusedId));
            broadcastRoomUpdate(room);
        }
    }

    public void vote(String connectionId, String targetId) {
        Room room = requireRoom(connectionId);
        synchronized (room) {
            requireLive(room);
            requirePhase(room, GamePhase.VOTING, ErrorCode.NOT_IN_VOTING);
            requirePlayer(room, connectionId);
            requireTarget(room, targetId);

            room.getVotes().put(connectionId, targetId);
            log.debug("{} voted for {} in room {}", connectionId, targetId, room.getCode());

            int submitted = room.getVotes().size();
            int total = room.getPlayers().size();
            if (submitted < total) {
                broadcaster.broadcast(room, MessageType.VOTE_PROGRESS, new ProgressDTO(submitted, total));
                return;
            }
            resolveVotes(room);
        }
    }

    public void guess(String connectionId, String guess) {
        Room room = requireRoom(connectionId);
        synchronized (room) {
            requireLive(room);
            requirePhase(room, GamePhase.CHAMELEON_GUESS, ErrorCode.NOT_IN_GUESS);
            if (!connectionId.equals(room.getChameleonId())) {
                throw new GameException(ErrorCode.NOT_CHAMELEON);
            }
            if (isBlank(guess) || guess.trim().length() > properties.getGame().getMaxGuessLength()) {
                throw new GameException(ErrorCode.INVALID_GUESS);
            }

            boolean correct = guess.trim().equalsIgnoreCase(room.getSecretWord().trim());
            finishRound(room, !correct, room.getChameleonId(),
                    correct ? RoundResultDTO.REASON_GUESSED_WORD : RoundResultDTO.REASON_MISSED_WORD);
        }
    }

    public void resetRoom(String connectionId) {
        Room room = requireRoom(connectionId);
        synchronized (room) {
            requireLive(room);
            requireHost(room, connectionId);
            room.reset();
            log.info("Room {} reset to lobby by host", room.getCode());
            broadcastRoomUpdate(room);
        }
    }

    /**
     * Cleanup for a closed connection, whether it closed on its own or was dropped by the
     * liveness sweep. Safe to call more than once for the same connection.
     */
    public void disconnect(String connectionId) {
        Connection connection = connectionRegistry.remove(connectionId);
        if (connection == null) {
            return;
        }
        Room room = roomService.getRoom(connection.getRoomCode());
        if (room == null) {
            return;
        }
        synchronized (room) {
            if (connection.isHost() && room.isHost(connectionId)) {
                closeRoom(room);
            } else {
                leaveRoom(room, connectionId);
            }
        }
    }

    private void closeRoom(Room room) {
        log.info("Host left, closing room {}", room.getCode());
        room.setHostId(null);
        broadcaster.broadcast(room, MessageType.ROOM_CLOSED, Map.of());
        for (Player p : room.getPlayers()) {
            Connection c = connectionRegistry.get(p.getId());
            if (c != null) {
                c.unbind();
            }
        }
        roomService.removeRoom(room.getCode());
    }

    private void leaveRoom(Room room, String playerId) {
        boolean wasChameleon = playerId.equals(room.getChameleonId());
        if (!room.removePlayer(playerId)) {
            return;
        }
        log.info("Player {} left room {}", playerId, room.getCode());
        if (wasChameleon && room.getPhase().isRoundActive()) {
            room.setStalled(true);
            log.warn("Chameleon left room {} mid-round; round stalled until host reset", room.getCode());
        }
        if (room.getPlayers().isEmpty() && !room.hasHost()) {
            roomService.removeRoom(room.getCode());
            return;
        }
        broadcastRoomUpdate(room);
    }

    private void resolveVotes(Room room) {
        VoteTally tally = VoteTally.of(room.getVotes().values());
        String accusedId = !room.getAccusations().isEmpty()
                ? room.getAccusations().get(0).getAccusedId()
                : tally.consensus().orElse(null);

        if (accusedId == null) {
            finishRound(room, false, null, RoundResultDTO.REASON_NO_CONSENSUS);
        } else if (accusedId.equals(room.getChameleonId())) {
            if (properties.getGame().getVariant() == RoundVariant.ACCUSATION) {
                room.setPhase(GamePhase.CHAMELEON_GUESS);
                log.info("Chameleon caught in room {}, awaiting guess", room.getCode());
                broadcaster.broadcast(room, MessageType.CHAMELEON_CAUGHT,
                        new ChameleonCaughtDTO(accusedId, room.getChameleonId()));
                broadcastRoomUpdate(room);
            } else {
                finishRound(room, true, accusedId, RoundResultDTO.REASON_CAUGHT);
            }
        } else {
            finishRound(room, false, accusedId, RoundResultDTO.REASON_WRONG_ACCUSATION);
        }
    }

    private void finishRound(Room room, boolean success, String accusedId, String reason) {
        room.setPhase(GamePhase.REVEAL);
        RoundResultDTO result = new RoundResultDTO(success, room.getSecretWord(), room.getChameleonId(),
                accusedId, reason);
        broadcaster.broadcast(room, MessageType.ROUND_RESULT, result);
        log.info("Round finished in room {}: {} ({})", room.getCode(),
                success ? "group wins" : "chameleon wins", reason);
        room.setPhase(GamePhase.FINISHED);
        broadcastRoomUpdate(room);
    }

    public void broadcastRoomUpdate(Room room) {
        broadcaster.broadcast(room, MessageType.ROOM_UPDATE, RoomStatusDTO.of(room));
    }

    private Connection requireConnection(String connectionId) {
        Connection connection = connectionRegistry.get(connectionId);
        if (connection == null) {
            throw new GameException(ErrorCode.NOT_IN_ROOM);
        }
        return connection;
    }

    private Room requireRoom(String connectionId) {
        Connection connection = requireConnection(connectionId);
        if (!connection.isBound()) {
            throw new GameException(ErrorCode.NOT_IN_ROOM);
        }
        Room room = roomService.getRoom(connection.getRoomCode());
        if (room == null) {
            throw new GameException(ErrorCode.ROOM_NOT_FOUND);
        }
        return room;
    }

    private void requireLive(Room room) {
        if (!roomService.isLive(room)) {
            throw new GameException(ErrorCode.ROOM_NOT_FOUND);
        }
    }

    private void requireHost(Room room, String connectionId) {
        if (!room.isHost(connectionId)) {
            throw new GameException(ErrorCode.NOT_HOST);
        }
    }

    private void requirePhase(Room room, GamePhase phase, ErrorCode otherwise) {
        if (room.isStalled()) {
            throw new GameException(ErrorCode.ROUND_STALLED);
        }
        if (room.getPhase() != phase) {
            throw new GameException(otherwise);
        }
    }

    private void requirePlayer(Room room, String connectionId) {
        if (!room.hasPlayer(connectionId)) {
            throw new GameException(ErrorCode.NOT_A_PLAYER);
        }
    }

    private void requireTarget(Room room, String targetId) {
        if (isBlank(targetId) || !room.hasPlayer(targetId)) {
            throw new GameException(ErrorCode.INVALID_TARGET);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
