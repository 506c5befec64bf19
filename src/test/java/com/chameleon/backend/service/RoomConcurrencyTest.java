package com.chameleon.backend.service;

import com.chameleon.backend.dto.MessageType;
import com.chameleon.backend.exception.ErrorCode;
import com.chameleon.backend.exception.GameException;
import com.chameleon.backend.model.GamePhase;
import com.chameleon.backend.model.Room;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomConcurrencyTest {

    @Mock
    private RandomSource random;

    @Mock
    private Broadcaster broadcaster;

    private GameFixture fixture;
    private GameService gameService;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        fixture = new GameFixture(random, broadcaster);
        gameService = fixture.gameService;
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void testSimultaneousLastHintsRevealOnce() throws Exception {
        String hostId = fixture.connect();
        Room room = gameService.createRoom(hostId);
        List<String> ids = fixture.join(room, "Ann", "Ben", "Cy", "Dee", "Eve", "Fay", "Gus", "Hal");
        gameService.startGame(hostId);

        runTogether(ids, id -> gameService.submitHint(id, "hint-" + id));

        verify(broadcaster, times(1)).broadcast(eq(room), eq(MessageType.HINTS_REVEALED), any());
        verify(broadcaster, times(7)).broadcast(eq(room), eq(MessageType.HINT_PROGRESS), any());
        assertEquals(GamePhase.ACCUSATION, room.getPhase());
        assertEquals(8, room.getHints().size());
    }

    @Test
    void testSimultaneousLastVotesResolveOnce() throws Exception {
        String hostId = fixture.connect();
        Room room = gameService.createRoom(hostId);
        List<String> ids = fixture.join(room, "Ann", "Ben", "Cy", "Dee", "Eve", "Fay", "Gus", "Hal");
        gameService.startGame(hostId);
        ids.forEach(id -> gameService.submitHint(id, "fruit"));
        // chameleon is Ann; Ben is accused and everyone agrees
        gameService.accuse(ids.get(2), ids.get(1));

        runTogether(ids, id -> gameService.vote(id, ids.get(1)));

        verify(broadcaster, times(1)).broadcast(eq(room), eq(MessageType.ROUND_RESULT), any());
        verify(broadcaster, never()).broadcast(eq(room), eq(MessageType.CHAMELEON_CAUGHT), any());
        assertEquals(GamePhase.FINISHED, room.getPhase());
        assertEquals(8, room.getVotes().size());
    }

    @Test
    void testJoinRacingDisconnectDoesNotSeatClosedConnection() throws Exception {
        String hostId = fixture.connect();
        Room room = gameService.createRoom(hostId);
        fixture.join(room, "Ann", "Ben", "Dee");
        String late = fixture.connect();

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread joiner = new Thread(() -> {
            try {
                gameService.joinRoom(late, room.getCode(), "Cy");
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        synchronized (room) {
            joiner.start();
            awaitBlocked(joiner);
            gameService.disconnect(late);
        }
        joiner.join(TimeUnit.SECONDS.toMillis(5));
        gameService.disconnect(late);

        assertFalse(joiner.isAlive());
        GameException e = assertInstanceOf(GameException.class, failure.get());
        assertEquals(ErrorCode.NOT_IN_ROOM, e.getErrorCode());
        assertFalse(room.hasPlayer(late));
        assertEquals(3, room.getPlayers().size());
        assertNull(fixture.registry.get(late));
    }

    @Test
    void testCreateRacingDisconnectLeavesNoRoom() {
        RoomService rooms = spy(fixture.roomService);
        GameService service = new GameService(rooms, fixture.registry, broadcaster, fixture.catalog,
                random, fixture.properties);
        String id = fixture.connect();
        doAnswer(inv -> {
            Object created = inv.callRealMethod();
            service.disconnect(id);
            return created;
        }).when(rooms).createRoom(id);

        GameException e = assertThrows(GameException.class, () -> service.createRoom(id));

        assertEquals(ErrorCode.NOT_IN_ROOM, e.getErrorCode());
        assertEquals(0, rooms.size());
        verify(broadcaster, never()).send(eq(id), eq(MessageType.ROOM_CREATED), any());
    }

    @Test
    void testActionRacingHostCloseLeavesDiscardedRoomAlone() throws Exception {
        String hostId = fixture.connect();
        Room room = gameService.createRoom(hostId);
        List<String> ids = fixture.join(room, "Ann", "Ben", "Cy");
        gameService.startGame(hostId);

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread hinter = new Thread(() -> {
            try {
                gameService.submitHint(ids.get(1), "sour");
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        synchronized (room) {
            hinter.start();
            awaitBlocked(hinter);
            gameService.disconnect(hostId);
        }
        hinter.join(TimeUnit.SECONDS.toMillis(5));

        GameException e = assertInstanceOf(GameException.class, failure.get());
        assertEquals(ErrorCode.ROOM_NOT_FOUND, e.getErrorCode());
        assertTrue(room.getHints().isEmpty());
        verify(broadcaster, never()).broadcast(eq(room), eq(MessageType.HINT_PROGRESS), any());
    }

    private void runTogether(List<String> ids, Consumer<String> action) throws Exception {
        CountDownLatch ready = new CountDownLatch(ids.size());
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (String id : ids) {
            futures.add(pool.submit(() -> {
                ready.countDown();
                go.await();
                action.accept(id);
                return null;
            }));
        }
        assertTrue(ready.await(5, TimeUnit.SECONDS));
        go.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
    }

    private static void awaitBlocked(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.BLOCKED) {
            assertTrue(System.nanoTime() < deadline, "thread never blocked on the room");
            Thread.sleep(5);
        }
    }
}
