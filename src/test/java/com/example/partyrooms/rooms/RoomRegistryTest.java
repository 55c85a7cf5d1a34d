package com.example.partyrooms.rooms;

import com.example.partyrooms.error.ErrorKind;
import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.model.GameMeta;
import com.example.partyrooms.model.RoomStatus;
import com.example.partyrooms.model.Team;
import com.example.partyrooms.model.Visibility;
import com.example.partyrooms.support.FakeConnection;
import com.example.partyrooms.support.RoomsHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.partyrooms.support.RoomsHarness.GAME_ID;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.*;

class RoomRegistryTest {

    private RoomsHarness h;
    private RoomService rooms;

    @BeforeEach
    void setUp() {
        h = new RoomsHarness().withQuestions(5);
        rooms = h.service;
    }

    private static JoinRequest as(String name) {
        return new JoinRequest(name, null, null);
    }

    private static JoinRequest as(String name, String team) {
        return new JoinRequest(name, team, null);
    }

    @Nested
    @DisplayName("createRoom")
    class Create {

        @Test
        @DisplayName("applies defaults, exposes hasPassword but never the hash")
        void createsWithDefaults() {
            RoomView room = h.createRoom("u-host", "pw", null);

            assertTrue(RoomCodeAllocator.isWellFormed(room.code()));
            assertEquals(RoomStatus.WAITING, room.status());
            assertNull(room.hostUserId(), "no host until the creator holds a player record");
            assertEquals(5, room.settings().getRoundCount());
            assertEquals(30, room.settings().getTimePerPromptSeconds());
            assertTrue(room.hasPassword());
            assertNotNull(room.createdAt());
            assertTrue(h.store.codeExists(room.code()));
        }

        @Test
        void unknownGame() {
            RoomException ex = assertThrows(RoomException.class, () ->
                    rooms.createRoom(new CreateRoomRequest("nope", null, Visibility.PUBLIC, null, null), "u"));
            assertEquals("GAME_NOT_FOUND", ex.getCode());
            assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
        }

        @Test
        void offlineGameCannotHostARoom() {
            h.store.registerGame(new GameMeta("board", "Board game", 2, 6, false));
            RoomException ex = assertThrows(RoomException.class, () ->
                    rooms.createRoom(new CreateRoomRequest("board", null, Visibility.PUBLIC, null, null), "u"));
            assertEquals("GAME_NOT_ONLINE", ex.getCode());
        }

        @Test
        void settingsOutOfBounds() {
            for (SettingsPatch bad : List.of(RoomsHarness.rounds(0, 30), RoomsHarness.rounds(21, 30),
                    RoomsHarness.rounds(5, 4), RoomsHarness.rounds(5, 121), RoomsHarness.maxPlayers(1))) {
                RoomException ex = assertThrows(RoomException.class, () -> h.createRoom("u", null, bad));
                assertEquals("INVALID_SETTINGS", ex.getCode(), bad.toString());
            }
            assertEquals(0, h.codes.reservedCount(), "failed creations release their code");
        }
    }

    @Nested
    @DisplayName("joinRoom")
    class Join {

        @Test
        void rejoinWithSameUserIsIdempotent() {
            String code = h.createRoom("u-host").code();
            PlayerView first = rooms.join(code, as("Jan"), "u-jan", "ip");
            PlayerView again = rooms.join(code, as("Jan again"), "u-jan", "ip");

            assertEquals(first.id(), again.id());
            assertEquals(1, rooms.snapshot(code).players().size());
        }

        @Test
        void anonymousJoinsAreSeparatePlayers() {
            String code = h.createRoom("u-host").code();
            rooms.join(code, as("Anon1"), null, "ip");
            rooms.join(code, as("Anon2"), null, "ip");
            assertEquals(2, rooms.snapshot(code).players().size());
        }

        @Test
        void capacityCountsConnectedPlayersOnly() {
            String code = h.createRoom("u-host", null, RoomsHarness.maxPlayers(2)).code();
            rooms.join(code, as("Host"), "u-host", "ip");
            PlayerView bob = rooms.join(code, as("Bob"), "u-bob", "ip");

            RoomException full = assertThrows(RoomException.class, () -> rooms.join(code, as("Carl"), "u-carl", "ip"));
            assertEquals("ROOM_FULL", full.getCode());
            assertEquals(ErrorKind.CONFLICT, full.getKind());

            rooms.disconnect(code, bob.id());
            assertDoesNotThrow(() -> rooms.join(code, as("Carl"), "u-carl", "ip"));
        }

        @Test
        void autoBalanceKeepsTeamsWithinOne() {
            String code = h.createRoom("u-host").code();
            List<String> names = List.of("Anna", "Ben", "Cleo", "Dave", "Eve", "Finn", "Gus");
            for (String n : names) rooms.join(code, as(n), "u-" + n, "ip");

            List<PlayerView> players = rooms.snapshot(code).players();
            long a = players.stream().filter(p -> p.team() == Team.A).count();
            long b = players.stream().filter(p -> p.team() == Team.B).count();
            assertTrue(Math.abs(a - b) <= 1, "A=" + a + " B=" + b);
            assertEquals(Team.A, players.get(0).team(), "tie goes to A");
            assertEquals(Team.B, players.get(1).team());
        }

        @Test
        void explicitTeamIsHonoured_unknownTeamRejected() {
            String code = h.createRoom("u-host").code();
            assertEquals(Team.SPECTATOR, rooms.join(code, as("Watcher", "spectator"), "u-w", "ip").team());

            RoomException ex = assertThrows(RoomException.class, () -> rooms.join(code, as("Odd", "C"), "u-o", "ip"));
            assertEquals("INVALID_TEAM", ex.getCode());
        }

        @Test
        void displayNameLength() {
            String code = h.createRoom("u-host").code();
            assertEquals("INVALID_INPUT",
                    assertThrows(RoomException.class, () -> rooms.join(code, as("J"), "u", "ip")).getCode());
            assertEquals("INVALID_INPUT",
                    assertThrows(RoomException.class, () -> rooms.join(code, as("x".repeat(21)), "u", "ip")).getCode());
        }

        @Test
        void passwordProtectedRoom() {
            String code = h.createRoom("u-host", "open-sesame", null).code();

            assertEquals("PASSWORD_REQUIRED",
                    assertThrows(RoomException.class, () -> rooms.join(code, as("Jan"), "u-jan", "ip")).getCode());
            assertEquals("INVALID_PASSWORD",
                    assertThrows(RoomException.class, () ->
                            rooms.join(code, new JoinRequest("Jan", null, "wrong"), "u-jan", "ip")).getCode());
            assertDoesNotThrow(() -> rooms.join(code, new JoinRequest("Jan", null, "open-sesame"), "u-jan", "ip"));
        }

        @Test
        void unknownRoom() {
            RoomException ex = assertThrows(RoomException.class, () -> rooms.join("ZZZZ-ZZZZ", as("Jan"), "u", "ip"));
            assertEquals("ROOM_NOT_FOUND", ex.getCode());
            assertTrue(h.actors.find("ZZZZ-ZZZZ").isEmpty(), "no actor opened for unknown codes");
        }

        @Test
        void firstAuthenticatedJoinerHostsAnUnhostedRoom() {
            String code = h.createRoom(null).code();
            rooms.join(code, as("Anon"), null, "ip");
            assertNull(rooms.snapshot(code).hostUserId());

            PlayerView jan = rooms.join(code, as("Jan"), "u-jan", "ip");
            assertEquals("u-jan", rooms.snapshot(code).hostUserId());
            assertTrue(rooms.snapshot(code).players().stream().filter(p -> p.id().equals(jan.id())).findFirst().orElseThrow().host());
        }

        @Test
        void creatorBecomesHostOnFirstJoin() {
            String code = h.createRoom("u-host").code();
            rooms.join(code, as("Bob"), "u-bob", "ip");
            assertNull(rooms.snapshot(code).hostUserId(), "the creator's seat is not handed to others");

            rooms.join(code, as("Host"), "u-host", "ip");
            assertEquals("u-host", rooms.snapshot(code).hostUserId());
        }

        @Test
        void creatorWhoNeverJoinsDoesNotLockTheRoom() {
            String code = h.createRoom("u-host").code();
            rooms.join(code, as("Bob"), "u-bob", "ip");
            rooms.join(code, as("Carl"), "u-carl", "ip");

            RoomView started = rooms.startGame(code, "u-bob");
            assertEquals(RoomStatus.PLAYING, started.status());
        }

        @Test
        void broadcastsPlayerJoinedAndRoomUpdated() {
            String code = h.createRoom("u-host").code();
            FakeConnection watcher = new FakeConnection("w", null);
            h.broadcaster.subscribe(code, watcher);

            rooms.join(code, as("Jan"), "u-jan", "ip");

            assertThat(watcher.eventTypes(), contains("player-joined", "room-updated"));
        }
    }

    @Nested
    @DisplayName("settings and start")
    class Lifecycle {

        private String code;

        @BeforeEach
        void room() {
            code = h.createRoom("u-host").code();
            rooms.join(code, as("Host"), "u-host", "ip");
        }

        @Test
        void onlyHostMayChangeSettings_anonymousCallerIsNotRestricted() {
            RoomException ex = assertThrows(RoomException.class,
                    () -> rooms.updateSettings(code, RoomsHarness.rounds(3, 20), "u-other"));
            assertEquals("NOT_ROOM_HOST", ex.getCode());
            assertEquals(ErrorKind.FORBIDDEN, ex.getKind());

            assertEquals(3, rooms.updateSettings(code, RoomsHarness.rounds(3, 20), "u-host").settings().getRoundCount());
            assertEquals(4, rooms.updateSettings(code, RoomsHarness.rounds(4, 20), null).settings().getRoundCount());
        }

        @Test
        void settingsPatchKeepsUntouchedFields() {
            rooms.updateSettings(code, new SettingsPatch(null, 45, List.of("science"), "hard", false, 8), "u-host");
            RoomView room = rooms.snapshot(code);
            assertEquals(5, room.settings().getRoundCount());
            assertEquals(45, room.settings().getTimePerPromptSeconds());
            assertEquals(List.of("science"), room.settings().getCategories());
            assertFalse(room.settings().isTeamMode());
            assertEquals(8, room.settings().getMaxPlayers());
        }

        @Test
        void startNeedsMinimumPlayers() {
            RoomException ex = assertThrows(RoomException.class, () -> rooms.startGame(code, "u-host"));
            assertEquals("NOT_ENOUGH_PLAYERS", ex.getCode());
            assertEquals(RoomStatus.WAITING, rooms.snapshot(code).status());
        }

        @Test
        void startHappensOnce() {
            rooms.join(code, as("Guest"), "u-guest", "ip");

            assertEquals("NOT_ROOM_HOST",
                    assertThrows(RoomException.class, () -> rooms.startGame(code, "u-guest")).getCode());

            RoomView started = rooms.startGame(code, "u-host");
            assertEquals(RoomStatus.PLAYING, started.status());
            assertNotNull(started.startedAt());

            assertEquals("GAME_ALREADY_STARTED",
                    assertThrows(RoomException.class, () -> rooms.startGame(code, "u-host")).getCode());
            assertEquals(1, h.lifecycleCount(RoomLifecycleEvent.GameStarted.class));

            assertEquals("GAME_ALREADY_STARTED",
                    assertThrows(RoomException.class, () -> rooms.join(code, as("Late"), "u-late", "ip")).getCode());
            assertEquals("GAME_ALREADY_STARTED",
                    assertThrows(RoomException.class, () -> rooms.updateSettings(code, RoomsHarness.rounds(2, 10), "u-host")).getCode());
        }

        @Test
        void teamAndReadyOnlyWhileWaiting() {
            PlayerView guest = rooms.join(code, as("Guest"), "u-guest", "ip");
            assertEquals(Team.SPECTATOR, rooms.changeTeam(code, guest.id(), "spectator").team());
            assertTrue(rooms.setReady(code, guest.id(), true).ready());

            assertEquals("INVALID_TEAM",
                    assertThrows(RoomException.class, () -> rooms.changeTeam(code, guest.id(), "purple")).getCode());
            assertEquals("PLAYER_NOT_FOUND",
                    assertThrows(RoomException.class, () -> rooms.setReady(code, "missing", true)).getCode());

            rooms.join(code, as("Third"), "u-third", "ip");
            rooms.startGame(code, "u-host");
            assertEquals("GAME_ALREADY_STARTED",
                    assertThrows(RoomException.class, () -> rooms.setReady(code, guest.id(), false)).getCode());
        }
    }

    @Nested
    @DisplayName("leaving")
    class Leaving {

        @Test
        void lastPlayerLeavingDeletesTheRoom() {
            String code = h.createRoom(null).code();
            PlayerView anon = rooms.join(code, as("Anon"), null, "ip");
            FakeConnection watcher = new FakeConnection("w", null);
            h.broadcaster.subscribe(code, watcher);

            rooms.leave(code, anon.id());

            assertFalse(h.store.codeExists(code));
            assertEquals(1, watcher.count("room-closed"));
            assertEquals("EMPTY", watcher.last("room-closed").payload().get("reason"));
            assertEquals(0, h.broadcaster.subscriberCount(code));
            assertTrue(h.actors.find(code).isEmpty());
            assertEquals("ROOM_NOT_FOUND",
                    assertThrows(RoomException.class, () -> rooms.snapshot(code)).getCode());
        }

        @Test
        void leaveHardRemoves_disconnectKeepsRecord() {
            String code = h.createRoom("u-host").code();
            rooms.join(code, as("Host"), "u-host", "ip");
            PlayerView a = rooms.join(code, as("Anna"), "u-a", "ip");
            PlayerView b = rooms.join(code, as("Ben"), "u-b", "ip");

            rooms.leave(code, a.id());
            rooms.disconnect(code, b.id());

            List<PlayerView> players = rooms.snapshot(code).players();
            assertEquals(2, players.size());
            assertFalse(players.stream().anyMatch(p -> p.id().equals(a.id())));
            assertFalse(players.stream().filter(p -> p.id().equals(b.id())).findFirst().orElseThrow().connected());
        }
    }

    @Test
    void commandForARoomRemovedUnderAStaleActorLeavesNoActorBehind() {
        h.actors.open("GONE-0001");

        RoomException ex = assertThrows(RoomException.class, () -> rooms.snapshot("GONE-0001"));

        assertEquals("ROOM_NOT_FOUND", ex.getCode());
        assertTrue(h.actors.find("GONE-0001").isEmpty());
    }

    @Test
    void publicLobbyListsWaitingPublicRoomsOnly() {
        String open = h.createRoom("u1").code();
        String secret = rooms.createRoom(new CreateRoomRequest(GAME_ID, "secret", Visibility.PRIVATE, null, null), "u2").code();
        String running = h.createRoom("u3").code();
        rooms.join(running, as("P1"), "u3", "ip");
        rooms.join(running, as("P2"), "u4", "ip");
        rooms.startGame(running, "u3");

        List<String> codes = rooms.listPublicRooms().stream().map(RoomSummary::code).toList();
        assertThat(codes, hasItem(open));
        assertFalse(codes.contains(secret));
        assertFalse(codes.contains(running));
    }
}
