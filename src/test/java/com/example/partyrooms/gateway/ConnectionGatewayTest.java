package com.example.partyrooms.gateway;

import com.example.partyrooms.rooms.PlayerView;
import com.example.partyrooms.rooms.RoomView;
import com.example.partyrooms.rooms.SettingsPatch;
import com.example.partyrooms.support.FakeConnection;
import com.example.partyrooms.support.RoomsHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.*;

class ConnectionGatewayTest {

    private RoomsHarness h;
    private ConnectionGateway gateway;
    private String code;

    @BeforeEach
    void setUp() {
        h = new RoomsHarness().withQuestions(3);
        gateway = new ConnectionGateway(h.service, h.broadcaster);
        h.onLifecycle(gateway::onLifecycle);
        code = h.createRoom("u-jan").code();
    }

    private static ClientCommand join(String roomCode, String name) {
        return new ClientCommand("join-room", roomCode, name, null, null, null, null, null);
    }

    private FakeConnection connectAndJoin(String id, String userId, String name) {
        FakeConnection conn = new FakeConnection(id, userId);
        gateway.connect(conn);
        gateway.handle(conn, join(code, name));
        return conn;
    }

    @Test
    @DisplayName("join-room replies with joined ack plus snapshot and subscribes the connection")
    void joinBindsAndSubscribes() {
        FakeConnection jan = connectAndJoin("c1", "u-jan", "Jan");

        Map<String, Object> ack = jan.lastReply();
        assertEquals("joined", ack.get("type"));
        assertEquals(code, ack.get("roomCode"));
        PlayerView player = (PlayerView) ack.get("player");
        assertEquals("Jan", player.displayName());
        assertEquals(1, ((RoomView) ack.get("room")).players().size());
        assertTrue(gateway.isBound(jan));
        assertEquals(1, h.broadcaster.subscriberCount(code));

        connectAndJoin("c2", "u-petra", "Petra");
        assertThat(jan.eventTypes(), hasItem("player-joined"));
    }

    @Test
    void lowercaseCodesAreNormalised() {
        FakeConnection conn = new FakeConnection("c1", "u-jan");
        gateway.handle(conn, join(code.toLowerCase(), "Jan"));
        assertEquals("joined", conn.lastReply().get("type"));
    }

    @Test
    void errorsGoBackToTheCallerOnly() {
        FakeConnection jan = connectAndJoin("c1", "u-jan", "Jan");
        FakeConnection stranger = new FakeConnection("c9", "u-x");

        gateway.handle(stranger, join("ZZZZ-ZZZZ", "Xavier"));

        Map<String, Object> err = stranger.lastReply();
        assertEquals("error", err.get("type"));
        assertEquals("ROOM_NOT_FOUND", err.get("code"));
        assertEquals("NOT_FOUND", err.get("kind"));
        assertNotNull(err.get("message"));
        assertFalse(jan.replies.stream().anyMatch(r -> "error".equals(r.get("type"))));
    }

    @Test
    void commandsBeforeJoinAreRejected() {
        FakeConnection conn = new FakeConnection("c1", "u-jan");
        gateway.handle(conn, ClientCommand.of("start-game"));
        assertEquals("NOT_IN_ROOM", conn.lastReply().get("code"));

        gateway.handle(conn, ClientCommand.of("dance"));
        assertEquals("UNKNOWN_COMMAND", conn.lastReply().get("code"));
    }

    @Test
    void boundIdentityDrivesHostCommands() {
        FakeConnection jan = connectAndJoin("c1", "u-jan", "Jan");
        FakeConnection petra = connectAndJoin("c2", "u-petra", "Petra");

        gateway.handle(petra, new ClientCommand("update-settings", null, null, null, null, null, null,
                new SettingsPatch(2, null, null, null, null, null)));
        assertEquals("NOT_ROOM_HOST", petra.lastReply().get("code"));

        gateway.handle(jan, ClientCommand.of("start-game"));
        assertEquals("game-starting", jan.lastReply().get("type"));
        assertThat(petra.eventTypes(), hasItem("prompt-show"));

        gateway.handle(petra, new ClientCommand("submit-answer", null, null, null, null, null, 1, null));
        assertEquals("answer-accepted", petra.lastReply().get("type"));
        assertEquals(true, petra.lastReply().get("correct"));
    }

    @Test
    void requestSyncReturnsSnapshot() {
        FakeConnection jan = connectAndJoin("c1", "u-jan", "Jan");
        gateway.handle(jan, ClientCommand.of("request-sync"));
        assertEquals("sync", jan.lastReply().get("type"));
        assertEquals(code, ((RoomView) jan.lastReply().get("room")).code());
    }

    @Test
    void transportCloseSoftRemovesPlayer() {
        connectAndJoin("c1", "u-jan", "Jan");
        FakeConnection petra = connectAndJoin("c2", "u-petra", "Petra");

        petra.close();
        gateway.disconnect(petra);

        RoomView room = h.service.snapshot(code);
        assertEquals(2, room.players().size());
        assertFalse(room.players().stream()
                .filter(p -> p.displayName().equals("Petra")).findFirst().orElseThrow().connected());
        assertFalse(gateway.isBound(petra));
    }

    @Test
    void leaveUnbindsSoALaterCloseIsANoOp() {
        connectAndJoin("c1", "u-jan", "Jan");
        FakeConnection petra = connectAndJoin("c2", "u-petra", "Petra");

        gateway.handle(petra, ClientCommand.of("leave-room"));
        assertEquals("left", petra.lastReply().get("type"));
        assertEquals(1, h.service.snapshot(code).players().size());

        assertDoesNotThrow(() -> gateway.disconnect(petra));
        assertEquals(1, h.service.snapshot(code).players().size());
    }

    @Test
    void hostDroppingHandsOverToNextPlayer() {
        FakeConnection jan = connectAndJoin("c1", "u-jan", "Jan");
        FakeConnection petra = connectAndJoin("c2", "u-petra", "Petra");

        jan.close();
        gateway.disconnect(jan);

        assertEquals("u-petra", h.service.snapshot(code).hostUserId());
        assertThat(petra.eventTypes(), hasItem("host-transferred"));
    }

    @Test
    @DisplayName("a rejoin from a new connection takes over; closing the old one leaves the player alone")
    void rejoinFromNewConnectionSurvivesOldSocketClose() {
        FakeConnection oldJan = connectAndJoin("c1", "u-jan", "Jan");
        FakeConnection petra = connectAndJoin("c2", "u-petra", "Petra");
        FakeConnection newJan = connectAndJoin("c3", "u-jan", "Jan");

        assertEquals("joined", newJan.lastReply().get("type"));
        assertFalse(gateway.isBound(oldJan));
        assertTrue(gateway.isBound(newJan));

        oldJan.close();
        gateway.disconnect(oldJan);

        RoomView room = h.service.snapshot(code);
        assertEquals("u-jan", room.hostUserId());
        assertTrue(room.players().stream()
                .filter(p -> p.displayName().equals("Jan")).findFirst().orElseThrow().connected());
        assertFalse(petra.eventTypes().contains("host-transferred"));

        gateway.handle(newJan, ClientCommand.of("request-sync"));
        assertEquals("sync", newJan.lastReply().get("type"));

        gateway.disconnect(newJan);
        assertEquals("u-petra", h.service.snapshot(code).hostUserId());
    }

    @Test
    @DisplayName("only the current connection of a player receives room events")
    void replacedConnectionStopsReceivingEvents() {
        FakeConnection oldJan = connectAndJoin("c1", "u-jan", "Jan");
        connectAndJoin("c3", "u-jan", "Jan");
        int before = oldJan.events.size();

        connectAndJoin("c2", "u-petra", "Petra");

        assertEquals(before, oldJan.events.size());
        assertEquals(2, h.broadcaster.subscriberCount(code));
    }

    @Test
    @DisplayName("a room closed elsewhere unbinds its connections so they can join another room")
    void roomClosedElsewhereUnbindsConnections() {
        FakeConnection jan = connectAndJoin("c1", "u-jan", "Jan");
        PlayerView janPlayer = (PlayerView) jan.lastReply().get("player");

        // host removed through another surface (HTTP), nobody left to take over
        h.service.leave(code, janPlayer.id());

        assertFalse(h.store.codeExists(code));
        assertFalse(gateway.isBound(jan));

        String next = h.createRoom("u-anna").code();
        gateway.handle(jan, join(next, "Jan"));
        assertEquals("joined", jan.lastReply().get("type"));
        assertEquals(next, jan.lastReply().get("roomCode"));
    }

    @Test
    void lastPlayerDroppingClosesRoomAndLaterDisconnectsAreHarmless() {
        FakeConnection jan = connectAndJoin("c1", "u-jan", "Jan");
        FakeConnection watcher = new FakeConnection("w", null);
        h.broadcaster.subscribe(code, watcher);

        gateway.disconnect(jan);

        assertEquals(1, watcher.count("room-closed"));
        assertFalse(h.store.codeExists(code));
        assertDoesNotThrow(() -> gateway.disconnect(jan));
    }
}
