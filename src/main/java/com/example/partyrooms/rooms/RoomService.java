package com.example.partyrooms.rooms;

import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.Team;
import com.example.partyrooms.persistence.RoomStore;
import com.example.partyrooms.rooms.actor.RoomActors;
import com.example.partyrooms.session.SessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Entry point for every room command, shared by the HTTP controller and the connection gateway.
 * Each command is executed on the room's actor and the caller waits for its result.
 */
@Service
public class RoomService {

    private static final Logger log = LoggerFactory.getLogger(RoomService.class);

    private static final String ROOM_NOT_FOUND = "ROOM_NOT_FOUND";

    private final RoomActors actors;
    private final RoomRegistry registry;
    private final RoomCodeAllocator codes;
    private final HostFailover failover;
    private final SessionCoordinator sessions;
    private final RoomStore store;

    public RoomService(RoomActors actors, RoomRegistry registry, RoomCodeAllocator codes,
                       HostFailover failover, SessionCoordinator sessions, RoomStore store) {
        this.actors = actors;
        this.registry = registry;
        this.codes = codes;
        this.failover = failover;
        this.sessions = sessions;
        this.store = store;
    }

    public RoomView createRoom(CreateRoomRequest req, String userId) {
        String code = codes.allocate();
        try {
            return actors.call(code, () -> registry.createRoom(code, req, userId));
        } catch (RuntimeException e) {
            actors.retire(code);
            throw e;
        } finally {
            codes.release(code);
        }
    }

    public PlayerView join(String code, JoinRequest req, String userId, String clientKey) {
        return onRoom(code, () -> {
            Player p = registry.joinRoom(code, req, userId, clientKey);
            return PlayerView.from(p, registry.requireRoom(code));
        });
    }

    /** Explicit leave; a leaving host triggers failover. */
    public void leave(String code, String playerId) {
        onRoom(code, () -> {
            if (isHost(code, playerId)) {
                failover.handleHostDeparture(code, playerId, true);
            } else {
                registry.leave(code, playerId);
            }
            return null;
        });
    }

    /** Transport dropped; the player stays listed as disconnected. */
    public void disconnect(String code, String playerId) {
        onRoom(code, () -> {
            if (isHost(code, playerId)) {
                failover.handleHostDeparture(code, playerId, false);
            } else {
                registry.markDisconnected(code, playerId);
            }
            return null;
        });
    }

    public PlayerView changeTeam(String code, String playerId, String team) {
        Team parsed = Team.parse(team)
                .orElseThrow(() -> RoomException.invalid("INVALID_TEAM", "Unknown team: " + team));
        return onRoom(code, () -> {
            Player p = registry.changeTeam(code, playerId, parsed);
            return PlayerView.from(p, registry.requireRoom(code));
        });
    }

    public PlayerView setReady(String code, String playerId, boolean ready) {
        return onRoom(code, () -> {
            Player p = registry.setReady(code, playerId, ready);
            return PlayerView.from(p, registry.requireRoom(code));
        });
    }

    public RoomView updateSettings(String code, SettingsPatch patch, String userId) {
        return onRoom(code, () -> registry.updateSettings(code, patch, userId));
    }

    public RoomView startGame(String code, String userId) {
        return onRoom(code, () -> registry.startGame(code, userId));
    }

    public SessionCoordinator.AnswerResult submitAnswer(String code, String playerId, Integer answerIndex) {
        if (answerIndex == null) throw RoomException.invalid("INVALID_INPUT", "answerIndex is required");
        return onRoom(code, () -> sessions.submitAnswer(code, playerId, answerIndex));
    }

    public void requestNextPrompt(String code, String userId) {
        onRoom(code, () -> {
            sessions.requestNextPrompt(code, userId);
            return null;
        });
    }

    public RoomView snapshot(String code) {
        return onRoom(code, () -> registry.snapshot(code));
    }

    public List<RoomSummary> listPublicRooms() {
        return registry.listPublicRooms();
    }

    // ---------------------------------------------------------------------
    // internals
    // ---------------------------------------------------------------------

    /** Runs on the room's actor; unknown codes fail fast without opening an actor. */
    private <T> T onRoom(String code, Callable<T> task) {
        if (code == null || code.isBlank()) throw RoomException.invalid("INVALID_INPUT", "room code is required");
        if (actors.find(code).isEmpty() && !store.codeExists(code)) {
            log.debug("Command for unknown room {}", code);
            throw RoomException.roomNotFound(code);
        }
        try {
            return actors.call(code, task);
        } catch (RoomException e) {
            if (ROOM_NOT_FOUND.equals(e.getCode()) && !store.codeExists(code) && !codes.isReserved(code)) {
                // the room went away between the check and the task; drop the actor call() reopened
                actors.retire(code);
            }
            throw e;
        }
    }

    private boolean isHost(String code, String playerId) {
        Room room = registry.requireRoom(code);
        Player player = registry.requirePlayer(room, playerId);
        return room.isHost(player.getUserId());
    }
}
