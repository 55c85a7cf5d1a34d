package com.example.partyrooms.rooms;

import com.example.partyrooms.broadcast.Broadcaster;
import com.example.partyrooms.broadcast.EventType;
import com.example.partyrooms.broadcast.RoomEvent;
import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.persistence.RoomStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Host departure handling: hand the host role to the earliest-joined connected player, or close
 * the room when nobody is left to take it. Runs on the room's actor.
 */
@Service
public class HostFailover {

    private static final Logger log = LoggerFactory.getLogger(HostFailover.class);

    private static final Comparator<Player> JOIN_ORDER =
            Comparator.comparing(Player::getJoinedAt).thenComparingLong(Player::getJoinSequence);

    private final RoomRegistry registry;
    private final RoomStore store;
    private final Broadcaster broadcaster;

    public HostFailover(RoomRegistry registry, RoomStore store, Broadcaster broadcaster) {
        this.registry = registry;
        this.store = store;
        this.broadcaster = broadcaster;
    }

    public record Outcome(Optional<Player> newHost, boolean roomClosed) {}

    /** Earliest-joined connected player other than the departing one. */
    public static Optional<Player> selectSuccessor(List<Player> players, String departingPlayerId) {
        return players.stream()
                .filter(Player::isConnected)
                .filter(p -> !p.getId().equals(departingPlayerId))
                .min(JOIN_ORDER);
    }

    /**
     * @param hardRemove true for an explicit leave (record deleted), false for a transport drop
     *                   (record kept, connected=false)
     */
    public Outcome handleHostDeparture(String code, String departingPlayerId, boolean hardRemove) {
        Room room = registry.requireRoom(code);
        Player departing = registry.requirePlayer(room, departingPlayerId);
        CloseReason reason = hardRemove ? CloseReason.HOST_LEFT : CloseReason.HOST_DISCONNECTED;

        Optional<Player> successor = selectSuccessor(registry.players(room), departing.getId());
        if (successor.isEmpty()) {
            log.info("Host {} left room {} with no successor", departing.getUserId(), code);
            registry.deleteRoom(code, reason);
            return new Outcome(Optional.empty(), true);
        }

        Player next = successor.get();
        String previousHost = room.getHostUserId();
        room.setHostUserId(next.getUserId());
        room = registry.saveRoom(room);

        if (hardRemove) {
            store.deletePlayer(departing.getId());
        } else {
            store.updatePlayerFields(departing.getId(), p -> p.setConnected(false));
        }
        registry.publishPlayerLeft(room, departing, hardRemove);

        log.info("Host transferred in room {}: {} -> {} ({})", code, previousHost, next.getUserId(), next.getId());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("previousHostUserId", previousHost);
        payload.put("hostUserId", next.getUserId());
        payload.put("hostPlayerId", next.getId());
        payload.put("hostDisplayName", next.getDisplayName());
        payload.put("reason", reason.name());
        broadcaster.publish(RoomEvent.of(EventType.HOST_TRANSFERRED, code, payload));
        registry.publishRoomUpdated(room);
        return new Outcome(Optional.of(next), false);
    }
}
