package com.example.partyrooms.rooms;

import com.example.partyrooms.broadcast.Broadcaster;
import com.example.partyrooms.broadcast.EventType;
import com.example.partyrooms.broadcast.RoomEvent;
import com.example.partyrooms.config.RoomProperties;
import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.model.Difficulty;
import com.example.partyrooms.model.GameMeta;
import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.RoomSettings;
import com.example.partyrooms.model.RoomStatus;
import com.example.partyrooms.model.Team;
import com.example.partyrooms.model.Visibility;
import com.example.partyrooms.persistence.RoomStore;
import com.example.partyrooms.security.PasswordGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative room and player records.
 *
 * Every per-room method must run on that room's actor (see RoomService); the registry itself holds
 * no locks. Game start/finish and room deletion are announced as {@link RoomLifecycleEvent}s, the
 * registry never calls into the session layer.
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private static final int NAME_MIN = 2;
    private static final int NAME_MAX = 20;
    private static final int ROOM_NAME_MAX = 100;

    private final RoomStore store;
    private final PasswordGuard passwordGuard;
    private final Broadcaster broadcaster;
    private final ApplicationEventPublisher events;
    private final RoomProperties props;
    private final Clock clock;

    @Autowired
    public RoomRegistry(RoomStore store, PasswordGuard passwordGuard, Broadcaster broadcaster,
                        ApplicationEventPublisher events, RoomProperties props) {
        this(store, passwordGuard, broadcaster, events, props, Clock.systemUTC());
    }

    public RoomRegistry(RoomStore store, PasswordGuard passwordGuard, Broadcaster broadcaster,
                        ApplicationEventPublisher events, RoomProperties props, Clock clock) {
        this.store = store;
        this.passwordGuard = passwordGuard;
        this.broadcaster = broadcaster;
        this.events = events;
        this.props = props;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------
    // Creation
    // ---------------------------------------------------------------------

    public RoomView createRoom(String code, CreateRoomRequest req, String hostUserId) {
        if (req == null || req.gameId() == null || req.gameId().isBlank()) {
            throw RoomException.invalid("INVALID_INPUT", "gameId is required");
        }
        GameMeta game = store.findGameMeta(req.gameId())
                .filter(GameMeta::isActive)
                .orElseThrow(() -> RoomException.gameNotFound(req.gameId()));
        if (!game.isOnline()) {
            throw RoomException.invalid("GAME_NOT_ONLINE", "Game " + game.getId() + " cannot be played online");
        }
        if (req.name() != null && req.name().trim().length() > ROOM_NAME_MAX) {
            throw RoomException.invalid("INVALID_INPUT", "Room name must be at most " + ROOM_NAME_MAX + " characters");
        }

        RoomSettings settings = new RoomSettings(props.getDefaultRoundCount(), props.getDefaultTimePerPromptSeconds(), true);
        applyPatch(settings, req.settings());
        validateSettings(settings);

        Room room = new Room(code, game.getId());
        room.setName(req.name());
        room.setVisibility(req.visibility() == null ? Visibility.PUBLIC : req.visibility());
        room.setPasswordHash(passwordGuard.hashForNewRoom(req.password()));
        // the creator becomes host only once they hold a player record
        room.setPendingHostUserId(blankToNull(hostUserId));
        room.setSettings(settings);
        room = store.saveRoom(room);

        log.info("Room created: code={}, game={}, creator={}, protected={}",
                room.getCode(), room.getGameId(), room.getPendingHostUserId(), room.hasPassword());
        RoomView view = RoomView.from(room, List.of());
        broadcaster.publish(RoomEvent.of(EventType.ROOM_UPDATED, code, Map.of("room", view)));
        return view;
    }

    // ---------------------------------------------------------------------
    // Membership
    // ---------------------------------------------------------------------

    public Player joinRoom(String code, JoinRequest req, String userId, String clientKey) {
        Room room = requireRoom(code);
        if (room.getStatus() == RoomStatus.FINISHED) {
            throw RoomException.conflict("ROOM_FINISHED", "Room " + code + " has finished");
        }
        if (room.getStatus() == RoomStatus.PLAYING) {
            throw RoomException.conflict("GAME_ALREADY_STARTED", "Game in room " + code + " has already started");
        }

        String displayName = validDisplayName(req == null ? null : req.displayName());
        Team requested = null;
        if (req != null && req.team() != null && !req.team().isBlank()) {
            requested = Team.parse(req.team())
                    .orElseThrow(() -> RoomException.invalid("INVALID_TEAM", "Unknown team: " + req.team()));
        }

        passwordGuard.checkJoin(room, req == null ? null : req.password(), clientKey);

        String uid = blankToNull(userId);
        List<Player> players = store.listPlayers(room.getId());
        if (uid != null) {
            Optional<Player> existing = players.stream()
                    .filter(p -> p.isConnected() && uid.equals(p.getUserId()))
                    .findFirst();
            if (existing.isPresent()) {
                log.debug("Idempotent rejoin of user {} in room {}", uid, code);
                return existing.get();
            }
        }

        long connected = players.stream().filter(Player::isConnected).count();
        int capacity = effectiveMaxPlayers(room);
        if (connected >= capacity) {
            throw RoomException.conflict("ROOM_FULL", "Room " + code + " is full (" + capacity + " players)");
        }

        Team team = (requested != null) ? requested : balancedTeam(players);
        Player player = new Player(room.getId(), uid, displayName, team, room.nextJoinSequence());
        if (claimsHost(room, uid)) {
            room.setHostUserId(uid);
            room.setPendingHostUserId(null);
            log.info("User {} is now host of room {}", uid, code);
        }
        room = store.saveRoom(room);
        player = store.upsertPlayer(player);

        log.info("Player joined: room={}, player={}, name='{}', team={}", code, player.getId(), displayName, team);
        broadcaster.publish(RoomEvent.of(EventType.PLAYER_JOINED, code, Map.of("player", PlayerView.from(player, room))));
        publishRoomUpdated(room);
        return player;
    }

    /** Hard-removes the player; deletes the room once nobody connected remains. */
    public void leave(String code, String playerId) {
        Room room = requireRoom(code);
        Player player = requirePlayer(room, playerId);
        store.deletePlayer(player.getId());
        log.info("Player left: room={}, player={}", code, player.getId());
        publishPlayerLeft(room, player, true);
        closeIfEmptyOrUpdate(room);
    }

    /** Soft-removes the player (connected=false); the record stays for the scoreboard. */
    public void markDisconnected(String code, String playerId) {
        Room room = requireRoom(code);
        Player player = requirePlayer(room, playerId);
        if (!player.isConnected()) return;
        store.updatePlayerFields(player.getId(), p -> p.setConnected(false));
        log.info("Player disconnected: room={}, player={}", code, player.getId());
        publishPlayerLeft(room, player, false);
        closeIfEmptyOrUpdate(room);
    }

    public Player changeTeam(String code, String playerId, Team team) {
        if (team == null) throw RoomException.invalid("INVALID_TEAM", "team is required");
        Room room = requireWaiting(code);
        requirePlayer(room, playerId);
        Player updated = store.updatePlayerFields(playerId, p -> p.setTeam(team))
                .orElseThrow(() -> RoomException.playerNotFound(playerId));
        log.debug("Player {} moved to team {} in room {}", playerId, team, code);
        publishRoomUpdated(room);
        return updated;
    }

    public Player setReady(String code, String playerId, boolean ready) {
        Room room = requireWaiting(code);
        requirePlayer(room, playerId);
        Player updated = store.updatePlayerFields(playerId, p -> p.setReady(ready))
                .orElseThrow(() -> RoomException.playerNotFound(playerId));
        publishRoomUpdated(room);
        return updated;
    }

    // ---------------------------------------------------------------------
    // Settings & lifecycle
    // ---------------------------------------------------------------------

    public RoomView updateSettings(String code, SettingsPatch patch, String actorUserId) {
        Room room = requireRoom(code);
        requireHost(room, actorUserId, "change settings");
        if (room.getStatus() != RoomStatus.WAITING) {
            throw RoomException.conflict("GAME_ALREADY_STARTED", "Settings can only change while waiting");
        }

        RoomSettings merged = room.getSettings().copy();
        applyPatch(merged, patch);
        validateSettings(merged);
        if (merged.getMaxPlayers() != null && merged.getMaxPlayers() < connectedCount(room)) {
            throw RoomException.invalid("INVALID_SETTINGS", "maxPlayers is below the number of connected players");
        }

        room.setSettings(merged);
        room = store.saveRoom(room);
        log.info("Settings updated: room={}, settings={}", code, merged);
        return publishRoomUpdated(room);
    }

    public RoomView startGame(String code, String actorUserId) {
        Room room = requireRoom(code);
        requireHost(room, actorUserId, "start the game");
        if (room.getStatus() != RoomStatus.WAITING) {
            throw RoomException.conflict("GAME_ALREADY_STARTED", "Game in room " + code + " has already started");
        }
        GameMeta game = store.findGameMeta(room.getGameId())
                .orElseThrow(() -> RoomException.gameNotFound(room.getGameId()));
        long connected = connectedCount(room);
        if (connected < game.getMinPlayers()) {
            throw RoomException.conflict("NOT_ENOUGH_PLAYERS",
                    "Need at least " + game.getMinPlayers() + " connected players, have " + connected);
        }

        room.advanceTo(RoomStatus.PLAYING, clock.instant());
        Room saved = store.saveRoom(room);
        log.info("Game started: room={}, game={}, players={}", code, saved.getGameId(), connected);
        RoomView view = publishRoomUpdated(saved);
        try {
            events.publishEvent(new RoomLifecycleEvent.GameStarted(code, saved.getGameId()));
        } catch (RuntimeException e) {
            log.warn("Session for room {} could not be set up, back to WAITING: {}", code, e.toString());
            revertStart(saved, e);
            throw e;
        }
        return view;
    }

    private void revertStart(Room room, RuntimeException cause) {
        room.revertStart();
        try {
            publishRoomUpdated(store.saveRoom(room));
        } catch (RuntimeException e) {
            log.error("Room {} could not be put back into WAITING", room.getCode(), e);
            cause.addSuppressed(e);
        }
    }

    public RoomView finishGame(String code) {
        Room room = requireRoom(code);
        if (room.getStatus() != RoomStatus.PLAYING) {
            throw RoomException.conflict("GAME_NOT_PLAYING", "Game in room " + code + " is not running");
        }
        room.advanceTo(RoomStatus.FINISHED, clock.instant());
        room = store.saveRoom(room);
        log.info("Game finished: room={}", code);
        RoomView view = publishRoomUpdated(room);
        events.publishEvent(new RoomLifecycleEvent.GameFinished(code));
        return view;
    }

    /** Deletes room and players, announces room-closed exactly once and closes the channel. */
    public void deleteRoom(String code, CloseReason reason) {
        Room room = requireRoom(code);
        store.deleteRoom(room.getId());
        log.info("Room closed: code={}, reason={}", code, reason);
        broadcaster.publish(RoomEvent.of(EventType.ROOM_CLOSED, code, Map.of("reason", reason.name())));
        broadcaster.closeChannel(code);
        events.publishEvent(new RoomLifecycleEvent.RoomClosed(code, reason));
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    public RoomView snapshot(String code) {
        Room room = requireRoom(code);
        return RoomView.from(room, store.listPlayers(room.getId()));
    }

    /** Public WAITING rooms, oldest first. Read-only, so it may run off-actor. */
    public List<RoomSummary> listPublicRooms() {
        return store.listRoomsByStatus(RoomStatus.WAITING).stream()
                .filter(r -> r.getVisibility() == Visibility.PUBLIC)
                .map(r -> new RoomSummary(r.getCode(), r.getName(), r.getGameId(), r.hasPassword(),
                        (int) connectedCount(r), r.getSettings().getMaxPlayers()))
                .toList();
    }

    // ---------------------------------------------------------------------
    // Helpers shared with HostFailover / SessionCoordinator
    // ---------------------------------------------------------------------

    public Room requireRoom(String code) {
        return store.findRoomByCode(code).orElseThrow(() -> RoomException.roomNotFound(code));
    }

    public Player requirePlayer(Room room, String playerId) {
        return store.findPlayer(playerId)
                .filter(p -> p.getRoomId().equals(room.getId()))
                .orElseThrow(() -> RoomException.playerNotFound(playerId));
    }

    public List<Player> players(Room room) {
        return store.listPlayers(room.getId());
    }

    /** Anonymous callers and unhosted rooms are not restricted. */
    public void requireHost(Room room, String actorUserId, String action) {
        String uid = blankToNull(actorUserId);
        if (room.getHostUserId() != null && uid != null && !room.isHost(uid)) {
            throw RoomException.notHost(action);
        }
    }

    public RoomView publishRoomUpdated(Room room) {
        RoomView view = RoomView.from(room, store.listPlayers(room.getId()));
        broadcaster.publish(RoomEvent.of(EventType.ROOM_UPDATED, room.getCode(), Map.of("room", view)));
        return view;
    }

    void publishPlayerLeft(Room room, Player player, boolean removed) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("playerId", player.getId());
        payload.put("displayName", player.getDisplayName());
        payload.put("removed", removed);
        broadcaster.publish(RoomEvent.of(EventType.PLAYER_LEFT, room.getCode(), payload));
    }

    Room saveRoom(Room room) {
        return store.saveRoom(room);
    }

    // ---------------------------------------------------------------------
    // internals
    // ---------------------------------------------------------------------

    /** An unhosted room goes to the creator if one is pending, else to the first authenticated joiner. */
    private static boolean claimsHost(Room room, String uid) {
        if (uid == null || room.getHostUserId() != null) return false;
        return room.getPendingHostUserId() == null || room.getPendingHostUserId().equals(uid);
    }

    private void closeIfEmptyOrUpdate(Room room) {
        if (connectedCount(room) == 0) {
            deleteRoom(room.getCode(), CloseReason.EMPTY);
        } else {
            publishRoomUpdated(room);
        }
    }

    private Room requireWaiting(String code) {
        Room room = requireRoom(code);
        if (room.getStatus() != RoomStatus.WAITING) {
            throw RoomException.conflict("GAME_ALREADY_STARTED", "Room " + code + " is no longer waiting");
        }
        return room;
    }

    private long connectedCount(Room room) {
        return store.listPlayers(room.getId()).stream().filter(Player::isConnected).count();
    }

    private int effectiveMaxPlayers(Room room) {
        Integer configured = room.getSettings().getMaxPlayers();
        if (configured != null) return configured;
        return store.findGameMeta(room.getGameId()).map(GameMeta::getMaxPlayers).orElse(props.getMaxPlayersLimit());
    }

    /** Smaller of A/B by connected players; ties go to A. */
    static Team balancedTeam(List<Player> players) {
        long a = players.stream().filter(p -> p.isConnected() && p.getTeam() == Team.A).count();
        long b = players.stream().filter(p -> p.isConnected() && p.getTeam() == Team.B).count();
        return (b < a) ? Team.B : Team.A;
    }

    private static String validDisplayName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.length() < NAME_MIN || name.length() > NAME_MAX) {
            throw RoomException.invalid("INVALID_INPUT",
                    "Display name must be " + NAME_MIN + "-" + NAME_MAX + " characters");
        }
        return name;
    }

    private void applyPatch(RoomSettings target, SettingsPatch patch) {
        if (patch == null) return;
        if (patch.roundCount() != null) target.setRoundCount(patch.roundCount());
        if (patch.timePerPromptSeconds() != null) target.setTimePerPromptSeconds(patch.timePerPromptSeconds());
        if (patch.categories() != null) target.setCategories(patch.categories());
        if (patch.difficulty() != null) {
            if (patch.difficulty().isBlank()) {
                target.setDifficulty(null);
            } else {
                Difficulty d = Difficulty.parse(patch.difficulty())
                        .orElseThrow(() -> RoomException.invalid("INVALID_SETTINGS", "Unknown difficulty: " + patch.difficulty()));
                target.setDifficulty(d);
            }
        }
        if (patch.teamMode() != null) target.setTeamMode(patch.teamMode());
        if (patch.maxPlayers() != null) target.setMaxPlayers(patch.maxPlayers());
    }

    private void validateSettings(RoomSettings s) {
        if (s.getRoundCount() < props.getMinRoundCount() || s.getRoundCount() > props.getMaxRoundCount()) {
            throw RoomException.invalid("INVALID_SETTINGS",
                    "roundCount must be " + props.getMinRoundCount() + "-" + props.getMaxRoundCount());
        }
        if (s.getTimePerPromptSeconds() < props.getMinTimePerPromptSeconds()
                || s.getTimePerPromptSeconds() > props.getMaxTimePerPromptSeconds()) {
            throw RoomException.invalid("INVALID_SETTINGS",
                    "timePerPromptSeconds must be " + props.getMinTimePerPromptSeconds() + "-" + props.getMaxTimePerPromptSeconds());
        }
        Integer max = s.getMaxPlayers();
        if (max != null && (max < props.getMinPlayersLimit() || max > props.getMaxPlayersLimit())) {
            throw RoomException.invalid("INVALID_SETTINGS",
                    "maxPlayers must be " + props.getMinPlayersLimit() + "-" + props.getMaxPlayersLimit());
        }
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
