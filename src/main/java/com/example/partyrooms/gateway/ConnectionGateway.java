package com.example.partyrooms.gateway;

import com.example.partyrooms.broadcast.Broadcaster;
import com.example.partyrooms.error.ErrorKind;
import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.rooms.JoinRequest;
import com.example.partyrooms.rooms.PlayerView;
import com.example.partyrooms.rooms.RoomLifecycleEvent;
import com.example.partyrooms.rooms.RoomService;
import com.example.partyrooms.rooms.RoomView;
import com.example.partyrooms.session.SessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds live connections to (room, player) and turns client commands into RoomService calls.
 *
 * - join-room binds the connection and subscribes it to the room channel
 * - every other command acts on the bound identity
 * - failures go back to the caller only, as {"type":"error", code, kind, message}
 * - a transport close of a still-bound connection soft-removes its player
 * - a rejoin of the same player from a new connection takes over the binding, so the old
 *   connection's close no longer affects the player
 * - bindings of a closed room are dropped
 */
@Component
public class ConnectionGateway {

    private static final Logger log = LoggerFactory.getLogger(ConnectionGateway.class);

    private final RoomService rooms;
    private final Broadcaster broadcaster;

    /** connection id → bound identity */
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    /** "code/playerId" → the connection currently speaking for that player */
    private final Map<String, ClientConnection> holders = new ConcurrentHashMap<>();

    public ConnectionGateway(RoomService rooms, Broadcaster broadcaster) {
        this.rooms = rooms;
        this.broadcaster = broadcaster;
    }

    private record Binding(String roomCode, String playerId, String userId) {
        Binding {
            Objects.requireNonNull(roomCode, "roomCode");
            Objects.requireNonNull(playerId, "playerId");
        }

        String playerKey() {
            return roomCode + "/" + playerId;
        }
    }

    public void connect(ClientConnection conn) {
        log.debug("Connection opened: {} user={} client={}", conn.id(), conn.userId(), conn.clientKey());
    }

    public void handle(ClientConnection conn, ClientCommand cmd) {
        String type = (cmd == null || cmd.type() == null) ? "" : cmd.type().trim();
        try {
            switch (type) {
                case "join-room" -> join(conn, cmd);
                case "leave-room" -> leave(conn);
                case "change-team" -> {
                    Binding b = bound(conn);
                    send(conn, ack("team-changed", "player", rooms.changeTeam(b.roomCode(), b.playerId(), cmd.team())));
                }
                case "set-ready" -> {
                    Binding b = bound(conn);
                    boolean ready = cmd.ready() == null || cmd.ready();
                    send(conn, ack("ready-set", "player", rooms.setReady(b.roomCode(), b.playerId(), ready)));
                }
                case "update-settings" -> {
                    Binding b = bound(conn);
                    send(conn, ack("settings-updated", "room", rooms.updateSettings(b.roomCode(), cmd.settings(), b.userId())));
                }
                case "start-game" -> {
                    Binding b = bound(conn);
                    send(conn, ack("game-starting", "room", rooms.startGame(b.roomCode(), b.userId())));
                }
                case "submit-answer" -> {
                    Binding b = bound(conn);
                    SessionCoordinator.AnswerResult r = rooms.submitAnswer(b.roomCode(), b.playerId(), cmd.answerIndex());
                    Map<String, Object> msg = new LinkedHashMap<>();
                    msg.put("type", "answer-accepted");
                    msg.put("correct", r.correct());
                    msg.put("scores", r.scores());
                    send(conn, msg);
                }
                case "next-prompt" -> {
                    Binding b = bound(conn);
                    rooms.requestNextPrompt(b.roomCode(), b.userId());
                }
                case "request-sync" -> {
                    Binding b = bound(conn);
                    send(conn, ack("sync", "room", rooms.snapshot(b.roomCode())));
                }
                default -> throw RoomException.invalid("UNKNOWN_COMMAND", "Unknown command type: '" + type + "'");
            }
        } catch (RoomException e) {
            log.debug("Command {} from {} rejected: {}", type, conn.id(), e.toString());
            send(conn, error(e));
        }
    }

    /** Transport gone: soft-remove the bound player. A connection that already left is a no-op. */
    public void disconnect(ClientConnection conn) {
        Binding b = unbind(conn);
        if (b == null) {
            log.debug("Connection closed unbound: {}", conn.id());
            return;
        }
        try {
            rooms.disconnect(b.roomCode(), b.playerId());
        } catch (RoomException e) {
            // room or player already gone (closed by failover, or removed)
            log.debug("Disconnect of {} in room {} ignored: {}", b.playerId(), b.roomCode(), e.getCode());
        }
    }

    public boolean isBound(ClientConnection conn) {
        return bindings.containsKey(conn.id());
    }

    /** Drops every binding of a room that no longer exists. */
    @EventListener
    public void onLifecycle(RoomLifecycleEvent event) {
        if (!(event instanceof RoomLifecycleEvent.RoomClosed closed)) return;
        String code = closed.roomCode();
        int dropped = 0;
        for (Iterator<Map.Entry<String, Binding>> it = bindings.entrySet().iterator(); it.hasNext(); ) {
            Binding b = it.next().getValue();
            if (code.equals(b.roomCode())) {
                it.remove();
                holders.remove(b.playerKey());
                dropped++;
            }
        }
        if (dropped > 0) log.debug("Room {} closed, {} connection(s) unbound", code, dropped);
    }

    // ---------------------------------------------------------------------
    // internals
    // ---------------------------------------------------------------------

    private void join(ClientConnection conn, ClientCommand cmd) {
        if (bindings.containsKey(conn.id())) {
            throw RoomException.conflict("ALREADY_IN_ROOM", "Leave the current room before joining another");
        }
        if (cmd.roomCode() == null || cmd.roomCode().isBlank()) {
            throw RoomException.invalid("INVALID_INPUT", "roomCode is required");
        }
        String code = cmd.roomCode().trim().toUpperCase(Locale.ROOT);
        PlayerView player = rooms.join(code, new JoinRequest(cmd.displayName(), cmd.team(), cmd.password()),
                conn.userId(), conn.clientKey());

        Binding binding = new Binding(code, player.id(), conn.userId());
        bindings.put(conn.id(), binding);
        ClientConnection previous = holders.put(binding.playerKey(), conn);
        if (previous != null && !previous.id().equals(conn.id())) {
            bindings.remove(previous.id());
            broadcaster.unsubscribe(code, previous);
            log.info("Player {} in room {} moved from connection {} to {}", player.id(), code, previous.id(), conn.id());
        }
        broadcaster.subscribe(code, conn);
        RoomView snapshot = rooms.snapshot(code);

        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "joined");
        msg.put("roomCode", code);
        msg.put("player", player);
        msg.put("room", snapshot);
        send(conn, msg);
        log.info("Connection {} joined room {} as player {}", conn.id(), code, player.id());
    }

    private void leave(ClientConnection conn) {
        Binding b = unbind(conn);
        if (b == null) throw RoomException.conflict("NOT_IN_ROOM", "Connection is not in a room");
        rooms.leave(b.roomCode(), b.playerId());
        send(conn, Map.of("type", "left", "roomCode", b.roomCode()));
    }

    private Binding unbind(ClientConnection conn) {
        Binding b = bindings.remove(conn.id());
        if (b != null) {
            holders.remove(b.playerKey(), conn);
            broadcaster.unsubscribe(b.roomCode(), conn);
        }
        return b;
    }

    private Binding bound(ClientConnection conn) {
        Binding b = bindings.get(conn.id());
        if (b == null) throw RoomException.conflict("NOT_IN_ROOM", "Join a room first");
        return b;
    }

    private static Map<String, Object> ack(String type, String key, Object value) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", type);
        msg.put(key, value);
        return msg;
    }

    static Map<String, Object> error(RoomException e) {
        return error(e.getCode(), e.getKind(), e.getMessage());
    }

    public static Map<String, Object> error(String code, ErrorKind kind, String message) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "error");
        msg.put("code", code);
        msg.put("kind", kind.name());
        msg.put("message", message);
        return msg;
    }

    private void send(ClientConnection conn, Map<String, Object> message) {
        if (!conn.isOpen()) return;
        try {
            conn.reply(message);
        } catch (IOException e) {
            log.warn("Reply to {} failed: {}", conn.id(), e.toString());
        }
    }
}
