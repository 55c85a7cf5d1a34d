package com.example.partyrooms.persistence;

import com.example.partyrooms.model.GameContent;
import com.example.partyrooms.model.GameMeta;
import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.RoomStatus;
import com.example.partyrooms.prompt.Prompt;
import com.example.partyrooms.prompt.PromptCodec;
import com.example.partyrooms.prompt.PromptKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory RoomStore for deployments without a database (and for tests).
 *
 * - Rooms keyed by code, players keyed by id, both in ConcurrentHashMaps.
 * - Catalog rows are decoded when registered, so malformed content never reaches a round.
 */
public class InMemoryRoomStore implements RoomStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRoomStore.class);

    private final ConcurrentHashMap<String, Room> roomsByCode = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Player> playersById = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, GameMeta> games = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Prompt>> promptsByGameAndKind = new ConcurrentHashMap<>();

    private static String promptKey(String gameId, PromptKind kind) { return gameId + "|" + kind; }

    // ---------------------------------------------------------------------
    // Rooms
    // ---------------------------------------------------------------------

    @Override
    public Optional<Room> findRoomByCode(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(roomsByCode.get(code));
    }

    @Override
    public Room saveRoom(Room room) {
        Objects.requireNonNull(room, "room");
        roomsByCode.put(room.getCode(), room);
        return room;
    }

    @Override
    public boolean codeExists(String code) {
        return code != null && roomsByCode.containsKey(code);
    }

    @Override
    public void deleteRoom(String roomId) {
        if (roomId == null) return;
        roomsByCode.values().removeIf(r -> roomId.equals(r.getId()));
        playersById.values().removeIf(p -> roomId.equals(p.getRoomId()));
    }

    @Override
    public List<Room> listRoomsByStatus(RoomStatus status) {
        return roomsByCode.values().stream()
                .filter(r -> r.getStatus() == status)
                .sorted(Comparator.comparing(Room::getCreatedAt))
                .collect(Collectors.toList());
    }

    // ---------------------------------------------------------------------
    // Players
    // ---------------------------------------------------------------------

    @Override
    public List<Player> listPlayers(String roomId) {
        return playersById.values().stream()
                .filter(p -> p.getRoomId().equals(roomId))
                .sorted(Comparator.comparingLong(Player::getJoinSequence))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Player> findPlayer(String playerId) {
        if (playerId == null) return Optional.empty();
        return Optional.ofNullable(playersById.get(playerId));
    }

    @Override
    public Player upsertPlayer(Player player) {
        Objects.requireNonNull(player, "player");
        playersById.put(player.getId(), player);
        return player;
    }

    @Override
    public Optional<Player> updatePlayerFields(String playerId, Consumer<Player> change) {
        Player p = (playerId == null) ? null : playersById.get(playerId);
        if (p == null) return Optional.empty();
        change.accept(p);
        return Optional.of(p);
    }

    @Override
    public void deletePlayer(String playerId) {
        if (playerId != null) playersById.remove(playerId);
    }

    // ---------------------------------------------------------------------
    // Catalog
    // ---------------------------------------------------------------------

    @Override
    public Optional<GameMeta> findGameMeta(String gameId) {
        if (gameId == null) return Optional.empty();
        return Optional.ofNullable(games.get(gameId));
    }

    @Override
    public List<Prompt> listApprovedPrompts(String gameId, PromptKind kind, int limit) {
        List<Prompt> all = promptsByGameAndKind.getOrDefault(promptKey(gameId, kind), List.of());
        return all.stream().limit(Math.max(0, limit)).collect(Collectors.toList());
    }

    @Override
    public void registerGame(GameMeta game) {
        games.put(game.getId(), game);
    }

    @Override
    public void registerContent(GameContent content) {
        if (content == null || !content.isApproved()) return;
        Prompt prompt;
        try {
            prompt = PromptCodec.decode(content);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping malformed catalog content id={} game={}: {}",
                    content.getId(), content.getGameId(), e.getMessage());
            return;
        }
        promptsByGameAndKind
                .computeIfAbsent(promptKey(content.getGameId(), prompt.kind()), k -> new CopyOnWriteArrayList<>())
                .add(prompt);
    }
}
