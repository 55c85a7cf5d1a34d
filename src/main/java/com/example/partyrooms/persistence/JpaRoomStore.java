package com.example.partyrooms.persistence;

import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.model.GameContent;
import com.example.partyrooms.model.GameMeta;
import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.RoomStatus;
import com.example.partyrooms.prompt.Prompt;
import com.example.partyrooms.prompt.PromptCodec;
import com.example.partyrooms.prompt.PromptKind;
import com.example.partyrooms.repository.GameContentRepository;
import com.example.partyrooms.repository.GameMetaRepository;
import com.example.partyrooms.repository.PlayerRepository;
import com.example.partyrooms.repository.RoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Adapter onto the Spring Data repositories. Only active when features.persistent-rooms.enabled=true.
 * Every DataAccessException is reported as a TRANSIENT RoomException; nothing is retried here.
 */
public class JpaRoomStore implements RoomStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRoomStore.class);

    private final RoomRepository rooms;
    private final PlayerRepository players;
    private final GameMetaRepository games;
    private final GameContentRepository content;

    public JpaRoomStore(RoomRepository rooms, PlayerRepository players,
                        GameMetaRepository games, GameContentRepository content) {
        this.rooms = rooms;
        this.players = players;
        this.games = games;
        this.content = content;
    }

    private static <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.warn("Room store {} failed: {}", operation, e.getMessage());
            throw RoomException.storeUnavailable(operation, e);
        }
    }

    // ---------------------------------------------------------------------
    // Rooms
    // ---------------------------------------------------------------------

    @Override
    public Optional<Room> findRoomByCode(String code) {
        if (code == null) return Optional.empty();
        return guarded("findRoomByCode", () -> rooms.findByCode(code));
    }

    @Override
    public Room saveRoom(Room room) {
        return guarded("saveRoom", () -> rooms.save(room));
    }

    @Override
    public boolean codeExists(String code) {
        return code != null && guarded("codeExists", () -> rooms.existsByCode(code));
    }

    @Override
    @Transactional
    public void deleteRoom(String roomId) {
        if (roomId == null) return;
        guarded("deleteRoom", () -> {
            players.deleteByRoomId(roomId);
            rooms.deleteById(roomId);
            return null;
        });
    }

    @Override
    public List<Room> listRoomsByStatus(RoomStatus status) {
        return guarded("listRoomsByStatus", () -> rooms.findByStatusOrderByCreatedAtAsc(status));
    }

    // ---------------------------------------------------------------------
    // Players
    // ---------------------------------------------------------------------

    @Override
    public List<Player> listPlayers(String roomId) {
        return guarded("listPlayers", () -> players.findByRoomIdOrderByJoinSequenceAsc(roomId));
    }

    @Override
    public Optional<Player> findPlayer(String playerId) {
        if (playerId == null) return Optional.empty();
        return guarded("findPlayer", () -> players.findById(playerId));
    }

    @Override
    public Player upsertPlayer(Player player) {
        return guarded("upsertPlayer", () -> players.save(player));
    }

    @Override
    @Transactional
    public Optional<Player> updatePlayerFields(String playerId, Consumer<Player> change) {
        return guarded("updatePlayerFields", () -> players.findById(playerId).map(p -> {
            change.accept(p);
            return players.save(p);
        }));
    }

    @Override
    public void deletePlayer(String playerId) {
        if (playerId == null) return;
        guarded("deletePlayer", () -> {
            players.deleteById(playerId);
            return null;
        });
    }

    // ---------------------------------------------------------------------
    // Catalog
    // ---------------------------------------------------------------------

    @Override
    public Optional<GameMeta> findGameMeta(String gameId) {
        if (gameId == null) return Optional.empty();
        return guarded("findGameMeta", () -> games.findById(gameId));
    }

    @Override
    public List<Prompt> listApprovedPrompts(String gameId, PromptKind kind, int limit) {
        List<GameContent> rows = guarded("listApprovedPrompts",
                () -> content.findByGameIdAndKindAndApprovedIsTrue(gameId, kind, PageRequest.of(0, Math.max(1, limit))));
        List<Prompt> out = new ArrayList<>(rows.size());
        for (GameContent row : rows) {
            try {
                out.add(PromptCodec.decode(row));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed catalog content id={} game={}: {}", row.getId(), gameId, e.getMessage());
            }
        }
        return out;
    }

    @Override
    public void registerGame(GameMeta game) {
        guarded("registerGame", () -> games.save(game));
    }

    @Override
    public void registerContent(GameContent row) {
        guarded("registerContent", () -> content.save(row));
    }
}
