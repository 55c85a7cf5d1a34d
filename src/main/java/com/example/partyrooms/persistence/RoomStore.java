package com.example.partyrooms.persistence;

import com.example.partyrooms.model.GameContent;
import com.example.partyrooms.model.GameMeta;
import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.RoomStatus;
import com.example.partyrooms.prompt.Prompt;
import com.example.partyrooms.prompt.PromptKind;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Port for the persistent room/player records and the read-only game catalog.
 * Implementations report any storage failure as a TRANSIENT RoomException.
 * Per-room calls are made from that room's actor only; implementations need to be safe
 * across rooms, not within one.
 */
public interface RoomStore {

    // ------------------------------------------------------------------------
    // Rooms
    // ------------------------------------------------------------------------

    Optional<Room> findRoomByCode(String code);

    /** Insert or update. Returns the stored instance, which callers should keep using. */
    Room saveRoom(Room room);

    boolean codeExists(String code);

    /** Removes the room and all of its players. No-op if absent. */
    void deleteRoom(String roomId);

    List<Room> listRoomsByStatus(RoomStatus status);

    // ------------------------------------------------------------------------
    // Players
    // ------------------------------------------------------------------------

    /** Players of a room in join order. */
    List<Player> listPlayers(String roomId);

    Optional<Player> findPlayer(String playerId);

    Player upsertPlayer(Player player);

    /** Applies {@code change} to the stored player and persists it; empty if the player is gone. */
    Optional<Player> updatePlayerFields(String playerId, Consumer<Player> change);

    void deletePlayer(String playerId);

    // ------------------------------------------------------------------------
    // Catalog (read side; registration exists for seeding/ingestion)
    // ------------------------------------------------------------------------

    Optional<GameMeta> findGameMeta(String gameId);

    /** At most {@code limit} approved prompts; malformed catalog rows are skipped. */
    List<Prompt> listApprovedPrompts(String gameId, PromptKind kind, int limit);

    void registerGame(GameMeta game);

    void registerContent(GameContent content);
}
