package com.example.partyrooms.rooms;

import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.RoomSettings;
import com.example.partyrooms.model.RoomStatus;
import com.example.partyrooms.model.Visibility;

import java.time.Instant;
import java.util.List;

/** Room snapshot as sent to clients. The password hash never appears here, only hasPassword. */
public record RoomView(
        String id,
        String code,
        String name,
        String gameId,
        Visibility visibility,
        boolean hasPassword,
        String hostUserId,
        RoomStatus status,
        RoomSettings settings,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        List<PlayerView> players) {

    public static RoomView from(Room room, List<Player> players) {
        List<PlayerView> views = players.stream().map(p -> PlayerView.from(p, room)).toList();
        return new RoomView(room.getId(), room.getCode(), room.getName(), room.getGameId(),
                room.getVisibility(), room.hasPassword(), room.getHostUserId(), room.getStatus(),
                room.getSettings().copy(), room.getCreatedAt(), room.getStartedAt(), room.getFinishedAt(),
                views);
    }

    public long connectedCount() {
        return players.stream().filter(PlayerView::connected).count();
    }
}
