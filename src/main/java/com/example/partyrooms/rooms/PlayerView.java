package com.example.partyrooms.rooms;

import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.Team;

import java.time.Instant;

/** Outward view of a player. */
public record PlayerView(
        String id,
        String userId,
        String displayName,
        Team team,
        boolean connected,
        boolean ready,
        int score,
        Instant joinedAt,
        boolean host) {

    public static PlayerView from(Player p, Room room) {
        return new PlayerView(p.getId(), p.getUserId(), p.getDisplayName(), p.getTeam(),
                p.isConnected(), p.isReady(), p.getScore(), p.getJoinedAt(),
                room != null && room.isHost(p.getUserId()));
    }
}
