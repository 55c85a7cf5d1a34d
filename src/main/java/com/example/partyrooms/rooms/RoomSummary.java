package com.example.partyrooms.rooms;

/** Lobby list entry for a public waiting room. */
public record RoomSummary(String code, String name, String gameId, boolean hasPassword,
                          int connectedPlayers, Integer maxPlayers) {
}
