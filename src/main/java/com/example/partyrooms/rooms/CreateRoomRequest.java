package com.example.partyrooms.rooms;

import com.example.partyrooms.model.Visibility;

/** Input of room creation. Settings fields left null take the configured defaults. */
public record CreateRoomRequest(
        String gameId,
        String name,
        Visibility visibility,
        String password,
        SettingsPatch settings) {
}
