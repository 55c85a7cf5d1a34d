package com.example.partyrooms.gateway;

import com.example.partyrooms.rooms.SettingsPatch;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound command frame. Only the fields relevant to {@code type} are read:
 * join-room (roomCode, displayName, team, password), change-team (team), set-ready (ready),
 * update-settings (settings), submit-answer (answerIndex).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientCommand(
        String type,
        String roomCode,
        String displayName,
        String team,
        String password,
        Boolean ready,
        Integer answerIndex,
        SettingsPatch settings) {

    public static ClientCommand of(String type) {
        return new ClientCommand(type, null, null, null, null, null, null, null);
    }
}
