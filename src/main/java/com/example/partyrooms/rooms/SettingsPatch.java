package com.example.partyrooms.rooms;

import java.util.List;

/** Partial settings update; null fields keep the current value. */
public record SettingsPatch(
        Integer roundCount,
        Integer timePerPromptSeconds,
        List<String> categories,
        String difficulty,
        Boolean teamMode,
        Integer maxPlayers) {
}
