package com.example.partyrooms.model;

import java.util.Locale;
import java.util.Optional;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD;

    public static Optional<Difficulty> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(Difficulty.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
