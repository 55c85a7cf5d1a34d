package com.example.partyrooms.model;

import java.util.Locale;
import java.util.Optional;

public enum Team {
    A,
    B,
    SPECTATOR;

    /** Lenient parse for wire input ("a", " B ", "spectator"); empty when unknown or blank. */
    public static Optional<Team> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(Team.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean isPlaying() {
        return this != SPECTATOR;
    }
}
