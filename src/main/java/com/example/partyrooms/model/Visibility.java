package com.example.partyrooms.model;

import java.util.Locale;
import java.util.Optional;

public enum Visibility {
    PUBLIC,
    PRIVATE;

    /** Case-insensitive parse for wire input; empty when unknown or blank. */
    public static Optional<Visibility> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(Visibility.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
