package com.example.partyrooms.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "features")
public record FeaturesProperties(PersistentRooms persistentRooms) {

    public static record PersistentRooms(boolean enabled) { }

    public boolean persistentRoomsEnabled() {
        return persistentRooms != null && persistentRooms.enabled();
    }
}
