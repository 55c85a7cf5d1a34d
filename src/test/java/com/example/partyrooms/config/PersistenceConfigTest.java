package com.example.partyrooms.config;

import com.example.partyrooms.persistence.InMemoryRoomStore;
import com.example.partyrooms.persistence.JpaRoomStore;
import com.example.partyrooms.persistence.RoomStore;
import com.example.partyrooms.repository.GameContentRepository;
import com.example.partyrooms.repository.GameMetaRepository;
import com.example.partyrooms.repository.PlayerRepository;
import com.example.partyrooms.repository.RoomRepository;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class PersistenceConfigTest {

    private RoomStore storeFor(FeaturesProperties features) {
        return new PersistenceConfig().roomStore(features,
                mock(RoomRepository.class), mock(PlayerRepository.class),
                mock(GameMetaRepository.class), mock(GameContentRepository.class));
    }

    @Test
    void jpaStoreWhenFeatureEnabled() {
        RoomStore store = storeFor(new FeaturesProperties(new FeaturesProperties.PersistentRooms(true)));
        assertInstanceOf(JpaRoomStore.class, store);
    }

    @Test
    void inMemoryByDefault() {
        assertInstanceOf(InMemoryRoomStore.class, storeFor(new FeaturesProperties(null)));
        assertInstanceOf(InMemoryRoomStore.class,
                storeFor(new FeaturesProperties(new FeaturesProperties.PersistentRooms(false))));
    }
}
