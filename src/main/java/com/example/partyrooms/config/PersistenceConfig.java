package com.example.partyrooms.config;

import com.example.partyrooms.persistence.InMemoryRoomStore;
import com.example.partyrooms.persistence.JpaRoomStore;
import com.example.partyrooms.persistence.RoomStore;
import com.example.partyrooms.repository.GameContentRepository;
import com.example.partyrooms.repository.GameMetaRepository;
import com.example.partyrooms.repository.PlayerRepository;
import com.example.partyrooms.repository.RoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PersistenceConfig {

  private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

  // JPA-backed store only when features.persistent-rooms.enabled=true, in-memory otherwise
  @Bean
  public RoomStore roomStore(FeaturesProperties features,
                             RoomRepository rooms, PlayerRepository players,
                             GameMetaRepository games, GameContentRepository content) {
    if (features.persistentRoomsEnabled()) {
      log.info("Room store: JPA");
      return new JpaRoomStore(rooms, players, games, content);
    }
    log.info("Room store: in-memory");
    return new InMemoryRoomStore();
  }
}
