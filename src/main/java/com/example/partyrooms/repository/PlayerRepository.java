package com.example.partyrooms.repository;

import com.example.partyrooms.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PlayerRepository extends JpaRepository<Player, String> {

    List<Player> findByRoomIdOrderByJoinSequenceAsc(String roomId);

    void deleteByRoomId(String roomId);
}
