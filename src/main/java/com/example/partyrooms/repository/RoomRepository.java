package com.example.partyrooms.repository;

import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.RoomStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoomRepository extends JpaRepository<Room, String> {

    Optional<Room> findByCode(String code);

    boolean existsByCode(String code);

    List<Room> findByStatusOrderByCreatedAtAsc(RoomStatus status);
}
