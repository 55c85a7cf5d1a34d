package com.example.partyrooms.repository;

import com.example.partyrooms.model.GameMeta;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GameMetaRepository extends JpaRepository<GameMeta, String> { }
