package com.example.partyrooms.repository;

import com.example.partyrooms.model.GameContent;
import com.example.partyrooms.prompt.PromptKind;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GameContentRepository extends JpaRepository<GameContent, String> {

    List<GameContent> findByGameIdAndKindAndApprovedIsTrue(String gameId, PromptKind kind, Pageable page);
}
