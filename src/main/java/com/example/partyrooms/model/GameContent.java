package com.example.partyrooms.model;

import com.example.partyrooms.prompt.PromptKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Raw catalog row as stored: the payload is a JSON document whose shape depends on {@link #kind}.
 * PromptCodec turns it into a typed Prompt when it is read.
 */
@Entity
@Table(
    name = "game_content",
    indexes = {
        @Index(name = "idx_game_content_lookup", columnList = "gameId,kind,approved")
    }
)
public class GameContent {

    @Id
    @Column(length = 64, nullable = false, updatable = false)
    private String id;

    @Column(nullable = false, length = 64)
    private String gameId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PromptKind kind;

    @Column(nullable = false, length = 4000)
    private String payload;

    @Column(length = 64)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Difficulty difficulty = Difficulty.MEDIUM;

    private boolean approved;

    protected GameContent() {}

    public GameContent(String id, String gameId, PromptKind kind, String payload,
                       String category, Difficulty difficulty, boolean approved) {
        this.id = id;
        this.gameId = gameId;
        this.kind = kind;
        this.payload = payload;
        this.category = category;
        this.difficulty = difficulty;
        this.approved = approved;
    }

    public String getId() { return id; }
    public String getGameId() { return gameId; }
    public PromptKind getKind() { return kind; }
    public String getPayload() { return payload; }
    public String getCategory() { return category; }
    public Difficulty getDifficulty() { return difficulty; }
    public boolean isApproved() { return approved; }
}
