package com.example.partyrooms.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-room game settings. Bounds are enforced by RoomRegistry, not here, so a settings
 * object can hold a partial patch before it is merged.
 */
@Embeddable
public class RoomSettings {

    @Column(nullable = false)
    private int roundCount = 5;

    @Column(nullable = false)
    private int timePerPromptSeconds = 30;

    @Convert(converter = StringListConverter.class)
    @Column(length = 1000)
    private List<String> categories = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Difficulty difficulty;

    @Column(nullable = false)
    private boolean teamMode = true;

    /** Null means "use the game's maximum". */
    private Integer maxPlayers;

    public RoomSettings() {}

    public RoomSettings(int roundCount, int timePerPromptSeconds, boolean teamMode) {
        this.roundCount = roundCount;
        this.timePerPromptSeconds = timePerPromptSeconds;
        this.teamMode = teamMode;
    }

    public int getRoundCount() { return roundCount; }
    public void setRoundCount(int roundCount) { this.roundCount = roundCount; }

    public int getTimePerPromptSeconds() { return timePerPromptSeconds; }
    public void setTimePerPromptSeconds(int timePerPromptSeconds) { this.timePerPromptSeconds = timePerPromptSeconds; }

    public List<String> getCategories() { return categories; }
    public void setCategories(List<String> categories) {
        this.categories = (categories == null) ? new ArrayList<>() : new ArrayList<>(categories);
    }

    public Difficulty getDifficulty() { return difficulty; }
    public void setDifficulty(Difficulty difficulty) { this.difficulty = difficulty; }

    public boolean isTeamMode() { return teamMode; }
    public void setTeamMode(boolean teamMode) { this.teamMode = teamMode; }

    public Integer getMaxPlayers() { return maxPlayers; }
    public void setMaxPlayers(Integer maxPlayers) { this.maxPlayers = maxPlayers; }

    public RoomSettings copy() {
        RoomSettings s = new RoomSettings(roundCount, timePerPromptSeconds, teamMode);
        s.setCategories(categories);
        s.setDifficulty(difficulty);
        s.setMaxPlayers(maxPlayers);
        return s;
    }

    @Override
    public String toString() {
        return "RoomSettings{" +
                "roundCount=" + roundCount +
                ", timePerPromptSeconds=" + timePerPromptSeconds +
                ", categories=" + categories +
                ", difficulty=" + difficulty +
                ", teamMode=" + teamMode +
                ", maxPlayers=" + maxPlayers +
                '}';
    }
}
