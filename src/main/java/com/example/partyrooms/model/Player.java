package com.example.partyrooms.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** Participant record scoped to one room. userId is null for anonymous players. */
@Entity
@Table(
    name = "room_players",
    indexes = {
        @Index(name = "idx_room_players_room", columnList = "roomId"),
        @Index(name = "idx_room_players_room_user", columnList = "roomId,userId")
    }
)
public class Player {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(length = 36, nullable = false, updatable = false)
    private String roomId;

    @Column(length = 64, updatable = false)
    private String userId;

    @Column(nullable = false, length = 20)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Team team = Team.SPECTATOR;

    private boolean connected = true;   // live transport or fresh HTTP join
    private boolean ready = false;
    private int score = 0;

    @Column(nullable = false, updatable = false)
    private Instant joinedAt;

    @Column(nullable = false, updatable = false)
    private long joinSequence;

    protected Player() {}

    public Player(String roomId, String userId, String displayName, Team team, long joinSequence) {
        this.id = UUID.randomUUID().toString();
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.userId = userId;
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.team = (team == null ? Team.SPECTATOR : team);
        this.joinedAt = Instant.now();
        this.joinSequence = joinSequence;
    }

    // identity
    public String getId() { return id; }
    public String getRoomId() { return roomId; }
    public String getUserId() { return userId; }
    public String getDisplayName() { return displayName; }

    // team
    public Team getTeam() { return team; }
    public void setTeam(Team team) { this.team = Objects.requireNonNull(team, "team"); }

    // presence
    public boolean isConnected() { return connected; }
    public void setConnected(boolean connected) { this.connected = connected; }

    public boolean isReady() { return ready; }
    public void setReady(boolean ready) { this.ready = ready; }

    // scoring
    public int getScore() { return score; }
    public void addScore(int points) { this.score += points; }

    // ordering
    public Instant getJoinedAt() { return joinedAt; }
    public long getJoinSequence() { return joinSequence; }

    @Override
    public String toString() {
        return "Player{" +
                "id='" + id + '\'' +
                ", displayName='" + displayName + '\'' +
                ", userId='" + userId + '\'' +
                ", team=" + team +
                ", connected=" + connected +
                ", ready=" + ready +
                ", score=" + score +
                '}';
    }
}
