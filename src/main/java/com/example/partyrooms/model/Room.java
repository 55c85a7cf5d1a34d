package com.example.partyrooms.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Room record: identity, public code, lifecycle status, host and settings.
 * Players live in their own table keyed by roomId. All mutation happens on the room's actor,
 * so this class itself does not add locking.
 */
@Entity
@Table(
    name = "rooms",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_rooms_code", columnNames = "code")
    },
    indexes = {
        @Index(name = "idx_rooms_status", columnList = "status")
    }
)
public class Room {

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(length = 9, nullable = false, updatable = false)
    private String code;

    @Size(max = 100)
    @Column(length = 100)
    private String name;

    @Column(nullable = false, length = 64, updatable = false)
    private String gameId;

    // ---------------------------------------------------------------------
    // Access
    // ---------------------------------------------------------------------

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Visibility visibility = Visibility.PUBLIC;

    /** BCrypt hash; never leaves the server. */
    @Column(length = 100)
    private String passwordHash;

    @Column(length = 64)
    private String hostUserId;

    /** Creator's claim on the host seat; taken over on their first join. */
    @Column(length = 64)
    private String pendingHostUserId;

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RoomStatus status = RoomStatus.WAITING;

    @Embedded
    private RoomSettings settings = new RoomSettings();

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant startedAt;
    private Instant finishedAt;

    /** Monotonic join sequence; breaks joinedAt ties when picking a successor host. */
    @Column(nullable = false)
    private long joinCounter = 0;

    protected Room() {}

    public Room(String code, String gameId) {
        this.id = UUID.randomUUID().toString();
        this.code = Objects.requireNonNull(code, "code");
        this.gameId = Objects.requireNonNull(gameId, "gameId");
        this.createdAt = Instant.now();
    }

    @PrePersist
    protected void onCreate() {
        if (this.id == null || this.id.isBlank()) this.id = UUID.randomUUID().toString();
        if (this.createdAt == null) this.createdAt = Instant.now();
        if (this.name != null) this.name = this.name.trim();
    }

    // ---------------------------------------------------------------------
    // Lifecycle transitions
    // ---------------------------------------------------------------------

    /** Moves status forward by exactly one step; anything else is a programming error. */
    public void advanceTo(RoomStatus next, Instant at) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Room " + code + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        if (next == RoomStatus.PLAYING) this.startedAt = at;
        if (next == RoomStatus.FINISHED) this.finishedAt = at;
    }

    /** Undoes a start whose round session never came up; only valid straight after advancing to PLAYING. */
    public void revertStart() {
        if (status != RoomStatus.PLAYING) {
            throw new IllegalStateException("Room " + code + " is " + status + ", not a fresh start");
        }
        this.status = RoomStatus.WAITING;
        this.startedAt = null;
    }

    public long nextJoinSequence() {
        return ++joinCounter;
    }

    public boolean isHost(String userId) {
        return userId != null && userId.equals(hostUserId);
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isBlank();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String getId() { return id; }
    public String getCode() { return code; }
    public String getGameId() { return gameId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = (name == null || name.isBlank()) ? null : name.trim(); }

    public Visibility getVisibility() { return visibility; }
    public void setVisibility(Visibility visibility) { this.visibility = (visibility == null ? Visibility.PUBLIC : visibility); }

    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }

    public String getHostUserId() { return hostUserId; }
    public void setHostUserId(String hostUserId) { this.hostUserId = hostUserId; }

    public String getPendingHostUserId() { return pendingHostUserId; }
    public void setPendingHostUserId(String pendingHostUserId) { this.pendingHostUserId = pendingHostUserId; }

    public RoomStatus getStatus() { return status; }

    public RoomSettings getSettings() { return settings; }
    public void setSettings(RoomSettings settings) { this.settings = (settings == null ? new RoomSettings() : settings); }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    public long getJoinCounter() { return joinCounter; }

    @Override
    public String toString() {
        return "Room{" +
                "code='" + code + '\'' +
                ", gameId='" + gameId + '\'' +
                ", status=" + status +
                ", hostUserId='" + hostUserId + '\'' +
                ", visibility=" + visibility +
                ", settings=" + settings +
                '}';
    }
}
