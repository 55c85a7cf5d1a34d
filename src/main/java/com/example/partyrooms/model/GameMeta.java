package com.example.partyrooms.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/** Catalog entry for a game: player limits and whether it can run in an online room. */
@Entity
@Table(name = "games")
public class GameMeta {

    @Id
    @Column(length = 64, nullable = false, updatable = false)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    private int minPlayers = 2;
    private int maxPlayers = 20;

    private boolean online = true;
    private boolean active = true;

    protected GameMeta() {}

    public GameMeta(String id, String name, int minPlayers, int maxPlayers, boolean online) {
        this.id = id;
        this.name = name;
        this.minPlayers = minPlayers;
        this.maxPlayers = maxPlayers;
        this.online = online;
    }

    public String getId() { return id; }
    public String getName() { return name; }

    public int getMinPlayers() { return minPlayers; }
    public int getMaxPlayers() { return maxPlayers; }

    public boolean isOnline() { return online; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    @Override
    public String toString() {
        return "GameMeta{id='" + id + "', name='" + name + "', minPlayers=" + minPlayers
                + ", maxPlayers=" + maxPlayers + ", online=" + online + ", active=" + active + '}';
    }
}
