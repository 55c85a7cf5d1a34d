package com.example.partyrooms.rooms;

/** Input of a join; team is optional (auto-balanced when absent). */
public record JoinRequest(String displayName, String team, String password) {
}
