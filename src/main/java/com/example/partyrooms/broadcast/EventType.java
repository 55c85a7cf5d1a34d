package com.example.partyrooms.broadcast;

/** Outbound room events with their wire names. */
public enum EventType {
    ROOM_UPDATED("room-updated"),
    PLAYER_JOINED("player-joined"),
    PLAYER_LEFT("player-left"),
    HOST_TRANSFERRED("host-transferred"),
    ROOM_CLOSED("room-closed"),
    GAME_STARTED("game-started"),
    PROMPT_SHOW("prompt-show"),
    ANSWER_SUBMITTED("answer-submitted"),
    ROUND_RESULT("round-result"),
    GAME_FINISHED("game-finished");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
