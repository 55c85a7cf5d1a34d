package com.example.partyrooms.rooms;

/**
 * Lifecycle notifications published by RoomRegistry through the application event publisher.
 * Listeners run synchronously on the room's actor.
 */
public interface RoomLifecycleEvent {

    String roomCode();

    record GameStarted(String roomCode, String gameId) implements RoomLifecycleEvent {}

    record GameFinished(String roomCode) implements RoomLifecycleEvent {}

    record RoomClosed(String roomCode, CloseReason reason) implements RoomLifecycleEvent {}
}
