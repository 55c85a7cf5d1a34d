package com.example.partyrooms.broadcast;

/**
 * Per-room publish/subscribe fan-out. Delivery is at-most-once without replay:
 * a subscriber that misses an event must fetch a fresh room snapshot.
 */
public interface Broadcaster {

    void subscribe(String roomCode, RoomSubscriber subscriber);

    void unsubscribe(String roomCode, RoomSubscriber subscriber);

    void publish(RoomEvent event);

    /** Drops the channel and all of its subscribers. */
    void closeChannel(String roomCode);

    int subscriberCount(String roomCode);
}
