package com.example.partyrooms.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node broadcaster: one subscriber set per room code.
 * Closed subscribers and subscribers whose send fails are dropped from the channel.
 */
@Component
public class InMemoryBroadcaster implements Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroadcaster.class);

    private final ConcurrentHashMap<String, Set<RoomSubscriber>> channels = new ConcurrentHashMap<>();

    @Override
    public void subscribe(String roomCode, RoomSubscriber subscriber) {
        if (roomCode == null || subscriber == null) return;
        // add under the map's lock so a concurrent unsubscribe cannot drop the set first
        channels.compute(roomCode, (k, subs) -> {
            Set<RoomSubscriber> set = (subs == null) ? ConcurrentHashMap.newKeySet() : subs;
            set.add(subscriber);
            return set;
        });
        log.debug("Subscribed {} to room {}", subscriber.id(), roomCode);
    }

    @Override
    public void unsubscribe(String roomCode, RoomSubscriber subscriber) {
        if (roomCode == null || subscriber == null) return;
        channels.computeIfPresent(roomCode, (k, subs) -> {
            subs.remove(subscriber);
            return subs.isEmpty() ? null : subs;
        });
    }

    @Override
    public void publish(RoomEvent event) {
        Set<RoomSubscriber> subs = channels.get(event.roomCode());
        if (subs == null || subs.isEmpty()) {
            log.debug("No subscribers for {} on room {}", event.type().wireName(), event.roomCode());
            return;
        }

        subs.removeIf(sub -> {
            if (!sub.isOpen()) return true;
            try {
                sub.deliver(event);
                return false;
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping subscriber {} from room {} after failed {} delivery: {}",
                        sub.id(), event.roomCode(), event.type().wireName(), e.toString());
                return true;
            }
        });
        log.debug("Published {} to room {} ({} subscribers)", event.type().wireName(), event.roomCode(), subs.size());
    }

    @Override
    public void closeChannel(String roomCode) {
        if (roomCode == null) return;
        Set<RoomSubscriber> removed = channels.remove(roomCode);
        if (removed != null) {
            log.debug("Closed channel {} ({} subscribers detached)", roomCode, removed.size());
        }
    }

    @Override
    public int subscriberCount(String roomCode) {
        Set<RoomSubscriber> subs = channels.get(roomCode);
        return subs == null ? 0 : subs.size();
    }
}
