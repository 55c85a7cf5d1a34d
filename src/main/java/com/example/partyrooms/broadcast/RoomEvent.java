package com.example.partyrooms.broadcast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One event on a room channel. Payloads describe resulting state (not deltas to apply),
 * so receiving the same event twice is harmless.
 */
public record RoomEvent(EventType type, String roomCode, Map<String, Object> payload) {

    public RoomEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(roomCode, "roomCode");
        payload = (payload == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static RoomEvent of(EventType type, String roomCode, Map<String, Object> payload) {
        return new RoomEvent(type, roomCode, payload);
    }

    /** Flat wire form: {"type": ..., "roomCode": ..., ...payload}. */
    public Map<String, Object> toWire() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", type.wireName());
        out.put("roomCode", roomCode);
        out.putAll(payload);
        return out;
    }
}
