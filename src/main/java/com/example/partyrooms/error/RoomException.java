package com.example.partyrooms.error;

import java.util.Objects;

/**
 * Single unchecked failure type for room operations. {@link #getCode()} is the stable
 * machine-readable reason sent to clients (e.g. ROOM_FULL); {@link #getKind()} drives the
 * HTTP status / retry decision.
 */
public class RoomException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public RoomException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.code = Objects.requireNonNull(code, "code");
    }

    public RoomException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorKind getKind() { return kind; }
    public String getCode() { return code; }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static RoomException roomNotFound(String roomCode) {
        return new RoomException(ErrorKind.NOT_FOUND, "ROOM_NOT_FOUND", "Room " + roomCode + " not found");
    }

    public static RoomException gameNotFound(String gameId) {
        return new RoomException(ErrorKind.NOT_FOUND, "GAME_NOT_FOUND", "Game " + gameId + " not found");
    }

    public static RoomException playerNotFound(String playerId) {
        return new RoomException(ErrorKind.NOT_FOUND, "PLAYER_NOT_FOUND", "Player " + playerId + " not found in room");
    }

    public static RoomException conflict(String code, String message) {
        return new RoomException(ErrorKind.CONFLICT, code, message);
    }

    public static RoomException notHost(String action) {
        return new RoomException(ErrorKind.FORBIDDEN, "NOT_ROOM_HOST", "Only the room host can " + action);
    }

    public static RoomException invalid(String code, String message) {
        return new RoomException(ErrorKind.INVALID_INPUT, code, message);
    }

    public static RoomException storeUnavailable(String operation, Throwable cause) {
        return new RoomException(ErrorKind.TRANSIENT, "STORE_UNAVAILABLE",
                "Room store unavailable during " + operation, cause);
    }

    @Override
    public String toString() {
        return "RoomException{" + kind + "/" + code + ": " + getMessage() + '}';
    }
}
