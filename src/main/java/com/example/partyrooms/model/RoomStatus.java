package com.example.partyrooms.model;

/** Room lifecycle. Only moves forward: WAITING → PLAYING → FINISHED. */
public enum RoomStatus {
    WAITING,
    PLAYING,
    FINISHED;

    public boolean canAdvanceTo(RoomStatus next) {
        return next != null && next.ordinal() == this.ordinal() + 1;
    }
}
