package com.example.partyrooms.rooms;

/** Why a room was torn down; sent to clients in the room-closed event. */
public enum CloseReason {
    HOST_LEFT,
    HOST_DISCONNECTED,
    EMPTY
}
