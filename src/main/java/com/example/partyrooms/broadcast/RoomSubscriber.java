package com.example.partyrooms.broadcast;

import java.io.IOException;

/** Anything that can receive room events, typically one live client connection. */
public interface RoomSubscriber {

    String id();

    boolean isOpen();

    void deliver(RoomEvent event) throws IOException;
}
