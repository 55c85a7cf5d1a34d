package com.example.partyrooms.gateway;

import com.example.partyrooms.broadcast.RoomSubscriber;

import java.io.IOException;
import java.util.Map;

/** One live client, independent of the transport carrying it. */
public interface ClientConnection extends RoomSubscriber {

    /** Direct reply to this client only (acks, errors, sync). */
    void reply(Map<String, Object> message) throws IOException;

    /** Authenticated user id from the handshake, or null for anonymous clients. */
    String userId();

    /** Key for password rate limiting, usually the remote address. */
    String clientKey();
}
