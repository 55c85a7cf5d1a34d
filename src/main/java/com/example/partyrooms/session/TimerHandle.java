package com.example.partyrooms.session;

/** Cancellable pending timer. Cancelling a fired or already cancelled timer does nothing. */
@FunctionalInterface
public interface TimerHandle {

    void cancel();
}
