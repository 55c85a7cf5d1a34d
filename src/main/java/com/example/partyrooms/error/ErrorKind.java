package com.example.partyrooms.error;

/** Failure classes callers can act on. TRANSIENT is the only one worth retrying. */
public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    FORBIDDEN,
    INVALID_INPUT,
    RATE_LIMITED,
    TRANSIENT
}
