package com.example.partyrooms.security;

import com.example.partyrooms.config.PasswordProperties;
import com.example.partyrooms.error.ErrorKind;
import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Room password gate: hashes on creation, verifies on join, and caps verification attempts per
 * client key (usually the remote address) within a rolling window.
 * Shared by all rooms; the attempt windows are guarded per key.
 */
@Component
public class PasswordGuard {

    private static final Logger log = LoggerFactory.getLogger(PasswordGuard.class);

    private static final int PURGE_THRESHOLD = 10_000;

    private final PasswordHasher hasher;
    private final int maxAttempts;
    private final Duration window;
    private final Clock clock;

    /** client key → attempt timestamps inside the current window (oldest first). */
    private final ConcurrentHashMap<String, Deque<Instant>> attempts = new ConcurrentHashMap<>();

    @Autowired
    public PasswordGuard(PasswordHasher hasher, PasswordProperties props) {
        this(hasher, props, Clock.systemUTC());
    }

    public PasswordGuard(PasswordHasher hasher, PasswordProperties props, Clock clock) {
        this.hasher = hasher;
        this.maxAttempts = Math.max(1, props.getMaxAttempts());
        this.window = props.getWindow();
        this.clock = clock;
    }

    /** Hash for a new room, or null when the room stays open. */
    public String hashForNewRoom(String password) {
        if (password == null || password.isBlank()) return null;
        return hasher.hash(password);
    }

    /**
     * Admits or rejects a join attempt against a protected room. Open rooms always pass.
     *
     * @throws RoomException PASSWORD_REQUIRED, RATE_LIMITED or INVALID_PASSWORD
     */
    public void checkJoin(Room room, String candidate, String clientKey) {
        if (room == null || !room.hasPassword()) return;

        if (candidate == null || candidate.isBlank()) {
            throw new RoomException(ErrorKind.FORBIDDEN, "PASSWORD_REQUIRED",
                    "Room " + room.getCode() + " is password protected");
        }

        String key = (clientKey == null || clientKey.isBlank()) ? "unknown" : clientKey;
        if (!recordAttempt(key)) {
            log.warn("Password attempts rate-limited (room={}, client={})", room.getCode(), key);
            throw new RoomException(ErrorKind.RATE_LIMITED, "RATE_LIMITED",
                    "Too many password attempts, retry in " + window.toSeconds() + "s");
        }

        if (!hasher.matches(candidate, room.getPasswordHash())) {
            throw new RoomException(ErrorKind.FORBIDDEN, "INVALID_PASSWORD", "Invalid room password");
        }
        attempts.remove(key);
    }

    /** Returns false when the key has already used up its attempts in the window. */
    private boolean recordAttempt(String key) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        if (attempts.size() > PURGE_THRESHOLD) purgeExpired(cutoff);

        boolean[] allowed = new boolean[1];
        attempts.compute(key, (k, q) -> {
            Deque<Instant> deque = (q == null) ? new ArrayDeque<>() : q;
            while (!deque.isEmpty() && !deque.peekFirst().isAfter(cutoff)) deque.pollFirst();
            if (deque.size() < maxAttempts) {
                deque.addLast(now);
                allowed[0] = true;
            }
            return deque;
        });
        return allowed[0];
    }

    private void purgeExpired(Instant cutoff) {
        for (String key : attempts.keySet()) {
            attempts.computeIfPresent(key, (k, q) -> {
                Instant last = q.peekLast();
                return (last == null || !last.isAfter(cutoff)) ? null : q;
            });
        }
    }

    int trackedClients() {
        return attempts.size();
    }
}
