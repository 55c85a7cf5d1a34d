package com.example.partyrooms.rooms;

import com.example.partyrooms.config.RoomProperties;
import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.persistence.RoomStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hands out room codes of the form XXXX-XXXX (A-Z, 0-9).
 * A code is reserved from allocation until the room is persisted (or creation fails), so two
 * concurrent creations never receive the same code even before either is stored.
 */
@Component
public class RoomCodeAllocator {

    private static final Logger log = LoggerFactory.getLogger(RoomCodeAllocator.class);

    private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();
    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Z0-9]{4}-[A-Z0-9]{4}$");

    private final RoomStore store;
    private final Random random;
    private final int maxAttempts;

    /** guarded by this */
    private final Set<String> reserved = new HashSet<>();

    @Autowired
    public RoomCodeAllocator(RoomStore store, RoomProperties props) {
        this(store, props, new SecureRandom());
    }

    public RoomCodeAllocator(RoomStore store, RoomProperties props, Random random) {
        this.store = store;
        this.random = random;
        this.maxAttempts = Math.max(1, props.getCodeAttempts());
    }

    public static boolean isWellFormed(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }

    /**
     * Reserves a fresh code. The caller must {@link #release(String)} it once the room is
     * stored or creation has failed.
     *
     * @throws RoomException CODE_EXHAUSTED when every attempt collided
     */
    public synchronized String allocate() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = randomCode();
            if (reserved.contains(candidate) || store.codeExists(candidate)) {
                log.debug("Room code collision on attempt {}: {}", attempt, candidate);
                continue;
            }
            reserved.add(candidate);
            return candidate;
        }
        log.warn("No free room code after {} attempts", maxAttempts);
        throw RoomException.conflict("CODE_EXHAUSTED", "Could not allocate a room code, try again");
    }

    public synchronized void release(String code) {
        reserved.remove(code);
    }

    public synchronized boolean isReserved(String code) {
        return reserved.contains(code);
    }

    synchronized int reservedCount() {
        return reserved.size();
    }

    private String randomCode() {
        StringBuilder sb = new StringBuilder(9);
        for (int i = 0; i < 8; i++) {
            if (i == 4) sb.append('-');
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }
}
