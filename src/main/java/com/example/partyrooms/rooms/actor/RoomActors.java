package com.example.partyrooms.rooms.actor;

import com.example.partyrooms.error.ErrorKind;
import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.rooms.RoomLifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Supervisor of the per-room actors, keyed by room code.
 *
 * Actors are opened lazily and retired when their room is closed; a retired actor rejects
 * anything still queued, so a later room that happens to reuse the code never sees stale work.
 */
@Component
public class RoomActors {

    private static final Logger log = LoggerFactory.getLogger(RoomActors.class);

    private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(10);

    private final Executor workers;
    private final Duration callTimeout;
    private final ConcurrentHashMap<String, RoomActor> actors = new ConcurrentHashMap<>();

    @Autowired
    public RoomActors(@Qualifier("roomWorkers") Executor workers) {
        this(workers, DEFAULT_CALL_TIMEOUT);
    }

    public RoomActors(Executor workers, Duration callTimeout) {
        this.workers = workers;
        this.callTimeout = callTimeout;
    }

    public RoomActor open(String roomCode) {
        return actors.computeIfAbsent(roomCode, code -> {
            log.debug("Opening actor for room {}", code);
            return new RoomActor(code, workers);
        });
    }

    public Optional<RoomActor> find(String roomCode) {
        return roomCode == null ? Optional.empty() : Optional.ofNullable(actors.get(roomCode));
    }

    /**
     * Runs the task on the room's actor and waits for its result. A RoomException thrown by the
     * task is rethrown unchanged. Called from inside the same actor, the task runs inline.
     */
    public <T> T call(String roomCode, Callable<T> task) {
        RoomActor actor = open(roomCode);
        if (actor.isCurrentThread()) {
            return runInline(task);
        }
        CompletableFuture<T> future = actor.submit(task);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RoomException re) throw re;
            if (cause instanceof RuntimeException rte) throw rte;
            throw new IllegalStateException("Room " + roomCode + " task failed", cause);
        } catch (TimeoutException e) {
            log.warn("Room {} did not answer within {} ms", roomCode, callTimeout.toMillis());
            throw new RoomException(ErrorKind.TRANSIENT, "ROOM_BUSY", "Room " + roomCode + " is busy, retry shortly", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoomException(ErrorKind.TRANSIENT, "INTERRUPTED", "Interrupted while waiting for room " + roomCode, e);
        }
    }

    /** Fire-and-forget work for a live actor (timer callbacks). Dropped when the room is gone. */
    public void post(String roomCode, Runnable task) {
        RoomActor actor = actors.get(roomCode);
        if (actor == null || actor.isRetired()) {
            log.debug("Dropping background task for closed room {}", roomCode);
            return;
        }
        actor.post(task);
    }

    /** Removes and retires the actor; its session and pending timer are discarded. */
    public void retire(String roomCode) {
        RoomActor actor = actors.remove(roomCode);
        if (actor != null) {
            actor.retire();
            log.debug("Retired actor for room {}", roomCode);
        }
    }

    @EventListener
    public void onLifecycle(RoomLifecycleEvent event) {
        if (event instanceof RoomLifecycleEvent.RoomClosed closed) {
            retire(closed.roomCode());
        }
    }

    public int size() {
        return actors.size();
    }

    private static <T> T runInline(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
