package com.example.partyrooms.rooms.actor;

import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Serialized owner of one room. Tasks run one at a time, in submission order, on the shared
 * worker pool; different rooms' actors run in parallel.
 *
 * The session slot is actor-confined: only read or written from tasks of this actor.
 */
public final class RoomActor {

    private static final Logger log = LoggerFactory.getLogger(RoomActor.class);

    private final String roomCode;
    private final Executor workers;

    private final Queue<Runnable> queue = new ArrayDeque<>();
    private Runnable active;                 // guarded by queue
    private volatile Thread runningThread;   // thread currently draining this actor, if any
    private volatile boolean retired;

    private SessionState session;

    RoomActor(String roomCode, Executor workers) {
        this.roomCode = roomCode;
        this.workers = workers;
    }

    public String getRoomCode() { return roomCode; }

    public boolean isRetired() { return retired; }

    /** True when called from inside one of this actor's tasks. */
    public boolean isCurrentThread() {
        return runningThread == Thread.currentThread();
    }

    // ---------------------------------------------------------------------
    // Task submission
    // ---------------------------------------------------------------------

    <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        enqueue(() -> {
            if (retired) {
                result.completeExceptionally(RoomException.roomNotFound(roomCode));
                return;
            }
            try {
                result.complete(task.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result;
    }

    void post(Runnable task) {
        enqueue(() -> {
            if (retired) return;
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Room {} background task failed: {}", roomCode, e.toString(), e);
            }
        });
    }

    private void enqueue(Runnable task) {
        synchronized (queue) {
            queue.add(() -> {
                runningThread = Thread.currentThread();
                try {
                    task.run();
                } finally {
                    runningThread = null;
                    scheduleNext();
                }
            });
            if (active == null) scheduleNext();
        }
    }

    private void scheduleNext() {
        synchronized (queue) {
            if ((active = queue.poll()) != null) {
                workers.execute(active);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Session slot (actor-confined)
    // ---------------------------------------------------------------------

    public SessionState getSession() { return session; }

    public void setSession(SessionState next) {
        SessionState prev = this.session;
        if (prev != null && prev != next) prev.discard();
        this.session = next;
    }

    public void clearSession() {
        setSession(null);
    }

    /** Marks the actor dead: queued tasks are rejected and the session (with its timer) is discarded. */
    void retire() {
        retired = true;
        clearSession();
    }

    @Override
    public String toString() {
        return "RoomActor{" + roomCode + (retired ? ", retired" : "") + '}';
    }
}
