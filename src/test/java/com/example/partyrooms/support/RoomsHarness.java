package com.example.partyrooms.support;

import com.example.partyrooms.broadcast.InMemoryBroadcaster;
import com.example.partyrooms.config.PasswordProperties;
import com.example.partyrooms.config.RoomProperties;
import com.example.partyrooms.config.SessionProperties;
import com.example.partyrooms.model.Difficulty;
import com.example.partyrooms.model.GameContent;
import com.example.partyrooms.model.GameMeta;
import com.example.partyrooms.model.Visibility;
import com.example.partyrooms.persistence.InMemoryRoomStore;
import com.example.partyrooms.prompt.PromptKind;
import com.example.partyrooms.rooms.CreateRoomRequest;
import com.example.partyrooms.rooms.HostFailover;
import com.example.partyrooms.rooms.RoomCodeAllocator;
import com.example.partyrooms.rooms.RoomLifecycleEvent;
import com.example.partyrooms.rooms.RoomRegistry;
import com.example.partyrooms.rooms.RoomService;
import com.example.partyrooms.rooms.RoomView;
import com.example.partyrooms.rooms.SettingsPatch;
import com.example.partyrooms.rooms.actor.RoomActors;
import com.example.partyrooms.security.PasswordGuard;
import com.example.partyrooms.security.PasswordHasher;
import com.example.partyrooms.session.SessionCoordinator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Wires the room stack by hand, without a Spring context: in-memory store, manual round timer,
 * and lifecycle events dispatched to the same listeners Spring would call.
 */
public final class RoomsHarness {

    public static final String GAME_ID = "quiz";

    public final InMemoryRoomStore store;
    public final InMemoryBroadcaster broadcaster = new InMemoryBroadcaster();
    public final ManualRoundTimer timer = new ManualRoundTimer();
    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    public final List<RoomLifecycleEvent> lifecycle = new CopyOnWriteArrayList<>();
    private final List<Consumer<RoomLifecycleEvent>> extraListeners = new CopyOnWriteArrayList<>();

    public final RoomProperties roomProps = new RoomProperties();
    public final SessionProperties sessionProps = new SessionProperties();
    public final PasswordProperties passwordProps = new PasswordProperties();

    public final RoomActors actors;
    public final PasswordGuard passwords;
    public final RoomRegistry registry;
    public final HostFailover failover;
    public final SessionCoordinator sessions;
    public final RoomCodeAllocator codes;
    public final RoomService service;

    /** Direct executor: every room command completes before the call returns. */
    public RoomsHarness() {
        this(Runnable::run);
    }

    public RoomsHarness(Executor workers) {
        this(workers, new InMemoryRoomStore());
    }

    public RoomsHarness(Executor workers, InMemoryRoomStore store) {
        this.store = store;
        passwordProps.setBcryptCost(4);
        actors = new RoomActors(workers, Duration.ofSeconds(10));
        passwords = new PasswordGuard(new PasswordHasher(passwordProps), passwordProps, clock);
        registry = new RoomRegistry(store, passwords, broadcaster, this::dispatch, roomProps, clock);
        failover = new HostFailover(registry, store, broadcaster);
        sessions = new SessionCoordinator(registry, store, broadcaster, actors, timer, sessionProps,
                new Random(42), clock);
        codes = new RoomCodeAllocator(store, roomProps);
        service = new RoomService(actors, registry, codes, failover, sessions, store);

        store.registerGame(new GameMeta(GAME_ID, "Quiz", 2, 10, true));
    }

    private void dispatch(Object event) {
        if (event instanceof RoomLifecycleEvent e) {
            lifecycle.add(e);
            sessions.onLifecycle(e);
            actors.onLifecycle(e);
            extraListeners.forEach(l -> l.accept(e));
        }
    }

    /** Registers another lifecycle listener, e.g. a gateway built on top of this harness. */
    public RoomsHarness onLifecycle(Consumer<RoomLifecycleEvent> listener) {
        extraListeners.add(listener);
        return this;
    }

    /** Adds {@code n} approved questions whose correct option is always index 1. */
    public RoomsHarness withQuestions(int n) {
        for (int i = 1; i <= n; i++) {
            String json = "{\"question\":\"Q" + i + "?\",\"options\":[\"a\",\"b\",\"c\"],\"correctAnswer\":1}";
            store.registerContent(new GameContent("q" + i, GAME_ID, PromptKind.QUESTION, json,
                    i % 2 == 0 ? "science" : "history", Difficulty.EASY, true));
        }
        return this;
    }

    public RoomView createRoom(String hostUserId) {
        return createRoom(hostUserId, null, null);
    }

    public RoomView createRoom(String hostUserId, String password, SettingsPatch settings) {
        return service.createRoom(new CreateRoomRequest(GAME_ID, "Friday quiz", Visibility.PUBLIC, password, settings), hostUserId);
    }

    public static SettingsPatch rounds(int roundCount, int timePerPromptSeconds) {
        return new SettingsPatch(roundCount, timePerPromptSeconds, null, null, null, null);
    }

    public static SettingsPatch maxPlayers(int max) {
        return new SettingsPatch(null, null, null, null, null, max);
    }

    public long lifecycleCount(Class<? extends RoomLifecycleEvent> type) {
        return lifecycle.stream().filter(type::isInstance).count();
    }
}
