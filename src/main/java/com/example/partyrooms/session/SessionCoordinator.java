package com.example.partyrooms.session;

import com.example.partyrooms.broadcast.Broadcaster;
import com.example.partyrooms.broadcast.EventType;
import com.example.partyrooms.broadcast.RoomEvent;
import com.example.partyrooms.config.SessionProperties;
import com.example.partyrooms.error.RoomException;
import com.example.partyrooms.model.Player;
import com.example.partyrooms.model.Room;
import com.example.partyrooms.model.RoomSettings;
import com.example.partyrooms.persistence.RoomStore;
import com.example.partyrooms.prompt.Prompt;
import com.example.partyrooms.prompt.PromptCodec;
import com.example.partyrooms.prompt.PromptPayload;
import com.example.partyrooms.rooms.RoomLifecycleEvent;
import com.example.partyrooms.rooms.RoomRegistry;
import com.example.partyrooms.rooms.actor.RoomActor;
import com.example.partyrooms.rooms.actor.RoomActors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the rounds of a PLAYING room:
 * Idle -> RoundActive -> RoundReveal -> (RoundActive | Finished).
 *
 * Session state lives on the room's actor. Timer callbacks re-enter through
 * {@link RoomActors#post} and carry the session generation they were scheduled for, so a callback
 * that outlived its game is ignored.
 */
@Service
public class SessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    private final RoomRegistry registry;
    private final RoomStore store;
    private final Broadcaster broadcaster;
    private final RoomActors actors;
    private final RoundTimer timer;
    private final SessionProperties props;
    private final Random random;
    private final Clock clock;

    private final AtomicLong generations = new AtomicLong();

    @Autowired
    public SessionCoordinator(RoomRegistry registry, RoomStore store, Broadcaster broadcaster,
                              RoomActors actors, RoundTimer timer, SessionProperties props) {
        this(registry, store, broadcaster, actors, timer, props, new SecureRandom(), Clock.systemUTC());
    }

    public SessionCoordinator(RoomRegistry registry, RoomStore store, Broadcaster broadcaster,
                              RoomActors actors, RoundTimer timer, SessionProperties props,
                              Random random, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.broadcaster = broadcaster;
        this.actors = actors;
        this.timer = timer;
        this.props = props;
        this.random = random;
        this.clock = clock;
    }

    public record AnswerResult(boolean correct, Map<String, Object> scores) {}

    // ---------------------------------------------------------------------
    // Lifecycle events (delivered on the room's actor)
    // ---------------------------------------------------------------------

    @EventListener
    public void onLifecycle(RoomLifecycleEvent event) {
        if (event instanceof RoomLifecycleEvent.GameStarted started) {
            begin(started.roomCode());
        } else if (event instanceof RoomLifecycleEvent.GameFinished finished) {
            actors.find(finished.roomCode()).ifPresent(RoomActor::clearSession);
        } else if (event instanceof RoomLifecycleEvent.RoomClosed closed) {
            actors.find(closed.roomCode()).ifPresent(a -> {
                if (a.getSession() != null) log.debug("Discarding session of closed room {}", closed.roomCode());
                a.clearSession();
            });
        }
    }

    /** A failure here propagates back to startGame, which puts the room back into WAITING. */
    private void begin(String code) {
        RoomActor actor = actors.open(code);
        Room room = registry.requireRoom(code);
        SessionState state = new SessionState(code, generations.incrementAndGet(), loadCandidates(room));
        actor.setSession(state);
        try {
            announce(actor, state, room);
        } catch (RuntimeException e) {
            actor.clearSession();
            throw e;
        }
    }

    private void announce(RoomActor actor, SessionState state, Room room) {
        String code = room.getCode();
        log.info("Session started: room={}, gen={}, rounds={}, prompts={}",
                code, state.getGeneration(), room.getSettings().getRoundCount(), state.getCandidates().size());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("totalRounds", room.getSettings().getRoundCount());
        payload.put("timePerPromptSeconds", room.getSettings().getTimePerPromptSeconds());
        payload.put("scores", state.scoresView());
        broadcaster.publish(RoomEvent.of(EventType.GAME_STARTED, code, payload));

        beginRound(actor, state, room);
    }

    // ---------------------------------------------------------------------
    // Commands (run on the room's actor)
    // ---------------------------------------------------------------------

    public AnswerResult submitAnswer(String code, String playerId, int answerIndex) {
        Room room = registry.requireRoom(code);
        Player player = registry.requirePlayer(room, playerId);
        SessionState state = liveSession(code);
        if (state == null) {
            throw RoomException.conflict("GAME_NOT_PLAYING", "Game in room " + code + " is not running");
        }
        if (state.getPhase() != SessionState.Phase.ROUND_ACTIVE) {
            throw RoomException.conflict("ROUND_NOT_ACTIVE", "No round is accepting answers in room " + code);
        }

        boolean correct = state.getCurrentPrompt().isCorrect(answerIndex);
        if (correct && player.getTeam().isPlaying()) {
            int points = props.getPointsPerCorrectAnswer();
            state.award(player.getTeam(), points);
            store.updatePlayerFields(player.getId(), p -> p.addScore(points));
        }
        long elapsed = Duration.between(state.getRoundStartedAt(), clock.instant()).toMillis();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("playerId", player.getId());
        payload.put("displayName", player.getDisplayName());
        payload.put("answerIndex", answerIndex);
        payload.put("correct", correct);
        payload.put("elapsedMillis", elapsed);
        payload.put("scores", state.scoresView());
        broadcaster.publish(RoomEvent.of(EventType.ANSWER_SUBMITTED, code, payload));
        log.debug("Answer in room {} round {}: player={}, index={}, correct={}",
                code, state.getCurrentRoundIndex(), player.getId(), answerIndex, correct);
        return new AnswerResult(correct, state.scoresView());
    }

    /** Host skip: reveals now when a round is active, otherwise moves straight to the next prompt. */
    public void requestNextPrompt(String code, String actorUserId) {
        Room room = registry.requireRoom(code);
        registry.requireHost(room, actorUserId, "advance the round");
        SessionState state = liveSession(code);
        if (state == null) {
            throw RoomException.conflict("GAME_NOT_PLAYING", "Game in room " + code + " is not running");
        }
        if (state.getPhase() == SessionState.Phase.ROUND_ACTIVE) {
            reveal(state, false);
        }
        advance(actors.open(code), state);
    }

    public SessionState.Phase phase(String code) {
        SessionState state = liveSession(code);
        return state == null ? SessionState.Phase.IDLE : state.getPhase();
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    private void beginRound(RoomActor actor, SessionState state, Room room) {
        RoomSettings settings = room.getSettings();
        if (state.getCurrentRoundIndex() >= settings.getRoundCount() || state.getCandidates().isEmpty()) {
            if (state.getCandidates().isEmpty()) log.warn("No approved prompts for game {} in room {}", room.getGameId(), room.getCode());
            finish(actor, state);
            return;
        }

        List<Prompt> candidates = state.getCandidates();
        Prompt prompt = candidates.get(random.nextInt(candidates.size()));
        state.startRound(prompt, clock.instant());
        int round = state.getCurrentRoundIndex();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("round", round);
        payload.put("totalRounds", settings.getRoundCount());
        payload.put("prompt", PromptCodec.publicView(prompt));
        payload.put("timeLimitSeconds", settings.getTimePerPromptSeconds());
        broadcaster.publish(RoomEvent.of(EventType.PROMPT_SHOW, state.getRoomCode(), payload));
        log.debug("Round {} of room {} showing prompt {}", round, state.getRoomCode(), prompt.id());

        long gen = state.getGeneration();
        String code = state.getRoomCode();
        state.replaceTimer(timer.schedule(Duration.ofSeconds(settings.getTimePerPromptSeconds()),
                () -> actors.post(code, () -> onRevealDue(code, gen, round))));
    }

    private void onRevealDue(String code, long gen, int round) {
        SessionState state = current(code, gen);
        if (state == null || state.getPhase() != SessionState.Phase.ROUND_ACTIVE || state.getCurrentRoundIndex() != round) {
            return;
        }
        reveal(state, true);
    }

    private void reveal(SessionState state, boolean scheduleAdvance) {
        state.markRevealed();
        Prompt prompt = state.getCurrentPrompt();
        int round = state.getCurrentRoundIndex();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("round", round);
        payload.put("promptId", prompt.id());
        payload.put("correctAnswer", prompt.payload() instanceof PromptPayload.Question q ? q.correctIndex() : null);
        payload.put("scores", state.scoresView());
        broadcaster.publish(RoomEvent.of(EventType.ROUND_RESULT, state.getRoomCode(), payload));

        if (!scheduleAdvance) {
            state.cancelTimer();
            return;
        }
        long gen = state.getGeneration();
        String code = state.getRoomCode();
        state.replaceTimer(timer.schedule(props.getRevealPause(),
                () -> actors.post(code, () -> onAdvanceDue(code, gen, round))));
    }

    private void onAdvanceDue(String code, long gen, int round) {
        SessionState state = current(code, gen);
        if (state == null || state.getPhase() != SessionState.Phase.ROUND_REVEAL || state.getCurrentRoundIndex() != round) {
            return;
        }
        advance(actors.open(code), state);
    }

    private void advance(RoomActor actor, SessionState state) {
        state.cancelTimer();
        Room room = store.findRoomByCode(state.getRoomCode()).orElse(null);
        if (room == null) {
            actor.clearSession();
            return;
        }
        beginRound(actor, state, room);
    }

    private void finish(RoomActor actor, SessionState state) {
        String code = state.getRoomCode();
        int totalRounds = state.getCurrentRoundIndex();
        Map<String, Object> finalScores = state.scoresView();
        String winner = state.winner();
        actor.clearSession();

        try {
            registry.finishGame(code);
        } catch (RoomException e) {
            log.debug("Room {} was not finishable: {}", code, e.getMessage());
            return;
        }

        log.info("Session finished: room={}, rounds={}, scores={}, winner={}", code, totalRounds, finalScores, winner);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("finalScores", finalScores);
        payload.put("winner", winner);
        payload.put("totalRounds", totalRounds);
        broadcaster.publish(RoomEvent.of(EventType.GAME_FINISHED, code, payload));
    }

    // ---------------------------------------------------------------------
    // internals
    // ---------------------------------------------------------------------

    private SessionState liveSession(String code) {
        return actors.find(code)
                .map(RoomActor::getSession)
                .filter(SessionState::isLive)
                .orElse(null);
    }

    private SessionState current(String code, long gen) {
        SessionState state = liveSession(code);
        return (state != null && state.getGeneration() == gen) ? state : null;
    }

    /** Approved prompts of the room's game, narrowed by settings only when that leaves something. */
    List<Prompt> loadCandidates(Room room) {
        List<Prompt> all = store.listApprovedPrompts(room.getGameId(), props.getPromptKind(), props.getPromptPoolSize());
        RoomSettings s = room.getSettings();
        List<Prompt> filtered = all.stream()
                .filter(p -> s.getCategories().isEmpty() || (p.category() != null && s.getCategories().contains(p.category())))
                .filter(p -> s.getDifficulty() == null || s.getDifficulty() == p.difficulty())
                .toList();
        return filtered.isEmpty() ? all : filtered;
    }
}
