package com.example.partyrooms.session;

import com.example.partyrooms.model.Team;
import com.example.partyrooms.prompt.Prompt;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ephemeral round bookkeeping of one PLAYING room. Confined to the room's actor thread;
 * never persisted. The generation identifies this particular game run so that timers
 * scheduled for an earlier run can recognise themselves as stale.
 */
public final class SessionState {

    public enum Phase { IDLE, ROUND_ACTIVE, ROUND_REVEAL, FINISHED }

    private final String roomCode;
    private final long generation;
    private final List<Prompt> candidates;

    private Phase phase = Phase.IDLE;
    private int currentRoundIndex = 0;
    private Prompt currentPrompt;
    private Instant roundStartedAt;
    private int scoreA = 0;
    private int scoreB = 0;

    private TimerHandle timer;

    public SessionState(String roomCode, long generation, List<Prompt> candidates) {
        this.roomCode = roomCode;
        this.generation = generation;
        this.candidates = List.copyOf(candidates);
    }

    public String getRoomCode() { return roomCode; }
    public long getGeneration() { return generation; }
    public List<Prompt> getCandidates() { return candidates; }

    public Phase getPhase() { return phase; }
    public int getCurrentRoundIndex() { return currentRoundIndex; }
    public Prompt getCurrentPrompt() { return currentPrompt; }
    public Instant getRoundStartedAt() { return roundStartedAt; }

    public boolean isLive() { return phase != Phase.FINISHED; }

    void startRound(Prompt prompt, Instant at) {
        currentRoundIndex++;
        currentPrompt = prompt;
        roundStartedAt = at;
        phase = Phase.ROUND_ACTIVE;
    }

    void markRevealed() {
        phase = Phase.ROUND_REVEAL;
    }

    void award(Team team, int points) {
        if (team == Team.A) scoreA += points;
        else if (team == Team.B) scoreB += points;
    }

    public int score(Team team) {
        return team == Team.A ? scoreA : team == Team.B ? scoreB : 0;
    }

    /** "A" / "B" / "draw" by strictly higher score. */
    public String winner() {
        if (scoreA > scoreB) return Team.A.name();
        if (scoreB > scoreA) return Team.B.name();
        return "draw";
    }

    public Map<String, Object> scoresView() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(Team.A.name(), scoreA);
        m.put(Team.B.name(), scoreB);
        return m;
    }

    /** Replaces (and cancels) any pending timer. */
    void replaceTimer(TimerHandle next) {
        cancelTimer();
        this.timer = next;
    }

    void cancelTimer() {
        TimerHandle t = this.timer;
        this.timer = null;
        if (t != null) t.cancel();
    }

    /** Ends this run: cancels the pending timer; later callbacks see a dead session. */
    public void discard() {
        cancelTimer();
        phase = Phase.FINISHED;
    }

    @Override
    public String toString() {
        return "SessionState{room=" + roomCode + ", gen=" + generation + ", phase=" + phase
                + ", round=" + currentRoundIndex + ", A=" + scoreA + ", B=" + scoreB + '}';
    }
}
