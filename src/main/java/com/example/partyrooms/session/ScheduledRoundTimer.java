package com.example.partyrooms.session;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** RoundTimer on the shared round scheduler. Timer tasks only enqueue work on a room actor. */
@Component
public class ScheduledRoundTimer implements RoundTimer {

    private final ScheduledExecutorService scheduler;

    public ScheduledRoundTimer(@Qualifier("roundScheduler") ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public TimerHandle schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> f = scheduler.schedule(task, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return () -> f.cancel(false);
    }
}
