package com.example.partyrooms.session;

import java.time.Duration;

/** Schedules round deadlines (reveal, next prompt). */
public interface RoundTimer {

    TimerHandle schedule(Duration delay, Runnable task);
}
