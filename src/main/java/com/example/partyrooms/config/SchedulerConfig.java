package com.example.partyrooms.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools behind the room actors and round timers.
 * Timer threads only enqueue onto actors, so a single scheduler thread is enough.
 */
@Configuration
public class SchedulerConfig {

  @Bean(name = "roomWorkers", destroyMethod = "shutdown")
  public ExecutorService roomWorkers(RoomProperties props) {
    return Executors.newFixedThreadPool(Math.max(1, props.getWorkerThreads()), named("room-worker-"));
  }

  @Bean(name = "roundScheduler", destroyMethod = "shutdownNow")
  public ScheduledExecutorService roundScheduler() {
    ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(1, named("round-timer-"));
    exec.setRemoveOnCancelPolicy(true);
    return exec;
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
