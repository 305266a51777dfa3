package me.golemcore.context.sweeper;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.model.SweepResult;
import me.golemcore.context.domain.service.ContextStore;
import me.golemcore.context.infrastructure.config.ContextEngineProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background remover of TTL-expired context entries.
 *
 * <p>
 * Each sweep:
 * <ul>
 * <li>Snapshots the ids that are expired when the sweep starts</li>
 * <li>Removes them in batches of {@code context.sweeper.batch-size} through
 * {@link ContextStore#removeIfExpired(String)}, which shares the removal path of
 * {@link ContextStore#remove(String)} and skips entries re-added since the
 * snapshot</li>
 * <li>Logs and skips entries whose removal fails</li>
 * </ul>
 *
 * <p>
 * Sweeps never overlap: a tick or manual trigger that arrives while a sweep is
 * running is skipped, not queued. While paused no sweep runs at all.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ExpirationSweeper {

    public enum State {
        STOPPED, RUNNING, PAUSED
    }

    private final ContextStore contextStore;
    private final ContextEngineProperties properties;
    private final AtomicBoolean sweeping = new AtomicBoolean(false);

    private volatile boolean started;
    private volatile boolean paused;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    public ExpirationSweeper(ContextStore contextStore, ContextEngineProperties properties) {
        this.contextStore = contextStore;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.getSweeper().isEnabled()) {
            log.info("[Sweeper] Background sweeping disabled");
            return;
        }
        start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
        log.info("[Sweeper] Shut down");
    }

    // ==================== Lifecycle ====================

    public synchronized void start() {
        if (started) {
            log.debug("[Sweeper] Already started ({})", getState());
            return;
        }
        long intervalMs = properties.getSweeper().getIntervalMs();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "context-expiration-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        started = true;
        log.info("[Sweeper] Started with interval: {}ms", intervalMs);
    }

    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        started = false;
        paused = false;
    }

    /**
     * Suspend sweeping, whether ticks come from the background thread or from a
     * host loop. The schedule itself keeps running.
     */
    public synchronized void pause() {
        if (!paused) {
            paused = true;
            log.info("[Sweeper] Paused");
        }
    }

    public synchronized void resume() {
        if (paused) {
            paused = false;
            log.info("[Sweeper] Resumed");
        }
    }

    public State getState() {
        if (paused) {
            return State.PAUSED;
        }
        return started ? State.RUNNING : State.STOPPED;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isSweeping() {
        return sweeping.get();
    }

    // ==================== Sweeping ====================

    /**
     * Scheduled entry point, also callable from a host loop when the background
     * thread is not started.
     */
    public void tick() {
        try {
            runCleanup();
        } catch (Exception e) {
            log.error("[Sweeper] Tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one sweep now.
     *
     * @return the outcome; {@link SweepResult#isSkipped()} when paused or when
     *         another sweep is still running
     */
    public SweepResult runCleanup() {
        if (paused) {
            log.debug("[Sweeper] Sweep skipped: paused");
            return SweepResult.skippedSweep();
        }
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("[Sweeper] Sweep skipped: previous sweep still in progress");
            return SweepResult.skippedSweep();
        }

        long startNanos = System.nanoTime();
        try {
            List<String> expiredIds;
            try {
                expiredIds = contextStore.getExpiredIds();
            } catch (RuntimeException e) {
                log.error("[Sweeper] Could not collect expired entries: {}", e.getMessage(), e);
                return SweepResult.builder()
                        .duration(Duration.ofNanos(System.nanoTime() - startNanos))
                        .build();
            }
            int batchSize = Math.max(1, properties.getSweeper().getBatchSize());
            int removed = 0;
            int failed = 0;
            int batches = 0;

            for (int from = 0; from < expiredIds.size(); from += batchSize) {
                List<String> batch = expiredIds.subList(from, Math.min(expiredIds.size(), from + batchSize));
                batches++;
                for (String id : batch) {
                    try {
                        if (contextStore.removeIfExpired(id)) {
                            removed++;
                        }
                    } catch (RuntimeException e) {
                        failed++;
                        log.warn("[Sweeper] Failed to remove expired entry {}: {}", id, e.getMessage());
                    }
                }
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            if (!expiredIds.isEmpty()) {
                log.info("[Sweeper] Removed {} expired entries ({} failed, {} batches, {}ms)",
                        removed, failed, batches, duration.toMillis());
            }
            return SweepResult.builder()
                    .scanned(expiredIds.size())
                    .removed(removed)
                    .failed(failed)
                    .batches(batches)
                    .duration(duration)
                    .build();
        } finally {
            sweeping.set(false);
        }
    }
}
