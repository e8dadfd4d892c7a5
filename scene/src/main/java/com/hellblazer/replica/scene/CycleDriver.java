/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Replica.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.replica.scene;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs {@link SceneReplica#runCycle()} at a fixed cadence on a dedicated thread, making that thread the scene's
 * single consumer.
 * <p>
 * Usage:
 * <pre>
 * var replica = new SceneReplica(config, transport);
 * replica.initialize("world");
 * try (var driver = new CycleDriver(replica, report -> renderer.refresh())) {
 *     driver.start();
 *     ...
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class CycleDriver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CycleDriver.class);

    private final SceneReplica              replica;
    private final Consumer<CycleReport>     reportSink;
    private final long                      periodMs;
    private final ScheduledExecutorService  scheduler;
    private final AtomicLong                failures = new AtomicLong();
    private volatile ScheduledFuture<?>     task;

    public CycleDriver(SceneReplica replica) {
        this(replica, report -> {
        });
    }

    /**
     * @param replica    scene to reconcile
     * @param reportSink receives the report of every cycle, on the driver thread
     */
    public CycleDriver(SceneReplica replica, Consumer<CycleReport> reportSink) {
        this.replica = Objects.requireNonNull(replica, "replica cannot be null");
        this.reportSink = Objects.requireNonNull(reportSink, "reportSink cannot be null");
        this.periodMs = replica.config().getCyclePeriodMs();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "scene-cycle-" + replica.name());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start ticking. Has no effect if already started.
     */
    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleAtFixedRate(this::tick, 0, periodMs, TimeUnit.MILLISECONDS);
        log.info("Cycle driver for {} started, period {}ms", replica.name(), periodMs);
    }

    /**
     * Stop ticking; a cycle already in progress completes.
     */
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    public boolean isRunning() {
        var current = task;
        return current != null && !current.isDone();
    }

    /**
     * @return number of ticks whose cycle or report sink threw
     */
    public long failureCount() {
        return failures.get();
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void tick() {
        if (!replica.isRunning()) {
            log.debug("Scene {} no longer running, stopping driver", replica.name());
            stop();
            return;
        }
        try {
            reportSink.accept(replica.runCycle());
        } catch (RuntimeException e) {
            if (!replica.isRunning()) {
                // shut down between the check and the cycle
                log.debug("Scene {} stopped during tick: {}", replica.name(), e.getMessage());
                stop();
                return;
            }
            failures.incrementAndGet();
            log.error("Cycle failed for scene {}", replica.name(), e);
        }
    }
}
