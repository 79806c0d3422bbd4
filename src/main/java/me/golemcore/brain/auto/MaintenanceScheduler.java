package me.golemcore.brain.auto;

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
import me.golemcore.brain.domain.component.BrainComponent;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background scheduler for brain maintenance (confidence decay, git metric
 * collection, insight generation).
 *
 * <p>
 * Ticks at {@code brain.maintenance.tick-interval} and asks the brain to run
 * maintenance if its trigger is due. If a tick is still running, the next one
 * is skipped.
 */
@Component
@Slf4j
public class MaintenanceScheduler {

    private final BrainComponent brain;
    private final BrainProperties.MaintenanceProperties settings;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public MaintenanceScheduler(BrainComponent brain, BrainProperties properties) {
        this.brain = brain;
        this.settings = properties.getMaintenance();
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("[Maintenance] Scheduler disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "brain-maintenance");
            t.setDaemon(true);
            return t;
        });

        long tickMillis = settings.getTickInterval().toMillis();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.info("[Maintenance] Scheduler started with tick interval: {}", settings.getTickInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
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
            log.info("[Maintenance] Scheduler shut down");
        }
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Maintenance] Tick skipped: previous run still in progress");
            return;
        }
        try {
            brain.runMaintenanceIfDue();
        } catch (Exception e) {
            log.error("[Maintenance] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    boolean isExecuting() {
        return executing.get();
    }
}
