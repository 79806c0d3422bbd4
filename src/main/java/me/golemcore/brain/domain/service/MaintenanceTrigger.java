package me.golemcore.brain.domain.service;

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

import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides when maintenance should run: after {@code event-threshold} recorded
 * events or once {@code interval} has elapsed since the last run, whichever
 * comes first. The interval is measured from construction until the first run.
 */
@Component
public class MaintenanceTrigger {

    private final Clock clock;
    private final int eventThreshold;
    private final Duration interval;
    private final AtomicInteger pendingEvents = new AtomicInteger();
    private final AtomicReference<Instant> lastRun;

    public MaintenanceTrigger(BrainProperties properties, Clock clock) {
        this.clock = clock;
        this.eventThreshold = properties.getMaintenance().getEventThreshold();
        this.interval = properties.getMaintenance().getInterval();
        this.lastRun = new AtomicReference<>(clock.instant());
    }

    public void recordEvent() {
        pendingEvents.incrementAndGet();
    }

    public int getPendingEvents() {
        return pendingEvents.get();
    }

    public Instant getLastRun() {
        return lastRun.get();
    }

    public boolean isDue() {
        if (pendingEvents.get() >= eventThreshold) {
            return true;
        }
        return !lastRun.get().plus(interval).isAfter(clock.instant());
    }

    /**
     * Consume the events a run has handled and restart the interval. Events
     * recorded while the run was in progress stay pending.
     *
     * @param handledEvents
     *            the pending count read when the run started
     */
    public void markRun(int handledEvents) {
        pendingEvents.updateAndGet(pending -> Math.max(0, pending - Math.max(0, handledEvents)));
        lastRun.set(clock.instant());
    }
}
