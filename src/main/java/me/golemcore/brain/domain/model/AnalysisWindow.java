package me.golemcore.brain.domain.model;

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

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive range of calendar days.
 */
public record AnalysisWindow(LocalDate start, LocalDate end) {

    public AnalysisWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    /**
     * The {@code days} calendar days ending with {@code end}.
     */
    public static AnalysisWindow endingOn(LocalDate end, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Window must cover at least one day");
        }
        return new AnalysisWindow(end.minusDays(days - 1L), end);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
