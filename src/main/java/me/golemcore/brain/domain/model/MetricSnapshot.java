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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Daily repository activity. Written once per (scope, date) and never changed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MetricSnapshot {

    private String scope;
    private LocalDate date;
    private int commitCount;
    private int linesAdded;
    private int linesRemoved;
    private int filesChanged;
    private int contributorCount;
    private Instant recordedAt;

    public static String keyOf(String scope, LocalDate date) {
        return scope + "|" + date;
    }
}
