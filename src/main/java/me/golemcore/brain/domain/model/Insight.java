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

/**
 * Rule-derived observation about repository health.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Insight {

    public enum Kind {
        VELOCITY_DROP, VELOCITY_GAIN, FILE_HOTSPOT
    }

    public enum Severity {
        INFO, WARNING, ERROR, CRITICAL
    }

    private String id;
    private Kind kind;
    private Severity severity;
    private String title;
    private String message;
    private String recommendation;
    private String relatedEntity;
    private String metricReference;
    private Instant createdAt;
}
