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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Knowledge graph node: a reusable unit of knowledge with a confidence that
 * decays when the pattern goes unused.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Pattern {

    public enum Kind {
        WORKFLOW, PRINCIPLE, ANTI_PATTERN, SOLUTION, CONTEXT
    }

    private String id;
    private String title;
    private String body;
    private Kind kind;
    private Double confidence;
    private Instant createdAt;
    private Instant lastAccessed;
    private long accessCount;
    private String source;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private boolean pinned;
    private Boolean immutable;
    private PatternMetadata metadata;

    /** Date of the last decay penalty, so a window is never penalized twice. */
    private LocalDate decayEvaluatedOn;

    @JsonIgnore
    public boolean isProtected() {
        return pinned || Boolean.TRUE.equals(immutable);
    }
}
