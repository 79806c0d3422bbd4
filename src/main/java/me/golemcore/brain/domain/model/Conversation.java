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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Working memory conversation: the ordered turns of one session plus what was
 * extracted from them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {

    private String id;
    private long sequence;
    private String sessionId;

    @Builder.Default
    private List<ConversationTurn> turns = new ArrayList<>();

    @Builder.Default
    private List<String> entityKeys = new ArrayList<>();

    @Builder.Default
    private List<String> relatedFiles = new ArrayList<>();

    private String intent;
    private Instant createdAt;
    private Instant lastActivityAt;
    private boolean closed;
    private boolean pinned;
    private Instant closedAt;

    /**
     * Active conversations are immune to eviction: still open and not timed
     * out, or pinned.
     */
    public boolean isActive(Instant now, Duration sessionTimeout) {
        if (pinned) {
            return true;
        }
        return !closed && !isTimedOut(now, sessionTimeout);
    }

    public boolean isTimedOut(Instant now, Duration sessionTimeout) {
        Instant last = lastActivityAt != null ? lastActivityAt : createdAt;
        return last != null && !last.plus(sessionTimeout).isAfter(now);
    }
}
