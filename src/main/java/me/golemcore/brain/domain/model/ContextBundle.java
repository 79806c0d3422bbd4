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
import java.util.ArrayList;
import java.util.List;

/**
 * Merged read across the three tiers. Tiers that missed their budget are
 * named in {@code excludedTiers} and contribute nothing. {@code ranked} orders
 * everything returned by relevance across tiers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextBundle {

    public enum Tier {
        WORKING_MEMORY, KNOWLEDGE_GRAPH, CONTEXT_INTELLIGENCE
    }

    @Builder.Default
    private List<Conversation> recentConversations = new ArrayList<>();

    @Builder.Default
    private List<ConversationMatch> conversationMatches = new ArrayList<>();

    @Builder.Default
    private List<ScoredPattern> matchedPatterns = new ArrayList<>();

    @Builder.Default
    private List<Insight> insights = new ArrayList<>();

    @Builder.Default
    private List<ContextHit> ranked = new ArrayList<>();

    @Builder.Default
    private List<Tier> excludedTiers = new ArrayList<>();

    private Duration elapsed;

    public boolean isPartial() {
        return !excludedTiers.isEmpty();
    }
}
