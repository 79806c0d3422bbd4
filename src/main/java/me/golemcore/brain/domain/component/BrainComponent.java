package me.golemcore.brain.domain.component;

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

import me.golemcore.brain.domain.model.ContextBundle;
import me.golemcore.brain.domain.model.ContextRequest;
import me.golemcore.brain.domain.model.ContextSummary;
import me.golemcore.brain.domain.model.Conversation;
import me.golemcore.brain.domain.model.InteractionRecord;
import me.golemcore.brain.domain.model.MaintenanceReport;
import me.golemcore.brain.domain.model.MemoryResult;
import me.golemcore.brain.domain.model.Pattern;
import me.golemcore.brain.domain.model.RelatedPattern;
import me.golemcore.brain.domain.model.Relationship;
import me.golemcore.brain.domain.model.ScoredPattern;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Single entry point of the tiered memory. Callers (intent routing, planning,
 * editor integrations) talk to the brain only through this contract and never
 * touch a tier directly.
 */
public interface BrainComponent {

    /**
     * Stores a finished interaction in working memory as one conversation.
     *
     * @param interaction
     *            session, turns, touched files, caller-named entities and intent
     * @return the id of the stored conversation, or a VALIDATION failure if the
     *         interaction is incomplete
     */
    MemoryResult<String> recordInteraction(InteractionRecord interaction);

    /**
     * Reads all three tiers in parallel and merges what arrives before the
     * deadline. Tiers that miss their budget are listed as excluded; this
     * method never fails because a tier is slow.
     *
     * @param request
     *            what to look for
     * @param deadline
     *            overall time the caller is willing to wait
     * @return the merged context, possibly partial
     */
    ContextBundle queryContext(ContextRequest request, Duration deadline);

    /**
     * Same as {@link #queryContext(ContextRequest, Duration)} with the largest
     * configured tier budget as deadline.
     */
    ContextBundle queryContext(ContextRequest request);

    MemoryResult<String> addPattern(Pattern pattern);

    MemoryResult<Relationship> linkPatterns(String from, String to, Relationship.Kind kind, double strength);

    List<ScoredPattern> searchPatterns(String query, double minConfidence, int limit);

    List<RelatedPattern> getRelatedPatterns(String patternId, Relationship.Kind kind, int maxDepth);

    List<Conversation> getRecentConversations(int limit);

    ContextSummary getContextSummary();

    /**
     * Runs decay, metric collection and insight generation, then resets the
     * maintenance trigger. Failures of one step are reported and do not stop
     * the others.
     */
    MaintenanceReport runMaintenance();

    /**
     * Runs maintenance only if the trigger says it is due.
     */
    Optional<MaintenanceReport> runMaintenanceIfDue();
}
