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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.component.BrainComponent;
import me.golemcore.brain.domain.model.ContextBundle;
import me.golemcore.brain.domain.model.ContextHit;
import me.golemcore.brain.domain.model.ContextRequest;
import me.golemcore.brain.domain.model.ContextSummary;
import me.golemcore.brain.domain.model.Conversation;
import me.golemcore.brain.domain.model.ConversationMatch;
import me.golemcore.brain.domain.model.Insight;
import me.golemcore.brain.domain.model.InteractionRecord;
import me.golemcore.brain.domain.model.MaintenanceReport;
import me.golemcore.brain.domain.model.MemoryResult;
import me.golemcore.brain.domain.model.Pattern;
import me.golemcore.brain.domain.model.RelatedPattern;
import me.golemcore.brain.domain.model.Relationship;
import me.golemcore.brain.domain.model.ScoredPattern;
import me.golemcore.brain.infrastructure.config.BrainConfiguration;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Facade over the three memory tiers.
 *
 * <p>
 * Context queries fan out on a bounded executor. Each tier gets its own budget
 * (working memory 50 ms, knowledge graph 150 ms, context intelligence 200 ms by
 * default), capped by the caller's deadline. Every write counts as one event
 * for the {@link MaintenanceTrigger}. The bundle ranks what came back across
 * tiers: search scores are divided by the best score of their tier, pattern
 * relevance is further weighted by confidence, and insights rank by severity.
 */
@Service
@Slf4j
public class BrainService implements BrainComponent {

    private final WorkingMemoryService workingMemory;
    private final KnowledgeGraphService knowledgeGraph;
    private final ContextIntelligenceService contextIntelligence;
    private final PatternPromotionService patternPromotion;
    private final MaintenanceTrigger maintenanceTrigger;
    private final ExecutorService queryExecutor;
    private final BrainProperties.FacadeProperties settings;
    private final Clock clock;
    private final ReentrantLock maintenanceLock = new ReentrantLock();

    public BrainService(WorkingMemoryService workingMemory, KnowledgeGraphService knowledgeGraph,
            ContextIntelligenceService contextIntelligence, PatternPromotionService patternPromotion,
            MaintenanceTrigger maintenanceTrigger,
            @Qualifier(BrainConfiguration.QUERY_EXECUTOR) ExecutorService queryExecutor,
            BrainProperties properties, Clock clock) {
        this.workingMemory = workingMemory;
        this.knowledgeGraph = knowledgeGraph;
        this.contextIntelligence = contextIntelligence;
        this.patternPromotion = patternPromotion;
        this.maintenanceTrigger = maintenanceTrigger;
        this.queryExecutor = queryExecutor;
        this.settings = properties.getFacade();
        this.clock = clock;
    }

    // ==================== Writes ====================

    @Override
    public MemoryResult<String> recordInteraction(InteractionRecord interaction) {
        MemoryResult<String> recorded = workingMemory.recordInteraction(interaction);
        if (recorded.isSuccess()) {
            maintenanceTrigger.recordEvent();
            log.debug("[Brain] Recorded interaction {}", recorded.getValue());
        } else {
            log.debug("[Brain] Interaction rejected ({}): {}", recorded.getFailureKind(), recorded.getError());
        }
        return recorded;
    }

    @Override
    public MemoryResult<String> addPattern(Pattern pattern) {
        MemoryResult<String> result = knowledgeGraph.addPattern(pattern);
        if (result.isSuccess()) {
            maintenanceTrigger.recordEvent();
        }
        return result;
    }

    @Override
    public MemoryResult<Relationship> linkPatterns(String from, String to, Relationship.Kind kind, double strength) {
        MemoryResult<Relationship> result = knowledgeGraph.linkPatterns(from, to, kind, strength);
        if (result.isSuccess()) {
            maintenanceTrigger.recordEvent();
        }
        return result;
    }

    // ==================== Reads ====================

    @Override
    public ContextBundle queryContext(ContextRequest request) {
        Duration widest = settings.getWorkingMemoryBudget();
        if (settings.getKnowledgeGraphBudget().compareTo(widest) > 0) {
            widest = settings.getKnowledgeGraphBudget();
        }
        if (settings.getContextBudget().compareTo(widest) > 0) {
            widest = settings.getContextBudget();
        }
        return queryContext(request, widest);
    }

    @Override
    public ContextBundle queryContext(ContextRequest request, Duration deadline) {
        ContextRequest effective = request != null ? request : ContextRequest.builder().build();
        long startNanos = System.nanoTime();
        long deadlineNanos = deadline == null || deadline.isNegative() ? 0 : deadline.toNanos();

        int conversationLimit = positiveOr(effective.getConversationLimit(), settings.getDefaultConversationLimit());
        int patternLimit = positiveOr(effective.getPatternLimit(), settings.getDefaultPatternLimit());
        double minConfidence = effective.getMinConfidence() != null ? effective.getMinConfidence() : 0.0;
        String query = effective.getQuery();
        boolean hasQuery = query != null && !query.isBlank();

        CompletableFuture<List<ConversationMatch>> conversations = submit(
                () -> readConversations(query, hasQuery, conversationLimit));
        CompletableFuture<List<ScoredPattern>> patterns = submit(
                () -> hasQuery ? knowledgeGraph.searchPatterns(query, minConfidence, patternLimit) : List.of());
        CompletableFuture<List<Insight>> insights = submit(
                () -> effective.isIncludeInsights() ? contextIntelligence.getLatestInsights() : List.of());

        ContextBundle bundle = ContextBundle.builder().build();
        bundle.setConversationMatches(await(conversations, ContextBundle.Tier.WORKING_MEMORY,
                settings.getWorkingMemoryBudget(), startNanos, deadlineNanos, bundle));
        for (ConversationMatch match : bundle.getConversationMatches()) {
            bundle.getRecentConversations().add(match.getConversation());
        }
        bundle.setMatchedPatterns(await(patterns, ContextBundle.Tier.KNOWLEDGE_GRAPH,
                settings.getKnowledgeGraphBudget(), startNanos, deadlineNanos, bundle));
        bundle.setInsights(await(insights, ContextBundle.Tier.CONTEXT_INTELLIGENCE,
                settings.getContextBudget(), startNanos, deadlineNanos, bundle));
        bundle.setRanked(rank(bundle));
        bundle.setElapsed(Duration.ofNanos(System.nanoTime() - startNanos));

        if (bundle.isPartial()) {
            log.info("[Brain] Partial context after {} ms, excluded {}", bundle.getElapsed().toMillis(),
                    bundle.getExcludedTiers());
        }
        return bundle;
    }

    /**
     * Search hits, or the most recent conversations with a zero score when there
     * is no query or nothing matched.
     */
    private List<ConversationMatch> readConversations(String query, boolean hasQuery, int limit) {
        if (hasQuery) {
            List<ConversationMatch> matched = workingMemory.search(query, limit);
            if (!matched.isEmpty()) {
                return new ArrayList<>(matched);
            }
        }
        List<ConversationMatch> recent = new ArrayList<>();
        for (Conversation conversation : workingMemory.getRecent(limit)) {
            recent.add(ConversationMatch.builder().conversation(conversation).score(0.0).build());
        }
        return recent;
    }

    private static List<ContextHit> rank(ContextBundle bundle) {
        List<ContextHit> hits = new ArrayList<>();

        List<ConversationMatch> matches = bundle.getConversationMatches();
        double bestConversation = matches.stream().mapToDouble(ConversationMatch::getScore).max().orElse(0.0);
        for (int i = 0; i < matches.size(); i++) {
            ConversationMatch match = matches.get(i);
            // unscored recent conversations rank by position
            double relevance = bestConversation > 0.0 ? match.getScore() / bestConversation : 1.0 / (i + 1);
            hits.add(hit(ContextBundle.Tier.WORKING_MEMORY, match.getConversation().getId(),
                    match.getConversation().getIntent(), relevance));
        }

        List<ScoredPattern> patterns = bundle.getMatchedPatterns();
        double bestPattern = patterns.stream().mapToDouble(ScoredPattern::getScore).max().orElse(0.0);
        for (ScoredPattern scored : patterns) {
            Pattern pattern = scored.getPattern();
            double confidence = pattern.getConfidence() != null ? pattern.getConfidence() : 1.0;
            double relevance = bestPattern > 0.0 ? scored.getScore() / bestPattern * confidence : confidence;
            hits.add(hit(ContextBundle.Tier.KNOWLEDGE_GRAPH, pattern.getId(), pattern.getTitle(), relevance));
        }

        for (Insight insight : bundle.getInsights()) {
            hits.add(hit(ContextBundle.Tier.CONTEXT_INTELLIGENCE, insight.getId(), insight.getTitle(),
                    severityWeight(insight.getSeverity())));
        }

        hits.sort(Comparator.comparingDouble(ContextHit::getRelevance).reversed()
                .thenComparing(ContextHit::getTier)
                .thenComparing(ContextHit::getId, Comparator.nullsLast(Comparator.naturalOrder())));
        return hits;
    }

    private static ContextHit hit(ContextBundle.Tier tier, String id, String title, double relevance) {
        return ContextHit.builder()
                .tier(tier)
                .id(id)
                .title(title)
                .relevance(Math.max(0.0, Math.min(1.0, relevance)))
                .build();
    }

    private static double severityWeight(Insight.Severity severity) {
        if (severity == null) {
            return 0.25;
        }
        return switch (severity) {
            case CRITICAL -> 1.0;
            case ERROR -> 0.75;
            case WARNING -> 0.5;
            case INFO -> 0.25;
        };
    }

    private <T> CompletableFuture<List<T>> submit(Supplier<List<T>> read) {
        return CompletableFuture.supplyAsync(read, queryExecutor);
    }

    private <T> List<T> await(CompletableFuture<List<T>> future, ContextBundle.Tier tier, Duration budget,
            long startNanos, long deadlineNanos, ContextBundle bundle) {
        long tierDeadline = startNanos + Math.min(budget.toNanos(), deadlineNanos);
        long waitNanos = Math.max(0, tierDeadline - System.nanoTime());
        try {
            List<T> value = future.get(waitNanos, TimeUnit.NANOSECONDS);
            return value != null ? value : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("[Brain] {} missed its {} ms budget", tier, budget.toMillis());
        } catch (ExecutionException e) {
            log.warn("[Brain] {} read failed: {}", tier, e.getCause() != null ? e.getCause().getMessage()
                    : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
        }
        bundle.getExcludedTiers().add(tier);
        return new ArrayList<>();
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    @Override
    public List<ScoredPattern> searchPatterns(String query, double minConfidence, int limit) {
        return knowledgeGraph.searchPatterns(query, minConfidence, limit);
    }

    @Override
    public List<RelatedPattern> getRelatedPatterns(String patternId, Relationship.Kind kind, int maxDepth) {
        return knowledgeGraph.getRelatedPatterns(patternId, kind, maxDepth);
    }

    @Override
    public List<Conversation> getRecentConversations(int limit) {
        return workingMemory.getRecent(limit);
    }

    @Override
    public ContextSummary getContextSummary() {
        return contextIntelligence.getContextSummary();
    }

    // ==================== Maintenance ====================

    @Override
    public MaintenanceReport runMaintenance() {
        maintenanceLock.lock();
        try {
            int handledEvents = maintenanceTrigger.getPendingEvents();
            MaintenanceReport report = MaintenanceReport.builder()
                    .startedAt(clock.instant())
                    .build();
            log.info("[Maintenance] Starting");

            try {
                report.setDecay(knowledgeGraph.applyConfidenceDecay());
            } catch (RuntimeException e) {
                log.warn("[Maintenance] Confidence decay failed: {}", e.getMessage());
                report.getErrors().add("decay: " + e.getMessage());
            }
            try {
                report.setCollection(contextIntelligence.collectGitMetrics());
            } catch (RuntimeException e) {
                log.warn("[Maintenance] Metric collection failed: {}", e.getMessage());
                report.getErrors().add("collection: " + e.getMessage());
            }
            try {
                report.setInsights(contextIntelligence.generateInsights());
            } catch (RuntimeException e) {
                log.warn("[Maintenance] Insight generation failed: {}", e.getMessage());
                report.getErrors().add("insights: " + e.getMessage());
            }

            try {
                report.setPromotion(patternPromotion.promote());
            } catch (RuntimeException e) {
                log.warn("[Maintenance] Pattern promotion failed: {}", e.getMessage());
                report.getErrors().add("promotion: " + e.getMessage());
            }

            report.getRecoveryEvents().addAll(workingMemory.getRecoveryEvents());
            report.getRecoveryEvents().addAll(knowledgeGraph.getRecoveryEvents());
            report.getRecoveryEvents().addAll(contextIntelligence.getRecoveryEvents());

            maintenanceTrigger.markRun(handledEvents);
            report.setFinishedAt(clock.instant());
            log.info("[Maintenance] Finished: decayed={}, deleted={}, insights={}, errors={}",
                    report.getDecay() != null ? report.getDecay().getDecayedCount() : 0,
                    report.getDecay() != null ? report.getDecay().getDeletedCount() : 0,
                    report.getInsights().size(), report.getErrors().size());
            return report;
        } finally {
            maintenanceLock.unlock();
        }
    }

    @Override
    public Optional<MaintenanceReport> runMaintenanceIfDue() {
        if (!maintenanceTrigger.isDue()) {
            return Optional.empty();
        }
        return Optional.of(runMaintenance());
    }
}
