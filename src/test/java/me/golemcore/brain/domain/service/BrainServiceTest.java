package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.CollectionResult;
import me.golemcore.brain.domain.model.ContextBundle;
import me.golemcore.brain.domain.model.ContextHit;
import me.golemcore.brain.domain.model.ContextRequest;
import me.golemcore.brain.domain.model.Conversation;
import me.golemcore.brain.domain.model.ConversationMatch;
import me.golemcore.brain.domain.model.ConversationTurn;
import me.golemcore.brain.domain.model.DecayResult;
import me.golemcore.brain.domain.model.Insight;
import me.golemcore.brain.domain.model.InteractionRecord;
import me.golemcore.brain.domain.model.MaintenanceReport;
import me.golemcore.brain.domain.model.MemoryFailureKind;
import me.golemcore.brain.domain.model.MemoryResult;
import me.golemcore.brain.domain.model.Pattern;
import me.golemcore.brain.domain.model.PromotionResult;
import me.golemcore.brain.domain.model.ScoredPattern;
import me.golemcore.brain.domain.store.RecoveryEvent;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrainServiceTest {

    private static final Instant NOW = Instant.parse("2026-04-01T08:00:00Z");

    private WorkingMemoryService workingMemory;
    private KnowledgeGraphService knowledgeGraph;
    private ContextIntelligenceService contextIntelligence;
    private PatternPromotionService promotion;
    private MaintenanceTrigger trigger;
    private ExecutorService executor;
    private MutableClock clock;
    private BrainService brain;

    @BeforeEach
    void setUp() {
        workingMemory = mock(WorkingMemoryService.class);
        knowledgeGraph = mock(KnowledgeGraphService.class);
        contextIntelligence = mock(ContextIntelligenceService.class);
        promotion = mock(PatternPromotionService.class);
        clock = new MutableClock(NOW);
        executor = Executors.newFixedThreadPool(3);

        BrainProperties properties = new BrainProperties();
        properties.getFacade().setWorkingMemoryBudget(Duration.ofMillis(1000));
        properties.getFacade().setKnowledgeGraphBudget(Duration.ofMillis(300));
        properties.getFacade().setContextBudget(Duration.ofMillis(1000));
        properties.getMaintenance().setEventThreshold(2);
        trigger = new MaintenanceTrigger(properties, clock);

        brain = new BrainService(workingMemory, knowledgeGraph, contextIntelligence, promotion, trigger, executor,
                properties, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Conversation conversation(String id) {
        return Conversation.builder().id(id).sessionId("s1").build();
    }

    private static ConversationTurn turn(ConversationTurn.Role role, String text) {
        return ConversationTurn.builder().role(role).text(text).build();
    }

    // ==================== Context queries ====================

    @Test
    void shouldReturnPartialBundleWhenTierIsSlow() {
        when(workingMemory.search("retry", 5)).thenReturn(List.of(
                ConversationMatch.builder().conversation(conversation("conv-1")).score(1.0).build()));
        when(knowledgeGraph.searchPatterns(eq("retry"), anyDouble(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(3000);
            return List.of();
        });
        when(contextIntelligence.getLatestInsights()).thenReturn(List.of(Insight.builder().id("ins-1").build()));

        ContextBundle bundle = brain.queryContext(ContextRequest.builder().query("retry").build());

        assertTrue(bundle.isPartial());
        assertEquals(List.of(ContextBundle.Tier.KNOWLEDGE_GRAPH), bundle.getExcludedTiers());
        assertEquals("conv-1", bundle.getRecentConversations().get(0).getId());
        assertTrue(bundle.getMatchedPatterns().isEmpty());
        assertEquals(1, bundle.getInsights().size());
        assertTrue(bundle.getElapsed().toMillis() < 3000);
    }

    @Test
    void shouldExcludeFailingTier() {
        when(workingMemory.getRecent(5)).thenReturn(List.of(conversation("conv-1")));
        when(contextIntelligence.getLatestInsights()).thenThrow(new IllegalStateException("store closed"));

        ContextBundle bundle = brain.queryContext(ContextRequest.builder().build());

        assertEquals(List.of(ContextBundle.Tier.CONTEXT_INTELLIGENCE), bundle.getExcludedTiers());
        assertEquals(1, bundle.getRecentConversations().size());
    }

    @Test
    void shouldFallBackToRecentConversationsWithoutMatches() {
        when(workingMemory.search("nothing", 2)).thenReturn(List.of());
        when(workingMemory.getRecent(2)).thenReturn(List.of(conversation("conv-9")));
        Pattern pattern = Pattern.builder().id("p1").title("t").build();
        when(knowledgeGraph.searchPatterns("nothing", 0.5, 10))
                .thenReturn(List.of(ScoredPattern.builder().pattern(pattern).score(0.4).build()));

        ContextBundle bundle = brain.queryContext(ContextRequest.builder()
                .query("nothing")
                .conversationLimit(2)
                .minConfidence(0.5)
                .includeInsights(false)
                .build());

        assertFalse(bundle.isPartial());
        assertEquals("conv-9", bundle.getRecentConversations().get(0).getId());
        assertEquals(1, bundle.getMatchedPatterns().size());
        verify(contextIntelligence, never()).getLatestInsights();
    }

    @Test
    void shouldRankResultsAcrossTiersByRelevance() {
        when(workingMemory.search("cache", 5)).thenReturn(List.of(
                ConversationMatch.builder().conversation(conversation("conv-1")).score(4.0).build(),
                ConversationMatch.builder().conversation(conversation("conv-2")).score(1.0).build()));
        when(knowledgeGraph.searchPatterns(eq("cache"), anyDouble(), anyInt())).thenReturn(List.of(
                ScoredPattern.builder().pattern(Pattern.builder().id("p1").title("Cache keys").confidence(0.9).build())
                        .score(2.0).build(),
                ScoredPattern.builder().pattern(Pattern.builder().id("p2").title("Eviction").confidence(1.0).build())
                        .score(0.2).build()));
        when(contextIntelligence.getLatestInsights()).thenReturn(List.of(
                Insight.builder().id("ins-1").title("Hotspot").severity(Insight.Severity.WARNING).build()));

        ContextBundle bundle = brain.queryContext(ContextRequest.builder().query("cache").build());

        List<ContextHit> ranked = bundle.getRanked();
        assertEquals(List.of("conv-1", "p1", "ins-1", "conv-2", "p2"),
                ranked.stream().map(ContextHit::getId).toList());
        assertEquals(1.0, ranked.get(0).getRelevance(), 1e-9);
        assertEquals(0.9, ranked.get(1).getRelevance(), 1e-9);
        assertEquals(ContextBundle.Tier.CONTEXT_INTELLIGENCE, ranked.get(2).getTier());
        assertEquals(0.25, ranked.get(3).getRelevance(), 1e-9);
        assertEquals(4.0, bundle.getConversationMatches().get(0).getScore(), 1e-9);
    }

    @Test
    void shouldRankRecentConversationsByPositionWithoutQuery() {
        when(workingMemory.getRecent(5)).thenReturn(List.of(conversation("conv-2"), conversation("conv-1")));

        ContextBundle bundle = brain.queryContext(ContextRequest.builder().includeInsights(false).build());

        assertEquals(List.of("conv-2", "conv-1"), bundle.getRanked().stream().map(ContextHit::getId).toList());
        assertEquals(0.5, bundle.getRanked().get(1).getRelevance(), 1e-9);
        assertEquals(0.0, bundle.getConversationMatches().get(0).getScore(), 1e-9);
    }

    @Test
    void shouldSkipPatternSearchWithoutQuery() {
        when(workingMemory.getRecent(5)).thenReturn(List.of());

        ContextBundle bundle = brain.queryContext(null);

        assertFalse(bundle.isPartial());
        verify(knowledgeGraph, never()).searchPatterns(anyString(), anyDouble(), anyInt());
    }

    // ==================== Writes ====================

    @Test
    void shouldRecordInteractionThroughWorkingMemory() {
        InteractionRecord interaction = InteractionRecord.builder()
                .sessionId("s1")
                .turns(List.of(turn(ConversationTurn.Role.USER, "Fix the cache"),
                        turn(ConversationTurn.Role.ASSISTANT, "Done")))
                .files(List.of("src/Cache.java"))
                .entities(List.of("caching"))
                .intent("bugfix")
                .build();
        when(workingMemory.recordInteraction(interaction)).thenReturn(MemoryResult.success("conv-1"));

        MemoryResult<String> result = brain.recordInteraction(interaction);

        assertTrue(result.isSuccess());
        assertEquals("conv-1", result.getValue());
        verify(workingMemory).recordInteraction(interaction);
        verify(workingMemory, never()).startConversation(anyString());
        verify(workingMemory, never()).appendTurn(anyString(), any());
        assertEquals(1, trigger.getPendingEvents());
    }

    @Test
    void shouldNotCountRejectedInteraction() {
        when(workingMemory.recordInteraction(any()))
                .thenReturn(MemoryResult.validation("turn 2: turn text must not be blank"));

        MemoryResult<String> result = brain.recordInteraction(InteractionRecord.builder()
                .sessionId("s1")
                .turns(List.of(turn(ConversationTurn.Role.USER, "ok"), turn(ConversationTurn.Role.ASSISTANT, " ")))
                .build());

        assertEquals(MemoryFailureKind.VALIDATION, result.getFailureKind());
        assertEquals(0, trigger.getPendingEvents());
    }

    @Test
    void shouldPropagateStorageFailure() {
        when(workingMemory.recordInteraction(any()))
                .thenReturn(MemoryResult.failure(MemoryFailureKind.STORAGE, "disk full"));

        MemoryResult<String> result = brain.recordInteraction(InteractionRecord.builder()
                .sessionId("s1")
                .turns(List.of(turn(ConversationTurn.Role.USER, "hello")))
                .build());

        assertEquals(MemoryFailureKind.STORAGE, result.getFailureKind());
        assertEquals("disk full", result.getError());
        assertEquals(0, trigger.getPendingEvents());
    }

    @Test
    void shouldCountOnlySuccessfulPatternWrites() {
        when(knowledgeGraph.addPattern(any())).thenReturn(MemoryResult.success("p1"),
                MemoryResult.validation("title must not be blank"));

        brain.addPattern(Pattern.builder().title("one").build());
        brain.addPattern(Pattern.builder().build());

        assertEquals(1, trigger.getPendingEvents());
    }

    // ==================== Maintenance ====================

    @Test
    void shouldCollectErrorsAndRecoveryEventsDuringMaintenance() {
        RecoveryEvent recovery = new RecoveryEvent("tier1", RecoveryEvent.Outcome.RESTORED_FROM_BACKUP,
                "bad json", "tier1.json.corrupt-1", NOW);
        when(knowledgeGraph.applyConfidenceDecay()).thenThrow(new IllegalStateException("disk full"));
        when(contextIntelligence.collectGitMetrics()).thenReturn(CollectionResult.builder().scope("/repo").build());
        when(contextIntelligence.generateInsights()).thenReturn(List.of(Insight.builder().id("ins-1").build()));
        when(workingMemory.getRecoveryEvents()).thenReturn(List.of(recovery));
        when(knowledgeGraph.getRecoveryEvents()).thenReturn(List.of());
        when(contextIntelligence.getRecoveryEvents()).thenReturn(List.of());
        trigger.recordEvent();

        MaintenanceReport report = brain.runMaintenance();

        assertEquals(List.of("decay: disk full"), report.getErrors());
        assertNull(report.getDecay());
        assertEquals("/repo", report.getCollection().getScope());
        assertEquals(1, report.getInsights().size());
        assertEquals(List.of(recovery), report.getRecoveryEvents());
        assertEquals(0, trigger.getPendingEvents());
    }

    @Test
    void shouldPromoteObservationsDuringMaintenance() {
        PromotionResult promoted = PromotionResult.builder().candidateCount(2).promotedCount(1).mergedCount(1).build();
        when(promotion.promote()).thenReturn(promoted);

        MaintenanceReport report = brain.runMaintenance();

        assertEquals(promoted, report.getPromotion());
        assertTrue(report.getErrors().isEmpty());
    }

    @Test
    void shouldReportPromotionFailure() {
        when(promotion.promote()).thenThrow(new IllegalStateException("store closed"));

        MaintenanceReport report = brain.runMaintenance();

        assertEquals(List.of("promotion: store closed"), report.getErrors());
        assertNull(report.getPromotion());
    }

    @Test
    void shouldKeepEventsRecordedWhileMaintenanceRuns() {
        trigger.recordEvent();
        trigger.recordEvent();
        when(knowledgeGraph.applyConfidenceDecay()).thenAnswer(invocation -> {
            trigger.recordEvent();
            return DecayResult.builder().build();
        });

        brain.runMaintenance();

        assertEquals(1, trigger.getPendingEvents());
    }

    @Test
    void shouldRunMaintenanceOnlyWhenDue() {
        when(knowledgeGraph.applyConfidenceDecay()).thenReturn(DecayResult.builder().build());

        Optional<MaintenanceReport> early = brain.runMaintenanceIfDue();
        trigger.recordEvent();
        trigger.recordEvent();
        Optional<MaintenanceReport> due = brain.runMaintenanceIfDue();

        assertTrue(early.isEmpty());
        assertTrue(due.isPresent());
        verify(knowledgeGraph, times(1)).applyConfidenceDecay();
    }
}
