package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.DecayLogEntry;
import me.golemcore.brain.domain.model.DecayResult;
import me.golemcore.brain.domain.model.MemoryFailureKind;
import me.golemcore.brain.domain.model.MemoryResult;
import me.golemcore.brain.domain.model.Pattern;
import me.golemcore.brain.domain.model.PatternUpdate;
import me.golemcore.brain.domain.model.RelatedPattern;
import me.golemcore.brain.domain.model.Relationship;
import me.golemcore.brain.domain.model.ScoredPattern;
import me.golemcore.brain.domain.model.SolutionMetadata;
import me.golemcore.brain.domain.model.TagCount;
import me.golemcore.brain.domain.model.WorkflowMetadata;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.StoragePort;
import me.golemcore.brain.testsupport.MutableClock;
import me.golemcore.brain.testsupport.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeGraphServiceTest {

    @TempDir
    Path tempDir;

    private StoragePort storage;
    private MutableClock clock;
    private BrainProperties properties;
    private KnowledgeGraphService service;

    @BeforeEach
    void setUp() {
        storage = TestStores.storage(tempDir);
        clock = new MutableClock(Instant.parse("2026-01-10T09:00:00Z"));
        properties = new BrainProperties();
        properties.getKnowledgeGraph().setDecayTimeSlice(Duration.ofSeconds(30));
        service = newService();
    }

    @AfterEach
    void tearDown() {
        TestStores.closeAll();
    }

    private KnowledgeGraphService newService() {
        return new KnowledgeGraphService(TestStores.open("tier2", storage, clock), new PatternMetadataValidator(),
                properties, clock);
    }

    private String add(String id, String title, String body, double confidence, String... tags) {
        MemoryResult<String> result = service.addPattern(Pattern.builder()
                .id(id)
                .title(title)
                .body(body)
                .kind(Pattern.Kind.SOLUTION)
                .confidence(confidence)
                .tags(List.of(tags))
                .build());
        assertTrue(result.isSuccess(), result.getError());
        return result.getValue();
    }

    // ==================== CRUD ====================

    @Test
    void shouldGenerateIdAndDefaults() {
        MemoryResult<String> result = service.addPattern(Pattern.builder()
                .title("  Guard clauses ")
                .body("Return early")
                .kind(Pattern.Kind.PRINCIPLE)
                .tags(List.of("Style", "style"))
                .build());

        Pattern stored = service.peekPattern(result.getValue()).orElseThrow();
        assertTrue(stored.getId().startsWith("pat-"));
        assertEquals("Guard clauses", stored.getTitle());
        assertEquals(1.0, stored.getConfidence());
        assertEquals(List.of("style"), stored.getTags());
        assertTrue(stored.getImmutable());
    }

    @Test
    void shouldRejectDuplicateIdAsIntegrityFailure() {
        add("p1", "One", "body", 0.9);

        MemoryResult<String> duplicate = service.addPattern(Pattern.builder()
                .id("p1").title("Other").body("body").kind(Pattern.Kind.SOLUTION).build());

        assertEquals(MemoryFailureKind.INTEGRITY, duplicate.getFailureKind());
        assertEquals("One", service.peekPattern("p1").orElseThrow().getTitle());
    }

    @Test
    void shouldRejectInvalidMetadata() {
        MemoryResult<String> result = service.addPattern(Pattern.builder()
                .title("Release")
                .body("Steps to release")
                .kind(Pattern.Kind.SOLUTION)
                .metadata(WorkflowMetadata.builder().steps(List.of("tag")).build())
                .build());

        assertEquals(MemoryFailureKind.VALIDATION, result.getFailureKind());
        assertEquals(0, service.countPatterns());
    }

    @Test
    void shouldRoundTripPatternAndCountAccess() {
        service.addPattern(Pattern.builder()
                .id("p1")
                .title("Fix N+1 queries")
                .body("Use a join fetch")
                .kind(Pattern.Kind.SOLUTION)
                .confidence(0.8)
                .metadata(SolutionMetadata.builder().problem("slow listing").files(List.of("Repo.java")).build())
                .build());

        service.getPattern("p1");
        Pattern read = service.getPattern("p1").orElseThrow();

        assertEquals(2, read.getAccessCount());
        assertEquals("Fix N+1 queries", read.getTitle());
        assertEquals(0.8, read.getConfidence());
        assertInstanceOf(SolutionMetadata.class, read.getMetadata());
        assertEquals("slow listing", ((SolutionMetadata) read.getMetadata()).getProblem());

        Pattern reloaded = newService().peekPattern("p1").orElseThrow();
        assertEquals(2, reloaded.getAccessCount());
        assertEquals(read.getMetadata(), reloaded.getMetadata());
    }

    @Test
    void shouldBlockContentChangesOnImmutablePattern() {
        String id = service.addPattern(Pattern.builder()
                .title("Never log secrets").body("Mask tokens").kind(Pattern.Kind.PRINCIPLE).build()).getValue();

        MemoryResult<Pattern> blocked = service.updatePattern(id, PatternUpdate.builder().body("changed").build());
        MemoryResult<Boolean> deleteBlocked = service.deletePattern(id);
        MemoryResult<Pattern> unlocked = service.updatePattern(id,
                PatternUpdate.builder().body("Mask tokens and keys").immutable(false).build());

        assertEquals(MemoryFailureKind.VALIDATION, blocked.getFailureKind());
        assertEquals(MemoryFailureKind.VALIDATION, deleteBlocked.getFailureKind());
        assertTrue(unlocked.isSuccess());
        assertEquals("Mask tokens and keys", service.peekPattern(id).orElseThrow().getBody());
    }

    @Test
    void shouldClampReinforcement() {
        add("p1", "One", "body", 0.9);

        assertEquals(1.0, service.reinforcePattern("p1", 0.5).getValue().getConfidence());
        assertEquals(MemoryFailureKind.VALIDATION, service.reinforcePattern("p1", 2.0).getFailureKind());
        assertEquals(1, service.getDecayLog("p1", 10).size());
    }

    // ==================== Search ====================

    @Test
    void shouldInsertPromotedPatternOnce() {
        MemoryResult<Boolean> first = service.promotePattern(observed("comod-1", 0.7, "co-modification"));

        assertTrue(first.isSuccess());
        assertFalse(first.getValue());
        Pattern stored = service.peekPattern("comod-1").orElseThrow();
        assertEquals(0.7, stored.getConfidence());
        assertFalse(stored.getImmutable());
        assertEquals("working-memory", stored.getSource());
        assertEquals(1, service.searchPatterns("together", 0.0, 10).size());
    }

    @Test
    void shouldMergeRepeatedPromotionInsteadOfDuplicating() {
        service.promotePattern(observed("comod-1", 0.9, "co-modification"));
        clock.advance(Duration.ofDays(3));

        MemoryResult<Boolean> merged = service.promotePattern(observed("comod-1", 0.5, "file"));

        assertTrue(merged.getValue());
        Pattern stored = service.peekPattern("comod-1").orElseThrow();
        assertEquals(0.7, stored.getConfidence(), 1e-9);
        assertEquals(List.of("co-modification", "file"), stored.getTags());
        assertEquals(1, stored.getAccessCount());
        assertEquals(clock.instant(), stored.getLastAccessed());
        assertEquals(1, service.searchPatterns("together", 0.0, 10).size());
    }

    @Test
    void shouldLeaveImmutablePatternUntouchedOnPromotion() {
        service.addPattern(Pattern.builder().id("rule").title("Files edited together").body("Keep it")
                .kind(Pattern.Kind.PRINCIPLE).confidence(1.0).build());

        MemoryResult<Boolean> merged = service.promotePattern(observed("rule", 0.2, "file"));

        assertTrue(merged.getValue());
        Pattern stored = service.peekPattern("rule").orElseThrow();
        assertEquals(1.0, stored.getConfidence());
        assertEquals("Keep it", stored.getBody());
    }

    @Test
    void shouldRejectPromotionWithoutId() {
        MemoryResult<Boolean> result = service.promotePattern(observed(null, 0.7));

        assertEquals(MemoryFailureKind.VALIDATION, result.getFailureKind());
    }

    private static Pattern observed(String id, double confidence, String... tags) {
        return Pattern.builder()
                .id(id)
                .title("Files edited together")
                .body("A.java and B.java changed in the same turn")
                .kind(Pattern.Kind.CONTEXT)
                .confidence(confidence)
                .source("working-memory")
                .tags(List.of(tags))
                .build();
    }

    @Test
    void shouldMatchPrefixQuery() {
        add("p1", "Refactoring checklist", "Small safe steps", 0.9);
        add("p2", "Refactor in small steps", "Keep tests green", 0.8);
        add("p3", "Deploy pipeline", "Blue green deployment", 0.9);

        List<ScoredPattern> hits = service.searchPatterns("refactor*", 0.0, 10);

        assertEquals(2, hits.size());
        assertTrue(hits.stream().allMatch(hit -> hit.getScore() > 0));
        assertTrue(hits.stream().noneMatch(hit -> hit.getPattern().getId().equals("p3")));
    }

    @Test
    void shouldBreakScoreTiesByConfidence() {
        add("low", "Cache invalidation", "Use versioned keys", 0.5);
        add("high", "Cache invalidation", "Use versioned keys", 0.9);

        List<ScoredPattern> hits = service.searchPatterns("cache", 0.0, 10);

        assertEquals(List.of("high", "low"), hits.stream().map(hit -> hit.getPattern().getId()).toList());
        assertEquals(hits.get(0).getScore(), hits.get(1).getScore(), 1e-12);
    }

    @Test
    void shouldRankTitleAndTagMatchesHigher() {
        add("title", "Circuit breaker", "Stop calling a failing service", 0.7);
        add("body", "Resilience notes", "A circuit breaker stops cascades", 0.7);
        add("tagged", "Resilience notes", "A circuit breaker stops cascades", 0.7, "breaker");

        List<ScoredPattern> hits = service.searchPatterns("breaker", 0.0, 10);

        assertEquals("tagged", hits.get(0).getPattern().getId());
        assertEquals("body", hits.get(2).getPattern().getId());
    }

    @Test
    void shouldApplyBooleanOperatorsAndConfidenceFilter() {
        add("p1", "Redis cache", "Cache with redis", 0.9);
        add("p2", "Local cache", "Cache in memory", 0.9);
        add("p3", "Weak cache idea", "Cache everything", 0.2);

        List<ScoredPattern> hits = service.searchPatterns("cache NOT redis", 0.5, 10);

        assertEquals(List.of("p2"), hits.stream().map(hit -> hit.getPattern().getId()).toList());
    }

    @Test
    void shouldReportMalformedQuery() {
        assertEquals(MemoryFailureKind.VALIDATION, service.searchPatternsChecked("(open", 0.0, 5).getFailureKind());
        assertTrue(service.searchPatterns("(open", 0.0, 5).isEmpty());
    }

    @Test
    void shouldSeeNewPatternsInSearchAfterIndexBuilt() {
        add("p1", "Logging levels", "Use debug for detail", 0.9);
        assertEquals(1, service.searchPatterns("logging", 0.0, 10).size());

        add("p2", "Structured logging", "Key value pairs", 0.9);

        assertEquals(2, service.searchPatterns("logging", 0.0, 10).size());
    }

    @Test
    void shouldFindByTagAndBuildTagCloud() {
        add("p1", "One", "body", 0.9, "java", "testing");
        add("p2", "Two", "body", 0.9, "java");

        assertEquals(2, service.findPatternsByTag("Java").size());
        List<TagCount> cloud = service.getTagCloud(10);
        assertEquals("java", cloud.get(0).getTag());
        assertEquals(2, cloud.get(0).getCount());
    }

    // ==================== Relationships ====================

    @Test
    void shouldLinkAndTraverseOneLevel() {
        add("P1", "One", "body", 0.9);
        add("P2", "Two", "body", 0.9);

        MemoryResult<Relationship> link = service.linkPatterns("P1", "P2", Relationship.Kind.EXTENDS, 0.9);
        List<RelatedPattern> related = service.getRelatedPatterns("P1", null, 1);

        assertTrue(link.isSuccess());
        assertEquals(1, related.size());
        assertEquals("P2", related.get(0).getPattern().getId());
        assertEquals(1, related.get(0).getDistance());
        assertEquals(Relationship.Kind.EXTENDS, related.get(0).getViaKind());
    }

    @Test
    void shouldRejectLinkToMissingPatternWithoutStoringIt() {
        add("P1", "One", "body", 0.9);

        MemoryResult<Relationship> result = service.linkPatterns("P1", "ghost", Relationship.Kind.RELATED_TO, 0.5);

        assertEquals(MemoryFailureKind.INTEGRITY, result.getFailureKind());
        assertTrue(service.getRelationships("P1").isEmpty());
    }

    @Test
    void shouldRejectSelfLoopDuplicateAndBadStrength() {
        add("P1", "One", "body", 0.9);
        add("P2", "Two", "body", 0.9);
        service.linkPatterns("P1", "P2", Relationship.Kind.RELATED_TO, 0.5);

        assertEquals(MemoryFailureKind.VALIDATION,
                service.linkPatterns("P1", "P1", Relationship.Kind.RELATED_TO, 0.5).getFailureKind());
        assertEquals(MemoryFailureKind.VALIDATION,
                service.linkPatterns("P1", "P2", Relationship.Kind.RELATED_TO, 0.7).getFailureKind());
        assertEquals(MemoryFailureKind.VALIDATION,
                service.linkPatterns("P2", "P1", Relationship.Kind.RELATED_TO, 1.5).getFailureKind());
        assertTrue(service.linkPatterns("P1", "P2", Relationship.Kind.EXTENDS, 0.7).isSuccess());
    }

    @Test
    void shouldTerminateOnCyclesAndReportShortestDistance() {
        add("A", "A", "body", 0.9);
        add("B", "B", "body", 0.9);
        add("C", "C", "body", 0.9);
        service.linkPatterns("A", "B", Relationship.Kind.RELATED_TO, 0.8);
        service.linkPatterns("B", "C", Relationship.Kind.RELATED_TO, 0.8);
        service.linkPatterns("C", "A", Relationship.Kind.RELATED_TO, 0.8);
        service.linkPatterns("A", "C", Relationship.Kind.REPLACES, 0.3);

        List<RelatedPattern> all = service.getRelatedPatterns("A", null, 5);
        List<RelatedPattern> relatedOnly = service.getRelatedPatterns("A", Relationship.Kind.RELATED_TO, 5);

        assertEquals(List.of("B", "C"), all.stream().map(r -> r.getPattern().getId()).toList());
        assertEquals(1, all.get(1).getDistance());
        assertEquals(List.of("B", "C"), relatedOnly.stream().map(r -> r.getPattern().getId()).toList());
        assertEquals(2, relatedOnly.get(1).getDistance());
    }

    @Test
    void shouldCascadeRelationshipsOnDelete() {
        add("P1", "One", "body", 0.9);
        add("P2", "Two", "body", 0.9);
        service.linkPatterns("P1", "P2", Relationship.Kind.RELATED_TO, 0.5);

        assertTrue(service.deletePattern("P2").getValue());

        assertTrue(service.getRelationships("P1").isEmpty());
        assertFalse(service.deletePattern("P2").getValue());
    }

    // ==================== Decay ====================

    @Test
    void shouldApplyLightPenaltyAfterSixtyDays() {
        add("p1", "One", "body", 1.0);
        clock.advance(Duration.ofDays(65));

        DecayResult result = service.applyConfidenceDecay();

        assertEquals(1, result.getDecayedCount());
        assertEquals(0.9, service.peekPattern("p1").orElseThrow().getConfidence(), 1e-9);
        DecayLogEntry entry = service.getDecayLog("p1", 10).get(0);
        assertEquals(1.0, entry.getOldConfidence(), 1e-9);
        assertEquals(0.9, entry.getNewConfidence(), 1e-9);
    }

    @Test
    void shouldApplyHeavyPenaltyAfterNinetyDays() {
        add("p1", "One", "body", 1.0);
        clock.advance(Duration.ofDays(95));

        service.applyConfidenceDecay();

        assertEquals(0.75, service.peekPattern("p1").orElseThrow().getConfidence(), 1e-9);
    }

    @Test
    void shouldNotPenalizeTwiceInSameWindow() {
        add("p1", "One", "body", 1.0);
        clock.advance(Duration.ofDays(65));

        service.applyConfidenceDecay();
        DecayResult second = service.applyConfidenceDecay();

        assertEquals(0, second.getDecayedCount());
        assertEquals(0.9, service.peekPattern("p1").orElseThrow().getConfidence(), 1e-9);
    }

    @Test
    void shouldDeleteBelowFloorButKeepPinned() {
        add("weak", "Weak", "body", 0.35);
        add("pinned", "Pinned", "body", 0.35);
        service.pinPattern("pinned", true);
        clock.advance(Duration.ofDays(65));

        DecayResult result = service.applyConfidenceDecay();

        assertEquals(1, result.getDeletedCount());
        assertTrue(service.peekPattern("weak").isEmpty());
        assertEquals(0.35, service.peekPattern("pinned").orElseThrow().getConfidence(), 1e-9);
    }

    @Test
    void shouldDeleteAfterOneHundredTwentyDays() {
        add("old", "Old", "body", 1.0);
        add("fresh", "Fresh", "body", 1.0);
        service.linkPatterns("fresh", "old", Relationship.Kind.REPLACES, 1.0);
        clock.advance(Duration.ofDays(121));
        service.getPattern("fresh");

        DecayResult result = service.applyConfidenceDecay();

        assertEquals(1, result.getDeletedCount());
        assertTrue(service.peekPattern("old").isEmpty());
        assertTrue(service.getRelationships("fresh").isEmpty());
    }

    @Test
    void shouldLeaveRecentlyUsedPatternsAlone() {
        add("p1", "One", "body", 1.0);
        clock.advance(Duration.ofDays(59));

        DecayResult result = service.applyConfidenceDecay();

        assertEquals(0, result.getDecayedCount());
        assertEquals(1, result.getEvaluatedCount());
        assertFalse(result.isPartial());
    }

    @Test
    void shouldResumePartialDecayWithoutPenalizingTwice() {
        properties.getKnowledgeGraph().setDecayBatchSize(1);
        properties.getKnowledgeGraph().setDecayTimeSlice(Duration.ZERO);
        service = newService();
        add("p1", "One", "body", 1.0);
        add("p2", "Two", "body", 1.0);
        add("p3", "Three", "body", 1.0);
        clock.advance(Duration.ofDays(65));

        DecayResult first = service.applyConfidenceDecay();

        assertTrue(first.isPartial());
        assertEquals(1, first.getEvaluatedCount());
        assertEquals(1, first.getDecayedCount());
        assertEquals(0.9, service.peekPattern("p1").orElseThrow().getConfidence(), 1e-9);
        assertEquals(1.0, service.peekPattern("p2").orElseThrow().getConfidence(), 1e-9);

        DecayResult second = service.applyConfidenceDecay();
        DecayResult third = service.applyConfidenceDecay();

        assertEquals(1, second.getDecayedCount());
        assertEquals(1, third.getDecayedCount());
        assertEquals(0.9, service.peekPattern("p2").orElseThrow().getConfidence(), 1e-9);
        assertEquals(0.9, service.peekPattern("p3").orElseThrow().getConfidence(), 1e-9);

        DecayResult fourth = service.applyConfidenceDecay();

        assertEquals(1, fourth.getEvaluatedCount());
        assertEquals(0, fourth.getDecayedCount());
        assertEquals(0.9, service.peekPattern("p1").orElseThrow().getConfidence(), 1e-9);
        assertEquals(3, service.getDecayLog(null, 10).size());
    }
}
