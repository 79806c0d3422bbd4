package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.ContextMetadata;
import me.golemcore.brain.domain.model.Entity;
import me.golemcore.brain.domain.model.EntityStatistics;
import me.golemcore.brain.domain.model.FileCoModification;
import me.golemcore.brain.domain.model.MemoryFailureKind;
import me.golemcore.brain.domain.model.MemoryResult;
import me.golemcore.brain.domain.model.Pattern;
import me.golemcore.brain.domain.model.PromotionResult;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PatternPromotionServiceTest {

    private WorkingMemoryService workingMemory;
    private KnowledgeGraphService knowledgeGraph;
    private BrainProperties properties;
    private PatternPromotionService service;

    @BeforeEach
    void setUp() {
        workingMemory = mock(WorkingMemoryService.class);
        knowledgeGraph = mock(KnowledgeGraphService.class);
        properties = new BrainProperties();
        service = new PatternPromotionService(workingMemory, knowledgeGraph, properties);
        when(workingMemory.getFileCoModifications(anyInt())).thenReturn(List.of());
        when(workingMemory.getEntityStatistics(anyInt())).thenReturn(EntityStatistics.builder().build());
    }

    @Test
    void shouldDelegatePromotionEnabledFlag() {
        assertTrue(service.isPromotionEnabled());
        properties.getPromotion().setEnabled(false);
        assertFalse(service.isPromotionEnabled());
    }

    @Test
    void shouldPromoteCoModificationOnlyAboveBothThresholds() {
        assertTrue(service.shouldPromote(pair("A.java", "B.java", 3, 0.5)));
        assertFalse(service.shouldPromote(pair("A.java", "B.java", 2, 0.9)));
        assertFalse(service.shouldPromote(pair("A.java", "B.java", 5, 0.49)));
        assertFalse(service.shouldPromote((FileCoModification) null));
    }

    @Test
    void shouldPromoteOnlyConceptsSeenAcrossConversations() {
        assertTrue(service.shouldPromote(entity(Entity.Kind.CONCEPT, "caching", 3)));
        assertFalse(service.shouldPromote(entity(Entity.Kind.CONCEPT, "caching", 2)));
        assertFalse(service.shouldPromote(entity(Entity.Kind.FILE, "Cache.java", 5)));
        assertFalse(service.shouldPromote((Entity) null));
    }

    @Test
    void shouldBuildContextPatternsFromObservations() {
        when(workingMemory.getFileCoModifications(3)).thenReturn(List.of(
                pair("A.java", "B.java", 4, 0.8),
                pair("C.java", "D.java", 3, 0.2)));
        when(workingMemory.getEntityStatistics(anyInt())).thenReturn(EntityStatistics.builder()
                .mostMentioned(List.of(entity(Entity.Kind.CONCEPT, "caching", 4),
                        entity(Entity.Kind.CONCEPT, "retry", 1)))
                .build());
        when(knowledgeGraph.promotePattern(any())).thenReturn(MemoryResult.success(false));

        PromotionResult result = service.promote();

        ArgumentCaptor<Pattern> captor = ArgumentCaptor.forClass(Pattern.class);
        verify(knowledgeGraph, times(2)).promotePattern(captor.capture());
        Pattern files = captor.getAllValues().get(0);
        Pattern concept = captor.getAllValues().get(1);

        assertEquals(Pattern.Kind.CONTEXT, files.getKind());
        assertTrue(files.getId().startsWith("comod-"));
        assertEquals("Edited together: A.java and B.java", files.getTitle());
        assertEquals(0.7, files.getConfidence());
        assertEquals("working-memory", files.getSource());
        assertEquals("A.java|B.java", ((ContextMetadata) files.getMetadata()).getScope());
        assertTrue(concept.getId().startsWith("concept-"));
        assertEquals(List.of("concept", "caching"), concept.getTags());

        assertEquals(2, result.getCandidateCount());
        assertEquals(2, result.getPromotedCount());
    }

    @Test
    void shouldDeriveSameIdForSameObservation() {
        Pattern first = service.coModificationPattern(pair("A.java", "B.java", 3, 0.6));
        Pattern swapped = service.coModificationPattern(pair("B.java", "A.java", 5, 0.9));

        assertEquals(first.getId(), swapped.getId());
    }

    @Test
    void shouldCountMergesAndFailures() {
        when(workingMemory.getFileCoModifications(3)).thenReturn(List.of(
                pair("A.java", "B.java", 4, 0.8),
                pair("C.java", "D.java", 5, 0.9),
                pair("E.java", "F.java", 6, 1.0)));
        when(knowledgeGraph.promotePattern(any())).thenReturn(
                MemoryResult.success(true),
                MemoryResult.success(false),
                MemoryResult.failure(MemoryFailureKind.STORAGE, "disk full"));

        PromotionResult result = service.promote();

        assertEquals(3, result.getCandidateCount());
        assertEquals(1, result.getMergedCount());
        assertEquals(1, result.getPromotedCount());
        assertEquals(1, result.getFailedCount());
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        properties.getPromotion().setEnabled(false);

        PromotionResult result = service.promote();

        assertEquals(0, result.getCandidateCount());
        verify(workingMemory, never()).getFileCoModifications(anyInt());
        verify(knowledgeGraph, never()).promotePattern(any());
    }

    private static FileCoModification pair(String first, String second, int frequency, double confidence) {
        return FileCoModification.builder()
                .firstFile(first)
                .secondFile(second)
                .frequency(frequency)
                .confidence(confidence)
                .build();
    }

    private static Entity entity(Entity.Kind kind, String name, int conversations) {
        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (int i = 1; i <= conversations; i++) {
            occurrences.put("conv-" + i, 1);
        }
        return Entity.builder()
                .key(Entity.keyOf(kind, name))
                .kind(kind)
                .name(name)
                .occurrenceCount(conversations)
                .occurrencesByConversation(occurrences)
                .build();
    }
}
