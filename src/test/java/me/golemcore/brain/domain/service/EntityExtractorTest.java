package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.Entity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor();

    @Test
    void shouldExtractFilesSymbolsAndConcepts() {
        List<EntityExtractor.Mention> mentions = extractor.extract(
                "Moved `RetryPolicy` into src/net/Retry.java and called `backoff()` there #resilience");

        assertTrue(mentions.contains(new EntityExtractor.Mention(Entity.Kind.FILE, "src/net/Retry.java")));
        assertTrue(mentions.contains(new EntityExtractor.Mention(Entity.Kind.SYMBOL, "RetryPolicy")));
        assertTrue(mentions.contains(new EntityExtractor.Mention(Entity.Kind.SYMBOL, "backoff")));
        assertTrue(mentions.contains(new EntityExtractor.Mention(Entity.Kind.CONCEPT, "resilience")));
    }

    @Test
    void shouldDeduplicateRepeatedMentions() {
        List<EntityExtractor.Mention> mentions = extractor.extract("README.md and README.md again");

        assertEquals(List.of(new EntityExtractor.Mention(Entity.Kind.FILE, "README.md")), mentions);
    }

    @Test
    void shouldIgnoreUnknownExtensionsAndPlainWords() {
        assertTrue(extractor.extract("open archive.zip and think about Design").isEmpty());
    }

    @Test
    void shouldReturnEmptyForBlankText() {
        assertTrue(extractor.extract("  ").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }
}
