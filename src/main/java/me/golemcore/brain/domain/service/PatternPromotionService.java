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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.ContextMetadata;
import me.golemcore.brain.domain.model.Entity;
import me.golemcore.brain.domain.model.FileCoModification;
import me.golemcore.brain.domain.model.MemoryResult;
import me.golemcore.brain.domain.model.Pattern;
import me.golemcore.brain.domain.model.PromotionResult;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Promotion policy from working memory observations to knowledge graph
 * patterns.
 *
 * <p>
 * Two kinds of observation qualify: file pairs that keep being edited together
 * and concepts that come up across several conversations. Each becomes a
 * {@link Pattern.Kind#CONTEXT} pattern with a stable id derived from the
 * observation, so a later pass merges into the same pattern instead of adding
 * a duplicate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternPromotionService {

    static final String SOURCE = "working-memory";
    static final String NAMESPACE = "working-memory";
    private static final int CONCEPT_SCAN_LIMIT = 50;
    private static final int MAX_TITLE_LENGTH = 200;
    private static final int MAX_TAG_LENGTH = 64;

    private final WorkingMemoryService workingMemory;
    private final KnowledgeGraphService knowledgeGraph;
    private final BrainProperties properties;

    public boolean isPromotionEnabled() {
        return properties.getPromotion().isEnabled();
    }

    public boolean shouldPromote(FileCoModification pair) {
        if (pair == null) {
            return false;
        }
        BrainProperties.PromotionProperties settings = properties.getPromotion();
        return pair.getFrequency() >= settings.getMinFrequency()
                && pair.getConfidence() >= settings.getMinConfidence();
    }

    public boolean shouldPromote(Entity entity) {
        if (entity == null || entity.getKind() != Entity.Kind.CONCEPT) {
            return false;
        }
        return entity.getOccurrencesByConversation().size() >= properties.getPromotion().getConceptMinConversations();
    }

    /**
     * Promote every qualifying observation. Failures are counted and logged,
     * they do not stop the pass.
     */
    public PromotionResult promote() {
        PromotionResult result = new PromotionResult();
        if (!isPromotionEnabled()) {
            return result;
        }

        List<Pattern> candidates = new ArrayList<>();
        for (FileCoModification pair : workingMemory
                .getFileCoModifications(properties.getPromotion().getMinFrequency())) {
            if (shouldPromote(pair)) {
                candidates.add(coModificationPattern(pair));
            }
        }
        for (Entity entity : workingMemory.getEntityStatistics(CONCEPT_SCAN_LIMIT).getMostMentioned()) {
            if (shouldPromote(entity)) {
                candidates.add(conceptPattern(entity));
            }
        }
        result.setCandidateCount(candidates.size());

        for (Pattern candidate : candidates) {
            MemoryResult<Boolean> promoted = knowledgeGraph.promotePattern(candidate);
            if (!promoted.isSuccess()) {
                result.setFailedCount(result.getFailedCount() + 1);
                log.warn("[Promotion] Failed to promote {}: {}", candidate.getId(), promoted.getError());
            } else if (Boolean.TRUE.equals(promoted.getValue())) {
                result.setMergedCount(result.getMergedCount() + 1);
            } else {
                result.setPromotedCount(result.getPromotedCount() + 1);
            }
        }
        if (!candidates.isEmpty()) {
            log.info("[Promotion] {} candidates: {} new, {} merged, {} failed", result.getCandidateCount(),
                    result.getPromotedCount(), result.getMergedCount(), result.getFailedCount());
        }
        return result;
    }

    Pattern coModificationPattern(FileCoModification pair) {
        String key = FileCoModification.pairKey(pair.getFirstFile(), pair.getSecondFile());
        return Pattern.builder()
                .id("comod-" + stableId(key))
                .kind(Pattern.Kind.CONTEXT)
                .title(truncate("Edited together: " + pair.getFirstFile() + " and " + pair.getSecondFile()))
                .body(String.format(Locale.ROOT, "%s and %s were changed in the same turn %d times (confidence %.2f).",
                        pair.getFirstFile(), pair.getSecondFile(), pair.getFrequency(), pair.getConfidence()))
                .confidence(properties.getPromotion().getInitialConfidence())
                .source(SOURCE)
                .tags(new ArrayList<>(List.of("co-modification", "file")))
                .metadata(ContextMetadata.builder().namespace(NAMESPACE).scope(key).build())
                .build();
    }

    Pattern conceptPattern(Entity entity) {
        List<String> tags = new ArrayList<>(List.of("concept"));
        String name = entity.getName() != null ? entity.getName().strip() : "";
        if (!name.isEmpty() && name.length() <= MAX_TAG_LENGTH) {
            tags.add(name);
        }
        return Pattern.builder()
                .id("concept-" + stableId(entity.getKey()))
                .kind(Pattern.Kind.CONTEXT)
                .title(truncate("Recurring concept: " + name))
                .body(String.format(Locale.ROOT, "\"%s\" came up in %d conversations (%d mentions).", name,
                        entity.getOccurrencesByConversation().size(), entity.getOccurrenceCount()))
                .confidence(properties.getPromotion().getInitialConfidence())
                .source(SOURCE)
                .tags(tags)
                .metadata(ContextMetadata.builder().namespace(NAMESPACE).scope(entity.getKey()).build())
                .build();
    }

    private static String stableId(String key) {
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String truncate(String title) {
        return title.length() > MAX_TITLE_LENGTH ? title.substring(0, MAX_TITLE_LENGTH) : title;
    }
}
