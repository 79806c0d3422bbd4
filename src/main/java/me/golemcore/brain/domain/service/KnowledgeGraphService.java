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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.DecayLogEntry;
import me.golemcore.brain.domain.model.DecayResult;
import me.golemcore.brain.domain.model.MemoryFailureKind;
import me.golemcore.brain.domain.model.MemoryResult;
import me.golemcore.brain.domain.model.Pattern;
import me.golemcore.brain.domain.model.PatternUpdate;
import me.golemcore.brain.domain.model.RelatedPattern;
import me.golemcore.brain.domain.model.Relationship;
import me.golemcore.brain.domain.model.ScoredPattern;
import me.golemcore.brain.domain.model.TagCount;
import me.golemcore.brain.domain.store.IntegrityViolationException;
import me.golemcore.brain.domain.store.RecordStore;
import me.golemcore.brain.domain.store.RecordStoreException;
import me.golemcore.brain.domain.store.RecoveryEvent;
import me.golemcore.brain.domain.store.Transaction;
import me.golemcore.brain.infrastructure.config.BrainConfiguration;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Tier 2 knowledge graph: long-lived patterns, typed relationships between
 * them, a tag index, ranked search and confidence decay.
 *
 * <p>
 * Decay rules, evaluated for every pattern that is neither pinned nor
 * immutable:
 * <ul>
 * <li>unused for 60 days or more: confidence -0.10</li>
 * <li>unused for 90 days or more: confidence -0.25 instead</li>
 * <li>unused for 120 days or more, or confidence below 0.30 afterwards: the
 * pattern is deleted together with its relationships</li>
 * </ul>
 * A penalty is applied at most once per pattern per evaluation window, so
 * running decay twice on the same day changes nothing the second time.
 */
@Service
@Slf4j
public class KnowledgeGraphService {

    static final String PATTERNS = "patterns";
    static final String RELATIONSHIPS = "relationships";
    static final String DECAY_LOG = "decay_log";
    static final String DECAY_STATE = "decay_state";

    private static final String BY_TAG = "tag";
    private static final String BY_KIND = "kind";
    private static final String BY_FROM = "from";
    private static final String BY_TO = "to";
    private static final String BY_PATTERN = "pattern";
    private static final String SEQ_DECAY_LOG = "decay_log";
    private static final String DECAY_CURSOR = "cursor";
    private static final double DEFAULT_CONFIDENCE = 1.0;

    private static final Comparator<Pattern> BY_CONFIDENCE = Comparator
            .comparing(Pattern::getConfidence, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Pattern::getLastAccessed, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Pattern::getId);

    private static final Comparator<ScoredPattern> BY_RELEVANCE = Comparator
            .comparingDouble(ScoredPattern::getScore).reversed()
            .thenComparing(ScoredPattern::getPattern, BY_CONFIDENCE);

    private final RecordStore store;
    private final PatternMetadataValidator validator;
    private final BrainProperties.KnowledgeGraphProperties settings;
    private final Clock clock;

    private final AtomicLong contentVersion = new AtomicLong();
    private final AtomicReference<IndexHolder> searchIndex = new AtomicReference<>();

    public KnowledgeGraphService(@Qualifier(BrainConfiguration.KNOWLEDGE_GRAPH_STORE) RecordStore store,
            PatternMetadataValidator validator, BrainProperties properties, Clock clock) {
        this.store = store;
        this.validator = validator;
        this.settings = properties.getKnowledgeGraph();
        this.clock = clock;
        store.registerIndex(PATTERNS, BY_TAG, "tags");
        store.registerIndex(PATTERNS, BY_KIND, "kind");
        store.registerIndex(RELATIONSHIPS, BY_FROM, "from");
        store.registerIndex(RELATIONSHIPS, BY_TO, "to");
        store.registerIndex(DECAY_LOG, BY_PATTERN, "patternId");
    }

    // ==================== Pattern CRUD ====================

    /**
     * Insert a new pattern. An id is generated when the draft has none.
     * Principles are immutable unless the draft says otherwise.
     */
    public MemoryResult<String> addPattern(Pattern draft) {
        if (draft == null) {
            return MemoryResult.validation("pattern is required");
        }
        List<String> problems = validator.validate(draft);
        if (!problems.isEmpty()) {
            return MemoryResult.validation(String.join("; ", problems));
        }
        Instant now = clock.instant();
        return write(tx -> {
            String id = draft.getId();
            if (id == null) {
                do {
                    id = "pat-" + UUID.randomUUID().toString().substring(0, 8);
                } while (tx.contains(PATTERNS, id));
            }
            Pattern pattern = draft.toBuilder()
                    .id(id)
                    .title(draft.getTitle().strip())
                    .confidence(draft.getConfidence() != null ? draft.getConfidence() : DEFAULT_CONFIDENCE)
                    .tags(PatternMetadataValidator.normalizeTags(draft.getTags()))
                    .immutable(draft.getImmutable() != null ? draft.getImmutable()
                            : draft.getKind() == Pattern.Kind.PRINCIPLE)
                    .createdAt(now)
                    .lastAccessed(now)
                    .accessCount(0)
                    .decayEvaluatedOn(null)
                    .build();
            try {
                tx.insert(PATTERNS, id, pattern);
            } catch (IntegrityViolationException e) {
                return MemoryResult.integrity("Pattern already exists: " + id);
            }
            log.debug("[KnowledgeGraph] Added pattern {} ({})", id, pattern.getKind());
            return MemoryResult.success(id);
        });
    }

    /**
     * Store a pattern learned from observations. When a pattern with the same id
     * exists the two are merged: confidence becomes the mean of both, tags are
     * united, the body is refreshed and the usage is counted as an access.
     * Immutable patterns are left as they are.
     *
     * @return {@code true} when merged into an existing pattern, {@code false}
     *         when inserted
     */
    public MemoryResult<Boolean> promotePattern(Pattern draft) {
        if (draft == null || draft.getId() == null) {
            return MemoryResult.validation("promoted pattern needs an id");
        }
        List<String> problems = validator.validate(draft);
        if (!problems.isEmpty()) {
            return MemoryResult.validation(String.join("; ", problems));
        }
        Instant now = clock.instant();
        return write(tx -> {
            Optional<Pattern> found = tx.get(PATTERNS, draft.getId(), Pattern.class);
            if (found.isEmpty()) {
                tx.insert(PATTERNS, draft.getId(), draft.toBuilder()
                        .title(draft.getTitle().strip())
                        .confidence(draft.getConfidence() != null ? draft.getConfidence() : DEFAULT_CONFIDENCE)
                        .tags(PatternMetadataValidator.normalizeTags(draft.getTags()))
                        .immutable(Boolean.FALSE)
                        .createdAt(now)
                        .lastAccessed(now)
                        .accessCount(0)
                        .decayEvaluatedOn(null)
                        .build());
                log.debug("[KnowledgeGraph] Promoted new pattern {}", draft.getId());
                return MemoryResult.success(false);
            }
            Pattern existing = found.get();
            if (Boolean.TRUE.equals(existing.getImmutable())) {
                return MemoryResult.success(true);
            }
            double merged = round((confidenceOf(existing) + confidenceOf(draft)) / 2.0);
            List<String> tags = new ArrayList<>(existing.getTags());
            tags.addAll(draft.getTags());
            existing.setConfidence(clamp(merged));
            List<String> normalized = PatternMetadataValidator.normalizeTags(tags);
            existing.setTags(normalized.size() > PatternMetadataValidator.MAX_TAGS
                    ? new ArrayList<>(normalized.subList(0, PatternMetadataValidator.MAX_TAGS))
                    : normalized);
            existing.setBody(draft.getBody());
            existing.setAccessCount(existing.getAccessCount() + 1);
            existing.setLastAccessed(now);
            tx.put(PATTERNS, existing.getId(), existing);
            log.debug("[KnowledgeGraph] Merged observation into {} (confidence {})", existing.getId(), merged);
            return MemoryResult.success(true);
        });
    }

    /**
     * Read a pattern and record the access.
     */
    public Optional<Pattern> getPattern(String id) {
        if (id == null || store.get(PATTERNS, id, Pattern.class).isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        MemoryResult<Pattern> result = write(tx -> {
            Optional<Pattern> found = tx.get(PATTERNS, id, Pattern.class);
            if (found.isEmpty()) {
                return MemoryResult.integrity("Unknown pattern: " + id);
            }
            Pattern pattern = found.get();
            pattern.setAccessCount(pattern.getAccessCount() + 1);
            pattern.setLastAccessed(now);
            tx.put(PATTERNS, id, pattern);
            return MemoryResult.success(pattern);
        }, false);
        return result.isSuccess() ? Optional.of(result.getValue()) : Optional.empty();
    }

    /**
     * Read a pattern without counting it as an access.
     */
    public Optional<Pattern> peekPattern(String id) {
        return store.get(PATTERNS, id, Pattern.class);
    }

    public MemoryResult<Pattern> updatePattern(String id, PatternUpdate update) {
        if (update == null) {
            return MemoryResult.validation("update is required");
        }
        return modify(id, true, pattern -> {
            boolean contentChange = update.getTitle() != null || update.getBody() != null || update.getKind() != null;
            boolean staysImmutable = update.getImmutable() == null ? Boolean.TRUE.equals(pattern.getImmutable())
                    : update.getImmutable();
            if (contentChange && staysImmutable) {
                return "Pattern is immutable: " + id;
            }
            if (update.getTitle() != null) {
                pattern.setTitle(update.getTitle().strip());
            }
            if (update.getBody() != null) {
                pattern.setBody(update.getBody());
            }
            if (update.getKind() != null) {
                pattern.setKind(update.getKind());
            }
            if (update.getTags() != null) {
                pattern.setTags(update.getTags());
            }
            if (update.getSource() != null) {
                pattern.setSource(update.getSource());
            }
            if (update.getMetadata() != null) {
                pattern.setMetadata(update.getMetadata());
            }
            if (update.getPinned() != null) {
                pattern.setPinned(update.getPinned());
            }
            if (update.getImmutable() != null) {
                pattern.setImmutable(update.getImmutable());
            }
            List<String> problems = validator.validate(pattern);
            if (!problems.isEmpty()) {
                return String.join("; ", problems);
            }
            pattern.setTags(PatternMetadataValidator.normalizeTags(pattern.getTags()));
            return null;
        });
    }

    /**
     * Explicit reinforcement: add {@code delta} to confidence, clamped to [0, 1].
     * Counts as a use of the pattern.
     */
    public MemoryResult<Pattern> reinforcePattern(String id, double delta) {
        if (Double.isNaN(delta) || delta < -1.0 || delta > 1.0) {
            return MemoryResult.validation("delta must be within [-1, 1]");
        }
        Instant now = clock.instant();
        return write(tx -> {
            Optional<Pattern> found = tx.get(PATTERNS, id, Pattern.class);
            if (found.isEmpty()) {
                return MemoryResult.integrity("Unknown pattern: " + id);
            }
            Pattern pattern = found.get();
            double old = confidenceOf(pattern);
            double updated = clamp(old + delta);
            pattern.setConfidence(updated);
            pattern.setLastAccessed(now);
            tx.put(PATTERNS, id, pattern);
            appendDecayLog(tx, id, old, updated, "reinforced by " + delta, now);
            return MemoryResult.success(pattern);
        }, false);
    }

    public MemoryResult<Pattern> pinPattern(String id, boolean pinned) {
        return modify(id, false, pattern -> {
            pattern.setPinned(pinned);
            return null;
        });
    }

    /**
     * Delete a pattern and every relationship touching it. Immutable patterns
     * must be made mutable first.
     */
    public MemoryResult<Boolean> deletePattern(String id) {
        return write(tx -> {
            Optional<Pattern> found = tx.get(PATTERNS, id, Pattern.class);
            if (found.isEmpty()) {
                return MemoryResult.success(false);
            }
            if (Boolean.TRUE.equals(found.get().getImmutable())) {
                return MemoryResult.validation("Pattern is immutable: " + id);
            }
            int edges = deleteWithRelationships(tx, id);
            log.debug("[KnowledgeGraph] Deleted pattern {} and {} relationship(s)", id, edges);
            return MemoryResult.success(true);
        });
    }

    // ==================== Search ====================

    /**
     * Ranked search; malformed queries yield an empty list.
     */
    public List<ScoredPattern> searchPatterns(String query, double minConfidence, int limit) {
        MemoryResult<List<ScoredPattern>> result = searchPatternsChecked(query, minConfidence, limit);
        return result.isSuccess() ? result.getValue() : List.of();
    }

    /**
     * Ranked search reporting malformed queries as VALIDATION failures. Ties on
     * score are broken by confidence, then last access, then id.
     */
    public MemoryResult<List<ScoredPattern>> searchPatternsChecked(String query, double minConfidence, int limit) {
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            return MemoryResult.validation("minConfidence must be within [0, 1]");
        }
        if (limit <= 0) {
            return MemoryResult.validation("limit must be positive");
        }
        PatternQueryParser.Node parsed;
        try {
            parsed = PatternQueryParser.parse(query);
        } catch (PatternQueryParser.QueryParseException e) {
            return MemoryResult.validation("Malformed query: " + e.getMessage());
        }

        Map<String, Double> scores = index().search(parsed);
        List<ScoredPattern> ranked = new ArrayList<>();
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            Optional<Pattern> pattern = store.get(PATTERNS, entry.getKey(), Pattern.class);
            if (pattern.isPresent() && confidenceOf(pattern.get()) >= minConfidence) {
                ranked.add(ScoredPattern.builder().pattern(pattern.get()).score(entry.getValue()).build());
            }
        }
        ranked.sort(BY_RELEVANCE);
        return MemoryResult.success(ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked);
    }

    public List<Pattern> findPatternsByTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return List.of();
        }
        List<Pattern> patterns = store.lookup(PATTERNS, BY_TAG, tag.strip().toLowerCase(Locale.ROOT), Pattern.class);
        patterns.sort(BY_CONFIDENCE);
        return patterns;
    }

    public List<Pattern> getPatternsByKind(Pattern.Kind kind) {
        List<Pattern> patterns = store.lookup(PATTERNS, BY_KIND, kind.name(), Pattern.class);
        patterns.sort(BY_CONFIDENCE);
        return patterns;
    }

    /**
     * Most used tags first, ties alphabetical.
     */
    public List<TagCount> getTagCloud(int limit) {
        Map<String, Integer> counts = new HashMap<>();
        for (Pattern pattern : store.scan(PATTERNS, Pattern.class)) {
            for (String tag : pattern.getTags()) {
                counts.merge(tag, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .map(entry -> TagCount.builder().tag(entry.getKey()).count(entry.getValue()).build())
                .sorted(Comparator.comparingInt(TagCount::getCount).reversed().thenComparing(TagCount::getTag))
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Corruption recoveries performed when the store was opened.
     */
    public List<RecoveryEvent> getRecoveryEvents() {
        return store.getRecoveryEvents();
    }

    public int countPatterns() {
        return store.count(PATTERNS);
    }

    // ==================== Relationships ====================

    /**
     * Link two patterns. Missing endpoints are INTEGRITY failures; self-loops,
     * duplicates and out-of-range strengths are VALIDATION failures. Nothing is
     * stored on failure.
     */
    public MemoryResult<Relationship> linkPatterns(String from, String to, Relationship.Kind kind, double strength) {
        if (from == null || to == null || kind == null) {
            return MemoryResult.validation("from, to and kind are required");
        }
        if (from.equals(to)) {
            return MemoryResult.validation("A pattern cannot be linked to itself: " + from);
        }
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            return MemoryResult.validation("strength must be within [0, 1]");
        }
        Instant now = clock.instant();
        return write(tx -> {
            if (!tx.contains(PATTERNS, from)) {
                return MemoryResult.integrity("Unknown pattern: " + from);
            }
            if (!tx.contains(PATTERNS, to)) {
                return MemoryResult.integrity("Unknown pattern: " + to);
            }
            Relationship relationship = Relationship.builder()
                    .from(from)
                    .to(to)
                    .kind(kind)
                    .strength(strength)
                    .createdAt(now)
                    .build();
            try {
                tx.insert(RELATIONSHIPS, Relationship.keyOf(from, kind, to), relationship);
            } catch (IntegrityViolationException e) {
                return MemoryResult.validation("Relationship already exists: " + from + " " + kind + " " + to);
            }
            return MemoryResult.success(relationship);
        });
    }

    public MemoryResult<Boolean> unlinkPatterns(String from, String to, Relationship.Kind kind) {
        return write(tx -> MemoryResult.success(tx.delete(RELATIONSHIPS, Relationship.keyOf(from, kind, to))));
    }

    /**
     * Outgoing and incoming relationships of a pattern.
     */
    public List<Relationship> getRelationships(String id) {
        List<Relationship> relationships = new ArrayList<>(store.lookup(RELATIONSHIPS, BY_FROM, id,
                Relationship.class));
        for (Relationship incoming : store.lookup(RELATIONSHIPS, BY_TO, id, Relationship.class)) {
            if (!incoming.getFrom().equals(id)) {
                relationships.add(incoming);
            }
        }
        relationships.sort(Comparator.comparing(Relationship::getFrom)
                .thenComparing(Relationship::getKind)
                .thenComparing(Relationship::getTo));
        return relationships;
    }

    public List<RelatedPattern> getRelatedPatterns(String id, Relationship.Kind kind, int maxDepth) {
        return getRelatedPatterns(id, kind, maxDepth, 0.0);
    }

    /**
     * Breadth-first traversal over outgoing edges, optionally restricted to one
     * relationship kind and a minimum strength. Each pattern is reported once,
     * at its shortest distance, with the strongest edge that reached it there.
     * Ordered by distance, then strength descending, then id.
     */
    public List<RelatedPattern> getRelatedPatterns(String id, Relationship.Kind kind, int maxDepth,
            double minStrength) {
        if (id == null || maxDepth < 1 || store.get(PATTERNS, id, Pattern.class).isEmpty()) {
            return List.of();
        }
        Set<String> visited = new HashSet<>();
        visited.add(id);
        List<String> frontier = List.of(id);
        List<RelatedPattern> related = new ArrayList<>();

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            Map<String, Relationship> reached = new LinkedHashMap<>();
            for (String node : frontier) {
                for (Relationship edge : store.lookup(RELATIONSHIPS, BY_FROM, node, Relationship.class)) {
                    if ((kind != null && edge.getKind() != kind) || edge.getStrength() < minStrength
                            || visited.contains(edge.getTo())) {
                        continue;
                    }
                    Relationship best = reached.get(edge.getTo());
                    if (best == null || edge.getStrength() > best.getStrength()) {
                        reached.put(edge.getTo(), edge);
                    }
                }
            }
            List<String> next = new ArrayList<>();
            for (Map.Entry<String, Relationship> entry : reached.entrySet()) {
                visited.add(entry.getKey());
                Optional<Pattern> pattern = store.get(PATTERNS, entry.getKey(), Pattern.class);
                if (pattern.isEmpty()) {
                    continue;
                }
                next.add(entry.getKey());
                related.add(RelatedPattern.builder()
                        .pattern(pattern.get())
                        .distance(depth)
                        .strength(entry.getValue().getStrength())
                        .viaKind(entry.getValue().getKind())
                        .build());
            }
            next.sort(Comparator.naturalOrder());
            frontier = next;
        }

        related.sort(Comparator.comparingInt(RelatedPattern::getDistance)
                .thenComparing(Comparator.comparingDouble(RelatedPattern::getStrength).reversed())
                .thenComparing(r -> r.getPattern().getId()));
        return related;
    }

    // ==================== Decay ====================

    /**
     * Apply the decay rules in batches, one transaction per batch, until every
     * due pattern is handled or the time slice runs out. Patterns left over are
     * picked up by the next call.
     */
    public DecayResult applyConfidenceDecay() {
        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);
        long deadline = System.nanoTime() + settings.getDecayTimeSlice().toNanos();

        List<Pattern> candidates = resumeOrder(
                store.scan(PATTERNS, Pattern.class, pattern -> !pattern.isProtected()));

        int decayed = 0;
        int deleted = 0;
        int evaluated = 0;
        boolean partial = false;
        int batchSize = Math.max(1, settings.getDecayBatchSize());

        for (int start = 0; start < candidates.size(); start += batchSize) {
            if (start > 0 && System.nanoTime() > deadline) {
                partial = true;
                break;
            }
            List<Pattern> batch = candidates.subList(start, Math.min(candidates.size(), start + batchSize));
            int[] counts;
            try {
                String last = batch.get(batch.size() - 1).getId();
                counts = store.transaction(tx -> {
                    int[] batchCounts = decayBatch(tx, batch, now, today);
                    tx.put(DECAY_STATE, DECAY_CURSOR, new DecayCursor(last));
                    return batchCounts;
                });
            } catch (RecordStoreException e) {
                log.warn("[KnowledgeGraph] Decay batch failed, will retry on next run: {}", e.getMessage());
                partial = true;
                break;
            }
            decayed += counts[0];
            deleted += counts[1];
            evaluated += batch.size();
        }

        if (!partial && !candidates.isEmpty()) {
            store.update(tx -> tx.delete(DECAY_STATE, DECAY_CURSOR));
        }
        if (decayed > 0 || deleted > 0) {
            invalidateIndex();
            log.info("[KnowledgeGraph] Decay pass: {} decayed, {} deleted, {} evaluated{}", decayed, deleted,
                    evaluated, partial ? " (partial)" : "");
        }
        return DecayResult.builder()
                .decayedCount(decayed)
                .deletedCount(deleted)
                .evaluatedCount(evaluated)
                .partial(partial)
                .build();
    }

    /**
     * Candidates in id order, starting after the last pattern a partial run
     * evaluated.
     */
    private List<Pattern> resumeOrder(List<Pattern> candidates) {
        candidates.sort(Comparator.comparing(Pattern::getId));
        Optional<DecayCursor> cursor = store.get(DECAY_STATE, DECAY_CURSOR, DecayCursor.class);
        if (cursor.isEmpty() || cursor.get().getLastPatternId() == null) {
            return candidates;
        }
        String last = cursor.get().getLastPatternId();
        int split = 0;
        while (split < candidates.size() && candidates.get(split).getId().compareTo(last) <= 0) {
            split++;
        }
        List<Pattern> ordered = new ArrayList<>(candidates.subList(split, candidates.size()));
        ordered.addAll(candidates.subList(0, split));
        log.debug("[KnowledgeGraph] Resuming decay after {}", last);
        return ordered;
    }

    private int[] decayBatch(Transaction tx, List<Pattern> batch, Instant now, LocalDate today) {
        int decayed = 0;
        int deleted = 0;
        for (Pattern candidate : batch) {
            // re-read inside the transaction, the snapshot may be stale
            Optional<Pattern> current = tx.get(PATTERNS, candidate.getId(), Pattern.class);
            if (current.isEmpty() || current.get().isProtected()) {
                continue;
            }
            Pattern pattern = current.get();
            Instant lastUsed = pattern.getLastAccessed() != null ? pattern.getLastAccessed() : pattern.getCreatedAt();
            long unusedDays = lastUsed == null ? 0 : ChronoUnit.DAYS.between(lastUsed, now);
            double old = confidenceOf(pattern);

            if (unusedDays >= settings.getDeletionThresholdDays()) {
                deleteWithRelationships(tx, pattern.getId());
                appendDecayLog(tx, pattern.getId(), old, 0.0, "deleted: unused " + unusedDays + " days", now);
                deleted++;
                continue;
            }

            double penalty = 0.0;
            if (unusedDays >= settings.getDecaySecondThresholdDays()) {
                penalty = settings.getDecaySecondPenalty();
            } else if (unusedDays >= settings.getDecayFirstThresholdDays()) {
                penalty = settings.getDecayFirstPenalty();
            }
            boolean penalizedThisWindow = pattern.getDecayEvaluatedOn() != null
                    && today.isBefore(pattern.getDecayEvaluatedOn().plusDays(settings.getDecayWindowDays()));

            double updated = old;
            if (penalty > 0.0 && !penalizedThisWindow) {
                updated = clamp(round(old - penalty));
            }

            if (updated < settings.getDeletionConfidenceFloor()) {
                deleteWithRelationships(tx, pattern.getId());
                appendDecayLog(tx, pattern.getId(), old, updated,
                        "deleted: confidence below " + settings.getDeletionConfidenceFloor(), now);
                deleted++;
            } else if (updated != old) {
                pattern.setConfidence(updated);
                pattern.setDecayEvaluatedOn(today);
                tx.put(PATTERNS, pattern.getId(), pattern);
                appendDecayLog(tx, pattern.getId(), old, updated, "unused " + unusedDays + " days", now);
                decayed++;
            }
        }
        return new int[] { decayed, deleted };
    }

    /**
     * Newest entries first, optionally for one pattern.
     */
    public List<DecayLogEntry> getDecayLog(String patternId, int limit) {
        List<DecayLogEntry> entries = patternId == null
                ? store.scan(DECAY_LOG, DecayLogEntry.class)
                : store.lookup(DECAY_LOG, BY_PATTERN, patternId, DecayLogEntry.class);
        entries.sort(Comparator.comparingLong(DecayLogEntry::getSequence).reversed());
        return entries.size() > limit ? new ArrayList<>(entries.subList(0, Math.max(0, limit))) : entries;
    }

    // ==================== Internals ====================

    private <T> MemoryResult<T> write(Function<Transaction, MemoryResult<T>> work) {
        return write(work, true);
    }

    private <T> MemoryResult<T> write(Function<Transaction, MemoryResult<T>> work, boolean changesContent) {
        try {
            MemoryResult<T> result = store.transaction(tx -> {
                MemoryResult<T> outcome = work.apply(tx);
                if (!outcome.isSuccess()) {
                    tx.setRollbackOnly();
                }
                return outcome;
            });
            if (result.isSuccess() && changesContent) {
                invalidateIndex();
            }
            return result;
        } catch (RecordStoreException e) {
            log.warn("[KnowledgeGraph] Write failed: {}", e.getMessage());
            return MemoryResult.failure(MemoryFailureKind.STORAGE, e.getMessage());
        }
    }

    private MemoryResult<Pattern> modify(String id, boolean changesContent, Function<Pattern, String> change) {
        return write(tx -> {
            Optional<Pattern> found = tx.get(PATTERNS, id, Pattern.class);
            if (found.isEmpty()) {
                return MemoryResult.integrity("Unknown pattern: " + id);
            }
            Pattern pattern = found.get();
            String problem = change.apply(pattern);
            if (problem != null) {
                return MemoryResult.validation(problem);
            }
            tx.put(PATTERNS, id, pattern);
            return MemoryResult.success(pattern);
        }, changesContent);
    }

    private int deleteWithRelationships(Transaction tx, String id) {
        int removed = 0;
        for (Relationship edge : tx.lookup(RELATIONSHIPS, BY_FROM, id, Relationship.class)) {
            removed += tx.delete(RELATIONSHIPS, Relationship.keyOf(edge.getFrom(), edge.getKind(), edge.getTo())) ? 1
                    : 0;
        }
        for (Relationship edge : tx.lookup(RELATIONSHIPS, BY_TO, id, Relationship.class)) {
            removed += tx.delete(RELATIONSHIPS, Relationship.keyOf(edge.getFrom(), edge.getKind(), edge.getTo())) ? 1
                    : 0;
        }
        tx.delete(PATTERNS, id);
        return removed;
    }

    private void appendDecayLog(Transaction tx, String patternId, double oldConfidence, double newConfidence,
            String reason, Instant now) {
        long sequence = tx.nextSequence(SEQ_DECAY_LOG);
        tx.put(DECAY_LOG, "dl-" + sequence, DecayLogEntry.builder()
                .sequence(sequence)
                .patternId(patternId)
                .oldConfidence(oldConfidence)
                .newConfidence(newConfidence)
                .reason(reason)
                .timestamp(now)
                .build());
        tx.delete(DECAY_LOG, "dl-" + (sequence - settings.getDecayLogLimit()));
    }

    private PatternSearchIndex index() {
        long version = contentVersion.get();
        IndexHolder current = searchIndex.get();
        if (current != null && current.version() == version) {
            return current.index();
        }
        PatternSearchIndex rebuilt = PatternSearchIndex.build(store.scan(PATTERNS, Pattern.class),
                settings.getTitleWeight(), settings.getTagBoost());
        // a write during the rebuild bumps the version, so a stale index is never kept
        searchIndex.compareAndSet(current, new IndexHolder(version, rebuilt));
        return rebuilt;
    }

    private void invalidateIndex() {
        contentVersion.incrementAndGet();
    }

    private record IndexHolder(long version, PatternSearchIndex index) {
    }

    private static double confidenceOf(Pattern pattern) {
        return pattern.getConfidence() != null ? pattern.getConfidence() : DEFAULT_CONFIDENCE;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    // 1.0 - 0.10 must compare as 0.90, not 0.8999999999999999
    private static double round(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }

    /**
     * Last pattern evaluated by an unfinished decay pass.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static final class DecayCursor {

        private String lastPatternId;
    }
}
