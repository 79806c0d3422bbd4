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
import me.golemcore.brain.domain.model.Conversation;
import me.golemcore.brain.domain.model.ConversationMatch;
import me.golemcore.brain.domain.model.ConversationTurn;
import me.golemcore.brain.domain.model.Entity;
import me.golemcore.brain.domain.model.EntityStatistics;
import me.golemcore.brain.domain.model.EvictionEvent;
import me.golemcore.brain.domain.model.FileCoModification;
import me.golemcore.brain.domain.model.InteractionRecord;
import me.golemcore.brain.domain.model.MemoryFailureKind;
import me.golemcore.brain.domain.model.MemoryResult;
import me.golemcore.brain.domain.store.RecordStore;
import me.golemcore.brain.domain.store.RecordStoreException;
import me.golemcore.brain.domain.store.RecoveryEvent;
import me.golemcore.brain.domain.store.Transaction;
import me.golemcore.brain.infrastructure.config.BrainConfiguration;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Tier 1 working memory: a bounded FIFO log of recent conversations with an
 * entity index and file co-modification frequencies.
 *
 * <p>
 * Retention is capped (default 20). Inserting past the cap evicts at most one
 * conversation, the oldest one that is not active. Active conversations (open
 * and not timed out, or pinned) are never evicted, so the log may temporarily
 * exceed the cap. Evicting a conversation also removes its entity occurrences
 * and co-modification contributions.
 */
@Service
@Slf4j
public class WorkingMemoryService {

    static final String CONVERSATIONS = "conversations";
    static final String ENTITIES = "entities";
    static final String CO_MODIFICATIONS = "co_modifications";
    static final String EVICTIONS = "evictions";

    private static final String SEQ_CONVERSATION = "conversation";
    private static final String SEQ_EVICTION = "eviction";
    private static final String BY_SESSION = "session";
    private static final String BY_ENTITY = "entity";
    private static final String BY_CONVERSATION = "conversation";
    private static final int EVICTION_LOG_LIMIT = 200;
    private static final double RECENCY_WEIGHT = 0.10;

    private static final Comparator<Conversation> OLDEST_FIRST = Comparator
            .comparing(Conversation::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(Conversation::getSequence);

    private static final Comparator<Conversation> NEWEST_FIRST = OLDEST_FIRST.reversed();

    private final RecordStore store;
    private final EntityExtractor entityExtractor;
    private final BrainProperties.WorkingMemoryProperties settings;
    private final Clock clock;

    public WorkingMemoryService(@Qualifier(BrainConfiguration.WORKING_MEMORY_STORE) RecordStore store,
            EntityExtractor entityExtractor, BrainProperties properties, Clock clock) {
        this.store = store;
        this.entityExtractor = entityExtractor;
        this.settings = properties.getWorkingMemory();
        this.clock = clock;
        store.registerIndex(CONVERSATIONS, BY_SESSION, "sessionId");
        store.registerIndex(CONVERSATIONS, BY_ENTITY, "entityKeys");
        store.registerIndex(ENTITIES, BY_CONVERSATION, "occurrencesByConversation");
        store.registerIndex(CO_MODIFICATIONS, BY_CONVERSATION, "contributions");
    }

    // ==================== Writes ====================

    /**
     * Open a new conversation for a session. Any other open conversation of the
     * same session is closed first.
     */
    public MemoryResult<String> startConversation(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return MemoryResult.validation("sessionId must not be blank");
        }
        Instant now = clock.instant();
        return write(tx -> MemoryResult.success(openConversation(tx, sessionId, now).getId()));
    }

    /**
     * Append a turn. The entity index and co-modification frequencies are
     * updated in the same transaction. If entity extraction fails the turn is
     * still stored, without entities.
     */
    public MemoryResult<Conversation> appendTurn(String conversationId, ConversationTurn turn) {
        String problem = validateTurn(turn);
        if (problem != null) {
            return MemoryResult.validation(problem);
        }
        List<EntityExtractor.Mention> mentions = extractMentions(conversationId, turn.getText());
        Instant now = clock.instant();

        return write(tx -> {
            Optional<Conversation> found = tx.get(CONVERSATIONS, conversationId, Conversation.class);
            if (found.isEmpty()) {
                return MemoryResult.integrity("Unknown conversation: " + conversationId);
            }
            Conversation conversation = found.get();
            if (conversation.isClosed()) {
                return MemoryResult.validation("Conversation is closed: " + conversationId);
            }
            if (!conversation.isPinned() && conversation.isTimedOut(now, settings.getSessionTimeout())) {
                return MemoryResult.validation("Conversation timed out: " + conversationId);
            }
            storeTurn(tx, conversation, turn, mentions, now);
            return MemoryResult.success(conversation);
        });
    }

    /**
     * Store a complete interaction as one conversation in a single transaction:
     * start, every turn, caller entities, intent and close. Every turn is
     * validated before anything is written, and any failure leaves working
     * memory unchanged. Interaction-level files are attached to the first turn.
     */
    public MemoryResult<String> recordInteraction(InteractionRecord interaction) {
        String problem = validateInteraction(interaction);
        if (problem != null) {
            return MemoryResult.validation(problem);
        }
        List<ConversationTurn> turns = withInteractionFiles(interaction);
        List<List<EntityExtractor.Mention>> mentions = new ArrayList<>(turns.size());
        for (ConversationTurn turn : turns) {
            mentions.add(extractMentions(interaction.getSessionId(), turn.getText()));
        }
        Instant now = clock.instant();

        return write(tx -> {
            Conversation conversation = openConversation(tx, interaction.getSessionId(), now);
            for (int i = 0; i < turns.size(); i++) {
                storeTurn(tx, conversation, turns.get(i), mentions.get(i), now);
            }
            for (String entity : distinct(interaction.getEntities())) {
                recordMention(tx, conversation, Entity.Kind.CONCEPT, entity, now);
            }
            if (interaction.getIntent() != null && !interaction.getIntent().isBlank()) {
                conversation.setIntent(interaction.getIntent().strip());
            }
            if (!interaction.isKeepOpen()) {
                conversation.setClosed(true);
                conversation.setClosedAt(now);
            }
            tx.put(CONVERSATIONS, conversation.getId(), conversation);
            log.debug("[WorkingMemory] Recorded interaction {} with {} turn(s)", conversation.getId(),
                    turns.size());
            return MemoryResult.success(conversation.getId());
        });
    }

    /**
     * Attach a caller-supplied entity to a conversation.
     */
    public MemoryResult<Entity> addEntity(String conversationId, Entity.Kind kind, String name) {
        if (kind == null || name == null || name.isBlank()) {
            return MemoryResult.validation("entity kind and name are required");
        }
        Instant now = clock.instant();
        return write(tx -> {
            Optional<Conversation> found = tx.get(CONVERSATIONS, conversationId, Conversation.class);
            if (found.isEmpty()) {
                return MemoryResult.integrity("Unknown conversation: " + conversationId);
            }
            Conversation conversation = found.get();
            Entity entity = recordMention(tx, conversation, kind, name.strip(), now);
            tx.put(CONVERSATIONS, conversation.getId(), conversation);
            return MemoryResult.success(entity);
        });
    }

    public MemoryResult<Conversation> closeConversation(String conversationId) {
        Instant now = clock.instant();
        return modify(conversationId, conversation -> {
            if (!conversation.isClosed()) {
                conversation.setClosed(true);
                conversation.setClosedAt(now);
            }
            return null;
        });
    }

    /**
     * Pinned conversations count as active and are never evicted.
     */
    public MemoryResult<Conversation> pinConversation(String conversationId, boolean pinned) {
        return modify(conversationId, conversation -> {
            conversation.setPinned(pinned);
            return null;
        });
    }

    public MemoryResult<Conversation> setIntent(String conversationId, String intent) {
        if (intent == null || intent.isBlank()) {
            return MemoryResult.validation("intent must not be blank");
        }
        return modify(conversationId, conversation -> {
            conversation.setIntent(intent.strip());
            return null;
        });
    }

    // ==================== Reads ====================

    public Optional<Conversation> getConversation(String conversationId) {
        return store.get(CONVERSATIONS, conversationId, Conversation.class);
    }

    /**
     * Most recent conversations first, at most {@code n}.
     */
    public List<Conversation> getRecent(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<Conversation> all = store.scan(CONVERSATIONS, Conversation.class);
        all.sort(NEWEST_FIRST);
        return all.size() > n ? new ArrayList<>(all.subList(0, n)) : all;
    }

    /**
     * Lexical search over turn text, intent, entities and files of retained
     * conversations. Each matched query term scores {@code 1 + ln(tf)}; a small
     * recency boost separates otherwise equal hits.
     */
    public List<ConversationMatch> search(String query, int limit) {
        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty() || limit <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<ConversationMatch> matches = new ArrayList<>();
        for (Conversation conversation : store.scan(CONVERSATIONS, Conversation.class)) {
            Map<String, Integer> frequencies = termFrequencies(conversation);
            double score = 0.0;
            for (String token : queryTokens) {
                int tf = frequencies.getOrDefault(token, 0);
                if (tf > 0) {
                    score += 1.0 + Math.log(tf);
                }
            }
            if (score > 0.0) {
                score += RECENCY_WEIGHT * recency(conversation, now);
                matches.add(ConversationMatch.builder().conversation(conversation).score(score).build());
            }
        }
        matches.sort(Comparator.comparingDouble(ConversationMatch::getScore).reversed()
                .thenComparing(ConversationMatch::getConversation, NEWEST_FIRST));
        return matches.size() > limit ? new ArrayList<>(matches.subList(0, limit)) : matches;
    }

    public List<ConversationTurn> getMessages(String conversationId) {
        return getConversation(conversationId).map(Conversation::getTurns).orElse(List.of());
    }

    public List<Entity> getConversationEntities(String conversationId) {
        List<Entity> entities = store.lookup(ENTITIES, BY_CONVERSATION, conversationId, Entity.class);
        entities.sort(Comparator.comparing(Entity::getKey));
        return entities;
    }

    public List<Conversation> findConversationsWithEntity(Entity.Kind kind, String name) {
        List<Conversation> conversations = store.lookup(CONVERSATIONS, BY_ENTITY, Entity.keyOf(kind, name),
                Conversation.class);
        conversations.sort(NEWEST_FIRST);
        return conversations;
    }

    public List<Conversation> getConversationsBetween(Instant from, Instant to) {
        List<Conversation> conversations = store.scan(CONVERSATIONS, Conversation.class,
                c -> c.getCreatedAt() != null && !c.getCreatedAt().isBefore(from) && !c.getCreatedAt().isAfter(to));
        conversations.sort(NEWEST_FIRST);
        return conversations;
    }

    public EntityStatistics getEntityStatistics(int top) {
        List<Entity> entities = store.scan(ENTITIES, Entity.class);
        Map<Entity.Kind, Integer> byKind = new EnumMap<>(Entity.Kind.class);
        for (Entity entity : entities) {
            byKind.merge(entity.getKind(), 1, Integer::sum);
        }
        entities.sort(Comparator.comparingInt((Entity e) -> e.getOccurrencesByConversation().size()).reversed()
                .thenComparing(Comparator.comparingInt(Entity::getOccurrenceCount).reversed())
                .thenComparing(Entity::getKey));
        return EntityStatistics.builder()
                .totalEntities(entities.size())
                .countByKind(byKind)
                .mostMentioned(entities.size() > top ? new ArrayList<>(entities.subList(0, top)) : entities)
                .build();
    }

    /**
     * File pairs edited together at least {@code minFrequency} times, most
     * frequent first. Confidence is frequency over the number of turns that
     * touched either file, whichever is smaller.
     */
    public List<FileCoModification> getFileCoModifications(int minFrequency) {
        Map<String, Integer> turnsTouching = new HashMap<>();
        for (Conversation conversation : store.scan(CONVERSATIONS, Conversation.class)) {
            for (ConversationTurn turn : conversation.getTurns()) {
                for (String file : distinct(turn.getFiles())) {
                    turnsTouching.merge(file, 1, Integer::sum);
                }
            }
        }
        List<FileCoModification> result = store.scan(CO_MODIFICATIONS, FileCoModification.class,
                pair -> pair.getFrequency() >= Math.max(1, minFrequency));
        for (FileCoModification pair : result) {
            int denominator = Math.min(turnsTouching.getOrDefault(pair.getFirstFile(), 0),
                    turnsTouching.getOrDefault(pair.getSecondFile(), 0));
            double confidence = denominator == 0 ? 0.0 : (double) pair.getFrequency() / denominator;
            pair.setConfidence(Math.min(1.0, confidence));
        }
        result.sort(Comparator.comparingInt(FileCoModification::getFrequency).reversed()
                .thenComparing(FileCoModification::getFirstFile)
                .thenComparing(FileCoModification::getSecondFile));
        return result;
    }

    public List<EvictionEvent> getEvictionLog() {
        List<EvictionEvent> events = store.scan(EVICTIONS, EvictionEvent.class);
        events.sort(Comparator.comparing(EvictionEvent::getEvictedAt).reversed());
        return events;
    }

    /**
     * The open, not timed out conversation of a session, if any.
     */
    public Optional<Conversation> getActiveConversation(String sessionId) {
        Instant now = clock.instant();
        return store.lookup(CONVERSATIONS, BY_SESSION, sessionId, Conversation.class).stream()
                .filter(c -> !c.isClosed() && !c.isTimedOut(now, settings.getSessionTimeout()))
                .max(OLDEST_FIRST);
    }

    /**
     * Corruption recoveries performed when the store was opened.
     */
    public List<RecoveryEvent> getRecoveryEvents() {
        return store.getRecoveryEvents();
    }

    public int count() {
        return store.count(CONVERSATIONS);
    }

    // ==================== Internals ====================

    private <T> MemoryResult<T> write(Function<Transaction, MemoryResult<T>> work) {
        try {
            return store.transaction(tx -> {
                MemoryResult<T> result = work.apply(tx);
                if (!result.isSuccess()) {
                    tx.setRollbackOnly();
                }
                return result;
            });
        } catch (RecordStoreException e) {
            log.warn("[WorkingMemory] Write failed: {}", e.getMessage());
            return MemoryResult.failure(MemoryFailureKind.STORAGE, e.getMessage());
        }
    }

    private String validateTurn(ConversationTurn turn) {
        if (turn == null || turn.getRole() == null) {
            return "turn and its role are required";
        }
        if (turn.getText() == null || turn.getText().isBlank()) {
            return "turn text must not be blank";
        }
        if (turn.getText().length() > settings.getMaxTurnTextLength()) {
            return "turn text exceeds " + settings.getMaxTurnTextLength() + " characters";
        }
        return null;
    }

    private String validateInteraction(InteractionRecord interaction) {
        if (interaction == null) {
            return "interaction is required";
        }
        if (interaction.getSessionId() == null || interaction.getSessionId().isBlank()) {
            return "sessionId must not be blank";
        }
        if (interaction.getTurns() == null || interaction.getTurns().isEmpty()) {
            return "interaction has no turns";
        }
        for (int i = 0; i < interaction.getTurns().size(); i++) {
            String problem = validateTurn(interaction.getTurns().get(i));
            if (problem != null) {
                return "turn " + (i + 1) + ": " + problem;
            }
        }
        return null;
    }

    private static List<ConversationTurn> withInteractionFiles(InteractionRecord interaction) {
        List<ConversationTurn> turns = new ArrayList<>(interaction.getTurns());
        if (interaction.getFiles() == null || interaction.getFiles().isEmpty()) {
            return turns;
        }
        ConversationTurn first = turns.get(0);
        Set<String> files = new LinkedHashSet<>();
        if (first.getFiles() != null) {
            files.addAll(first.getFiles());
        }
        files.addAll(interaction.getFiles());
        turns.set(0, ConversationTurn.builder()
                .role(first.getRole())
                .text(first.getText())
                .timestamp(first.getTimestamp())
                .files(new ArrayList<>(files))
                .build());
        return turns;
    }

    private List<EntityExtractor.Mention> extractMentions(String owner, String text) {
        try {
            return entityExtractor.extract(text);
        } catch (RuntimeException e) {
            log.warn("[WorkingMemory] Entity extraction failed for {}, storing turn without entities: {}",
                    owner, e.getMessage());
            return List.of();
        }
    }

    private Conversation openConversation(Transaction tx, String sessionId, Instant now) {
        for (Conversation open : tx.lookup(CONVERSATIONS, BY_SESSION, sessionId, Conversation.class)) {
            if (!open.isClosed()) {
                open.setClosed(true);
                open.setClosedAt(now);
                tx.put(CONVERSATIONS, open.getId(), open);
            }
        }

        long sequence = tx.nextSequence(SEQ_CONVERSATION);
        Conversation conversation = Conversation.builder()
                .id("conv-" + sequence)
                .sequence(sequence)
                .sessionId(sessionId)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
        tx.insert(CONVERSATIONS, conversation.getId(), conversation);

        if (tx.count(CONVERSATIONS) > settings.getRetentionCap()) {
            evictOldestInactive(tx, now);
        }
        log.debug("[WorkingMemory] Started {} for session {}", conversation.getId(), sessionId);
        return conversation;
    }

    private void storeTurn(Transaction tx, Conversation conversation, ConversationTurn turn,
            List<EntityExtractor.Mention> mentions, Instant now) {
        List<String> files = distinct(turn.getFiles());
        conversation.getTurns().add(ConversationTurn.builder()
                .role(turn.getRole())
                .text(turn.getText())
                .timestamp(turn.getTimestamp() != null ? turn.getTimestamp() : now)
                .files(files)
                .build());
        conversation.setLastActivityAt(now);
        for (String file : files) {
            if (!conversation.getRelatedFiles().contains(file)) {
                conversation.getRelatedFiles().add(file);
            }
        }

        Set<EntityExtractor.Mention> all = new LinkedHashSet<>(mentions);
        for (String file : files) {
            all.add(new EntityExtractor.Mention(Entity.Kind.FILE, file));
        }
        for (EntityExtractor.Mention mention : all) {
            recordMention(tx, conversation, mention.kind(), mention.name(), now);
        }

        recordCoModifications(tx, conversation.getId(), files);
        tx.put(CONVERSATIONS, conversation.getId(), conversation);
    }

    private MemoryResult<Conversation> modify(String conversationId, Function<Conversation, String> change) {
        return write(tx -> {
            Optional<Conversation> found = tx.get(CONVERSATIONS, conversationId, Conversation.class);
            if (found.isEmpty()) {
                return MemoryResult.integrity("Unknown conversation: " + conversationId);
            }
            Conversation conversation = found.get();
            String problem = change.apply(conversation);
            if (problem != null) {
                return MemoryResult.validation(problem);
            }
            tx.put(CONVERSATIONS, conversationId, conversation);
            return MemoryResult.success(conversation);
        });
    }

    private Entity recordMention(Transaction tx, Conversation conversation, Entity.Kind kind, String name,
            Instant now) {
        String key = Entity.keyOf(kind, name);
        Entity entity = tx.get(ENTITIES, key, Entity.class).orElseGet(() -> Entity.builder()
                .key(key)
                .kind(kind)
                .name(name)
                .firstSeen(now)
                .build());
        entity.getOccurrencesByConversation().merge(conversation.getId(), 1, Integer::sum);
        entity.setOccurrenceCount(entity.getOccurrenceCount() + 1);
        entity.setLastSeen(now);
        tx.put(ENTITIES, key, entity);
        if (!conversation.getEntityKeys().contains(key)) {
            conversation.getEntityKeys().add(key);
        }
        return entity;
    }

    private void recordCoModifications(Transaction tx, String conversationId, List<String> files) {
        if (files.size() < 2) {
            return;
        }
        List<String> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.naturalOrder());
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                String first = sorted.get(i);
                String second = sorted.get(j);
                String key = FileCoModification.pairKey(first, second);
                FileCoModification pair = tx.get(CO_MODIFICATIONS, key, FileCoModification.class)
                        .orElseGet(() -> FileCoModification.builder().firstFile(first).secondFile(second).build());
                pair.getContributions().merge(conversationId, 1, Integer::sum);
                pair.setFrequency(pair.getFrequency() + 1);
                tx.put(CO_MODIFICATIONS, key, pair);
            }
        }
    }

    private void evictOldestInactive(Transaction tx, Instant now) {
        Duration timeout = settings.getSessionTimeout();
        Optional<Conversation> victim = tx.scan(CONVERSATIONS, Conversation.class).stream()
                .filter(c -> !c.isActive(now, timeout))
                .min(OLDEST_FIRST);
        if (victim.isEmpty()) {
            log.warn("[WorkingMemory] Retention cap {} exceeded but every conversation is active, nothing evicted",
                    settings.getRetentionCap());
            return;
        }
        Conversation evicted = victim.get();
        tx.delete(CONVERSATIONS, evicted.getId());

        for (Entity entity : tx.lookup(ENTITIES, BY_CONVERSATION, evicted.getId(), Entity.class)) {
            Integer removed = entity.getOccurrencesByConversation().remove(evicted.getId());
            if (entity.getOccurrencesByConversation().isEmpty()) {
                tx.delete(ENTITIES, entity.getKey());
            } else {
                entity.setOccurrenceCount(entity.getOccurrenceCount() - (removed != null ? removed : 0));
                tx.put(ENTITIES, entity.getKey(), entity);
            }
        }

        for (FileCoModification pair : tx.lookup(CO_MODIFICATIONS, BY_CONVERSATION, evicted.getId(),
                FileCoModification.class)) {
            Integer removed = pair.getContributions().remove(evicted.getId());
            String key = FileCoModification.pairKey(pair.getFirstFile(), pair.getSecondFile());
            if (pair.getContributions().isEmpty()) {
                tx.delete(CO_MODIFICATIONS, key);
            } else {
                pair.setFrequency(pair.getFrequency() - (removed != null ? removed : 0));
                tx.put(CO_MODIFICATIONS, key, pair);
            }
        }

        long sequence = tx.nextSequence(SEQ_EVICTION);
        tx.put(EVICTIONS, "evt-" + sequence, EvictionEvent.builder()
                .conversationId(evicted.getId())
                .sessionId(evicted.getSessionId())
                .reason("retention cap " + settings.getRetentionCap())
                .turnCount(evicted.getTurns().size())
                .evictedAt(now)
                .build());
        tx.delete(EVICTIONS, "evt-" + (sequence - EVICTION_LOG_LIMIT));

        log.info("[WorkingMemory] Evicted {} (session {}, {} turns)", evicted.getId(), evicted.getSessionId(),
                evicted.getTurns().size());
    }

    private Map<String, Integer> termFrequencies(Conversation conversation) {
        Map<String, Integer> frequencies = new HashMap<>();
        for (ConversationTurn turn : conversation.getTurns()) {
            countTokens(turn.getText(), frequencies);
        }
        countTokens(conversation.getIntent(), frequencies);
        for (String key : conversation.getEntityKeys()) {
            countTokens(key.substring(key.indexOf(':') + 1), frequencies);
        }
        for (String file : conversation.getRelatedFiles()) {
            countTokens(file, frequencies);
        }
        return frequencies;
    }

    private static void countTokens(String text, Map<String, Integer> sink) {
        if (text == null || text.isBlank()) {
            return;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_./#-]+")) {
            if (token.length() >= 2) {
                sink.merge(token, 1, Integer::sum);
                // paths also match on their segments
                if (token.indexOf('/') >= 0 || token.indexOf('.') > 0) {
                    for (String part : token.split("[/.]+")) {
                        if (part.length() >= 2 && !part.equals(token)) {
                            sink.merge(part, 1, Integer::sum);
                        }
                    }
                }
            }
        }
    }

    private static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_./#-]+")) {
            if (token.length() >= 2) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static double recency(Conversation conversation, Instant now) {
        Instant at = conversation.getLastActivityAt() != null ? conversation.getLastActivityAt()
                : conversation.getCreatedAt();
        if (at == null) {
            return 0.0;
        }
        double hours = Math.max(0, Duration.between(at, now).toMinutes() / 60.0);
        return 1.0 / (1.0 + hours / 24.0);
    }

    private static List<String> distinct(List<String> values) {
        if (values == null || values.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.add(value.strip());
            }
        }
        return new ArrayList<>(unique);
    }
}
