package me.golemcore.brain.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.store.RecordStore;
import me.golemcore.brain.port.outbound.StoragePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the shared infrastructure of the brain: time source, JSON mapper, one
 * record store per tier and the pool used for facade fan-out reads.
 *
 * <p>
 * Each tier gets its own embedded database file, so a corrupt file in one tier
 * never affects the others.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class BrainConfiguration {

    public static final String WORKING_MEMORY_STORE = "workingMemoryStore";
    public static final String KNOWLEDGE_GRAPH_STORE = "knowledgeGraphStore";
    public static final String CONTEXT_STORE = "contextIntelligenceStore";
    public static final String QUERY_EXECUTOR = "brainQueryExecutor";

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = WORKING_MEMORY_STORE, destroyMethod = "close")
    public RecordStore workingMemoryStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            BrainProperties properties) {
        return openStore("working-memory", "tier1", storagePort, objectMapper, clock, properties);
    }

    @Bean(name = KNOWLEDGE_GRAPH_STORE, destroyMethod = "close")
    public RecordStore knowledgeGraphStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            BrainProperties properties) {
        return openStore("knowledge-graph", "tier2", storagePort, objectMapper, clock, properties);
    }

    @Bean(name = CONTEXT_STORE, destroyMethod = "close")
    public RecordStore contextIntelligenceStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            BrainProperties properties) {
        return openStore("context-intelligence", "tier3", storagePort, objectMapper, clock, properties);
    }

    @Bean(name = QUERY_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService brainQueryExecutor(BrainProperties properties) {
        int threads = Math.max(1, properties.getFacade().getQueryThreads());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "brain-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static RecordStore openStore(String name, String directory, StoragePort storagePort,
            ObjectMapper objectMapper, Clock clock, BrainProperties properties) {
        RecordStore store = new RecordStore(name, directory, storagePort, objectMapper, clock,
                properties.getStorage().isKeepBackups());
        store.open();
        if (!store.getRecoveryEvents().isEmpty()) {
            log.warn("[Brain] Store '{}' was recovered on startup: {}", name, store.getRecoveryEvents());
        }
        return store;
    }
}
