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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the brain, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code brain.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where the tier store files live</li>
 * <li>{@link WorkingMemoryProperties} - tier 1 retention and sessions</li>
 * <li>{@link KnowledgeGraphProperties} - tier 2 decay and ranking</li>
 * <li>{@link ContextProperties} - tier 3 git metrics and thresholds</li>
 * <li>{@link FacadeProperties} - per-tier query budgets</li>
 * <li>{@link MaintenanceProperties} - background maintenance triggers</li>
 * <li>{@link PromotionProperties} - promotion of tier 1 observations into
 * tier 2 patterns</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "brain")
@Data
public class BrainProperties {

    private StorageProperties storage = new StorageProperties();
    private WorkingMemoryProperties workingMemory = new WorkingMemoryProperties();
    private KnowledgeGraphProperties knowledgeGraph = new KnowledgeGraphProperties();
    private ContextProperties context = new ContextProperties();
    private FacadeProperties facade = new FacadeProperties();
    private MaintenanceProperties maintenance = new MaintenanceProperties();
    private PromotionProperties promotion = new PromotionProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/brain";
        private boolean keepBackups = true;
    }

    @Data
    public static class WorkingMemoryProperties {
        private int retentionCap = 20;
        private Duration sessionTimeout = Duration.ofMinutes(30);
        private int maxTurnTextLength = 20000;
    }

    @Data
    public static class KnowledgeGraphProperties {
        private int decayFirstThresholdDays = 60;
        private double decayFirstPenalty = 0.10;
        private int decaySecondThresholdDays = 90;
        private double decaySecondPenalty = 0.25;
        private int deletionThresholdDays = 120;
        private double deletionConfidenceFloor = 0.30;
        private int decayWindowDays = 1;
        private int decayBatchSize = 50;
        private Duration decayTimeSlice = Duration.ofMillis(100);
        private double tagBoost = 1.5;
        private double titleWeight = 2.0;
        private int defaultSearchLimit = 20;
        private int decayLogLimit = 1000;
    }

    // ==================== CONTEXT INTELLIGENCE ====================

    @Data
    public static class ContextProperties {
        private String repositoryPath = ".";
        private Duration collectionInterval = Duration.ofHours(1);
        private Duration gitTimeout = Duration.ofSeconds(30);
        private int defaultWindowDays = 30;
        private double churnLowThreshold = 0.10;
        private double churnHighThreshold = 0.20;
        private double churnCriticalThreshold = 0.30;
        private double velocityChangeThreshold = 0.30;
        private int velocityMinCommitDelta = 2;
        private int insightHotspotLimit = 5;
    }

    @Data
    public static class FacadeProperties {
        private Duration workingMemoryBudget = Duration.ofMillis(50);
        private Duration knowledgeGraphBudget = Duration.ofMillis(150);
        private Duration contextBudget = Duration.ofMillis(200);
        private int queryThreads = 3;
        private int defaultConversationLimit = 5;
        private int defaultPatternLimit = 10;
    }

    @Data
    public static class MaintenanceProperties {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(30);
        private Duration interval = Duration.ofHours(6);
        private int eventThreshold = 25;
    }

    @Data
    public static class PromotionProperties {
        private boolean enabled = true;
        private int minFrequency = 3;
        private double minConfidence = 0.5;
        private double initialConfidence = 0.7;
        private int conceptMinConversations = 3;
    }
}
