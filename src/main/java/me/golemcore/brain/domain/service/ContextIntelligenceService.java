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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.AnalysisWindow;
import me.golemcore.brain.domain.model.CollectionResult;
import me.golemcore.brain.domain.model.CommitRecord;
import me.golemcore.brain.domain.model.ContextSummary;
import me.golemcore.brain.domain.model.FileChange;
import me.golemcore.brain.domain.model.FileHotspot;
import me.golemcore.brain.domain.model.Insight;
import me.golemcore.brain.domain.model.MetricSnapshot;
import me.golemcore.brain.domain.model.VelocityReport;
import me.golemcore.brain.domain.store.RecordStore;
import me.golemcore.brain.domain.store.RecoveryEvent;
import me.golemcore.brain.infrastructure.config.BrainConfiguration;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.VcsHistoryPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
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
import java.util.TreeMap;

/**
 * Tier 3 context intelligence: daily commit metrics, file churn hotspots,
 * commit velocity and the insights derived from them.
 *
 * <p>
 * All data is scoped by the absolute path of the analyzed repository. Daily
 * snapshots are append-only and keyed by (scope, date), so collecting the same
 * days twice never duplicates them. Collection is throttled per scope by
 * {@code brain.context.collection-interval}; a throttled call hands back the
 * previous result flagged as throttled.
 */
@Service
@Slf4j
public class ContextIntelligenceService {

    static final String SNAPSHOTS = "snapshots";
    static final String HOTSPOTS = "hotspots";
    static final String INSIGHTS = "insights";
    static final String COLLECTION_RUNS = "collection_runs";

    private static final String BY_SCOPE = "scope";
    private static final String SEQ_INSIGHT = "insight";
    private static final int HOTSPOT_CACHE_SIZE = 64;

    private static final Comparator<FileHotspot> BY_CHURN = Comparator
            .comparingDouble(FileHotspot::getChurnRate).reversed()
            .thenComparing(FileHotspot::getFilePath);

    private static final Comparator<Insight> BY_SEVERITY = Comparator
            .comparing(Insight::getSeverity, Comparator.reverseOrder())
            .thenComparing(Insight::getId);

    private final RecordStore store;
    private final VcsHistoryPort vcsHistoryPort;
    private final HotspotClassifier classifier;
    private final BrainProperties.ContextProperties settings;
    private final Clock clock;
    private final String scope;

    private final Cache<String, CollectionResult> collectionCache;
    private final Cache<AnalysisWindow, List<FileHotspot>> hotspotCache;

    public ContextIntelligenceService(@Qualifier(BrainConfiguration.CONTEXT_STORE) RecordStore store,
            VcsHistoryPort vcsHistoryPort, HotspotClassifier classifier, BrainProperties properties, Clock clock) {
        this.store = store;
        this.vcsHistoryPort = vcsHistoryPort;
        this.classifier = classifier;
        this.settings = properties.getContext();
        this.clock = clock;
        this.scope = Path.of(settings.getRepositoryPath()).toAbsolutePath().normalize().toString();
        this.collectionCache = newCache(settings.getCollectionInterval(), clock, 16);
        this.hotspotCache = newCache(settings.getCollectionInterval(), clock, HOTSPOT_CACHE_SIZE);
        store.registerIndex(SNAPSHOTS, BY_SCOPE, "scope");
        store.registerIndex(HOTSPOTS, BY_SCOPE, "scope");
    }

    public String getScope() {
        return scope;
    }

    /**
     * The default analysis window: {@code default-window-days} days ending
     * yesterday, the last completed day.
     */
    public AnalysisWindow defaultWindow() {
        return AnalysisWindow.endingOn(yesterday(), settings.getDefaultWindowDays());
    }

    // ==================== Collection ====================

    public CollectionResult collectGitMetrics() {
        return collectGitMetrics(defaultWindow());
    }

    /**
     * Append a snapshot for every completed day of the window that has none
     * yet. Days without commits get a zero snapshot.
     */
    public CollectionResult collectGitMetrics(AnalysisWindow window) {
        CollectionResult cached = collectionCache.getIfPresent(scope);
        if (cached != null) {
            log.debug("[ContextIntel] Collection for {} throttled, last run at {}", scope, cached.getCollectedAt());
            return cached.toBuilder().throttled(true).build();
        }

        Instant now = clock.instant();
        LocalDate end = window.end().isAfter(yesterday()) ? yesterday() : window.end();

        // the cache is empty after a restart, the persisted run still throttles
        Optional<CollectionResult> lastRun = store.get(COLLECTION_RUNS, scope, CollectionResult.class);
        if (lastRun.isPresent() && lastRun.get().getCollectedAt() != null
                && now.isBefore(lastRun.get().getCollectedAt().plus(settings.getCollectionInterval()))) {
            log.debug("[ContextIntel] Collection for {} throttled by stored run at {}", scope,
                    lastRun.get().getCollectedAt());
            return lastRun.get().toBuilder()
                    .snapshots(end.isBefore(window.start()) ? new ArrayList<>()
                            : getSnapshots(new AnalysisWindow(window.start(), end)))
                    .throttled(true)
                    .build();
        }

        if (end.isBefore(window.start())) {
            log.debug("[ContextIntel] Window {} has no completed day yet", window);
            CollectionResult empty = CollectionResult.builder()
                    .scope(scope)
                    .collectedAt(now)
                    .build();
            collectionCache.put(scope, empty);
            return empty;
        }
        AnalysisWindow completed = new AnalysisWindow(window.start(), end);

        List<CommitRecord> commits = vcsHistoryPort.readHistory(settings.getRepositoryPath(), completed.start(),
                completed.end());
        Map<LocalDate, MetricSnapshot> daily = aggregateByDay(completed, commits, now);

        List<MetricSnapshot> added = store.transaction(tx -> {
            List<MetricSnapshot> inserted = new ArrayList<>();
            for (MetricSnapshot snapshot : daily.values()) {
                String key = MetricSnapshot.keyOf(scope, snapshot.getDate());
                if (!tx.contains(SNAPSHOTS, key)) {
                    tx.insert(SNAPSHOTS, key, snapshot);
                    inserted.add(snapshot);
                }
            }
            CollectionResult run = CollectionResult.builder()
                    .scope(scope)
                    .collectedAt(now)
                    .commitsRead(commits.size())
                    .build();
            tx.put(COLLECTION_RUNS, scope, run);
            return inserted;
        });

        if (!added.isEmpty()) {
            hotspotCache.invalidateAll();
        }
        CollectionResult result = CollectionResult.builder()
                .scope(scope)
                .collectedAt(now)
                .commitsRead(commits.size())
                .newSnapshots(added)
                .snapshots(getSnapshots(completed))
                .build();
        collectionCache.put(scope, result);
        log.info("[ContextIntel] Collected {} commit(s) for {}: {} new snapshot(s)", commits.size(), scope,
                added.size());
        return result;
    }

    private Map<LocalDate, MetricSnapshot> aggregateByDay(AnalysisWindow window, List<CommitRecord> commits,
            Instant now) {
        Map<LocalDate, List<CommitRecord>> byDay = new HashMap<>();
        for (CommitRecord commit : commits) {
            if (window.contains(commit.date())) {
                byDay.computeIfAbsent(commit.date(), day -> new ArrayList<>()).add(commit);
            }
        }

        Map<LocalDate, MetricSnapshot> daily = new TreeMap<>();
        for (LocalDate day = window.start(); !day.isAfter(window.end()); day = day.plusDays(1)) {
            List<CommitRecord> dayCommits = byDay.getOrDefault(day, List.of());
            int linesAdded = 0;
            int linesRemoved = 0;
            Set<String> files = new HashSet<>();
            Set<String> authors = new HashSet<>();
            for (CommitRecord commit : dayCommits) {
                authors.add(commit.author());
                for (FileChange change : commit.changes()) {
                    linesAdded += change.linesAdded();
                    linesRemoved += change.linesRemoved();
                    files.add(change.path());
                }
            }
            daily.put(day, MetricSnapshot.builder()
                    .scope(scope)
                    .date(day)
                    .commitCount(dayCommits.size())
                    .linesAdded(linesAdded)
                    .linesRemoved(linesRemoved)
                    .filesChanged(files.size())
                    .contributorCount(authors.size())
                    .recordedAt(now)
                    .build());
        }
        return daily;
    }

    /**
     * Stored snapshots of the window, oldest first.
     */
    public List<MetricSnapshot> getSnapshots(AnalysisWindow window) {
        List<MetricSnapshot> snapshots = new ArrayList<>(
                store.lookup(SNAPSHOTS, BY_SCOPE, scope, MetricSnapshot.class));
        snapshots.removeIf(snapshot -> !window.contains(snapshot.getDate()));
        snapshots.sort(Comparator.comparing(MetricSnapshot::getDate));
        return snapshots;
    }

    public Optional<Instant> getLastCollectedAt() {
        return store.get(COLLECTION_RUNS, scope, CollectionResult.class).map(CollectionResult::getCollectedAt);
    }

    // ==================== Hotspots ====================

    /**
     * Churn of every file changed in the window, highest first. Results replace
     * any stored hotspots of the same period.
     */
    public List<FileHotspot> analyzeFileHotspots(AnalysisWindow window) {
        return hotspotCache.get(window, this::computeHotspots);
    }

    private List<FileHotspot> computeHotspots(AnalysisWindow window) {
        List<CommitRecord> commits = vcsHistoryPort.readHistory(settings.getRepositoryPath(), window.start(),
                window.end());
        int commitCount = commits.size();

        Map<String, int[]> perFile = new LinkedHashMap<>();
        for (CommitRecord commit : commits) {
            Set<String> touched = new HashSet<>();
            for (FileChange change : commit.changes()) {
                int[] counters = perFile.computeIfAbsent(change.path(), path -> new int[2]);
                if (touched.add(change.path())) {
                    counters[0]++;
                }
                counters[1] += change.linesAdded() + change.linesRemoved();
            }
        }

        List<FileHotspot> hotspots = new ArrayList<>();
        for (Map.Entry<String, int[]> entry : perFile.entrySet()) {
            int edits = entry.getValue()[0];
            double churn = (double) edits / commitCount;
            hotspots.add(FileHotspot.builder()
                    .scope(scope)
                    .filePath(entry.getKey())
                    .periodStart(window.start())
                    .periodEnd(window.end())
                    .commitCount(commitCount)
                    .editCount(edits)
                    .linesChanged(entry.getValue()[1])
                    .churnRate(churn)
                    .stability(classifier.classify(churn))
                    .build());
        }
        hotspots.sort(BY_CHURN);

        store.update(tx -> {
            List<FileHotspot> previous = tx.lookup(HOTSPOTS, BY_SCOPE, scope, FileHotspot.class);
            for (FileHotspot old : previous) {
                if (old.getPeriodStart().equals(window.start()) && old.getPeriodEnd().equals(window.end())) {
                    tx.delete(HOTSPOTS, hotspotKey(old));
                }
            }
            for (FileHotspot hotspot : hotspots) {
                tx.put(HOTSPOTS, hotspotKey(hotspot), hotspot);
            }
        });
        log.debug("[ContextIntel] Analyzed {} file(s) over {} commit(s) in {}", hotspots.size(), commitCount,
                window);
        return hotspots;
    }

    /**
     * Unstable files across stored analyses, highest churn first. A file
     * analyzed in several periods is reported with its most recent one.
     */
    public List<FileHotspot> getUnstableFiles(int limit) {
        Map<String, FileHotspot> latest = new HashMap<>();
        for (FileHotspot hotspot : store.lookup(HOTSPOTS, BY_SCOPE, scope, FileHotspot.class)) {
            latest.merge(hotspot.getFilePath(), hotspot,
                    (a, b) -> a.getPeriodEnd().isBefore(b.getPeriodEnd()) ? b : a);
        }
        return latest.values().stream()
                .filter(hotspot -> hotspot.getStability() == FileHotspot.Stability.UNSTABLE)
                .sorted(BY_CHURN)
                .limit(Math.max(0, limit))
                .toList();
    }

    private static String hotspotKey(FileHotspot hotspot) {
        return hotspot.getScope() + "|" + hotspot.getPeriodStart() + "|" + hotspot.getPeriodEnd() + "|"
                + hotspot.getFilePath();
    }

    // ==================== Velocity ====================

    /**
     * Compare commits in the newer half of the window with the older half,
     * using stored snapshots. With an odd number of days the newer half gets
     * the extra day.
     */
    public VelocityReport analyzeVelocity(AnalysisWindow window) {
        long olderDays = window.lengthInDays() / 2;
        LocalDate split = window.start().plusDays(olderDays);
        int older = 0;
        int newer = 0;
        for (MetricSnapshot snapshot : getSnapshots(window)) {
            if (snapshot.getDate().isBefore(split)) {
                older += snapshot.getCommitCount();
            } else {
                newer += snapshot.getCommitCount();
            }
        }

        double ratio;
        if (older == 0) {
            ratio = newer == 0 ? 0.0 : 1.0;
        } else {
            ratio = (double) (newer - older) / older;
        }

        VelocityReport.Trend trend = VelocityReport.Trend.STABLE;
        if (Math.abs(newer - older) >= settings.getVelocityMinCommitDelta()) {
            if (ratio <= -settings.getVelocityChangeThreshold()) {
                trend = VelocityReport.Trend.DECREASING;
            } else if (ratio >= settings.getVelocityChangeThreshold()) {
                trend = VelocityReport.Trend.INCREASING;
            }
        }

        return VelocityReport.builder()
                .windowStart(window.start())
                .windowEnd(window.end())
                .olderCommits(older)
                .newerCommits(newer)
                .changeRatio(ratio)
                .trend(trend)
                .build();
    }

    // ==================== Insights ====================

    /**
     * Derive insights over the default window and store them in place of the
     * previous set.
     */
    public List<Insight> generateInsights() {
        AnalysisWindow window = defaultWindow();
        Instant now = clock.instant();
        VelocityReport velocity = analyzeVelocity(window);
        List<FileHotspot> hotspots = analyzeFileHotspots(window);

        List<Insight> drafts = new ArrayList<>();
        String velocityReference = "velocity:" + window.start() + ".." + window.end();
        if (velocity.getTrend() == VelocityReport.Trend.DECREASING) {
            double drop = -velocity.getChangeRatio();
            drafts.add(Insight.builder()
                    .kind(Insight.Kind.VELOCITY_DROP)
                    .severity(drop >= 2 * settings.getVelocityChangeThreshold() ? Insight.Severity.ERROR
                            : Insight.Severity.WARNING)
                    .title(String.format(Locale.ROOT, "Commit velocity decreased %.1f%%", drop * 100))
                    .message(String.format(Locale.ROOT,
                            "Commits dropped from %d to %d between the two halves of %s..%s.",
                            velocity.getOlderCommits(), velocity.getNewerCommits(), window.start(), window.end()))
                    .recommendation("Break work into smaller, more frequent commits to keep progress visible.")
                    .metricReference(velocityReference)
                    .createdAt(now)
                    .build());
        }

        hotspots.stream()
                .filter(hotspot -> hotspot.getStability() == FileHotspot.Stability.UNSTABLE)
                .limit(settings.getInsightHotspotLimit())
                .forEach(hotspot -> drafts.add(hotspotInsight(hotspot, now)));

        if (velocity.getTrend() == VelocityReport.Trend.INCREASING) {
            drafts.add(Insight.builder()
                    .kind(Insight.Kind.VELOCITY_GAIN)
                    .severity(Insight.Severity.INFO)
                    .title(String.format(Locale.ROOT, "Commit velocity increased %.1f%%",
                            velocity.getChangeRatio() * 100))
                    .message(String.format(Locale.ROOT,
                            "Commits rose from %d to %d between the two halves of %s..%s.",
                            velocity.getOlderCommits(), velocity.getNewerCommits(), window.start(), window.end()))
                    .metricReference(velocityReference)
                    .createdAt(now)
                    .build());
        }

        List<Insight> stored = store.transaction(tx -> {
            for (Insight previous : tx.scan(INSIGHTS, Insight.class)) {
                tx.delete(INSIGHTS, previous.getId());
            }
            List<Insight> saved = new ArrayList<>();
            for (Insight insight : drafts) {
                insight.setId("ins-" + tx.nextSequence(SEQ_INSIGHT));
                tx.put(INSIGHTS, insight.getId(), insight);
                saved.add(insight);
            }
            return saved;
        });
        log.info("[ContextIntel] Generated {} insight(s), velocity {}", stored.size(), velocity.getTrend());
        return stored;
    }

    private Insight hotspotInsight(FileHotspot hotspot, Instant now) {
        boolean critical = classifier.isCritical(hotspot.getChurnRate());
        String fileName = Path.of(hotspot.getFilePath()).getFileName().toString();
        return Insight.builder()
                .kind(Insight.Kind.FILE_HOTSPOT)
                .severity(critical ? Insight.Severity.WARNING : Insight.Severity.INFO)
                .title((critical ? "High churn detected: " : "Unstable file: ") + fileName)
                .message(String.format(Locale.ROOT, "File %s was modified in %d of %d commits (%.1f%% churn).",
                        hotspot.getFilePath(), hotspot.getEditCount(), hotspot.getCommitCount(),
                        hotspot.getChurnRate() * 100))
                .recommendation(critical
                        ? "Consider refactoring this file or splitting it into smaller, focused modules."
                        : "Keep an eye on this file; frequent edits often precede instability.")
                .relatedEntity(hotspot.getFilePath())
                .metricReference("hotspot:" + hotspot.getPeriodStart() + ".." + hotspot.getPeriodEnd())
                .createdAt(now)
                .build();
    }

    /**
     * Insights of the last generation pass, most severe first.
     */
    public List<Insight> getLatestInsights() {
        List<Insight> insights = new ArrayList<>(store.scan(INSIGHTS, Insight.class));
        insights.sort(BY_SEVERITY);
        return insights;
    }

    /**
     * Corruption recoveries performed when the store was opened.
     */
    public List<RecoveryEvent> getRecoveryEvents() {
        return store.getRecoveryEvents();
    }

    public ContextSummary getContextSummary() {
        AnalysisWindow window = defaultWindow();
        return ContextSummary.builder()
                .scope(scope)
                .snapshotCount(getSnapshots(window).size())
                .lastCollectedAt(getLastCollectedAt().orElse(null))
                .velocity(analyzeVelocity(window))
                .unstableFiles(getUnstableFiles(settings.getInsightHotspotLimit()))
                .insights(getLatestInsights())
                .build();
    }

    private static <K, V> Cache<K, V> newCache(Duration ttl, Clock clock, long maximumSize) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(() -> clock.millis() * 1_000_000L)
                .executor(Runnable::run)
                .build();
    }

    private LocalDate yesterday() {
        return LocalDate.now(clock).minusDays(1);
    }
}
