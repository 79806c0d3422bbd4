package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.AnalysisWindow;
import me.golemcore.brain.domain.model.CollectionResult;
import me.golemcore.brain.domain.model.CommitRecord;
import me.golemcore.brain.domain.model.FileChange;
import me.golemcore.brain.domain.model.FileHotspot;
import me.golemcore.brain.domain.model.Insight;
import me.golemcore.brain.domain.model.MetricSnapshot;
import me.golemcore.brain.domain.model.VelocityReport;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.StoragePort;
import me.golemcore.brain.port.outbound.VcsHistoryPort;
import me.golemcore.brain.testsupport.MutableClock;
import me.golemcore.brain.testsupport.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContextIntelligenceServiceTest {

    private static final LocalDate YESTERDAY = LocalDate.of(2026, 3, 14);

    @TempDir
    Path tempDir;

    private StoragePort storage;
    private MutableClock clock;
    private BrainProperties properties;
    private VcsHistoryPort vcsHistoryPort;
    private List<CommitRecord> history;
    private ContextIntelligenceService service;

    @BeforeEach
    void setUp() {
        storage = TestStores.storage(tempDir);
        clock = new MutableClock(Instant.parse("2026-03-15T12:00:00Z"));
        properties = new BrainProperties();
        properties.getContext().setRepositoryPath("/work/repo");
        properties.getContext().setDefaultWindowDays(10);
        history = new ArrayList<>();
        vcsHistoryPort = mock(VcsHistoryPort.class);
        when(vcsHistoryPort.readHistory(anyString(), any(), any())).thenAnswer(invocation -> {
            LocalDate since = invocation.getArgument(1);
            LocalDate until = invocation.getArgument(2);
            return history.stream()
                    .filter(commit -> !commit.date().isBefore(since) && !commit.date().isAfter(until))
                    .toList();
        });
        service = newService();
    }

    @AfterEach
    void tearDown() {
        TestStores.closeAll();
    }

    private ContextIntelligenceService newService() {
        return new ContextIntelligenceService(TestStores.open("tier3", storage, clock), vcsHistoryPort,
                new HotspotClassifier(properties), properties, clock);
    }

    private void commit(LocalDate date, String author, String... paths) {
        List<FileChange> changes = Arrays.stream(paths).map(path -> new FileChange(path, 3, 1)).toList();
        history.add(new CommitRecord("c" + history.size(), date, author, changes));
    }

    private void commits(LocalDate date, int count, String... paths) {
        for (int i = 0; i < count; i++) {
            commit(date, "dev", paths);
        }
    }

    private static LocalDate march(int day) {
        return LocalDate.of(2026, 3, day);
    }

    // ==================== Collection ====================

    @Test
    void shouldWriteZeroSnapshotsForQuietDays() {
        commit(march(12), "alice", "src/A.java", "src/B.java");
        commit(march(12), "bob", "src/A.java");

        CollectionResult result = service.collectGitMetrics(new AnalysisWindow(march(10), march(14)));

        assertFalse(result.isThrottled());
        assertEquals(2, result.getCommitsRead());
        assertEquals(5, result.getNewSnapshots().size());
        MetricSnapshot quiet = result.getSnapshots().get(0);
        assertEquals(march(10), quiet.getDate());
        assertEquals(0, quiet.getCommitCount());
        MetricSnapshot busy = result.getSnapshots().get(2);
        assertEquals(2, busy.getCommitCount());
        assertEquals(2, busy.getFilesChanged());
        assertEquals(2, busy.getContributorCount());
        assertEquals(9, busy.getLinesAdded());
        assertEquals(3, busy.getLinesRemoved());
    }

    @Test
    void shouldThrottleWithinCollectionInterval() {
        AnalysisWindow window = new AnalysisWindow(march(10), march(14));
        CollectionResult first = service.collectGitMetrics(window);

        clock.advance(Duration.ofMinutes(10));
        CollectionResult second = service.collectGitMetrics(window);

        assertTrue(second.isThrottled());
        assertEquals(first.getCollectedAt(), second.getCollectedAt());
        assertEquals(first.getSnapshots(), second.getSnapshots());
        verify(vcsHistoryPort, times(1)).readHistory(anyString(), any(), any());
    }

    @Test
    void shouldThrottleFromStoredRunAfterRestart() {
        commit(march(11), "alice", "src/A.java");
        AnalysisWindow window = new AnalysisWindow(march(10), march(14));
        CollectionResult first = service.collectGitMetrics(window);

        clock.advance(Duration.ofMinutes(10));
        ContextIntelligenceService restarted = newService();
        CollectionResult second = restarted.collectGitMetrics(window);

        assertTrue(second.isThrottled());
        assertEquals(first.getCollectedAt(), second.getCollectedAt());
        assertEquals(1, second.getCommitsRead());
        assertEquals(5, second.getSnapshots().size());
        assertTrue(second.getNewSnapshots().isEmpty());
        verify(vcsHistoryPort, times(1)).readHistory(anyString(), any(), any());
    }

    @Test
    void shouldCollectAgainAfterRestartOnceIntervalPassed() {
        AnalysisWindow window = new AnalysisWindow(march(10), march(14));
        service.collectGitMetrics(window);

        clock.advance(Duration.ofMinutes(61));
        CollectionResult again = newService().collectGitMetrics(window);

        assertFalse(again.isThrottled());
        verify(vcsHistoryPort, times(2)).readHistory(anyString(), any(), any());
    }

    @Test
    void shouldNotDuplicateSnapshotsAfterInterval() {
        commit(march(11), "alice", "src/A.java");
        AnalysisWindow window = new AnalysisWindow(march(10), march(14));
        service.collectGitMetrics(window);

        clock.advance(Duration.ofMinutes(61));
        CollectionResult again = service.collectGitMetrics(window);

        assertFalse(again.isThrottled());
        assertTrue(again.getNewSnapshots().isEmpty());
        assertEquals(5, service.getSnapshots(window).size());
        verify(vcsHistoryPort, times(2)).readHistory(anyString(), any(), any());
    }

    @Test
    void shouldClampWindowToLastCompletedDay() {
        service.collectGitMetrics(new AnalysisWindow(march(10), march(20)));

        verify(vcsHistoryPort).readHistory(anyString(), eq(march(10)), eq(YESTERDAY));
        List<MetricSnapshot> stored = service.getSnapshots(new AnalysisWindow(march(1), march(31)));
        assertEquals(YESTERDAY, stored.get(stored.size() - 1).getDate());
    }

    @Test
    void shouldSkipWindowWithoutCompletedDay() {
        CollectionResult result = service.collectGitMetrics(new AnalysisWindow(march(15), march(16)));

        assertTrue(result.getSnapshots().isEmpty());
        verify(vcsHistoryPort, never()).readHistory(anyString(), any(), any());
    }

    @Test
    void shouldPersistLastCollectionAcrossRestart() {
        service.collectGitMetrics(new AnalysisWindow(march(10), march(14)));

        ContextIntelligenceService reopened = newService();

        assertEquals(Instant.parse("2026-03-15T12:00:00Z"), reopened.getLastCollectedAt().orElseThrow());
        assertEquals(5, reopened.getSnapshots(new AnalysisWindow(march(10), march(14))).size());
        assertEquals("/work/repo", reopened.getScope());
    }

    // ==================== Velocity ====================

    @Test
    void shouldDetectDecreasingVelocity() {
        commits(march(6), 10, "src/A.java");
        commits(march(12), 2, "src/A.java");
        AnalysisWindow window = new AnalysisWindow(march(5), march(14));
        service.collectGitMetrics(window);

        VelocityReport report = service.analyzeVelocity(window);

        assertEquals(10, report.getOlderCommits());
        assertEquals(2, report.getNewerCommits());
        assertEquals(-0.8, report.getChangeRatio(), 1e-9);
        assertEquals(VelocityReport.Trend.DECREASING, report.getTrend());
    }

    @Test
    void shouldTreatGrowthFromZeroAsIncreasing() {
        commits(march(13), 3, "src/A.java");
        AnalysisWindow window = new AnalysisWindow(march(5), march(14));
        service.collectGitMetrics(window);

        VelocityReport report = service.analyzeVelocity(window);

        assertEquals(1.0, report.getChangeRatio(), 1e-9);
        assertEquals(VelocityReport.Trend.INCREASING, report.getTrend());
    }

    @Test
    void shouldIgnoreSmallAbsoluteChanges() {
        commits(march(6), 1, "src/A.java");
        commits(march(12), 2, "src/A.java");
        AnalysisWindow window = new AnalysisWindow(march(5), march(14));
        service.collectGitMetrics(window);

        VelocityReport report = service.analyzeVelocity(window);

        assertEquals(1.0, report.getChangeRatio(), 1e-9);
        assertEquals(VelocityReport.Trend.STABLE, report.getTrend());
    }

    @Test
    void shouldGiveExtraDayOfOddWindowToNewerHalf() {
        commits(march(10), 4, "src/A.java");
        commits(march(11), 1, "src/A.java");
        AnalysisWindow window = new AnalysisWindow(march(8), march(14));
        service.collectGitMetrics(window);

        VelocityReport report = service.analyzeVelocity(window);

        assertEquals(4, report.getOlderCommits());
        assertEquals(1, report.getNewerCommits());
    }

    // ==================== Hotspots and insights ====================

    @Test
    void shouldRankHotspotsByChurn() {
        for (int i = 0; i < 10; i++) {
            List<String> paths = new ArrayList<>();
            paths.add("src/Noise" + i + ".java");
            if (i < 5) {
                paths.add("src/Hot.java");
            }
            if (i < 2) {
                paths.add("src/Warm.java");
            }
            commit(march(10), "dev", paths.toArray(new String[0]));
        }

        List<FileHotspot> hotspots = service.analyzeFileHotspots(new AnalysisWindow(march(10), march(14)));

        assertEquals("src/Hot.java", hotspots.get(0).getFilePath());
        assertEquals(0.5, hotspots.get(0).getChurnRate(), 1e-9);
        assertEquals(5, hotspots.get(0).getEditCount());
        assertEquals(FileHotspot.Stability.UNSTABLE, hotspots.get(0).getStability());
        assertEquals("src/Warm.java", hotspots.get(1).getFilePath());
        assertEquals(FileHotspot.Stability.UNSTABLE, hotspots.get(1).getStability());
        assertEquals(FileHotspot.Stability.STABLE, hotspots.get(2).getStability());
        assertEquals(List.of("src/Hot.java", "src/Warm.java"),
                service.getUnstableFiles(10).stream().map(FileHotspot::getFilePath).toList());
    }

    @Test
    void shouldCountFileOncePerCommit() {
        commit(march(10), "dev", "src/A.java", "src/A.java");
        commit(march(11), "dev", "src/B.java");

        List<FileHotspot> hotspots = service.analyzeFileHotspots(new AnalysisWindow(march(10), march(14)));

        FileHotspot a = hotspots.stream().filter(h -> h.getFilePath().equals("src/A.java")).findFirst()
                .orElseThrow();
        assertEquals(1, a.getEditCount());
        assertEquals(8, a.getLinesChanged());
        assertEquals(0.5, a.getChurnRate(), 1e-9);
    }

    @Test
    void shouldGenerateVelocityAndHotspotInsights() {
        commits(march(6), 10, "src/Core.java");
        commits(march(12), 2, "src/Other.java");
        service.collectGitMetrics();

        List<Insight> generated = service.generateInsights();
        List<Insight> latest = service.getLatestInsights();

        assertEquals(2, generated.size());
        assertEquals(Insight.Kind.VELOCITY_DROP, latest.get(0).getKind());
        assertEquals(Insight.Severity.ERROR, latest.get(0).getSeverity());
        assertEquals(Insight.Kind.FILE_HOTSPOT, latest.get(1).getKind());
        assertEquals(Insight.Severity.WARNING, latest.get(1).getSeverity());
        assertEquals("High churn detected: Core.java", latest.get(1).getTitle());
        assertEquals("src/Core.java", latest.get(1).getRelatedEntity());
    }

    @Test
    void shouldReplacePreviousInsights() {
        commits(march(6), 10, "src/Core.java");
        commits(march(12), 2, "src/Other.java");
        service.collectGitMetrics();
        service.generateInsights();

        List<Insight> second = service.generateInsights();

        assertEquals(2, service.getLatestInsights().size());
        assertEquals(List.of("ins-3", "ins-4"), second.stream().map(Insight::getId).toList());
    }

    @Test
    void shouldGenerateNothingForQuietRepository() {
        service.collectGitMetrics();

        assertTrue(service.generateInsights().isEmpty());
        assertEquals(VelocityReport.Trend.STABLE, service.getContextSummary().getVelocity().getTrend());
    }
}
