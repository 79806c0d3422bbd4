package me.golemcore.brain.adapter.outbound.vcs;

import me.golemcore.brain.domain.model.CommitRecord;
import me.golemcore.brain.domain.model.FileChange;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GitCliAdapterTest {

    @TempDir
    Path tempDir;

    @Test
    void parseLogReadsHeadersAndNumstat() {
        String output = String.join("\n",
                "@@commit|bbb222|2026-03-02|Bob",
                "",
                "10\t2\tsrc/Main.java",
                "-\t-\tassets/logo.png",
                "@@commit|aaa111|2026-03-01|Alice Smith",
                "",
                "1\t0\tREADME.md",
                "");

        List<CommitRecord> commits = GitCliAdapter.parseLog(output);

        assertEquals(2, commits.size());
        CommitRecord newest = commits.get(0);
        assertEquals("bbb222", newest.hash());
        assertEquals(LocalDate.of(2026, 3, 2), newest.date());
        assertEquals("Bob", newest.author());
        assertEquals(List.of(new FileChange("src/Main.java", 10, 2), new FileChange("assets/logo.png", 0, 0)),
                newest.changes());
        assertEquals("Alice Smith", commits.get(1).author());
        assertEquals(1, commits.get(1).changes().size());
    }

    @Test
    void parseLogKeepsCommitsWithoutFileChanges() {
        List<CommitRecord> commits = GitCliAdapter.parseLog("@@commit|abc|2026-03-01|Eve\n");

        assertEquals(1, commits.size());
        assertTrue(commits.get(0).changes().isEmpty());
    }

    @Test
    void parseLogSkipsMalformedHeadersAndTheirLines() {
        String output = String.join("\n",
                "@@commit|broken",
                "5\t5\tignored.txt",
                "@@commit|def|not-a-date|Zed",
                "5\t5\talso-ignored.txt",
                "@@commit|ghi|2026-03-03|Ann",
                "2\t1\tkept.txt");

        List<CommitRecord> commits = GitCliAdapter.parseLog(output);

        assertEquals(1, commits.size());
        assertEquals("ghi", commits.get(0).hash());
        assertEquals("kept.txt", commits.get(0).changes().get(0).path());
    }

    @Test
    void parseLogAuthorMayContainSeparator() {
        List<CommitRecord> commits = GitCliAdapter.parseLog("@@commit|h1|2026-03-01|Team | Ops\n");

        assertEquals("Team | Ops", commits.get(0).author());
    }

    @Test
    void readHistoryReturnsEmptyForMissingDirectory() {
        GitCliAdapter adapter = new GitCliAdapter(new BrainProperties());
        try {
            List<CommitRecord> commits = adapter.readHistory(tempDir.resolve("nope").toString(),
                    LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31));
            assertTrue(commits.isEmpty());
        } finally {
            adapter.shutdown();
        }
    }
}
