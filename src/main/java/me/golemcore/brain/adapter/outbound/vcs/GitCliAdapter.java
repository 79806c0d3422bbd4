package me.golemcore.brain.adapter.outbound.vcs;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.CommitRecord;
import me.golemcore.brain.domain.model.FileChange;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.VcsHistoryPort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads commit history by running {@code git log --numstat}.
 *
 * <p>
 * Every commit header line starts with a marker so numstat lines can be told
 * apart from headers:
 *
 * <pre>
 * @@commit|&lt;hash&gt;|&lt;yyyy-MM-dd&gt;|&lt;author&gt;
 * 12	3	src/Main.java
 * -	-	assets/logo.png
 * </pre>
 *
 * Failures (no git binary, not a repository, timeout) are logged and yield an
 * empty history.
 */
@Component
@Slf4j
public class GitCliAdapter implements VcsHistoryPort {

    static final String COMMIT_MARKER = "@@commit|";

    private final Duration timeout;
    private final ExecutorService outputReader;

    public GitCliAdapter(BrainProperties properties) {
        this.timeout = properties.getContext().getGitTimeout();
        this.outputReader = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "brain-git-reader");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        outputReader.shutdownNow();
    }

    @Override
    public List<CommitRecord> readHistory(String repositoryPath, LocalDate since, LocalDate until) {
        File repository = new File(repositoryPath);
        if (!repository.isDirectory()) {
            log.warn("[Git] Repository path is not a directory: {}", repositoryPath);
            return List.of();
        }

        // git filters on committer time; widen by a day and filter on author date below
        List<String> command = List.of("git", "-C", repository.getAbsolutePath(), "log",
                "--no-merges",
                "--since=" + since.minusDays(1),
                "--until=" + until.plusDays(1),
                "--date=short",
                "--pretty=format:" + COMMIT_MARKER + "%H|%ad|%an",
                "--numstat");

        String output = run(command);
        if (output == null) {
            return List.of();
        }

        List<CommitRecord> commits = new ArrayList<>();
        for (CommitRecord commit : parseLog(output)) {
            if (!commit.date().isBefore(since) && !commit.date().isAfter(until)) {
                commits.add(commit);
            }
        }
        Collections.reverse(commits);
        log.debug("[Git] Read {} commit(s) from {} between {} and {}", commits.size(), repositoryPath, since,
                until);
        return commits;
    }

    private String run(List<String> command) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);

        try {
            Process process = pb.start();

            Future<String> outputFuture = outputReader.submit(() -> {
                StringBuilder output = new StringBuilder();
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line = reader.readLine();
                    while (line != null) {
                        output.append(line).append('\n');
                        line = reader.readLine();
                    }
                }
                return output.toString();
            });

            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                outputFuture.cancel(true);
                log.warn("[Git] git log timed out after {}", timeout);
                return null;
            }

            String output = outputFuture.get(1, TimeUnit.SECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.warn("[Git] git log exited with code {}", exitCode);
                return null;
            }
            return output;

        } catch (IOException e) {
            log.warn("[Git] Failed to run git: {}", e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Git] Interrupted while reading history");
            return null;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Git] Failed to read git output: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Parse {@code git log --numstat} output in the marker format, newest commit
     * first as git prints it. Malformed lines are skipped.
     */
    static List<CommitRecord> parseLog(String output) {
        List<CommitRecord> commits = new ArrayList<>();
        String hash = null;
        LocalDate date = null;
        String author = null;
        List<FileChange> changes = new ArrayList<>();

        for (String rawLine : output.split("\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(COMMIT_MARKER)) {
                if (hash != null) {
                    commits.add(new CommitRecord(hash, date, author, changes));
                }
                hash = null;
                changes = new ArrayList<>();
                String[] parts = line.substring(COMMIT_MARKER.length()).split("\\|", 3);
                if (parts.length < 3) {
                    log.debug("[Git] Skipping malformed header: {}", line);
                    continue;
                }
                try {
                    date = LocalDate.parse(parts[1]);
                } catch (DateTimeParseException e) {
                    log.debug("[Git] Skipping commit with unparsable date: {}", line);
                    continue;
                }
                hash = parts[0];
                author = parts[2];
                continue;
            }
            if (hash == null) {
                continue;
            }
            FileChange change = parseNumstat(rawLine);
            if (change != null) {
                changes.add(change);
            }
        }
        if (hash != null) {
            commits.add(new CommitRecord(hash, date, author, changes));
        }
        return commits;
    }

    private static FileChange parseNumstat(String line) {
        String[] parts = line.split("\t", 3);
        if (parts.length < 3 || parts[2].isBlank()) {
            return null;
        }
        return new FileChange(parts[2].strip(), parseCount(parts[0]), parseCount(parts[1]));
    }

    private static int parseCount(String value) {
        // binary files report "-"
        if ("-".equals(value.strip())) {
            return 0;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
