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

package me.golemcore.brain.adapter.outbound.storage;

import me.golemcore.brain.infrastructure.config.BrainProperties;
import me.golemcore.brain.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Holds the tier databases and their backups in a local directory:
 * <ul>
 * <li>tier1/ - working memory
 * <li>tier2/ - knowledge graph
 * <li>tier3/ - context intelligence
 * </ul>
 *
 * <p>
 * Base path configured via {@code brain.storage.base-path}, defaults to
 * {@code ${user.home}/.golemcore/brain}.
 *
 * @see me.golemcore.brain.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String CORRUPT_SUFFIX = ".corrupt-";

    private final BrainProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);

            for (String dir : List.of("tier1", "tier2", "tier3")) {
                Files.createDirectories(basePath.resolve(dir));
            }

            log.info("[Storage] Brain storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(directory, path));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(resolvePath(directory, "."));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create directory: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> quarantine(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path source = resolvePath(directory, path);
            if (!Files.exists(source)) {
                return null;
            }
            Path target = source.resolveSibling(source.getFileName() + CORRUPT_SUFFIX + System.currentTimeMillis());
            try {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
                log.warn("[Storage] Quarantined unreadable file {} as {}", source, target.getFileName());
                return target.getFileName().toString();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to quarantine file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> replaceAtomic(String directory, String source, String target) {
        return CompletableFuture.runAsync(() -> {
            Path sourcePath = resolvePath(directory, source);
            Path targetPath = resolvePath(directory, target);

            try {
                // 1. fsync the new content
                try (FileChannel channel = FileChannel.open(sourcePath, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }

                // 2. Atomic rename over the previous version
                try {
                    Files.move(sourcePath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(sourcePath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }

                log.debug("[Storage] Atomic replace completed: {}/{}", directory, target);

            } catch (IOException e) {
                try {
                    Files.deleteIfExists(sourcePath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", sourcePath);
                }
                throw new UncheckedIOException("Atomic replace failed: " + directory + "/" + target, e);
            }
        });
    }

    @Override
    public Path resolve(String directory, String path) {
        return resolvePath(directory, path);
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
