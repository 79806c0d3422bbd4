package me.golemcore.brain.port.outbound;

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

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the files behind the tier stores. Each tier owns one directory
 * (tier1, tier2, tier3) holding its embedded database plus a backup script.
 */
public interface StoragePort {

    /**
     * Suffix of the backup kept next to each store.
     */
    String BACKUP_SUFFIX = ".bak";

    /**
     * Absolute location of a file inside the storage root. Paths escaping the
     * root are rejected.
     *
     * @throws IllegalArgumentException
     *             on path traversal
     */
    Path resolve(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Replace {@code target} with {@code source} so that readers see either the
     * old or the new file, never a partial one.
     *
     * <p>
     * The source is fsynced first and then renamed over the target with an
     * atomic move where the filesystem supports it.
     */
    CompletableFuture<Void> replaceAtomic(String directory, String source, String target);

    /**
     * Move an unreadable file out of the way so a recovered version can take its
     * place. The file is renamed with a {@code .corrupt-<epochMillis>} suffix.
     *
     * @return the relative name the file was moved to, or {@code null} when there
     *         was nothing to move
     */
    CompletableFuture<String> quarantine(String directory, String path);

    /**
     * Ensure directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);
}
