package me.golemcore.brain.domain.model;

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

/**
 * Failure categories reported through {@link MemoryResult}.
 */
public enum MemoryFailureKind {
    /** Malformed input, rejected before anything was written. */
    VALIDATION,
    /** Broken reference or uniqueness constraint, nothing persisted. */
    INTEGRITY,
    /** Maintenance requested too soon; the prior result is returned. */
    THROTTLED,
    /** A store file was unreadable and has been recovered. */
    CORRUPTION,
    /** Writing a store file failed and the transaction rolled back. */
    STORAGE
}
