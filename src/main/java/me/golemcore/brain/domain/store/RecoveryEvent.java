package me.golemcore.brain.domain.store;

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

import java.time.Instant;

/**
 * Record of a store file that could not be read on open and how it was
 * recovered.
 */
public record RecoveryEvent(String store, Outcome outcome, String reason, String quarantinedAs, Instant occurredAt) {

    public enum Outcome {
        RESTORED_FROM_BACKUP, RESET_TO_EMPTY
    }
}
