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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Something mentioned in conversations: a file, a code symbol or a concept.
 * Lives as long as at least one retained conversation references it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Entity {

    public enum Kind {
        FILE, SYMBOL, CONCEPT
    }

    private String key;
    private Kind kind;
    private String name;
    private Instant firstSeen;
    private Instant lastSeen;
    private int occurrenceCount;

    @Builder.Default
    private Map<String, Integer> occurrencesByConversation = new LinkedHashMap<>();

    public static String keyOf(Kind kind, String name) {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + name;
    }
}
