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

import me.golemcore.brain.domain.model.Entity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls file, symbol and concept mentions out of conversation text.
 *
 * <p>
 * Recognized forms:
 * <ul>
 * <li>file paths with a known extension, bare or in backticks
 * ({@code src/app/Main.java})</li>
 * <li>PascalCase identifiers in backticks ({@code `WorkingMemory`})</li>
 * <li>calls in backticks ({@code `apply_decay()`}, {@code `getRecent()`})</li>
 * <li>hashtags as concepts ({@code #refactoring})</li>
 * </ul>
 */
@Component
public class EntityExtractor {

    private static final Pattern FILE_PATTERN = Pattern.compile(
            "(?<![\\w/.-])((?:[\\w.-]+/)*[\\w-]+\\.(?:java|kt|py|ts|tsx|js|jsx|go|rs|cs|rb|md|yaml|yml|json|xml"
                    + "|properties|sql|sh|txt|css|html|gradle|toml))(?![\\w/])");
    private static final Pattern CLASS_PATTERN = Pattern.compile("`([A-Z][A-Za-z0-9_]*)`");
    private static final Pattern CALL_PATTERN = Pattern.compile("`([A-Za-z_][A-Za-z0-9_.]*)\\(\\)`");
    private static final Pattern CONCEPT_PATTERN = Pattern.compile("(?<![\\w#])#([a-z][a-z0-9-]{1,40})\\b");

    /**
     * A single distinct mention found in text.
     */
    public record Mention(Entity.Kind kind, String name) {
    }

    public List<Mention> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<Mention> mentions = new LinkedHashSet<>();
        collect(FILE_PATTERN, text, Entity.Kind.FILE, mentions);
        collect(CLASS_PATTERN, text, Entity.Kind.SYMBOL, mentions);
        collect(CALL_PATTERN, text, Entity.Kind.SYMBOL, mentions);
        collect(CONCEPT_PATTERN, text, Entity.Kind.CONCEPT, mentions);
        return new ArrayList<>(mentions);
    }

    private static void collect(Pattern pattern, String text, Entity.Kind kind, Set<Mention> sink) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            sink.add(new Mention(kind, matcher.group(1)));
        }
    }
}
