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

import me.golemcore.brain.domain.model.Pattern;
import me.golemcore.brain.domain.model.PatternMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Write-time validation of pattern fields: required text, confidence range,
 * tag shape and kind-compatible metadata.
 */
@Component
public class PatternMetadataValidator {

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_TAG_LENGTH = 64;
    static final int MAX_TAGS = 32;
    private static final java.util.regex.Pattern ID_PATTERN = java.util.regex.Pattern.compile("[A-Za-z0-9._:-]{1,100}");

    public List<String> validate(Pattern pattern) {
        List<String> problems = new ArrayList<>();
        if (pattern.getId() != null && !ID_PATTERN.matcher(pattern.getId()).matches()) {
            problems.add("id may only contain letters, digits, dot, colon, dash or underscore");
        }
        if (pattern.getTitle() == null || pattern.getTitle().isBlank()) {
            problems.add("title must not be blank");
        } else if (pattern.getTitle().length() > MAX_TITLE_LENGTH) {
            problems.add("title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
        if (pattern.getBody() == null || pattern.getBody().isBlank()) {
            problems.add("body must not be blank");
        }
        if (pattern.getKind() == null) {
            problems.add("kind is required");
        }
        Double confidence = pattern.getConfidence();
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            problems.add("confidence must be within [0, 1]");
        }
        if (pattern.getTags() != null) {
            if (pattern.getTags().size() > MAX_TAGS) {
                problems.add("at most " + MAX_TAGS + " tags are allowed");
            }
            for (String tag : pattern.getTags()) {
                if (tag == null || tag.isBlank()) {
                    problems.add("tags must not be blank");
                    break;
                }
                if (tag.length() > MAX_TAG_LENGTH) {
                    problems.add("tag exceeds " + MAX_TAG_LENGTH + " characters: " + tag);
                }
            }
        }
        problems.addAll(validateMetadata(pattern.getKind(), pattern.getMetadata()));
        return problems;
    }

    public List<String> validateMetadata(Pattern.Kind kind, PatternMetadata metadata) {
        if (metadata == null) {
            return List.of();
        }
        List<String> problems = new ArrayList<>(metadata.validate());
        if (kind != null && !metadata.applicableKinds().contains(kind)) {
            problems.add(metadata.getClass().getSimpleName() + " does not apply to " + kind + " patterns");
        }
        return problems;
    }

    /**
     * Lower-cased, trimmed, de-duplicated tags in first-seen order.
     */
    public static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return new ArrayList<>();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                normalized.add(tag.strip().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(normalized);
    }
}
