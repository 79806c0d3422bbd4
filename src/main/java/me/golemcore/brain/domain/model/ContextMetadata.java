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
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Namespace scoping for a pattern. Usable with any kind except anti-patterns.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextMetadata extends PatternMetadata {

    private String namespace;
    private String scope;

    @Override
    public Set<Pattern.Kind> applicableKinds() {
        return EnumSet.of(Pattern.Kind.CONTEXT, Pattern.Kind.PRINCIPLE, Pattern.Kind.WORKFLOW,
                Pattern.Kind.SOLUTION);
    }

    @Override
    public List<String> validate() {
        if (namespace == null || namespace.isBlank()) {
            return List.of("context metadata needs a namespace");
        }
        if (!namespace.matches("[a-z0-9][a-z0-9._-]*")) {
            return List.of("namespace must be lowercase letters, digits, dot, dash or underscore");
        }
        return List.of();
    }
}
