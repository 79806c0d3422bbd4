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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Set;

/**
 * Kind-specific extra fields of a pattern. Stored with a {@code type}
 * discriminator and validated when the pattern is written.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WorkflowMetadata.class, name = "workflow"),
        @JsonSubTypes.Type(value = SolutionMetadata.class, name = "solution"),
        @JsonSubTypes.Type(value = AntiPatternMetadata.class, name = "anti_pattern"),
        @JsonSubTypes.Type(value = ContextMetadata.class, name = "context")
})
public abstract class PatternMetadata {

    /**
     * Pattern kinds this metadata may be attached to.
     */
    @JsonIgnore
    public abstract Set<Pattern.Kind> applicableKinds();

    /**
     * Problems with the field values, empty when valid.
     */
    public abstract List<String> validate();
}
