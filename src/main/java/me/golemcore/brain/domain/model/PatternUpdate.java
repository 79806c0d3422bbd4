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

import java.util.List;

/**
 * Partial update of a pattern. Null fields are left unchanged. Confidence is
 * deliberately absent: it only moves through decay or reinforcement.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatternUpdate {

    private String title;
    private String body;
    private Pattern.Kind kind;
    private List<String> tags;
    private String source;
    private PatternMetadata metadata;
    private Boolean pinned;
    private Boolean immutable;
}
