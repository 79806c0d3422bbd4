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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkflowMetadata extends PatternMetadata {

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    private Integer estimatedMinutes;

    @Override
    public Set<Pattern.Kind> applicableKinds() {
        return Set.of(Pattern.Kind.WORKFLOW);
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (steps == null || steps.isEmpty()) {
            problems.add("workflow metadata needs at least one step");
        } else if (steps.stream().anyMatch(step -> step == null || step.isBlank())) {
            problems.add("workflow steps must not be blank");
        }
        if (estimatedMinutes != null && estimatedMinutes <= 0) {
            problems.add("estimatedMinutes must be positive");
        }
        return problems;
    }
}
