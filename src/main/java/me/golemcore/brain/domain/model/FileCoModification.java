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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Two files that were touched by the same conversation turn. Frequency is the
 * sum of per-conversation contributions so evicting a conversation removes its
 * share. Confidence is computed when read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FileCoModification {

    private String firstFile;
    private String secondFile;
    private int frequency;
    private double confidence;

    @Builder.Default
    private Map<String, Integer> contributions = new LinkedHashMap<>();

    /**
     * Order-independent key of a file pair.
     */
    public static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
