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

import me.golemcore.brain.domain.model.FileHotspot;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.springframework.stereotype.Component;

/**
 * Maps a churn rate to a stability class. Monotonic: a higher churn rate never
 * yields a less severe class.
 */
@Component
public class HotspotClassifier {

    private final double lowThreshold;
    private final double highThreshold;
    private final double criticalThreshold;

    public HotspotClassifier(BrainProperties properties) {
        BrainProperties.ContextProperties context = properties.getContext();
        this.lowThreshold = context.getChurnLowThreshold();
        this.highThreshold = context.getChurnHighThreshold();
        this.criticalThreshold = context.getChurnCriticalThreshold();
        if (lowThreshold > highThreshold || highThreshold > criticalThreshold) {
            throw new IllegalArgumentException("Churn thresholds must satisfy low <= high <= critical");
        }
    }

    public FileHotspot.Stability classify(double churnRate) {
        if (churnRate >= highThreshold) {
            return FileHotspot.Stability.UNSTABLE;
        }
        if (churnRate <= lowThreshold) {
            return FileHotspot.Stability.STABLE;
        }
        return FileHotspot.Stability.MODERATE;
    }

    public boolean isCritical(double churnRate) {
        return churnRate > criticalThreshold;
    }
}
