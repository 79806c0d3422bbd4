package me.golemcore.brain.domain.service;

import me.golemcore.brain.domain.model.FileHotspot;
import me.golemcore.brain.infrastructure.config.BrainProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class HotspotClassifierTest {

    private final HotspotClassifier classifier = new HotspotClassifier(new BrainProperties());

    @ParameterizedTest
    @CsvSource({
            "0.0, STABLE",
            "0.10, STABLE",
            "0.11, MODERATE",
            "0.19, MODERATE",
            "0.20, UNSTABLE",
            "0.95, UNSTABLE"
    })
    void shouldClassifyByThresholds(double churn, FileHotspot.Stability expected) {
        assertEquals(expected, classifier.classify(churn));
    }

    @Test
    void shouldNeverDowngradeAsChurnGrows() {
        FileHotspot.Stability previous = classifier.classify(0.0);
        for (int i = 1; i <= 100; i++) {
            FileHotspot.Stability current = classifier.classify(i / 100.0);
            assertTrue(current.ordinal() >= previous.ordinal(), "churn " + i / 100.0);
            previous = current;
        }
    }

    @Test
    void shouldFlagCriticalOnlyAboveThreshold() {
        assertFalse(classifier.isCritical(0.30));
        assertTrue(classifier.isCritical(0.31));
    }

    @Test
    void shouldRejectUnorderedThresholds() {
        BrainProperties properties = new BrainProperties();
        properties.getContext().setChurnLowThreshold(0.5);

        assertThrows(IllegalArgumentException.class, () -> new HotspotClassifier(properties));
    }
}
