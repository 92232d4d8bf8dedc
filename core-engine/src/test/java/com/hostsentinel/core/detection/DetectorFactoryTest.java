package com.hostsentinel.core.detection;

import com.hostsentinel.core.config.DetectionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Default config creates all four detectors in order")
    void shouldCreateAllDetectors() {
        List<AnomalyDetector> detectors = DetectorFactory.createAll(new DetectionConfig());

        assertThat(detectors).extracting(AnomalyDetector::getName)
                .containsExactly("system-outlier", "network-outlier", "threshold", "trend");
    }

    @Test
    @DisplayName("Disabled outlier families are left out")
    void shouldSkipDisabledFamilies() {
        DetectionConfig config = new DetectionConfig();
        config.getOutlier().getNetwork().setEnabled(false);

        assertThat(DetectorFactory.createAll(config)).extracting(AnomalyDetector::getName)
                .containsExactly("system-outlier", "threshold", "trend");
    }

    @Test
    @DisplayName("Each call returns fresh detector instances")
    void shouldCreateFreshInstances() {
        DetectionConfig config = new DetectionConfig();

        assertThat(DetectorFactory.createAll(config).get(0))
                .isNotSameAs(DetectorFactory.createAll(config).get(0));
    }
}
