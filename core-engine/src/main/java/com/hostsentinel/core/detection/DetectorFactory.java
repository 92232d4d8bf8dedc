package com.hostsentinel.core.detection;

import com.hostsentinel.core.config.DetectionConfig;
import com.hostsentinel.core.feature.FeatureFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Creates the standard detector set from a {@link DetectionConfig}.
 *
 * <p>
 * Each call returns fresh instances, so every history (one per source, or
 * the shared one) owns its own model caches.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create the system outlier, network outlier, threshold and trend
     * detectors. Outlier detectors disabled in the configuration are left out.
     *
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        DetectionConfig.OutlierConfig outlier = config.getOutlier();

        List<AnomalyDetector> detectors = new ArrayList<>(4);
        if (outlier.getSystem().isEnabled()) {
            detectors.add(new OutlierModelDetector(FeatureFamily.SYSTEM, outlier.getSystem(), outlier.getRandomSeed()));
        }
        if (outlier.getNetwork().isEnabled()) {
            detectors.add(new OutlierModelDetector(FeatureFamily.NETWORK, outlier.getNetwork(), outlier.getRandomSeed()));
        }
        detectors.add(new ThresholdDetector(config.getThresholds()));
        detectors.add(new TrendDetector(config.getTrend()));

        LOG.debug("Created {} detector(s): {}", detectors.size(),
                detectors.stream().map(AnomalyDetector::getName).toList());
        return Collections.unmodifiableList(detectors);
    }
}
