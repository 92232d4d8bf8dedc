/**
 * Detector set: the outlier-model, threshold and trend strategies.
 *
 * <p>
 * All detectors implement
 * {@link com.hostsentinel.core.detection.AnomalyDetector} and are created by
 * {@link com.hostsentinel.core.detection.DetectorFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.detection;
