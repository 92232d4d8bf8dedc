package com.hostsentinel.core.detection;

import com.hostsentinel.core.buffer.TelemetryBuffer;
import com.hostsentinel.core.config.DetectionConfig.OutlierSettings;
import com.hostsentinel.core.feature.FeatureExtractor;
import com.hostsentinel.core.feature.FeatureFamily;
import com.hostsentinel.core.feature.FeatureVector;
import com.hostsentinel.core.model.Finding;
import com.hostsentinel.core.model.FindingType;
import com.hostsentinel.core.model.Severity;
import com.hostsentinel.core.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Unsupervised outlier detector for one {@link FeatureFamily}.
 *
 * <p>
 * On every call where the buffer holds at least {@code minHistory}
 * snapshots, the detector extracts the family's vectors from the last
 * {@code window} snapshots, standardises them, refits an {@link OutlierModel}
 * on them and scores the current snapshot against that fresh fit. Refitting
 * every time keeps the baseline on the current operating regime.
 * </p>
 *
 * <p>
 * An outlier is reported as {@code high} when its decision score is below
 * {@code highSeverityScore}, otherwise {@code medium}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The last fitted model is cached for inspection. The cache is replaced
 * under its own lock; fitting itself runs outside of it.
 * </p>
 *
 * @since 1.0.0
 */
public class OutlierModelDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierModelDetector.class);

    private final FeatureFamily family;
    private final OutlierSettings settings;
    private final long seed;
    private final FindingType findingType;
    private final String description;

    private final Object cacheLock = new Object();
    private OutlierModel lastModel;

    /**
     * @param family   the feature family scored by this detector
     * @param settings window, ensemble and severity parameters
     * @param seed     random seed of every fit
     */
    public OutlierModelDetector(FeatureFamily family, OutlierSettings settings, long seed) {
        this.family = Objects.requireNonNull(family, "FeatureFamily must not be null");
        this.settings = Objects.requireNonNull(settings, "OutlierSettings must not be null");
        this.seed = seed;
        if (family == FeatureFamily.SYSTEM) {
            this.findingType = FindingType.SYSTEM_ANOMALY;
            this.description = "Unusual system behavior detected by ML model";
        } else {
            this.findingType = FindingType.NETWORK_ANOMALY;
            this.description = "Unusual network behavior detected";
        }
    }

    @Override
    public List<Finding> detect(Snapshot snapshot, TelemetryBuffer buffer) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        Objects.requireNonNull(buffer, "TelemetryBuffer must not be null");

        Optional<FeatureVector> current = FeatureExtractor.extract(snapshot, family);
        if (current.isEmpty()) {
            LOG.trace("[{}] no {} groups in snapshot from {} - skipping",
                    getName(), family, snapshot.getSourceId());
            return List.of();
        }
        if (buffer.size() < settings.getMinHistory()) {
            LOG.trace("[{}] history {} < {} - skipping", getName(), buffer.size(), settings.getMinHistory());
            return List.of();
        }

        List<double[]> rows = FeatureExtractor.extractRows(buffer.recent(settings.getWindow()), family);
        if (rows.size() < settings.getMinTrainingRows()) {
            LOG.trace("[{}] {} training rows < {} - skipping",
                    getName(), rows.size(), settings.getMinTrainingRows());
            return List.of();
        }

        try {
            OutlierModel model = OutlierModel.fit(rows, settings.getTrees(), settings.getContamination(), seed);
            synchronized (cacheLock) {
                lastModel = model;
            }

            double decision = model.decision(current.get().toArray());
            if (decision >= 0) {
                return List.of();
            }

            Severity severity = decision < settings.getHighSeverityScore() ? Severity.HIGH : Severity.MEDIUM;
            LOG.debug("[{}] outlier on {}: decision={} offset={} severity={}",
                    getName(), snapshot.getSourceId(), decision, model.offset(), severity.wireName());
            return List.of(Finding.builder()
                    .type(findingType)
                    .severity(severity)
                    .value(decision)
                    .description(description)
                    .build());
        } catch (RuntimeException e) {
            LOG.error("[{}] model fit or scoring failed for {}", getName(), snapshot.getSourceId(), e);
            return List.of();
        }
    }

    @Override
    public String getName() {
        return family == FeatureFamily.SYSTEM ? "system-outlier" : "network-outlier";
    }

    public FeatureFamily getFamily() {
        return family;
    }

    /**
     * @return the model fitted by the most recent scoring call, if any
     */
    Optional<OutlierModel> lastModel() {
        synchronized (cacheLock) {
            return Optional.ofNullable(lastModel);
        }
    }

    /**
     * Drop the cached model. The next call refits from the buffer anyway.
     */
    public void reset() {
        synchronized (cacheLock) {
            lastModel = null;
        }
    }
}
