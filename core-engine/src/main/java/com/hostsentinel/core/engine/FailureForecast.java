package com.hostsentinel.core.engine;

import com.hostsentinel.core.model.MetricGroup;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-resource failure predictions. Only {@link MetricGroup#DISK} and
 * {@link MetricGroup#MEMORY} are forecast; a resource without a prediction
 * is simply absent.
 *
 * @since 1.0.0
 */
public final class FailureForecast {

    private static final FailureForecast NONE = new FailureForecast(Map.of());

    private final Map<MetricGroup, FailurePrediction> predictions;

    FailureForecast(Map<MetricGroup, FailurePrediction> predictions) {
        this.predictions = predictions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(predictions));
    }

    public static FailureForecast none() {
        return NONE;
    }

    public Optional<FailurePrediction> get(MetricGroup resource) {
        return Optional.ofNullable(predictions.get(resource));
    }

    public Optional<FailurePrediction> disk() {
        return get(MetricGroup.DISK);
    }

    public Optional<FailurePrediction> memory() {
        return get(MetricGroup.MEMORY);
    }

    public Map<MetricGroup, FailurePrediction> asMap() {
        return predictions;
    }

    public boolean isEmpty() {
        return predictions.isEmpty();
    }

    @Override
    public String toString() {
        return "FailureForecast" + predictions;
    }
}
