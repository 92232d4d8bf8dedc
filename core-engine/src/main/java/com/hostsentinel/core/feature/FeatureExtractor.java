package com.hostsentinel.core.feature;

import com.hostsentinel.core.model.Snapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps snapshots to {@link FeatureVector}s.
 *
 * <p>
 * A snapshot yields no vector for a family when it carries none of the
 * family's metric groups. Otherwise every position is filled, with 0 for
 * each missing field or missing group.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureExtractor {

    private FeatureExtractor() {
        // utility class
    }

    public static Optional<FeatureVector> extract(Snapshot snapshot, FeatureFamily family) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(family, "family must not be null");

        boolean present = family.groups().stream().anyMatch(snapshot::hasGroup);
        if (!present) {
            return Optional.empty();
        }

        List<FeatureFamily.Field> fields = family.fields();
        double[] values = new double[fields.size()];
        for (int i = 0; i < values.length; i++) {
            FeatureFamily.Field field = fields.get(i);
            values[i] = snapshot.getValueOrZero(field.group(), field.name());
        }
        return Optional.of(new FeatureVector(family, values));
    }

    /**
     * Extract one row per snapshot, skipping snapshots without the family.
     *
     * @return rows in input order
     */
    public static List<double[]> extractRows(List<Snapshot> snapshots, FeatureFamily family) {
        List<double[]> rows = new ArrayList<>(snapshots.size());
        for (Snapshot snapshot : snapshots) {
            extract(snapshot, family).ifPresent(v -> rows.add(v.toArray()));
        }
        return rows;
    }
}
