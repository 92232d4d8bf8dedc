package com.hostsentinel.core.engine;

/**
 * Linear extrapolation of one resource towards its failure limit.
 *
 * @param timeToFailure sample intervals until the limit is reached; 0 if
 *                      the resource is already past it
 * @param confidence    slope-scaled heuristic in {@code (0, cap]}
 * @param currentUsage  latest usage, in percent
 * @param trend         fitted slope, in percentage points per interval
 * @since 1.0.0
 */
public record FailurePrediction(long timeToFailure, double confidence, double currentUsage, double trend) {
}
