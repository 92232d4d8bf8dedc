/**
 * Anomaly engine: per-snapshot detector orchestration plus the health,
 * failure-prediction and performance queries.
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.engine;
