/**
 * Domain model shared by the detection core and the streaming job.
 *
 * <ul>
 * <li>{@link com.hostsentinel.core.model.Snapshot}: one telemetry sample</li>
 * <li>{@link com.hostsentinel.core.model.Finding}: transient detector output</li>
 * <li>{@link com.hostsentinel.core.model.Alert}: deduplicated finding aggregate
 * with an active/resolved lifecycle</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.model;
