/**
 * YAML configuration of the detectors, the engine and the alert manager.
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.config;
