/**
 * Flink job wiring: Kafka sources and sink, JSON schemas, and the keyed
 * operator that runs the anomaly engine and alert manager per source.
 */
package com.hostsentinel.flink;
