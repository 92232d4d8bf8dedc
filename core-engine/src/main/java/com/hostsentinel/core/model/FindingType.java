package com.hostsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of finding kinds the detectors can emit.
 *
 * <p>
 * Each kind carries the remediation tag attached to every finding of that
 * kind and the fuller {@link RemediationPlan} an operator or agent may act on.
 * </p>
 *
 * @since 1.0.0
 */
public enum FindingType {

    SYSTEM_ANOMALY("investigate_system_resources", RemediationPlan.MANUAL_INVESTIGATION),

    NETWORK_ANOMALY("check_network_connectivity", RemediationPlan.MANUAL_INVESTIGATION),

    CPU_THRESHOLD_BREACH("identify_cpu_intensive_processes", new RemediationPlan(
            List.of("kill_high_cpu_processes", "restart_services", "scale_horizontally"),
            List.of("kill_top_cpu_process.sh", "restart_critical_services.sh"),
            Severity.HIGH)),

    MEMORY_THRESHOLD_BREACH("free_memory_resources", new RemediationPlan(
            List.of("clear_cache", "restart_memory_intensive_services", "enable_swap"),
            List.of("clear_system_cache.sh", "restart_services.sh"),
            Severity.HIGH)),

    DISK_THRESHOLD_BREACH("cleanup_disk_space", new RemediationPlan(
            List.of("cleanup_temp_files", "rotate_logs", "compress_old_files"),
            List.of("disk_cleanup.sh", "log_rotation.sh"),
            Severity.CRITICAL)),

    NETWORK_LATENCY_HIGH("check_network_connectivity", new RemediationPlan(
            List.of("restart_network_services", "flush_dns_cache", "check_firewall_rules"),
            List.of("network_reset.sh", "dns_flush.sh"),
            Severity.MEDIUM)),

    CPU_TREND_ANOMALY("investigate_cpu_spike", RemediationPlan.MANUAL_INVESTIGATION),

    MEMORY_LEAK_PATTERN("investigate_memory_leak", new RemediationPlan(
            List.of("restart_suspected_services", "dump_memory_analysis", "enable_memory_monitoring"),
            List.of("restart_leaky_services.sh", "memory_dump.sh"),
            Severity.HIGH));

    private final String suggestedAction;
    private final RemediationPlan remediation;

    FindingType(String suggestedAction, RemediationPlan remediation) {
        this.suggestedAction = suggestedAction;
        this.remediation = remediation;
    }

    /**
     * @return the wire name, e.g. {@code cpu_threshold_breach}
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String suggestedAction() {
        return suggestedAction;
    }

    public RemediationPlan remediation() {
        return remediation;
    }

    /**
     * Resolve a wire name back to its constant.
     *
     * @param wireName e.g. {@code memory_leak_pattern}; case-insensitive
     * @return the constant, or empty if the name is unknown
     */
    public static Optional<FindingType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String normalised = wireName.trim().toUpperCase(Locale.ROOT);
        for (FindingType type : values()) {
            if (type.name().equals(normalised)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static FindingType fromJson(String wireName) {
        return fromWireName(wireName).orElseThrow(() ->
                new IllegalArgumentException("Unknown finding type: '" + wireName + "'"));
    }
}
