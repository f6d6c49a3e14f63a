package com.company.matching.api;

import com.company.matching.audit.JsonLinesOracleAuditLog;
import com.company.matching.audit.OracleAuditLog;
import com.company.matching.metrics.MetricsService;
import com.company.matching.metrics.NoOpMetricsService;
import com.company.matching.oracle.OracleAvailability;
import com.company.matching.oracle.OracleConnector;
import com.company.matching.oracle.OracleSettings;

import java.util.Objects;

/**
 * Run-scoped collaborators of the matching pipeline, built once and passed in explicitly.
 * Oracle construction happens here, so an unavailable oracle is known before the run starts.
 */
public final class PipelineContext {

    private final OracleAvailability oracleAvailability;
    private final OracleAuditLog auditLog;
    private final MetricsService metricsService;

    public PipelineContext(OracleAvailability oracleAvailability, OracleAuditLog auditLog,
                           MetricsService metricsService) {
        this.oracleAvailability = Objects.requireNonNull(oracleAvailability, "oracleAvailability is required");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Connects the configured oracle and uses the default audit log file.
     */
    public static PipelineContext create(OracleSettings settings) {
        return create(settings, new JsonLinesOracleAuditLog(), new NoOpMetricsService());
    }

    public static PipelineContext create(OracleSettings settings, OracleAuditLog auditLog,
                                         MetricsService metricsService) {
        OracleAvailability availability = new OracleConnector().connect(settings);
        return new PipelineContext(availability, auditLog, metricsService);
    }

    public OracleAvailability getOracleAvailability() {
        return oracleAvailability;
    }

    public OracleAuditLog getAuditLog() {
        return auditLog;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }
}
