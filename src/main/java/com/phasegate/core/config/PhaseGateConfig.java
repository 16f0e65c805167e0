package com.phasegate.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.persistence.AuditCsvExporter;
import com.phasegate.core.persistence.WorkflowJson;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the workflow core.
 */
@Configuration
public class PhaseGateConfig {

    /** Strict mapper for state, audit trail and phase map files. */
    @Bean
    public ObjectMapper objectMapper() {
        return WorkflowJson.newMapper();
    }

    /** Audit timestamps are always UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuditCsvExporter auditCsvExporter() {
        return new AuditCsvExporter();
    }
}
