package com.phasegate.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "phasegate")
public class PhaseGateProperties {

    private String home = ".";
    private FileLocations files = new FileLocations();

    // -- Resolved paths (relative locations are taken against home) --
    public Path getStateFile() { return resolve(files.state); }
    public Path getAuditFile() { return resolve(files.audit); }
    public Path getPhaseMapFile() { return resolve(files.phaseMap); }
    public Path getAuditCsvFile() { return resolve(files.auditCsv); }

    private Path resolve(String location) {
        Path path = Path.of(location);
        return path.isAbsolute() ? path : Path.of(home).resolve(path).normalize();
    }

    public String getHome() { return home; }
    public void setHome(String home) { this.home = home; }
    public FileLocations getFiles() { return files; }
    public void setFiles(FileLocations files) { this.files = files; }

    public static class FileLocations {
        private String state = "state/state_schema.json";
        private String audit = "logs/audit_trail.json";
        private String phaseMap = "config/phase_agent_map.json";
        private String auditCsv = "logs/audit_trail.csv";

        public String getState() { return state; }
        public void setState(String state) { this.state = state; }
        public String getAudit() { return audit; }
        public void setAudit(String audit) { this.audit = audit; }
        public String getPhaseMap() { return phaseMap; }
        public void setPhaseMap(String phaseMap) { this.phaseMap = phaseMap; }
        public String getAuditCsv() { return auditCsv; }
        public void setAuditCsv(String auditCsv) { this.auditCsv = auditCsv; }
    }
}
