package com.phasegate.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.model.AuditLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AuditLog} stored as a JSON array. Each append rewrites the whole array
 * atomically, so an interrupted append leaves the previous log intact.
 */
public class JsonFileAuditLog implements AuditLog {

    private static final Logger log = LoggerFactory.getLogger(JsonFileAuditLog.class);
    private static final TypeReference<List<AuditLogEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileAuditLog(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public void append(AuditLogEntry entry) {
        List<AuditLogEntry> entries = new ArrayList<>(entries());
        entries.add(entry);
        try {
            AtomicFiles.write(file, mapper.writeValueAsString(entries));
        } catch (IOException e) {
            throw new PersistenceException("Failed to append to audit trail " + file, e);
        }
        log.debug("Audit entry #{} appended: phase={}, action={}, agent={}",
                entries.size(), entry.phase(), entry.action(), entry.agent());
    }

    @Override
    public List<AuditLogEntry> entries() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                throw new PersistenceException("Audit trail file is empty: " + file);
            }
            List<AuditLogEntry> entries = mapper.readValue(json, ENTRY_LIST);
            if (entries == null || entries.contains(null)) {
                throw new PersistenceException("Audit trail contains null records: " + file);
            }
            return List.copyOf(entries);
        } catch (IOException e) {
            throw new PersistenceException("Malformed audit trail in " + file + ": " + WorkflowJson.describe(e), e);
        }
    }

    public Path file() {
        return file;
    }
}
