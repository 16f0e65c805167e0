package com.phasegate.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.model.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link StateStore} backed by a single JSON document on disk.
 */
public class JsonFileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileStateStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public WorkflowState load() {
        if (!Files.exists(file)) {
            log.info("No workflow state at {}, starting from phase 0", file);
            return WorkflowState.initial();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                throw new PersistenceException("Workflow state file is empty: " + file);
            }
            WorkflowState state = mapper.readValue(json, WorkflowState.class);
            log.debug("Loaded workflow state from {}: phase={}, status={}",
                    file, state.currentPhase(), state.status());
            return state;
        } catch (IOException e) {
            throw new PersistenceException("Malformed workflow state in " + file + ": " + WorkflowJson.describe(e), e);
        }
    }

    @Override
    public void save(WorkflowState state) {
        try {
            AtomicFiles.write(file, mapper.writeValueAsString(state));
            log.debug("Saved workflow state to {}: phase={}, status={}",
                    file, state.currentPhase(), state.status());
        } catch (IOException e) {
            throw new PersistenceException("Failed to write workflow state to " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
