package com.phasegate.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.model.PhaseCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only assignment of agents to phases, loaded once per run.
 * <p>
 * The persisted form is a JSON object keyed by phase number as a string:
 * {@code {"0": "Planner", "7": "Market Intelligence"}}. Phases without an entry
 * resolve to {@link #UNKNOWN_AGENT}.
 */
public final class PhaseAgentMap {

    private static final Logger log = LoggerFactory.getLogger(PhaseAgentMap.class);
    private static final TypeReference<Map<String, String>> RAW_MAP = new TypeReference<>() {};

    public static final String UNKNOWN_AGENT = "Unknown Agent";

    private final Map<Integer, String> agents;

    public PhaseAgentMap(Map<Integer, String> agents) {
        this.agents = Collections.unmodifiableMap(new TreeMap<>(agents));
    }

    public static PhaseAgentMap empty() {
        return new PhaseAgentMap(Map.of());
    }

    /**
     * Loads the map from {@code file}. A missing file yields an empty map.
     *
     * @throws PersistenceException if the file exists but is not a valid phase-agent map
     */
    public static PhaseAgentMap load(Path file, ObjectMapper mapper) {
        if (!Files.exists(file)) {
            log.warn("No phase-agent map at {}; every phase resolves to '{}'", file, UNKNOWN_AGENT);
            return empty();
        }
        Map<String, String> raw;
        try {
            raw = mapper.readValue(Files.readString(file, StandardCharsets.UTF_8), RAW_MAP);
        } catch (IOException e) {
            throw new PersistenceException("Malformed phase-agent map in " + file + ": " + WorkflowJson.describe(e), e);
        }
        if (raw == null) {
            throw new PersistenceException("Phase-agent map is null: " + file);
        }

        Map<Integer, String> agents = new TreeMap<>();
        for (var entry : raw.entrySet()) {
            int phase = parsePhase(entry.getKey(), file);
            String agent = entry.getValue();
            if (agent == null || agent.isBlank()) {
                throw new PersistenceException("Blank agent name for phase " + phase + " in " + file);
            }
            agents.put(phase, agent.strip());
        }
        log.info("Loaded phase-agent map from {} ({} of {} phases assigned)",
                file, agents.size(), PhaseCatalog.LAST_PHASE + 1);
        return new PhaseAgentMap(agents);
    }

    private static int parsePhase(String key, Path file) {
        int phase;
        try {
            phase = Integer.parseInt(key.strip());
        } catch (NumberFormatException e) {
            throw new PersistenceException("Phase key '" + key + "' is not a number in " + file, e);
        }
        if (!PhaseCatalog.isGated(phase)) {
            throw new PersistenceException("Phase key " + phase + " outside [0, 13] in " + file);
        }
        return phase;
    }

    public Optional<String> find(int phase) {
        return Optional.ofNullable(agents.get(phase));
    }

    public String agentFor(int phase) {
        return agents.getOrDefault(phase, UNKNOWN_AGENT);
    }

    public Map<Integer, String> asMap() {
        return agents;
    }
}
