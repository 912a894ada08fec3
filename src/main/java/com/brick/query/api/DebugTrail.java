package com.brick.query.api;

import com.brick.query.core.model.PipelineStage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-stage diagnostics of one request, keyed by stage trace name
 * ({@code 1_intent_extraction} ... {@code 5_response_formatting}) in execution order.
 * Filled by the pipeline while the request runs; read-only afterwards.
 */
public final class DebugTrail {

    private final Map<String, Map<String, Object>> stages = new LinkedHashMap<>();

    DebugTrail() {
    }

    void put(PipelineStage stage, String key, Object value) {
        stages.computeIfAbsent(stage.getTraceName(), k -> new LinkedHashMap<>()).put(key, value);
    }

    public Map<String, Object> get(PipelineStage stage) {
        Map<String, Object> details = stages.get(stage.getTraceName());
        return details != null ? Collections.unmodifiableMap(details) : Map.of();
    }

    public boolean contains(PipelineStage stage) {
        return stages.containsKey(stage.getTraceName());
    }

    /**
     * All recorded stages; values may be {@code null} (an intent without entity type).
     */
    public Map<String, Map<String, Object>> asMap() {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        stages.forEach((stage, details) -> copy.put(stage, Collections.unmodifiableMap(new LinkedHashMap<>(details))));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "DebugTrail" + stages;
    }
}
