package com.patentflow.orchestrator.stage;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only snapshot of everything a payload builder may use.
 *
 * Taken once per run so the remote payload never observes a half-written record.
 */
public record StageInputs(UUID recordId,
                          String reference,
                          String stepId,
                          String scratchDir,
                          Map<String, String> fields) {

    public StageInputs {
        fields = Collections.unmodifiableMap(new HashMap<>(fields));
    }

    /** Field value, or "" when absent. */
    public String text(String name) {
        String value = fields.get(name);
        return value == null ? "" : value;
    }
}
