package com.patentflow.orchestrator.stage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Static configuration of one pipeline stage.
 *
 * The engine is generic; everything that differs between stages lives here:
 * liveness timeout, heartbeat cadence, which remote endpoint to call, how step
 * ids are prefixed, which record fields must be present, how to build the
 * payload, and how result keys map back onto record fields and artifacts.
 *
 * fieldMapping is keyed by record field, so one result key may fill several
 * fields (e.g. "final_tech" lands in both "final_tech" and "tech").
 */
public record StageDefinition(
        String key,
        String label,
        Duration timeout,
        Duration heartbeatInterval,
        String endpointName,
        String stepIdPrefix,
        List<String> requiredFields,
        Map<String, String> fieldMapping,
        Map<String, ArtifactOutput> artifactOutputs,
        PayloadBuilder payloadBuilder
) {
    public StageDefinition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(endpointName, "endpointName");
        Objects.requireNonNull(stepIdPrefix, "stepIdPrefix");
        Objects.requireNonNull(payloadBuilder, "payloadBuilder");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Stage '" + key + "': timeout must be positive");
        }
        if (heartbeatInterval.compareTo(timeout) >= 0) {
            throw new IllegalArgumentException("Stage '" + key + "': heartbeat interval "
                    + heartbeatInterval + " must be shorter than the timeout " + timeout);
        }
        if (stepIdPrefix.contains("-")) {
            throw new IllegalArgumentException("Stage '" + key + "': step id prefix must not contain '-'");
        }
        label           = label == null ? key : label;
        requiredFields  = List.copyOf(requiredFields);
        fieldMapping    = Collections.unmodifiableMap(new LinkedHashMap<>(fieldMapping));
        artifactOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(artifactOutputs));
    }

    public String doneTopic()   { return key + "_done"; }
    public String failedTopic() { return key + "_failed"; }

    /** Required fields that are missing or blank according to the given check. */
    public List<String> missingInputs(Predicate<String> hasText) {
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (!hasText.test(field)) missing.add(field);
        }
        return missing;
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {
        private final String key;
        private String label;
        private Duration timeout = Duration.ofMinutes(30);
        private Duration heartbeatInterval = Duration.ofSeconds(100);
        private String endpointName;
        private String stepIdPrefix;
        private final List<String> requiredFields = new ArrayList<>();
        private final Map<String, String> fieldMapping = new LinkedHashMap<>();
        private final Map<String, ArtifactOutput> artifactOutputs = new LinkedHashMap<>();
        private PayloadBuilder payloadBuilder;

        private Builder(String key) {
            this.key = key;
            this.endpointName = key;
        }

        public Builder label(String v)                { this.label = v; return this; }
        public Builder timeout(Duration v)            { this.timeout = v; return this; }
        public Builder heartbeatInterval(Duration v)  { this.heartbeatInterval = v; return this; }
        public Builder endpoint(String v)             { this.endpointName = v; return this; }
        public Builder stepIdPrefix(String v)         { this.stepIdPrefix = v; return this; }
        public Builder requires(String... fields)     { this.requiredFields.addAll(List.of(fields)); return this; }
        public Builder payload(PayloadBuilder v)      { this.payloadBuilder = v; return this; }

        /** Result key and record field share the same name. */
        public Builder maps(String... keys) {
            for (String k : keys) fieldMapping.put(k, k);
            return this;
        }

        public Builder mapsTo(String resultKey, String recordField) {
            fieldMapping.put(recordField, resultKey);
            return this;
        }

        public Builder artifact(String resultKey, ArtifactOutput output) {
            artifactOutputs.put(resultKey, output);
            return this;
        }

        public StageDefinition build() {
            return new StageDefinition(key, label, timeout, heartbeatInterval, endpointName,
                    stepIdPrefix, requiredFields, fieldMapping, artifactOutputs, payloadBuilder);
        }
    }
}
