package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw incident payload that enters the pipeline. Everything downstream is derived from it.
 *
 * <p>Common metric keys: {@code latency_p99_ms}, {@code latency_baseline_p99_ms},
 * {@code db_connection_pool_used}, {@code db_connection_pool_max}, {@code cache_hit_rate},
 * {@code cache_hit_rate_baseline}. {@code baselineConfig} is optional; when present, config
 * analysis compares against it instead of using heuristics.
 *
 * <p>All collections are copied and read-only, nested maps and lists included, so workers
 * sharing one instance cannot change what their siblings see. JSON {@code null} values are kept.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncidentInput(
    @JsonProperty("deploymentId")   String deploymentId,
    @JsonProperty("logs")           List<String> logs,
    @JsonProperty("metrics")        Map<String, Object> metrics,
    @JsonProperty("recentCommits")  List<CommitRecord> recentCommits,
    @JsonProperty("configSnapshot") Map<String, Object> configSnapshot,
    @JsonProperty("baselineConfig") Map<String, Object> baselineConfig
) {
    public IncidentInput {
        logs           = logs == null ? List.of() : List.copyOf(logs);
        metrics        = metrics == null ? Map.of() : readOnly(metrics);
        recentCommits  = recentCommits == null ? List.of() : List.copyOf(recentCommits);
        configSnapshot = configSnapshot == null ? Map.of() : readOnly(configSnapshot);
        baselineConfig = baselineConfig == null ? null : readOnly(baselineConfig);
    }

    public static IncidentInput of(String deploymentId, List<String> logs,
                                   Map<String, Object> metrics,
                                   List<CommitRecord> recentCommits,
                                   Map<String, Object> configSnapshot) {
        return new IncidentInput(deploymentId, logs, metrics, recentCommits, configSnapshot, null);
    }

    public static IncidentInput empty(String deploymentId) {
        return of(deploymentId, List.of(), Map.of(), List.of(), Map.of());
    }

    private static Map<String, Object> readOnly(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(key, readOnlyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object readOnlyValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            nested.forEach((key, item) -> copy.put(key, readOnlyValue(item)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(readOnlyValue(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
