package com.triageplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IncidentInputTest {

    @Test
    @DisplayName("caller mutations after construction are not visible")
    void copiesMaps() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("db_connection_pool_used", 20);
        Map<String, Object> baseline = new HashMap<>();
        baseline.put("MAX_DB_CONNECTIONS", 20);

        IncidentInput incident = new IncidentInput("deploy-1", List.of(), metrics, List.of(), Map.of(), baseline);
        metrics.put("db_connection_pool_used", -1);
        baseline.clear();

        assertEquals(20, incident.metrics().get("db_connection_pool_used"));
        assertEquals(20, incident.baselineConfig().get("MAX_DB_CONNECTIONS"));
    }

    @Test
    @DisplayName("maps are read-only, nested maps and lists included")
    void readOnly() {
        Map<String, Object> flags = new HashMap<>();
        flags.put("new_checkout", true);
        Map<String, Object> config = new HashMap<>();
        config.put("FEATURE_FLAGS", flags);
        config.put("ALLOWED_HOSTS", new java.util.ArrayList<>(List.of("a", "b")));

        IncidentInput incident = new IncidentInput("deploy-2", List.of(), Map.of(), List.of(), config, null);

        assertThrows(UnsupportedOperationException.class, () -> incident.configSnapshot().put("X", 1));
        @SuppressWarnings("unchecked")
        Map<String, Object> nested = (Map<String, Object>) incident.configSnapshot().get("FEATURE_FLAGS");
        assertThrows(UnsupportedOperationException.class, () -> nested.put("new_checkout", false));
        @SuppressWarnings("unchecked")
        List<Object> hosts = (List<Object>) incident.configSnapshot().get("ALLOWED_HOSTS");
        assertThrows(UnsupportedOperationException.class, () -> hosts.add("c"));
        assertNull(incident.baselineConfig());
    }

    @Test
    @DisplayName("JSON null values survive the copy")
    void nullValues() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("cache_hit_rate", null);

        IncidentInput incident = IncidentInput.of("deploy-3", null, metrics, null, null);

        assertTrue(incident.metrics().containsKey("cache_hit_rate"));
        assertNull(incident.metrics().get("cache_hit_rate"));
        assertTrue(incident.logs().isEmpty());
        assertTrue(incident.configSnapshot().isEmpty());
    }
}
