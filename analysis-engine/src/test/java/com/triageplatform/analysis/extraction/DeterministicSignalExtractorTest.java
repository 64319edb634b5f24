package com.triageplatform.analysis.extraction;

import com.triageplatform.common.model.CommitRecord;
import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeterministicSignalExtractorTest {

    private static IncidentInput badDeploy() {
        List<String> logs = new ArrayList<>();
        for (int i = 0; i < 8; i++) logs.add("INFO request served");
        for (int i = 0; i < 12; i++) logs.add("ERROR Connection pool exhausted");
        return IncidentInput.of("deploy-42", logs,
            Map.of("latency_p99_ms", 2400, "latency_baseline_p99_ms", 200,
                   "db_connection_pool_used", 20, "db_connection_pool_max", 20),
            List.of(CommitRecord.of("abc123", "Reduce MAX_DB_CONNECTIONS from 20 to 5", "")),
            Map.of("MAX_DB_CONNECTIONS", 5));
    }

    private static SignalAnalyzer fixed(String name, Signal... signals) {
        return new SignalAnalyzer() {
            @Override
            public List<Signal> analyze(IncidentInput incident) {
                return List.of(signals);
            }

            @Override
            public String analyzerName() {
                return name;
            }
        };
    }

    @Test
    @DisplayName("ids are sequential across analyzers")
    void sequentialIds() {
        List<Signal> signals = new DeterministicSignalExtractor().extract(badDeploy());

        assertTrue(signals.size() >= 5);
        for (int i = 0; i < signals.size(); i++) {
            assertEquals(String.format("sig_%03d", i + 1), signals.get(i).id());
        }
        assertEquals("log_analyzer", signals.get(0).source());
        assertEquals("config_analyzer", signals.get(signals.size() - 1).source());
    }

    @Test
    @DisplayName("same input → same signals")
    void deterministic() {
        DeterministicSignalExtractor extractor = new DeterministicSignalExtractor();
        assertEquals(extractor.extract(badDeploy()), extractor.extract(badDeploy()));
    }

    @Test
    @DisplayName("empty incident → no signals")
    void emptyIncident() {
        assertTrue(new DeterministicSignalExtractor().extract(IncidentInput.empty("deploy-0")).isEmpty());
    }

    @Test
    @DisplayName("failing analyzer is skipped, the rest still contribute")
    void failingAnalyzer() {
        SignalAnalyzer broken = new SignalAnalyzer() {
            @Override
            public List<Signal> analyze(IncidentInput incident) {
                throw new IllegalStateException("parser blew up");
            }

            @Override
            public String analyzerName() {
                return "Broken";
            }
        };
        Signal a = Signal.unassigned("log_anomaly", "a", null, Severity.LOW, "x");
        Signal b = Signal.unassigned("metric_spike", "b", 2.0, Severity.HIGH, "y");

        List<Signal> signals = new DeterministicSignalExtractor(List.of(fixed("A", a), broken, fixed("B", b)))
            .extract(IncidentInput.empty("deploy-1"));

        assertEquals(List.of(a.withId("sig_001"), b.withId("sig_002")), signals);
    }

    @Test
    @DisplayName("signalId pads to three digits")
    void signalIdFormat() {
        assertEquals("sig_007", DeterministicSignalExtractor.signalId(7));
        assertEquals("sig_1234", DeterministicSignalExtractor.signalId(1234));
    }
}
