package com.triageplatform.analysis.extraction;

import com.triageplatform.common.extraction.SignalExtractor;
import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs every {@link SignalAnalyzer} against the incident and numbers the combined output.
 *
 * <p>Analyzers run in a fixed order (logs, metrics, commits, config by default). One that
 * throws is logged and skipped; the others still contribute. Ids are assigned here, after all
 * analyzers ran, as {@code sig_001}, {@code sig_002}, ... in output order, so each analyzer can
 * be tested without knowing its position in the sequence.
 *
 * <p>No LLM involved. Same input, same signals.
 */
public class DeterministicSignalExtractor implements SignalExtractor {

    private static final Logger log = LoggerFactory.getLogger(DeterministicSignalExtractor.class);

    private final List<SignalAnalyzer> analyzers;

    public DeterministicSignalExtractor() {
        this(List.of(new LogAnalyzer(), new MetricsAnalyzer(), new CommitAnalyzer(), new ConfigAnalyzer()));
    }

    public DeterministicSignalExtractor(List<SignalAnalyzer> analyzers) {
        this.analyzers = List.copyOf(analyzers);
    }

    @Override
    public List<Signal> extract(IncidentInput incident) {
        List<Signal> raw = new ArrayList<>();
        for (SignalAnalyzer analyzer : analyzers) {
            try {
                List<Signal> produced = analyzer.analyze(incident);
                raw.addAll(produced);
                log.debug("Analyzer={} produced {} signals", analyzer.analyzerName(), produced.size());
            } catch (RuntimeException e) {
                log.error("Analyzer={} failed, skipping. deploymentId={}",
                    analyzer.analyzerName(), incident.deploymentId(), e);
            }
        }

        List<Signal> numbered = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            numbered.add(raw.get(i).withId(signalId(i + 1)));
        }
        log.info("Signal extraction complete. signals={} deploymentId={}", numbered.size(), incident.deploymentId());
        return List.copyOf(numbered);
    }

    static String signalId(int sequence) {
        return String.format(Locale.ROOT, "sig_%03d", sequence);
    }
}
