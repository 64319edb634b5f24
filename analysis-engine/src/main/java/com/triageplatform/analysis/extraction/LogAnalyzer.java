package com.triageplatform.analysis.extraction;

import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.Signal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Extracts signals from raw log lines.
 *
 * <ul>
 *   <li><b>Error rate spike</b>: more than {@value #ERROR_RATE_THRESHOLD} of lines are errors.
 *       Value is the multiple of the assumed 1% baseline.</li>
 *   <li><b>Dominant error</b>: the most frequent error prefix, if it occurs at least
 *       {@value #DOMINANT_MIN_OCCURRENCES} times.</li>
 *   <li><b>New error signatures</b>: prefixes seen in the last 80% of lines but not in the
 *       first 20%.</li>
 * </ul>
 * An error line starts with {@code ERROR}.
 */
public class LogAnalyzer implements SignalAnalyzer {

    static final double ERROR_RATE_THRESHOLD     = 0.10;
    static final double ERROR_RATE_BASELINE      = 0.01;
    static final int    DOMINANT_MIN_OCCURRENCES = 3;
    static final double DOMINANT_HIGH_SHARE      = 0.15;
    static final int    PREFIX_LENGTH            = 60;

    private static final String SOURCE = "log_analyzer";
    private static final String TYPE   = "log_anomaly";

    private static final Pattern LEVEL_TAG = Pattern.compile("^(ERROR|WARN|INFO)\\s+");
    private static final Pattern NUMBER    = Pattern.compile("\\b\\d+\\b");

    @Override
    public String analyzerName() { return "LogAnalyzer"; }

    @Override
    public List<Signal> analyze(IncidentInput incident) {
        List<String> logs = incident.logs();
        if (logs.isEmpty()) {
            return List.of();
        }

        List<Signal> signals = new ArrayList<>();
        List<String> errorLines = logs.stream().filter(LogAnalyzer::isError).toList();
        int total = logs.size();
        double errorRate = (double) errorLines.size() / total;

        // ── error rate spike ──
        if (errorRate > ERROR_RATE_THRESHOLD) {
            double ratio = PayloadValues.round(errorRate / ERROR_RATE_BASELINE, 1);
            signals.add(Signal.unassigned(TYPE,
                String.format(Locale.ROOT, "Error rate is %s, %sx above baseline of %s",
                    PayloadValues.percent(errorRate), ratio, PayloadValues.percent(ERROR_RATE_BASELINE)),
                ratio, ratio >= 2 ? Severity.HIGH : Severity.MEDIUM, SOURCE));
        }

        // ── dominant error type ──
        if (!errorLines.isEmpty()) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (String line : errorLines) {
                counts.merge(errorPrefix(line), 1, Integer::sum);
            }
            String dominant = null;
            int dominantCount = 0;
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                if (entry.getValue() > dominantCount) {  // first seen wins ties
                    dominant = entry.getKey();
                    dominantCount = entry.getValue();
                }
            }
            if (dominantCount >= DOMINANT_MIN_OCCURRENCES) {
                double share = (double) dominantCount / total;
                signals.add(Signal.unassigned(TYPE,
                    String.format(Locale.ROOT, "Dominant error: '%s' (%d occurrences, %s of all logs)",
                        dominant, dominantCount, PayloadValues.percent(share)),
                    (double) dominantCount,
                    share > DOMINANT_HIGH_SHARE ? Severity.HIGH : Severity.MEDIUM, SOURCE));
            }
        }

        // ── new error signatures ──
        int split = Math.max(1, total / 5);
        Set<String> early = new TreeSet<>();
        Set<String> late = new TreeSet<>();
        for (int i = 0; i < total; i++) {
            String line = logs.get(i);
            if (isError(line)) {
                (i < split ? early : late).add(errorPrefix(line));
            }
        }
        late.removeAll(early);
        for (String signature : late) {
            signals.add(Signal.unassigned(TYPE,
                "New error pattern appeared after deploy: '" + signature + "'",
                null, Severity.MEDIUM, SOURCE));
        }

        return signals;
    }

    private static boolean isError(String line) {
        return line != null && line.startsWith("ERROR");
    }

    /**
     * Stable bucket for an error line: level tag stripped, integers replaced by {@code N},
     * truncated to {@value #PREFIX_LENGTH} characters.
     */
    static String errorPrefix(String line) {
        String stripped = LEVEL_TAG.matcher(line).replaceFirst("");
        stripped = NUMBER.matcher(stripped).replaceAll("N");
        if (stripped.length() > PREFIX_LENGTH) {
            stripped = stripped.substring(0, PREFIX_LENGTH);
        }
        return stripped.strip();
    }
}
