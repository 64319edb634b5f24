package com.triageplatform.analysis.extraction;

import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Extracts signals from the config snapshot.
 *
 * <p>Numeric keys whose name looks like a capacity or rate limit are checked:
 * <ul>
 *   <li>with a baseline config: any decrease is reported (HIGH when below half the baseline);</li>
 *   <li>without one: zero values, and connection limits of 5 or less, are reported.</li>
 * </ul>
 * Flags under {@code FEATURE_FLAGS} that are enabled now but were not in the baseline are
 * reported as newly enabled.
 */
public class ConfigAnalyzer implements SignalAnalyzer {

    static final String FEATURE_FLAGS_KEY = "FEATURE_FLAGS";
    static final double LOW_CONNECTION_LIMIT = 5;

    private static final String SOURCE = "config_analyzer";
    private static final String TYPE   = "config_change";

    private static final Pattern LIMIT_KEYWORDS = Pattern.compile(
        "(max|limit|pool|size|connections|workers|threads|concurren|rate|ttl|timeout)",
        Pattern.CASE_INSENSITIVE);

    @Override
    public String analyzerName() { return "ConfigAnalyzer"; }

    @Override
    public List<Signal> analyze(IncidentInput incident) {
        Map<String, Object> config = incident.configSnapshot();
        Map<String, Object> baseline = incident.baselineConfig();
        List<Signal> signals = new ArrayList<>();
        checkNumericLimits(config, baseline, signals);
        checkFeatureFlags(config, baseline, signals);
        return signals;
    }

    private void checkNumericLimits(Map<String, Object> config, Map<String, Object> baseline,
                                    List<Signal> out) {
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            String key = entry.getKey();
            Double value = PayloadValues.asNumber(entry.getValue());
            if (value == null || !LIMIT_KEYWORDS.matcher(key).find()) continue;

            if (baseline != null) {
                Double before = PayloadValues.number(baseline, key);
                if (before != null && value < before) {
                    boolean severe = before > 0 && value / before < 0.5;
                    out.add(Signal.unassigned(TYPE,
                        "Config '" + key + "' reduced from " + PayloadValues.plain(before)
                            + " to " + PayloadValues.plain(value),
                        value, severe ? Severity.HIGH : Severity.MEDIUM, SOURCE));
                }
            } else if (value == 0.0 || (isIntegral(entry.getValue()) && value <= LOW_CONNECTION_LIMIT
                    && key.toLowerCase(Locale.ROOT).contains("connection"))) {
                out.add(Signal.unassigned(TYPE,
                    "Config '" + key + "' is set to " + PayloadValues.plain(value)
                        + ", unusually low for a limit/capacity setting",
                    value, Severity.MEDIUM, SOURCE));
            }
        }
    }

    private void checkFeatureFlags(Map<String, Object> config, Map<String, Object> baseline,
                                   List<Signal> out) {
        Map<?, ?> flags = asMap(config.get(FEATURE_FLAGS_KEY));
        Map<?, ?> baselineFlags = baseline == null ? Map.of() : asMap(baseline.get(FEATURE_FLAGS_KEY));

        for (Map.Entry<?, ?> flag : flags.entrySet()) {
            if (!Boolean.TRUE.equals(flag.getValue())) continue;
            if (Boolean.TRUE.equals(baselineFlags.get(flag.getKey()))) continue;
            out.add(Signal.unassigned(TYPE, "Feature flag '" + flag.getKey() + "' newly enabled",
                null, Severity.MEDIUM, SOURCE));
        }
    }

    private static Map<?, ?> asMap(Object value) {
        return value instanceof Map<?, ?> map ? map : Map.of();
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short;
    }
}
