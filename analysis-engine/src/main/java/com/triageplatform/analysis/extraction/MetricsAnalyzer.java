package com.triageplatform.analysis.extraction;

import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts signals from the incident metrics map.
 *
 * <h3>Checks</h3>
 * <pre>
 *   latency spike      : latency_p99_ms / latency_baseline_p99_ms  >= 2.0   (HIGH if >= 5)
 *   pool saturation    : db_connection_pool_used / db_connection_pool_max >= 0.90  (HIGH)
 *   cache degradation  : cache_hit_rate < 0.50, or < 50% of cache_hit_rate_baseline (HIGH if < 0.20)
 * </pre>
 * Missing keys, non-numeric values and zero denominators skip the check.
 */
public class MetricsAnalyzer implements SignalAnalyzer {

    static final double LATENCY_SPIKE_MULTIPLIER    = 2.0;
    static final double LATENCY_HIGH_MULTIPLIER     = 5.0;
    static final double POOL_SATURATION_THRESHOLD   = 0.90;
    static final double CACHE_ABSOLUTE_THRESHOLD    = 0.50;
    static final double CACHE_DEGRADATION_THRESHOLD = 0.50;
    static final double CACHE_HIGH_THRESHOLD        = 0.20;

    private static final String SOURCE = "metrics_analyzer";

    @Override
    public String analyzerName() { return "MetricsAnalyzer"; }

    @Override
    public List<Signal> analyze(IncidentInput incident) {
        Map<String, Object> metrics = incident.metrics();
        List<Signal> signals = new ArrayList<>();
        checkLatency(metrics, signals);
        checkDbPool(metrics, signals);
        checkCache(metrics, signals);
        return signals;
    }

    private void checkLatency(Map<String, Object> m, List<Signal> out) {
        Double p99 = PayloadValues.number(m, "latency_p99_ms");
        Double baseline = PayloadValues.number(m, "latency_baseline_p99_ms");
        if (p99 == null || baseline == null || baseline == 0.0) return;

        double ratio = p99 / baseline;
        if (ratio < LATENCY_SPIKE_MULTIPLIER) return;

        out.add(Signal.unassigned("metric_spike",
            String.format(Locale.ROOT, "p99 latency %sms vs baseline %sms (%.0fx spike)",
                PayloadValues.plain(p99), PayloadValues.plain(baseline), ratio),
            PayloadValues.round(ratio, 1),
            ratio >= LATENCY_HIGH_MULTIPLIER ? Severity.HIGH : Severity.MEDIUM, SOURCE));
    }

    private void checkDbPool(Map<String, Object> m, List<Signal> out) {
        Double used = PayloadValues.number(m, "db_connection_pool_used");
        Double max = PayloadValues.number(m, "db_connection_pool_max");
        if (used == null || max == null || max == 0.0) return;

        double saturation = used / max;
        if (saturation < POOL_SATURATION_THRESHOLD) return;

        out.add(Signal.unassigned("resource_saturation",
            String.format(Locale.ROOT, "DB connection pool %s saturated (%s/%s connections used)",
                PayloadValues.percent(saturation), PayloadValues.plain(used), PayloadValues.plain(max)),
            PayloadValues.round(saturation, 3), Severity.HIGH, SOURCE));
    }

    private void checkCache(Map<String, Object> m, List<Signal> out) {
        Double hitRate = PayloadValues.number(m, "cache_hit_rate");
        Double baseline = PayloadValues.number(m, "cache_hit_rate_baseline");
        if (hitRate == null) return;

        boolean absoluteBad = hitRate < CACHE_ABSOLUTE_THRESHOLD;
        boolean relativeBad = baseline != null && baseline > 0
            && hitRate < baseline * CACHE_DEGRADATION_THRESHOLD;
        if (!absoluteBad && !relativeBad) return;

        String description;
        if (baseline != null && baseline > 0) {
            description = String.format(Locale.ROOT, "Cache hit rate dropped from %s to %s (%s degradation)",
                PayloadValues.percent(baseline), PayloadValues.percent(hitRate),
                PayloadValues.percent((baseline - hitRate) / baseline));
        } else {
            description = "Cache hit rate is " + PayloadValues.percent(hitRate) + ", below healthy threshold";
        }

        out.add(Signal.unassigned("metric_degradation", description,
            PayloadValues.round(hitRate, 3),
            hitRate < CACHE_HIGH_THRESHOLD ? Severity.HIGH : Severity.MEDIUM, SOURCE));
    }
}
