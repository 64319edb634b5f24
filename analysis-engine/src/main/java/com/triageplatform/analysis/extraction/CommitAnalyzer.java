package com.triageplatform.analysis.extraction;

import com.triageplatform.common.model.CommitRecord;
import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans each commit's diff summary and message for high-risk changes:
 * cache removal, a potentially unindexed query, and a reduced DB connection pool.
 * At most one signal per category per commit. Pattern matching only.
 */
public class CommitAnalyzer implements SignalAnalyzer {

    private static final String SOURCE = "commit_analyzer";
    private static final String TYPE   = "commit_change";

    private static final List<Pattern> CACHE_REMOVAL = compile(
        "removed?\\s+@?cache",
        "cache\\s+decorator\\s+removed",
        "cache\\s*=\\s*False",
        "no.?cache",
        "disabled?\\s+cach",
        "CACHE_TTL\\s*=\\s*0");

    private static final List<Pattern> UNINDEXED_QUERY = compile(
        "SELECT\\s+\\*\\s+FROM\\s+\\w+\\s+JOIN",
        "JOIN\\b(?!.*\\bINDEX\\b)",
        "without\\s+index",
        "no\\s+index\\s+hint",
        "full\\s+table\\s+scan");

    private static final List<Pattern> POOL_REDUCTION = compile(
        "MAX_DB_CONNECTIONS\\s+from\\s+(\\d+)\\s+to\\s+(\\d+)",
        "pool_size\\s+from\\s+(\\d+)\\s+to\\s+(\\d+)",
        "MAX_CONNECTIONS\\s+from\\s+(\\d+)\\s+to\\s+(\\d+)",
        "DB_POOL_SIZE\\s+from\\s+(\\d+)\\s+to\\s+(\\d+)");

    @Override
    public String analyzerName() { return "CommitAnalyzer"; }

    @Override
    public List<Signal> analyze(IncidentInput incident) {
        List<Signal> signals = new ArrayList<>();
        for (CommitRecord commit : incident.recentCommits()) {
            String sha = commit.sha() == null ? "unknown" : commit.sha();
            String text = nullToEmpty(commit.diffSummary()) + " " + nullToEmpty(commit.message());

            if (anyMatch(CACHE_REMOVAL, text)) {
                signals.add(Signal.unassigned(TYPE, "Cache decorator removed in commit " + sha,
                    null, Severity.MEDIUM, SOURCE));
            }
            if (anyMatch(UNINDEXED_QUERY, text)) {
                signals.add(Signal.unassigned(TYPE, "Potentially unindexed query added in commit " + sha,
                    null, Severity.MEDIUM, SOURCE));
            }
            poolReduction(text, sha).ifPresent(signals::add);
        }
        return signals;
    }

    private Optional<Signal> poolReduction(String text, String sha) {
        for (Pattern pattern : POOL_REDUCTION) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) continue;

            long before;
            long after;
            try {
                before = Long.parseLong(m.group(1));
                after = Long.parseLong(m.group(2));
            } catch (NumberFormatException e) {
                return Optional.of(poolChanged(sha));
            }
            if (after < before) {
                return Optional.of(Signal.unassigned(TYPE,
                    "DB connection pool reduced from " + before + " to " + after + " in commit " + sha,
                    (double) after, Severity.HIGH, SOURCE));
            }
            return Optional.of(poolChanged(sha));
        }
        return Optional.empty();
    }

    private static Signal poolChanged(String sha) {
        return Signal.unassigned(TYPE, "DB connection pool size changed in commit " + sha,
            null, Severity.MEDIUM, SOURCE);
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
