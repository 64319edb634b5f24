package com.triageplatform.analysis.extraction;

import com.triageplatform.common.model.CommitRecord;
import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Severity;
import com.triageplatform.common.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommitAnalyzerTest {

    private final CommitAnalyzer analyzer = new CommitAnalyzer();

    private List<Signal> analyze(CommitRecord... commits) {
        return analyzer.analyze(IncidentInput.of("deploy-test", List.of(), Map.of(), List.of(commits), Map.of()));
    }

    @Test
    @DisplayName("removed cache decorator is flagged")
    void cacheRemoval() {
        List<Signal> signals = analyze(CommitRecord.of("a1b2c3", "Simplify user lookup",
            "Remove @cache decorator from get_user"));

        assertEquals(1, signals.size());
        Signal s = signals.get(0);
        assertEquals("commit_change", s.type());
        assertEquals("commit_analyzer", s.source());
        assertEquals("Cache decorator removed in commit a1b2c3", s.description());
        assertNull(s.value());
        assertEquals(Severity.MEDIUM, s.severity());
    }

    @Test
    @DisplayName("join without an index is flagged")
    void unindexedQuery() {
        List<Signal> signals = analyze(CommitRecord.of("d4e5f6", "Report query",
            "SELECT * FROM orders JOIN customers ON orders.cid = customers.id"));

        assertEquals(List.of("Potentially unindexed query added in commit d4e5f6"),
            signals.stream().map(Signal::description).toList());
    }

    @Test
    @DisplayName("reduced pool size is HIGH and carries the new size")
    void poolReduced() {
        List<Signal> signals = analyze(CommitRecord.of("789abc", "Reduce MAX_DB_CONNECTIONS from 20 to 5", ""));

        assertEquals(1, signals.size());
        Signal s = signals.get(0);
        assertEquals("DB connection pool reduced from 20 to 5 in commit 789abc", s.description());
        assertEquals(5.0, s.value(), 1e-9);
        assertEquals(Severity.HIGH, s.severity());
    }

    @Test
    @DisplayName("increased pool size is a MEDIUM change")
    void poolIncreased() {
        List<Signal> signals = analyze(CommitRecord.of("789abd", "Bump pool_size from 5 to 20", null));

        assertEquals(1, signals.size());
        assertEquals("DB connection pool size changed in commit 789abd", signals.get(0).description());
        assertEquals(Severity.MEDIUM, signals.get(0).severity());
    }

    @Test
    @DisplayName("benign commit and missing sha")
    void benignAndMissingSha() {
        assertTrue(analyze(CommitRecord.of("000111", "Fix typo in README", "docs only")).isEmpty());

        List<Signal> signals = analyze(CommitRecord.of(null, "disable caching for now", null));
        assertEquals("Cache decorator removed in commit unknown", signals.get(0).description());
    }

    @Test
    @DisplayName("one commit can raise several categories, in fixed order")
    void multipleCategories() {
        List<Signal> signals = analyze(CommitRecord.of("fff000", "Perf rework",
            "cache=False; add JOIN on audit; DB_POOL_SIZE from 10 to 2"));

        assertEquals(3, signals.size());
        assertTrue(signals.get(0).description().startsWith("Cache decorator removed"));
        assertTrue(signals.get(1).description().startsWith("Potentially unindexed query"));
        assertTrue(signals.get(2).description().startsWith("DB connection pool reduced from 10 to 2"));
    }
}
