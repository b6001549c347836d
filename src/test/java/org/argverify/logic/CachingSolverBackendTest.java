package org.argverify.logic;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class CachingSolverBackendTest {

    /** Answers from a fixed script and counts calls. */
    private static final class ScriptedBackend implements SolverBackend {
        private final Deque<SolverOutcome> answers;
        int calls = 0;

        ScriptedBackend(SolverOutcome... answers) {
            this.answers = new ArrayDeque<>(Arrays.asList(answers));
        }

        @Override
        public SolverOutcome check(String program, long timeoutMillis) {
            calls++;
            return answers.isEmpty() ? SolverOutcome.error("script exhausted") : answers.poll();
        }
    }

    @Test
    public void testDecidedAnswersAreReused() {
        ScriptedBackend raw = new ScriptedBackend(SolverOutcome.unsat());
        CachingSolverBackend cached = new CachingSolverBackend(raw, 4);

        assertEquals(SolverOutcome.Status.UNSAT, cached.check("(check-sat)", 100).status());
        assertEquals(SolverOutcome.Status.UNSAT, cached.check("(check-sat)", 100).status());
        assertEquals("second call must be served from cache", 1, raw.calls);
        assertEquals(1, cached.size());
    }

    @Test
    public void testUnknownIsNotCached() {
        ScriptedBackend raw = new ScriptedBackend(SolverOutcome.unknown("timeout"), SolverOutcome.sat());
        CachingSolverBackend cached = new CachingSolverBackend(raw, 4);

        assertEquals(SolverOutcome.Status.UNKNOWN, cached.check("p", 1).status());
        assertEquals(SolverOutcome.Status.SAT, cached.check("p", 1000).status());
        assertEquals(2, raw.calls);
    }

    @Test
    public void testEvictsLeastRecentlyUsed() {
        ScriptedBackend raw = new ScriptedBackend(
            SolverOutcome.sat(), SolverOutcome.sat(), SolverOutcome.sat(), SolverOutcome.unsat());
        CachingSolverBackend cached = new CachingSolverBackend(raw, 2);

        cached.check("a", 10);
        cached.check("b", 10);
        cached.check("a", 10);
        cached.check("c", 10);
        assertEquals(2, cached.size());
        assertEquals(3, raw.calls);

        // "b" was evicted, so it goes back to the delegate
        assertEquals(SolverOutcome.Status.UNSAT, cached.check("b", 10).status());
        assertEquals(4, raw.calls);
    }
}
