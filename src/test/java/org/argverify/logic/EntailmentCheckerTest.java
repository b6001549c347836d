package org.argverify.logic;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class EntailmentCheckerTest {

    private static Map<String, Formula> one(String label, String formula) throws FormulaParseException {
        Map<String, Formula> m = new LinkedHashMap<>();
        m.put(label, FormulaParser.parse(formula));
        return m;
    }

    @Test
    public void testVerdictFollowsSolverAnswer() throws Exception {
        EntailmentChecker unsat = new EntailmentChecker((p, t) -> SolverOutcome.unsat(), 50);
        EntailmentChecker sat = new EntailmentChecker((p, t) -> SolverOutcome.sat(), 50);

        EntailmentResult yes = unsat.check(one("1", "p & q"), one("2", "p"), null);
        assertTrue(yes.isEntailed());
        assertNotNull("program is kept for diagnostics", yes.program());

        EntailmentResult no = sat.check(one("1", "p | q"), one("2", "p"), null);
        assertEquals(EntailmentResult.Verdict.NOT_ENTAILED, no.verdict());
    }

    @Test
    public void testUnknownIsUndecided() throws Exception {
        EntailmentChecker checker = new EntailmentChecker((p, t) -> SolverOutcome.unknown("timeout"), 50);
        EntailmentResult r = checker.check(one("1", "p"), one("2", "q"), null);
        assertTrue(r.isUndecided());
        assertFalse(r.isEntailed());
        assertEquals("solver answered unknown: timeout", r.detail());
    }

    @Test
    public void testSolverErrorIsUndecided() throws Exception {
        EntailmentChecker checker = new EntailmentChecker((p, t) -> SolverOutcome.error("boom"), 50);
        EntailmentResult r = checker.check(one("1", "p"), one("2", "q"), null);
        assertTrue(r.isUndecided());
        assertEquals("solver error: boom", r.detail());
    }

    @Test
    public void testEncodingClashNeverReachesSolver() throws Exception {
        EntailmentChecker checker = new EntailmentChecker((p, t) -> {
            fail("solver must not be called");
            return null;
        }, 50);
        EntailmentResult r = checker.check(one("1", "p"), one("2", "p(a)"), null);
        assertTrue(r.isUndecided());
        assertNull(r.program());
        assertTrue(r.detail(), r.detail().startsWith("formulas cannot be encoded"));
    }

    @Test
    public void testTimeoutIsPassedThrough() throws Exception {
        long[] seen = new long[1];
        EntailmentChecker checker = new EntailmentChecker((p, t) -> {
            seen[0] = t;
            return SolverOutcome.unsat();
        }, 1234);
        checker.entails("1", FormulaParser.parse("p"), "2", FormulaParser.parse("p"), Map.of());
        assertEquals(1234, seen[0]);
    }
}
