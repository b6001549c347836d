package org.argverify.rules;

import org.argverify.logic.EntailmentChecker;
import org.argverify.logic.SolverOutcome;
import org.argverify.model.ArgumentGraph;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.argverify.request.VerifierSettings;
import org.junit.Test;

import java.util.*;

import static org.argverify.GraphFixtures.*;
import static org.junit.Assert.*;

public class DimensionBatteryHandlerTest {

    private static DimensionBatteryHandler battery(DimensionTable table) {
        EntailmentChecker never = new EntailmentChecker((program, timeout) -> {
            fail("solver must not be called");
            return SolverOutcome.error("unreachable");
        }, 1000);
        return new DimensionBatteryHandler("battery", null, table, RuleTable.DEFAULT, VerifierSettings.DEFAULT, never);
    }

    private static VerificationContext run(DimensionTable table, ArgumentGraph graph) {
        VerificationContext ctx = new VerificationContext((String) null, List.of(ArtifactRecord.graph("reco", graph)));
        return battery(table).process(ctx);
    }

    private static ArgumentGraph animals() {
        return new ArgumentGraph()
            .addProposition(prop("p1", "Animals suffer."))
            .addProposition(prop("p2", "We should stop eating meat."))
            .addArgument(argument("A", premise("1", "p1"), conclusion("2", "p2", "1")));
    }

    @Test
    public void testInformalReconstructionPasses() {
        VerificationContext ctx = run(DimensionTable.INFRECO_DEFAULT, animals());

        assertTrue("all dimensions should pass: " + ctx.getResults(), ctx.isValid());
        assertEquals(DimensionTable.INFRECO_DEFAULT.dimensions(), ctx.resultsById().keySet());
    }

    @Test
    public void testMissingFormalizationFailsOnlyFlawedFormalizations() {
        VerificationContext ctx = run(DimensionTable.LOGRECO_DEFAULT, animals());

        Map<String, CheckResult> byId = ctx.resultsById();
        CheckResult flawed = byId.get(DimensionTable.FLAWED_FORMALIZATIONS);
        assertFalse(flawed.isValid());
        assertTrue(flawed.getMessage(), flawed.getMessage().startsWith("Error in argument <A>: "));
        assertTrue(flawed.getMessage(), flawed.getMessage().contains("Proposition (1) lacks inline yaml data"));
        for (String dim : List.of(DimensionTable.INVALID_INFERENCE, DimensionTable.REDUNDANT_PREMISES,
                DimensionTable.INCONSISTENT_PREMISES, DimensionTable.UNGROUNDED_RELATIONS)) {
            assertTrue(dim + " should not cascade", byId.get(dim).isValid());
        }
    }

    @Test
    public void testEmptyPcsFailsMalformedArgument() {
        ArgumentGraph g = new ArgumentGraph().addArgument(argument("A"));

        CheckResult malformed = run(DimensionTable.INFRECO_DEFAULT, g).resultsById().get(DimensionTable.MALFORMED_ARGUMENT);

        assertFalse(malformed.isValid());
        assertTrue(malformed.getMessage(), malformed.getMessage().contains("lacks premise conclusion structure"));
        assertFalse("start/end checks are not applicable to an empty pcs",
            malformed.getMessage().contains("does not start with a premise"));
    }

    @Test
    public void testForwardReferenceIsDangling() {
        ArgumentGraph g = new ArgumentGraph()
            .addProposition(prop("p1", "one"))
            .addProposition(prop("p2", "two"))
            .addProposition(prop("p3", "three"))
            .addProposition(prop("p4", "four"))
            .addArgument(argument("A",
                premise("1", "p1"),
                conclusion("2", "p2", "3"),
                premise("3", "p3"),
                conclusion("4", "p4", "1", "2", "3")));

        CheckResult dangling = run(DimensionTable.INFRECO_DEFAULT, g).resultsById().get(DimensionTable.DANGLING_REFERENCE);

        assertFalse(dangling.isValid());
        assertTrue(dangling.getMessage(), dangling.getMessage().contains("Item '3' in inference information of conclusion 2"));
    }

    @Test
    public void testUnusedPremise() {
        ArgumentGraph g = new ArgumentGraph()
            .addProposition(prop("p1", "one"))
            .addProposition(prop("p2", "two"))
            .addProposition(prop("p3", "three"))
            .addArgument(argument("A", premise("1", "p1"), premise("2", "p2"), conclusion("3", "p3", "1")));

        CheckResult unused = run(DimensionTable.INFRECO_DEFAULT, g).resultsById().get(DimensionTable.UNUSED_PROPOSITIONS);

        assertFalse(unused.isValid());
        assertTrue(unused.getMessage(), unused.getMessage().endsWith("(2)."));
    }

    @Test
    public void testMultiArgumentTableAllowsSeveralArguments() {
        ArgumentGraph g = animals()
            .addProposition(prop("p3", "Meat is tasty."))
            .addProposition(prop("p4", "We should eat meat."))
            .addArgument(argument("B", premise("1", "p3"), conclusion("2", "p4", "1")));

        assertFalse(run(DimensionTable.INFRECO_DEFAULT, g).resultsById().get(DimensionTable.DISALLOWED_MATERIAL).isValid());
        assertTrue(run(DimensionTable.INFRECO_MULTI, g).isValid());
    }

    @Test
    public void testRunningTwiceGivesSameResults() {
        ArgumentGraph g = new ArgumentGraph()
            .addProposition(prop("p1", "one"))
            .addArgument(argument("A", premise("1", "p1")));
        DimensionBatteryHandler h = battery(DimensionTable.INFRECO_DEFAULT);

        List<CheckResult> first = h.process(new VerificationContext((String) null, List.of(ArtifactRecord.graph("r", g)))).getResults();
        List<CheckResult> second = h.process(new VerificationContext((String) null, List.of(ArtifactRecord.graph("r", g)))).getResults();

        assertEquals(first, second);
        assertFalse(first.isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownRuleIdIsRejected() {
        battery(DimensionTable.INFRECO_DEFAULT.with("typo", "no_such_rule"));
    }
}
