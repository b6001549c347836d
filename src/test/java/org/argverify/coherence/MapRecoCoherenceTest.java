package org.argverify.coherence;

import org.argverify.handler.ArtifactFilters;
import org.argverify.model.*;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.junit.Test;

import java.util.*;

import static org.argverify.GraphFixtures.*;
import static org.junit.Assert.*;

public class MapRecoCoherenceTest {

    private static ArgumentGraph map(DialecticalRelation... relations) {
        ArgumentGraph g = new ArgumentGraph()
            .addProposition(prop("C", "Meat is bad."))
            .addArgument(new Argument("A", List.of("Suffering"), List.of(), null))
            .addArgument(new Argument("B", List.of("Diet"), List.of(), null));
        for (DialecticalRelation r : relations) g.addRelation(r);
        return g;
    }

    private static ArgumentGraph reco(DialecticalRelation... relations) {
        ArgumentGraph g = new ArgumentGraph()
            .addProposition(prop("P1", "Animals suffer."))
            .addProposition(prop("C", "Meat is bad."))
            .addProposition(prop("P2", "We should go vegan."))
            .addArgument(argument("A", premise("1", "P1"), conclusion("2", "C", "1")))
            .addArgument(argument("B", premise("1", "C"), conclusion("2", "P2", "1")));
        for (DialecticalRelation r : relations) g.addRelation(r);
        return g;
    }

    private static Map<String, CheckResult> run(ArgumentGraph map, ArgumentGraph reco, boolean logical) {
        VerificationContext ctx = new VerificationContext((String) null, List.of(
            ArtifactRecord.graph("map", map, Map.of("filename", "map.ad")),
            ArtifactRecord.graph("reco", reco, Map.of("filename", "reconstructions.ad"))));
        (logical
            ? CoherenceHandlers.argmapLogreco(ArtifactFilters.mapGraphs(), ArtifactFilters.reconstructionGraphs())
            : CoherenceHandlers.argmapInfreco(ArtifactFilters.mapGraphs(), ArtifactFilters.reconstructionGraphs()))
            .process(ctx);
        return ctx.resultsById();
    }

    private static DialecticalRelation sketched(String s, String t, Valence v) {
        return new DialecticalRelation(s, t, v, Dialectics.SKETCHED);
    }

    private static DialecticalRelation grounded(String s, String t, Valence v) {
        return new DialecticalRelation(s, t, v, Dialectics.GROUNDED);
    }

    @Test
    public void testGroundedSketchPasses() {
        Map<String, CheckResult> results = run(map(sketched("A", "B", Valence.SUPPORT)), reco(), false);

        assertTrue(results.get("ArgmapInfrecoElemCohereHandler").isValid());
        assertTrue(results.get("ArgmapInfrecoRelationCohereHandler").isValid());
    }

    @Test
    public void testUngroundedSketchFails() {
        CheckResult rel = run(map(sketched("B", "A", Valence.SUPPORT)), reco(), false)
            .get("ArgmapInfrecoRelationCohereHandler");

        assertFalse(rel.isValid());
        assertTrue(rel.getMessage(), rel.getMessage().startsWith("Sketched support relation from <B> to <A>"));
    }

    @Test
    public void testClaimToArgumentAttackViaNegation() {
        ArgumentGraph m = map(sketched("N", "B", Valence.ATTACK)).addProposition(prop("N", "NOT: Meat is bad."));
        ArgumentGraph r = reco().addProposition(prop("N", "NOT: Meat is bad."));

        assertTrue(run(m, r, false).get("ArgmapInfrecoRelationCohereHandler").isValid());
    }

    @Test
    public void testLabelMismatches() {
        ArgumentGraph m = map().addArgument(new Argument("D", List.of("Other"), List.of(), null))
            .addProposition(prop("E", "Unreconstructed claim."));

        CheckResult elem = run(m, reco(), false).get("ArgmapInfrecoElemCohereHandler");

        assertFalse(elem.isValid());
        assertEquals("Argument <D> in map is not reconstructed (argument label mismatch). - "
            + "Claim [E] in argument map has no corresponding proposition in reconstructions (proposition label mismatch).",
            elem.getMessage());
    }

    @Test
    public void testLogicalRecoMustGroundSketches() {
        CheckResult ok = run(map(sketched("A", "B", Valence.SUPPORT)), reco(grounded("A", "B", Valence.SUPPORT)), true)
            .get("ArgmapLogrecoRelationCohereHandler");
        assertTrue(ok.getMessage(), ok.isValid());

        CheckResult ungrounded = run(map(sketched("A", "B", Valence.SUPPORT)),
            reco(new DialecticalRelation("A", "B", Valence.SUPPORT, Dialectics.SKETCHED)), true)
            .get("ArgmapLogrecoRelationCohereHandler");
        assertTrue(ungrounded.getMessage(), ungrounded.getMessage().endsWith("is not grounded in logical argument reconstructions."));

        CheckResult wrongValence = run(map(sketched("A", "B", Valence.SUPPORT)), reco(grounded("A", "B", Valence.ATTACK)), true)
            .get("ArgmapLogrecoRelationCohereHandler");
        assertTrue(wrongValence.getMessage(),
            wrongValence.getMessage().contains("is not matched by any relation in the argument reconstruction."));
        assertTrue(wrongValence.getMessage(),
            wrongValence.getMessage().contains("item 'A' attacks item 'B', but this dialectical relation is not captured"));
    }

    @Test
    public void testGroundedRelationMissingFromMap() {
        CheckResult rel = run(map(), reco(grounded("A", "B", Valence.SUPPORT)), true)
            .get("ArgmapLogrecoRelationCohereHandler");

        assertFalse(rel.isValid());
        assertEquals("According to the argument reconstructions, item 'A' supports item 'B', but this dialectical "
            + "relation is not captured in the argument map.", rel.getMessage());
    }
}
