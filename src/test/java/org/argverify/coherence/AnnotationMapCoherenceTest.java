package org.argverify.coherence;

import org.argverify.handler.ArtifactFilters;
import org.argverify.io.ArtifactJsonReader;
import org.argverify.model.*;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class AnnotationMapCoherenceTest {

    private static final String XML =
        "<proposition id=\"1\" argument_label=\"A\">We should stop eating meat</proposition> because "
            + "<proposition id=\"2\" supports=\"1\" argument_label=\"B\">animals suffer</proposition>.";

    private static Argument node(String label, String... ids) {
        return new Argument(label, List.of("Gist of " + label), List.of(), Map.of("annotation_ids", List.of(ids)));
    }

    private static ArgumentGraph map(Valence valence, String... idsOfA) {
        return new ArgumentGraph()
            .addArgument(node("A", idsOfA))
            .addArgument(node("B", "2"))
            .addRelation(new DialecticalRelation("B", "A", valence, Dialectics.SKETCHED));
    }

    private static Map<String, CheckResult> run(ArgumentGraph map, String xml) {
        VerificationContext ctx = new VerificationContext((String) null, List.of(
            ArtifactRecord.graph("map", map),
            ArtifactRecord.annotation("anno", ArtifactJsonReader.parseAnnotation(xml), xml)));
        return CoherenceHandlers.argannoArgmap(ArtifactFilters.graphs(), ArtifactFilters.annotations())
            .process(ctx).resultsById();
    }

    @Test
    public void testCoherentAnnotationAndMap() {
        Map<String, CheckResult> results = run(map(Valence.SUPPORT, "1"), XML);

        assertTrue(String.valueOf(results), results.get("ArgannoArgmapElemCohereHandler").isValid());
        assertTrue(String.valueOf(results), results.get("ArgannoArgmapDRelCohereHandler").isValid());
    }

    @Test
    public void testRelationsMustMatchBothWays() {
        CheckResult rel = run(map(Valence.ATTACK, "1"), XML).get("ArgannoArgmapDRelCohereHandler");

        assertFalse(rel.isValid());
        assertEquals("Annotated support relation 2 -> 1 is not matched by any relation in the argument map. "
            + "Dialectical ATTACK relation B -> A is not matched by any relation in the text annotation.", rel.getMessage());
    }

    @Test
    public void testBadNodeReferences() {
        String xml = XML + "<proposition id=\"3\" argument_label=\"Q\">stray</proposition>";

        CheckResult elem = run(map(Valence.SUPPORT, "1", "4", "2"), xml).get("ArgannoArgmapElemCohereHandler");

        assertFalse(elem.isValid());
        String msg = elem.getMessage();
        assertTrue(msg, msg.contains("No node with label 'Q' in the Argdown argument map."));
        assertTrue(msg, msg.contains("Illegal 'annotation_ids' reference of node with label 'A': No proposition element with id='4'"));
        assertTrue(msg, msg.contains("has a different argument_label: B."));
    }

    @Test
    public void testNodeWithoutAnnotationIds() {
        ArgumentGraph m = map(Valence.SUPPORT, "1").addProposition(new Proposition("C", "A claim."));

        String msg = run(m, XML).get("ArgannoArgmapElemCohereHandler").getMessage();

        assertEquals("Missing 'annotation_ids' attribute of node with label 'C'.", msg);
    }

    @Test
    public void testNodesSharingALabelAreCheckedSeparately() {
        ArgumentGraph m = map(Valence.SUPPORT, "1").addProposition(new Proposition("B", "Animals suffer."));

        CheckResult elem = run(m, XML).get("ArgannoArgmapElemCohereHandler");

        assertFalse(elem.isValid());
        assertEquals("Missing 'annotation_ids' attribute of node with label 'B'.", elem.getMessage());
    }
}
