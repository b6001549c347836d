package org.argverify.coherence;

import org.argverify.handler.ArtifactFilters;
import org.argverify.io.ArtifactJsonReader;
import org.argverify.model.*;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.junit.Test;

import java.util.*;

import static org.argverify.GraphFixtures.*;
import static org.junit.Assert.*;

public class AnnotationRecoCoherenceTest {

    private static final String ELEM = "ArgannoInfrecoElemCohereHandler";
    private static final String REL = "ArgannoInfrecoRelationCohereHandler";

    private static ArgumentGraph reco() {
        return new ArgumentGraph()
            .addProposition(withAnnotationIds("R", "Animals suffer.", "2"))
            .addProposition(withAnnotationIds("C", "We should stop eating meat.", "1"))
            .addArgument(argument("A", premise("1", "R"), conclusion("2", "C", "1")));
    }

    private static Map<String, CheckResult> run(ArgumentGraph reco, String xml) {
        VerificationContext ctx = new VerificationContext((String) null, List.of(
            ArtifactRecord.graph("reco", reco),
            ArtifactRecord.annotation("anno", ArtifactJsonReader.parseAnnotation(xml), xml)));
        return CoherenceHandlers.argannoInfreco(ArtifactFilters.graphs(), ArtifactFilters.annotations(), "from")
            .process(ctx).resultsById();
    }

    @Test
    public void testMatchingSupportPasses() {
        Map<String, CheckResult> results = run(reco(),
            "<proposition id=\"1\" argument_label=\"A\" ref_reco_label=\"2\">We should stop eating meat</proposition>"
                + " because <proposition id=\"2\" supports=\"1\" argument_label=\"A\" ref_reco_label=\"1\">animals suffer</proposition>.");

        assertTrue(String.valueOf(results.get(ELEM)), results.get(ELEM).isValid());
        assertTrue(String.valueOf(results.get(REL)), results.get(REL).isValid());
        assertEquals(List.of("reco", "anno"), results.get(REL).getArtifactRefs());
    }

    @Test
    public void testSupportAgainstInferenceDirectionFails() {
        CheckResult rel = run(reco(),
            "<proposition id=\"1\" supports=\"2\" argument_label=\"A\" ref_reco_label=\"2\">We should stop eating meat</proposition>"
                + " because <proposition id=\"2\" argument_label=\"A\" ref_reco_label=\"1\">animals suffer</proposition>.")
            .get(REL);

        assertFalse(rel.isValid());
        assertEquals("Annotated support relation 1 -> 2 is not matched by the inferential relations in the argument 'A'.",
            rel.getMessage());
    }

    @Test
    public void testAttackWithinOneArgumentFails() {
        CheckResult rel = run(reco(),
            "<proposition id=\"1\" argument_label=\"A\" ref_reco_label=\"2\">stop eating meat</proposition>"
                + "<proposition id=\"2\" attacks=\"1\" argument_label=\"A\" ref_reco_label=\"1\">animals suffer</proposition>")
            .get(REL);

        assertFalse(rel.isValid());
        assertTrue(rel.getMessage(), rel.getMessage().startsWith("Text segments assigned to the same argument cannot attack"));
    }

    @Test
    public void testSupportAcrossArgumentsNeedsRelation() {
        ArgumentGraph g = reco()
            .addProposition(withAnnotationIds("X", "Pigs scream.", "3"))
            .addArgument(argument("B", premise("1", "X"), conclusion("2", "R", "1")));
        String xml = "<proposition id=\"1\" argument_label=\"A\" ref_reco_label=\"2\">stop eating meat</proposition>"
            + "<proposition id=\"2\" argument_label=\"A\" ref_reco_label=\"1\">animals suffer</proposition>"
            + "<proposition id=\"3\" supports=\"2\" argument_label=\"B\" ref_reco_label=\"1\">pigs scream</proposition>";

        CheckResult without = run(g, xml).get(REL);
        assertFalse(without.isValid());
        assertTrue(without.getMessage(), without.getMessage().contains("are annotated to support each other"));

        g.addRelation(new DialecticalRelation("B", "R", Valence.SUPPORT, Dialectics.GROUNDED));
        assertTrue(run(g, xml).get(REL).isValid());
    }

    @Test
    public void testBrokenCrossReferences() {
        ArgumentGraph g = reco()
            .addArgument(argument("Lonely", premise("1", "R"), conclusion("2", "C", "1")));

        CheckResult elem = run(g,
            "<proposition id=\"1\" argument_label=\"A\" ref_reco_label=\"7\">stop eating meat</proposition>"
                + "<proposition id=\"2\" argument_label=\"Z\">animals suffer</proposition>").get(ELEM);

        assertFalse(elem.isValid());
        String msg = elem.getMessage();
        assertTrue(msg, msg.contains("Illegal 'ref_reco_label' reference of proposition element with id=1"));
        assertTrue(msg, msg.contains("No argument with label 'Z'"));
        assertTrue(msg, msg.contains("Free floating argument: Argument 'Lonely'"));
        assertTrue("messages are joined with ' - '", msg.contains(" - "));
    }

    @Test
    public void testMissingAndSharedAnnotationIds() {
        ArgumentGraph g = new ArgumentGraph()
            .addProposition(withAnnotationIds("R", "Animals suffer.", "1"))
            .addProposition(withAnnotationIds("C", "We should stop eating meat.", "1", "9"))
            .addProposition(prop("D", "Meat is murder."))
            .addArgument(argument("A", premise("1", "R"), premise("2", "D"), conclusion("3", "C", "1", "2")));

        String msg = run(g, "<proposition id=\"1\" argument_label=\"A\" ref_reco_label=\"1\">x</proposition>")
            .get(ELEM).getMessage();

        assertTrue(msg, msg.contains("Missing 'annotation_ids' attribute in proposition '2' of argument 'A'."));
        assertTrue(msg, msg.contains("No proposition element with id='9' in the annotation."));
        assertTrue(msg, msg.contains("are referenced by distinct propositions in the Argdown argument reconstruction ('R', 'C')"));
    }

    @Test
    public void testNothingRecordedWithoutAnnotation() {
        VerificationContext ctx = new VerificationContext((String) null, List.of(ArtifactRecord.graph("reco", reco())));
        CoherenceHandlers.argannoInfreco(ArtifactFilters.graphs(), ArtifactFilters.annotations(), "from").process(ctx);
        assertTrue(ctx.getResults().isEmpty());
    }
}
