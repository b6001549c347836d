package org.argverify.core;

import org.argverify.handler.ArtifactFilters;
import org.argverify.io.ArtifactJsonReader;
import org.argverify.request.ArtifactKind;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class ArgannoHandlersTest {

    private static final String SOURCE = "We should stop eating meat. Animals suffer.";

    private static Map<String, CheckResult> run(String source, String xml, List<String> argLabels) {
        VerificationContext ctx = new VerificationContext(source,
            List.of(ArtifactRecord.annotation("anno", ArtifactJsonReader.parseAnnotation(xml), xml)));
        return CoreHandlers.arganno(null, argLabels, List.of()).process(ctx).resultsById();
    }

    private static Map<String, CheckResult> run(String xml) {
        return run(SOURCE, xml, List.of());
    }

    @Test
    public void testWellFormedAnnotationPasses() {
        Map<String, CheckResult> results = run(SOURCE,
            "<proposition id=\"1\" argument_label=\"A\">We should stop eating meat.</proposition> "
                + "<proposition id=\"2\" supports=\"1\" argument_label=\"A\">Animals suffer.</proposition>",
            List.of("A", "B"));

        for (CheckResult r : results.values()) assertTrue(r.toString(), r.isValid());
        assertTrue(results.containsKey("Arganno.ArgumentLabelValidityHandler"));
        assertFalse("empty legal labels skip the check", results.containsKey("Arganno.RefRecoLabelValidityHandler"));
    }

    @Test
    public void testAlteredShortSource() {
        CheckResult r = run("<proposition id=\"1\">We should start eating meat.</proposition> Animals suffer.")
            .get("Arganno.SourceTextIntegrityHandler");

        assertFalse(r.isValid());
        assertTrue(r.getMessage(), r.getMessage().contains("was altered. First difference (whitespace ignored) at character 10"));
    }

    @Test
    public void testSmallTypoIsTolerated() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 30; i++) text.append("Animals suffer when we eat them. ");
        String source = text.toString();
        String xml = "<proposition id=\"1\">" + source.replaceFirst("suffer", "sufer") + "</proposition>";

        assertTrue(run(source, xml, List.of()).get("Arganno.SourceTextIntegrityHandler").isValid());
    }

    @Test
    public void testLongSourceMayBeShortenedButNotReordered() {
        StringBuilder text = new StringBuilder("Animals suffer. ");
        for (int i = 0; i < 210; i++) text.append("filler ");
        text.append("We should stop eating meat.");

        CheckResult shortened = run(text.toString(),
            "<proposition id=\"1\">Animals suffer.</proposition> ... <proposition id=\"2\">We should stop eating meat.</proposition>",
            List.of()).get("Arganno.SourceTextIntegrityHandler");
        assertTrue(String.valueOf(shortened.getMessage()), shortened.isValid());

        CheckResult mixed = run(text.toString(),
            "<proposition id=\"2\">We should stop eating meat.</proposition> <proposition id=\"1\">Animals suffer.</proposition>"
                + " <proposition id=\"3\">Cows fly.</proposition>",
            List.of()).get("Arganno.SourceTextIntegrityHandler");
        assertFalse(mixed.isValid());
        assertTrue(mixed.getMessage(), mixed.getMessage().contains("Text flow mixup: Annotated proposition"));
        assertTrue(mixed.getMessage(), mixed.getMessage().contains("is missing from the source text."));
    }

    @Test
    public void testNestedAndMissingIds() {
        Map<String, CheckResult> results = run(
            "<proposition id=\"1\">We should stop eating meat. <proposition>Animals suffer.</proposition></proposition>");

        CheckResult nested = results.get("Arganno.NestedPropositionHandler");
        assertFalse(nested.isValid());
        assertTrue(nested.getMessage(), nested.getMessage().startsWith("Nested annotations in proposition(s) "));
        assertFalse(results.get("Arganno.PropositionIdPresenceHandler").isValid());
    }

    @Test
    public void testDuplicateIdsAndDanglingReferences() {
        Map<String, CheckResult> results = run(
            "<proposition id=\"1\" attacks=\"7\">We should stop eating meat.</proposition> "
                + "<proposition id=\"1\" supports=\"1 9\">Animals suffer.</proposition>");

        assertEquals("Duplicate ids: 1", results.get("Arganno.PropositionIdUniquenessHandler").getMessage());
        String support = results.get("Arganno.SupportReferenceValidityHandler").getMessage();
        assertTrue(support, support.startsWith("Supported proposition with id '9' in proposition"));
        String attack = results.get("Arganno.AttackReferenceValidityHandler").getMessage();
        assertTrue(attack, attack.startsWith("Attacked proposition with id '7' in proposition"));
    }

    @Test
    public void testUnknownMarkupAndLabels() {
        Map<String, CheckResult> results = run(SOURCE,
            "<proposition id=\"1\" weight=\"2\" argument_label=\"Z\">We should stop eating meat.</proposition> "
                + "<b>Animals suffer.</b>",
            List.of("A"));

        assertTrue(results.get("Arganno.AttributeValidityHandler").getMessage().startsWith("Unknown attribute 'weight'"));
        assertTrue(results.get("Arganno.ElementValidityHandler").getMessage().startsWith("Unknown element 'b'"));
        String labels = results.get("Arganno.ArgumentLabelValidityHandler").getMessage();
        assertTrue(labels, labels.startsWith("Illegal argument_label 'Z' in proposition"));
        assertTrue(labels, labels.endsWith("(legal labels: A)."));
    }

    @Test
    public void testWithoutSourceNoIntegrityResult() {
        Map<String, CheckResult> results = run(null, "<proposition id=\"1\">x</proposition>", List.of());
        assertFalse(results.containsKey("Arganno.SourceTextIntegrityHandler"));
        assertTrue(results.get("Arganno.PropositionIdPresenceHandler").isValid());
    }

    @Test
    public void testHasArtifact() {
        HasArtifactHandler h = new HasArtifactHandler("HasAnnotationsHandler",
            ArtifactFilters.annotations(), "a text annotation");

        VerificationContext none = h.process(new VerificationContext((String) null, List.of()));
        assertEquals("Please provide a text annotation.", none.getResults().get(0).getMessage());

        ArtifactRecord broken = new ArtifactRecord("anno", ArtifactKind.ANNOTATION_TREE,
            null, "<proposition", Map.of());
        VerificationContext failed = h.process(new VerificationContext((String) null, List.of(broken)));
        assertEquals("Failed to parse a text annotation (anno).", failed.getResults().get(0).getMessage());
    }
}
