package org.argverify.pipeline;

import org.argverify.handler.CompositeHandler;
import org.argverify.handler.Handler;
import org.argverify.io.ArtifactJsonReader;
import org.argverify.logic.SolverBackend;
import org.argverify.logic.SolverOutcome;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.request.*;
import org.argverify.service.VerificationService;
import org.junit.Test;

import java.util.*;

import static org.argverify.GraphFixtures.*;
import static org.junit.Assert.*;

public class PipelineFactoryTest {

    private static final SolverBackend NO_SOLVER = (program, timeout) -> {
        fail("informal pipelines must not call the solver");
        return SolverOutcome.error("unreachable");
    };

    private final PipelineFactory factory = new PipelineFactory(VerifierSettings.DEFAULT, NO_SOLVER);
    private final VerificationService service = new VerificationService(factory);

    private static ArgumentGraph reco() {
        return new ArgumentGraph()
            .addProposition(withAnnotationIds("R", "Animals suffer.", "2"))
            .addProposition(withAnnotationIds("C", "We should stop eating meat.", "1"))
            .addArgument(argument("A", premise("1", "R"), conclusion("2", "C", "1")));
    }

    @Test
    public void testEveryPipelineCanBeCreated() {
        for (String name : PipelineFactory.PIPELINES) {
            Handler h = factory.create(name);
            assertTrue(name, h instanceof CompositeHandler);
            assertEquals(name, h.getName());
            assertFalse(name, ((CompositeHandler) h).getHandlers().isEmpty());
        }
        assertEquals("names are normalized", "infreco", factory.create(" InfReco ").getName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownPipeline() {
        factory.create("deductive_magic");
    }

    @Test
    public void testInfrecoEndToEnd() {
        ArgumentGraph plain = new ArgumentGraph()
            .addProposition(prop("R", "Animals suffer."))
            .addProposition(prop("C", "We should stop eating meat."))
            .addArgument(argument("A", premise("1", "R"), conclusion("2", "C", "1")));
        VerificationContext ctx = new VerificationContext((String) null, List.of(ArtifactRecord.graph("reco", plain)));

        VerificationReport report = service.verify("infreco", ctx);

        assertTrue(String.valueOf(report.getResults()), report.isValid());
        assertEquals("infreco", report.getPipeline());
        assertEquals(List.of("infreco", "HasArgdownHandler", "InfRecoCompositeHandler"), report.getExecutedChecks());
        assertTrue(report.toJson().contains("\"pipeline\": \"infreco\""));
    }

    @Test
    public void testMissingArtifactIsReported() {
        VerificationReport report = service.verify("infreco", new VerificationContext((String) null, List.of()));

        assertFalse(report.isValid());
        CheckResult has = report.getResults().get(0);
        assertEquals("HasArgdownHandler", has.getCheckId());
        assertEquals("Please provide an argument graph.", has.getMessage());
    }

    @Test
    public void testArgannoInfrecoEndToEnd() {
        String source = "We should stop eating meat because animals suffer.";
        String xml = "<proposition id=\"1\" argument_label=\"A\" ref_reco_label=\"2\">We should stop eating meat</proposition>"
            + " because <proposition id=\"2\" supports=\"1\" argument_label=\"A\" ref_reco_label=\"1\">animals suffer</proposition>.";
        VerificationContext ctx = new VerificationContext(source, List.of(
            ArtifactRecord.annotation("anno", ArtifactJsonReader.parseAnnotation(xml), xml),
            ArtifactRecord.graph("reco", reco())));

        VerificationReport report = service.verify("arganno_infreco", ctx,
            new PipelineOptions(List.of("A"), List.of("1", "2")));

        assertTrue(String.valueOf(report.getResults()), report.isValid());
        Set<String> ids = new HashSet<>();
        for (CheckResult r : report.getResults()) ids.add(r.getCheckId());
        assertTrue(ids.contains("Arganno.SourceTextIntegrityHandler"));
        assertTrue(ids.contains("ArgannoInfrecoRelationCohereHandler"));
        assertTrue(ids.contains("Arganno.RefRecoLabelValidityHandler"));
    }

    @Test
    public void testMapAndRecoAreTakenByFilename() {
        ArgumentGraph map = new ArgumentGraph()
            .addProposition(prop("C", "We should stop eating meat."))
            .addArgument(new Argument("A", List.of("Suffering"), List.of(), null));
        ArgumentGraph reco = new ArgumentGraph()
            .addProposition(prop("R", "Animals suffer."))
            .addProposition(prop("C", "We should stop eating meat."))
            .addArgument(argument("A", premise("1", "R"), conclusion("2", "C", "1")));
        VerificationContext ctx = new VerificationContext((String) null, List.of(
            ArtifactRecord.graph("m", map, Map.of("filename", "map.ad")),
            ArtifactRecord.graph("r", reco, Map.of("filename", "reconstructions.ad"))));

        VerificationReport report = service.verify("argmap_infreco", ctx);

        assertTrue(String.valueOf(report.getResults()), report.isValid());
        for (CheckResult r : report.getResults()) {
            if (r.getCheckId().startsWith("ArgMap.")) assertEquals(List.of("m"), r.getArtifactRefs());
        }
    }

    @Test
    public void testMapLogrecoNeedsSeveralArguments() {
        ArgumentGraph map = new ArgumentGraph()
            .addProposition(prop("C", "We should stop eating meat."))
            .addArgument(new Argument("A", List.of("Suffering"), List.of(), null));
        ArgumentGraph reco = new ArgumentGraph()
            .addProposition(prop("R", "Animals suffer."))
            .addProposition(prop("C", "We should stop eating meat."))
            .addArgument(argument("A", premise("1", "R"), conclusion("2", "C", "1")));
        List<ArtifactRecord> records = List.of(
            ArtifactRecord.graph("m", map, Map.of("filename", "map.ad")),
            ArtifactRecord.graph("r", reco, Map.of("filename", "reconstructions.ad")));

        VerificationReport strict = service.verify("argmap_logreco", new VerificationContext((String) null, records));
        CheckResult tooFew = find(strict, "HasAtLeastNArgumentsHandler.reco");
        assertFalse(tooFew.isValid());
        assertEquals("Not enough arguments (found 1, expected at least 2).", tooFew.getMessage());
        assertEquals(List.of("r"), tooFew.getArtifactRefs());

        VerificationReport lenient = service.verify("argmap_logreco", new VerificationContext((String) null, records),
            new PipelineOptions(null, null, 1));
        assertTrue(find(lenient, "HasAtLeastNArgumentsHandler.reco").isValid());
    }

    @Test
    public void testArgannoArgmapLogrecoChecksArgumentCount() {
        VerificationContext ctx = new VerificationContext((String) null, List.of(
            ArtifactRecord.graph("r", reco(), Map.of("filename", "reconstructions.ad"))));

        VerificationReport report = service.verify("arganno_argmap_logreco", ctx);

        assertFalse(find(report, "HasAtLeastNArgumentsHandler.reco").isValid());
    }

    private static CheckResult find(VerificationReport report, String checkId) {
        for (CheckResult r : report.getResults()) {
            if (r.getCheckId().equals(checkId)) return r;
        }
        fail("no result for " + checkId + " in " + report.getResults());
        return null;
    }
}
