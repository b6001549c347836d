package org.argverify.controller;

import org.argverify.dto.ArtifactPayload;
import org.argverify.dto.VerifyRequest;
import org.argverify.io.ArtifactJsonReader;
import org.argverify.logic.SolverOutcome;
import org.argverify.pipeline.PipelineFactory;
import org.argverify.request.VerifierSettings;
import org.argverify.service.VerificationService;
import org.junit.Test;
import org.springframework.http.ResponseEntity;

import java.util.*;

import static org.junit.Assert.*;

public class VerifyControllerTest {

    private final VerifyController controller = new VerifyController(
        new VerificationService(new PipelineFactory(VerifierSettings.DEFAULT, (p, t) -> SolverOutcome.unknown("no solver"))),
        new ArtifactJsonReader());

    private static VerifyRequest request(String kind, Object data) {
        return new VerifyRequest(null, List.of(new ArtifactPayload("reco", kind, data, null)));
    }

    private static Map<String, Object> graph() {
        Map<String, Object> g = new LinkedHashMap<>();
        g.put("propositions", List.of(
            Map.of("label", "p1", "texts", List.of("Animals suffer.")),
            Map.of("label", "c", "texts", List.of("Stop eating meat."))));
        g.put("arguments", List.of(Map.of("label", "A", "gists", List.of("Suffering"), "pcs", List.of(
            Map.of("label", "1", "proposition", "p1"),
            Map.of("label", "2", "proposition", "c", "conclusion", true, "inference", Map.of("from", List.of("1")))))));
        return g;
    }

    @Test
    public void testVerify() {
        ResponseEntity<?> resp = controller.verify("infreco", request("argdown", graph()));

        assertEquals(200, resp.getStatusCode().value());
        Map<?, ?> body = (Map<?, ?>) resp.getBody();
        assertEquals(Boolean.TRUE, body.get("valid"));
        assertEquals("infreco", body.get("pipeline"));
        assertFalse(((List<?>) body.get("results")).isEmpty());
    }

    @Test
    public void testBadRequests() {
        ResponseEntity<?> unknownPipeline = controller.verify("nope", request("argdown", graph()));
        assertEquals(400, unknownPipeline.getStatusCode().value());
        assertTrue(String.valueOf(((Map<?, ?>) unknownPipeline.getBody()).get("error")).contains("Unknown pipeline"));

        ResponseEntity<?> badKind = controller.verify("infreco", request("pdf", graph()));
        assertEquals(400, badKind.getStatusCode().value());

        ResponseEntity<?> noBody = controller.verify("infreco", null);
        assertEquals(400, noBody.getStatusCode().value());
    }

    @Test
    public void testPipelinesAndHealth() {
        Map<?, ?> pipelines = (Map<?, ?>) controller.pipelines().getBody();
        assertEquals(PipelineFactory.PIPELINES, pipelines.get("pipelines"));
        assertEquals("ok", ((Map<?, ?>) controller.health().getBody()).get("status"));
    }
}
