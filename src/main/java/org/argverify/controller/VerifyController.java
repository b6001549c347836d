package org.argverify.controller;

import org.argverify.dto.VerifyRequest;
import org.argverify.io.ArtifactJsonReader;
import org.argverify.pipeline.PipelineOptions;
import org.argverify.request.VerificationContext;
import org.argverify.request.VerificationReport;
import org.argverify.service.VerificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.*;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class VerifyController {

    private static final Logger LOG = LoggerFactory.getLogger(VerifyController.class);

    private final VerificationService verificationService;
    private final ArtifactJsonReader reader;

    @Autowired
    public VerifyController(VerificationService verificationService, ArtifactJsonReader reader) {
        this.verificationService = verificationService;
        this.reader = reader;
    }

    // POST { "source": "...", "artifacts": [ {id, kind, data, metadata} ] }
    @PostMapping("/verify/{pipeline}")
    public ResponseEntity<?> verify(@PathVariable("pipeline") String pipeline, @RequestBody VerifyRequest body) {
        try {
            VerificationContext ctx = reader.toContext(body);
            PipelineOptions options = new PipelineOptions(body.getArgumentLabels(), body.getRefRecoLabels(),
                body.getMinArguments());
            VerificationReport report = verificationService.verify(pipeline, ctx, options);
            return ResponseEntity.ok(report.toMap());
        } catch (IllegalArgumentException e) {
            LOG.warn("Rejected verification request for {}: {}", pipeline, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        } catch (Exception e) {
            LOG.error("Verification failed for {}", pipeline, e);
            return ResponseEntity.status(500).body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/pipelines")
    public ResponseEntity<?> pipelines() {
        return ResponseEntity.ok(Map.of("pipelines", verificationService.pipelines()));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
