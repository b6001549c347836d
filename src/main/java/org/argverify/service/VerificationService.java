package org.argverify.service;

import org.argverify.handler.Handler;
import org.argverify.pipeline.PipelineFactory;
import org.argverify.pipeline.PipelineOptions;
import org.argverify.request.VerificationContext;
import org.argverify.request.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs a named pipeline over one verification context.
 */
public class VerificationService {

    private static final Logger LOG = LoggerFactory.getLogger(VerificationService.class);

    private final PipelineFactory pipelines;

    public VerificationService(PipelineFactory pipelines) {
        this.pipelines = pipelines;
    }

    public VerificationReport verify(String pipeline, VerificationContext ctx) {
        return verify(pipeline, ctx, PipelineOptions.DEFAULT);
    }

    /**
     * @throws IllegalArgumentException for an unknown pipeline name
     */
    public VerificationReport verify(String pipeline, VerificationContext ctx, PipelineOptions options) {
        Handler chain = pipelines.create(pipeline, options);
        long t0 = System.nanoTime();
        chain.process(ctx);
        VerificationReport report = new VerificationReport(chain.getName(), ctx);
        LOG.info("[timing] pipeline {} ms={} artifacts={} results={} valid={}", chain.getName(),
            (System.nanoTime() - t0) / 1_000_000, ctx.getRecords().size(), ctx.getResults().size(), report.isValid());
        return report;
    }

    public List<String> pipelines() {
        return PipelineFactory.PIPELINES;
    }
}
