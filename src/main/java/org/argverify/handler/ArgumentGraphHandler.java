package org.argverify.handler;

import org.argverify.model.ArgumentGraph;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.function.Predicate;

/**
 * Base for checks that judge each parsed argument graph on its own.
 */
public abstract class ArgumentGraphHandler extends Handler {

    private final Predicate<ArtifactRecord> filter;

    protected ArgumentGraphHandler(String name, Predicate<ArtifactRecord> filter) {
        super(name);
        this.filter = filter == null ? ArtifactFilters.any() : filter;
    }

    protected boolean isApplicable(ArtifactRecord record, VerificationContext ctx) {
        return filter.test(record);
    }

    /** @return the result for this artifact, or null to record nothing */
    protected abstract CheckResult evaluate(ArtifactRecord record, ArgumentGraph graph, VerificationContext ctx);

    @Override
    protected VerificationContext handle(VerificationContext ctx) {
        for (ArtifactRecord record : ctx.getRecords()) {
            ArgumentGraph graph = record.graph();
            if (graph == null || !isApplicable(record, ctx)) continue;
            CheckResult result = evaluate(record, graph, ctx);
            if (result != null) ctx.addResult(result);
        }
        return ctx;
    }
}
