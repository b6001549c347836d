package org.argverify.handler;

import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.jsoup.nodes.Document;

import java.util.function.Predicate;

/**
 * Base for checks that judge each parsed annotation tree on its own.
 */
public abstract class AnnotationHandler extends Handler {

    private final Predicate<ArtifactRecord> filter;

    protected AnnotationHandler(String name, Predicate<ArtifactRecord> filter) {
        super(name);
        this.filter = filter == null ? ArtifactFilters.any() : filter;
    }

    protected abstract CheckResult evaluate(ArtifactRecord record, Document annotation, VerificationContext ctx);

    @Override
    protected VerificationContext handle(VerificationContext ctx) {
        for (ArtifactRecord record : ctx.getRecords()) {
            Document doc = record.annotation();
            if (doc == null || !filter.test(record)) continue;
            CheckResult result = evaluate(record, doc, ctx);
            if (result != null) ctx.addResult(result);
        }
        return ctx;
    }
}
