package org.argverify.core;

import org.argverify.handler.AnnotationHandler;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;
import java.util.function.Predicate;

public class NestedPropositionHandler extends AnnotationHandler {

    public NestedPropositionHandler(String name, Predicate<ArtifactRecord> filter) {
        super(name, filter);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, Document annotation, VerificationContext ctx) {
        List<String> nested = new ArrayList<>();
        for (Element segment : Segments.all(annotation)) {
            // getElementsByTag includes the segment itself
            if (segment.getElementsByTag(Segments.TAG).size() > 1) nested.add(Segments.describe(segment, 256));
        }
        if (nested.isEmpty()) return CheckResult.pass(getName(), List.of(record.getId()));
        return CheckResult.fail(getName(), List.of(record.getId()),
            "Nested annotations in proposition(s) " + String.join(", ", nested));
    }
}
