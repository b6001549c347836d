package org.argverify.core;

import org.argverify.handler.AnnotationHandler;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;
import java.util.function.Predicate;

/**
 * Segment ids: presence ({@link Mode#PRESENCE}) or uniqueness ({@link Mode#UNIQUENESS}).
 */
public class PropositionIdHandler extends AnnotationHandler {

    public enum Mode { PRESENCE, UNIQUENESS }

    private final Mode mode;

    public PropositionIdHandler(String name, Predicate<ArtifactRecord> filter, Mode mode) {
        super(name, filter);
        this.mode = mode;
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, Document annotation, VerificationContext ctx) {
        List<String> refs = List.of(record.getId());
        if (mode == Mode.PRESENCE) {
            List<String> missing = new ArrayList<>();
            for (Element segment : Segments.all(annotation)) {
                if (segment.attr(Segments.ID).isEmpty()) missing.add(Segments.describe(segment, 64));
            }
            if (missing.isEmpty()) return CheckResult.pass(getName(), refs);
            return CheckResult.fail(getName(), refs, "Missing id in proposition(s) " + String.join(", ", missing));
        }
        Set<String> seen = new HashSet<>();
        Set<String> dups = new LinkedHashSet<>();
        for (Element segment : Segments.all(annotation)) {
            String id = segment.attr(Segments.ID);
            if (!seen.add(id)) dups.add(id);
        }
        if (dups.isEmpty()) return CheckResult.pass(getName(), refs);
        return CheckResult.fail(getName(), refs, "Duplicate ids: " + String.join(", ", dups));
    }
}
