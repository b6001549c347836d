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
 * Segments that carry {@code argument_label} (or {@code ref_reco_label}) must use one of the
 * legal labels. Without legal labels the check records nothing.
 */
public class LabelValidityHandler extends AnnotationHandler {

    private final String attribute;
    private final Set<String> legalLabels;

    public LabelValidityHandler(String name, Predicate<ArtifactRecord> filter, String attribute, Collection<String> legalLabels) {
        super(name, filter);
        this.attribute = attribute;
        this.legalLabels = legalLabels == null ? Set.of() : new LinkedHashSet<>(legalLabels);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, Document annotation, VerificationContext ctx) {
        if (legalLabels.isEmpty()) return null;
        List<String> msgs = new ArrayList<>();
        for (Element segment : Segments.all(annotation)) {
            String label = Segments.attr(segment, attribute);
            if (label != null && !legalLabels.contains(label)) {
                msgs.add("Illegal " + attribute + " '" + label + "' in proposition " + Segments.describe(segment, 64)
                    + " (legal labels: " + String.join(", ", legalLabels) + ").");
            }
        }
        return CheckResult.fromMessages(getName(), List.of(record.getId()), msgs, " ");
    }
}
