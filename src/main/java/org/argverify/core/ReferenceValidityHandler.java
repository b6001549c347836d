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
 * Every id listed in a segment's {@code supports} (or {@code attacks}) attribute must exist.
 */
public class ReferenceValidityHandler extends AnnotationHandler {

    private final String attribute;

    public ReferenceValidityHandler(String name, Predicate<ArtifactRecord> filter, String attribute) {
        super(name, filter);
        if (!Segments.SUPPORTS.equals(attribute) && !Segments.ATTACKS.equals(attribute)) {
            throw new IllegalArgumentException("Not a reference attribute: " + attribute);
        }
        this.attribute = attribute;
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, Document annotation, VerificationContext ctx) {
        Set<String> ids = new HashSet<>(Segments.ids(annotation));
        String what = Segments.SUPPORTS.equals(attribute) ? "Supported" : "Attacked";
        List<String> msgs = new ArrayList<>();
        for (Element segment : Segments.all(annotation)) {
            for (String ref : Segments.idList(segment, attribute)) {
                if (!ids.contains(ref)) {
                    msgs.add(what + " proposition with id '" + ref + "' in proposition "
                        + Segments.describe(segment, 64) + " does not exist.");
                }
            }
        }
        return CheckResult.fromMessages(getName(), List.of(record.getId()), msgs, " ");
    }
}
