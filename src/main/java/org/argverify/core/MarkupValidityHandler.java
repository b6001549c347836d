package org.argverify.core;

import org.argverify.handler.AnnotationHandler;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;
import java.util.function.Predicate;

/**
 * Only {@code <proposition>} elements are allowed ({@link Target#ELEMENTS}), and they may only
 * carry the known attributes ({@link Target#ATTRIBUTES}).
 */
public class MarkupValidityHandler extends AnnotationHandler {

    public enum Target { ELEMENTS, ATTRIBUTES }

    private final Target target;

    public MarkupValidityHandler(String name, Predicate<ArtifactRecord> filter, Target target) {
        super(name, filter);
        this.target = target;
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, Document annotation, VerificationContext ctx) {
        List<String> msgs = new ArrayList<>();
        if (target == Target.ELEMENTS) {
            for (Element e : annotation.getAllElements()) {
                if (e == annotation || Segments.TAG.equals(e.normalName())) continue;
                msgs.add("Unknown element '" + e.tagName() + "' at " + Segments.describe(e, 64));
            }
        } else {
            for (Element segment : Segments.all(annotation)) {
                for (Attribute a : segment.attributes()) {
                    if (!Segments.ALLOWED_ATTRIBUTES.contains(a.getKey())) {
                        msgs.add("Unknown attribute '" + a.getKey() + "' in proposition " + Segments.describe(segment, 64));
                    }
                }
            }
        }
        return CheckResult.fromMessages(getName(), List.of(record.getId()), msgs, " ");
    }
}
