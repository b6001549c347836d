package org.argverify.core;

import org.argverify.Config;
import org.argverify.handler.AnnotationHandler;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;
import java.util.function.Predicate;

/**
 * The annotation must reproduce the source text. Short sources (up to the word threshold)
 * must match up to a small relative edit distance; longer ones may be shortened, as long as
 * every annotated segment occurs in the source in the annotated order.
 */
public class SourceTextIntegrityHandler extends AnnotationHandler {

    private final double tolerance;
    private final int shorteningThreshold;

    public SourceTextIntegrityHandler(String name, Predicate<ArtifactRecord> filter, double tolerance, int shorteningThreshold) {
        super(name, filter);
        this.tolerance = tolerance;
        this.shorteningThreshold = shorteningThreshold;
    }

    public SourceTextIntegrityHandler(String name, Predicate<ArtifactRecord> filter) {
        this(name, filter, Config.LEVENSHTEIN_TOLERANCE, Config.SHORTENING_WORD_THRESHOLD);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, Document annotation, VerificationContext ctx) {
        String source = ctx.getSourceText();
        if (source == null || source.isBlank()) return null;
        source = source.strip();
        List<String> msgs = source.split("\\s+").length <= shorteningThreshold
            ? checkStrict(source, annotation)
            : checkShorteningAllowed(source, annotation);
        return CheckResult.fromMessages(getName(), List.of(record.getId()), msgs, " ");
    }

    private List<String> checkStrict(String source, Document annotation) {
        String original = clean(source);
        String annotated = clean(annotation.text());
        if (original.equals(annotated) || TextDistance.normalized(original, annotated) <= tolerance) {
            return List.of();
        }
        int i = 0;
        while (i < original.length() && i < annotated.length() && original.charAt(i) == annotated.charAt(i)) i++;
        String was = original.substring(i, Math.min(original.length(), i + 30));
        String now = annotated.substring(i, Math.min(annotated.length(), i + 30));
        return List.of("Source text '" + Segments.shorten(source, 40) + "' was altered. First difference "
            + "(whitespace ignored) at character " + i + ": '" + was + "' became '" + now + "'.");
    }

    private List<String> checkShorteningAllowed(String source, Document annotation) {
        String cleanSource = clean(source);
        List<String> msgs = new ArrayList<>();
        int current = 0;
        for (Element segment : Segments.all(annotation)) {
            String text = clean(segment.text());
            int found = cleanSource.indexOf(text, current);
            if (found < 0) {
                if (!cleanSource.contains(text)) {
                    msgs.add("Annotated proposition " + Segments.describe(segment, 40) + " is missing from the source text.");
                } else {
                    msgs.add("Text flow mixup: Annotated proposition " + Segments.describe(segment, 40)
                        + " does not appear _after_ the previous annotation in the source text.");
                }
            } else {
                current = found + text.length();
            }
        }
        return msgs;
    }

    private static String clean(String text) {
        return text.replaceAll("\\s+", "");
    }
}
