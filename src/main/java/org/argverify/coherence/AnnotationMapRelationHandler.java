package org.argverify.coherence;

import org.argverify.core.Segments;
import org.argverify.model.ArgumentGraph;
import org.argverify.model.DialecticalRelation;
import org.argverify.model.Valence;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.jsoup.nodes.Document;

import java.util.*;
import java.util.function.Predicate;

/**
 * Annotated support/attack relations and the map's dialectical relations must correspond one
 * to one, via the argument_label of the segments.
 */
public class AnnotationMapRelationHandler extends CoherenceHandler {

    public AnnotationMapRelationHandler(String name, Predicate<ArtifactRecord> mapRole, Predicate<ArtifactRecord> annotationRole) {
        super(name, mapRole, annotationRole);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord first, ArtifactRecord second, VerificationContext ctx) {
        ArgumentGraph map = first.graph();
        Document annotation = second.annotation();
        if (map == null || annotation == null) return null;
        SegmentLinks links = SegmentLinks.toNodes(map, annotation);

        List<Annotated> annotated = new ArrayList<>();
        for (String[] rel : links.relations(annotation, Segments.SUPPORTS)) annotated.add(new Annotated(rel, Valence.SUPPORT));
        for (String[] rel : links.relations(annotation, Segments.ATTACKS)) annotated.add(new Annotated(rel, Valence.ATTACK));

        List<String> msgs = new ArrayList<>();
        for (Annotated ar : annotated) {
            boolean matched = false;
            for (DialecticalRelation dr : map.getRelations()) {
                if (ar.matches(dr, links)) {
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                msgs.add("Annotated " + ar.valence.name().toLowerCase() + " relation " + ar.from + " -> " + ar.to
                    + " is not matched by any relation in the argument map.");
            }
        }
        for (DialecticalRelation dr : map.getRelations()) {
            boolean matched = false;
            for (Annotated ar : annotated) {
                if (ar.matches(dr, links)) {
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                msgs.add("Dialectical " + dr.getValence().name() + " relation " + dr.getSource() + " -> " + dr.getTarget()
                    + " is not matched by any relation in the text annotation.");
            }
        }
        return CheckResult.fromMessages(getName(), List.of(first.getId(), second.getId()), msgs, " ");
    }

    private static final class Annotated {
        final String from;
        final String to;
        final Valence valence;

        Annotated(String[] rel, Valence valence) {
            this.from = rel[0];
            this.to = rel[1];
            this.valence = valence;
        }

        boolean matches(DialecticalRelation dr, SegmentLinks links) {
            return dr.getValence() == valence
                && Objects.equals(dr.getSource(), links.argumentLabel.get(from))
                && Objects.equals(dr.getTarget(), links.argumentLabel.get(to));
        }
    }
}
