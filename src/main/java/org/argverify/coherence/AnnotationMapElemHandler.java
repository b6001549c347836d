package org.argverify.coherence;

import org.argverify.core.Segments;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.model.Proposition;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;
import java.util.function.Predicate;

/**
 * Each segment's argument_label names a node of the map, and each map node lists the
 * annotation_ids of exactly the segments labeled with it.
 */
public class AnnotationMapElemHandler extends CoherenceHandler {

    public AnnotationMapElemHandler(String name, Predicate<ArtifactRecord> mapRole, Predicate<ArtifactRecord> annotationRole) {
        super(name, mapRole, annotationRole);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord first, ArtifactRecord second, VerificationContext ctx) {
        ArgumentGraph map = first.graph();
        Document annotation = second.annotation();
        if (map == null || annotation == null) return null;
        SegmentLinks links = SegmentLinks.toNodes(map, annotation);
        List<String> msgs = new ArrayList<>();

        for (Element segment : Segments.all(annotation)) {
            String label = Segments.attr(segment, Segments.ARGUMENT_LABEL);
            if (label == null || !links.argumentLabels.contains(label)) {
                msgs.add("Illegal 'argument_label' reference of proposition element with id=" + segment.attr(Segments.ID)
                    + ": No node with label '" + label + "' in the Argdown argument map.");
            }
        }

        // every node is checked on its own, even when labels repeat
        List<Map.Entry<String, Map<String, Object>>> nodes = new ArrayList<>();
        for (Proposition p : map.getPropositions()) nodes.add(new AbstractMap.SimpleImmutableEntry<>(p.getLabel(), p.getData()));
        for (Argument a : map.getArguments()) nodes.add(new AbstractMap.SimpleImmutableEntry<>(a.getLabel(), a.getData()));
        for (Map.Entry<String, Map<String, Object>> node : nodes) {
            String label = node.getKey();
            List<String> idRefs = SegmentLinks.annotationIdsOf(node.getValue());
            if (idRefs == null || idRefs.isEmpty()) {
                msgs.add("Missing 'annotation_ids' attribute of node with label '" + label + "'.");
                continue;
            }
            for (String ref : idRefs) {
                if (!links.annotationIds.contains(ref)) {
                    msgs.add("Illegal 'annotation_ids' reference of node with label '" + label
                        + "': No proposition element with id='" + ref + "' in the annotation.");
                } else if (!Objects.equals(links.argumentLabel.get(ref), label)) {
                    String other = links.argumentLabel.get(ref);
                    msgs.add("Label reference mismatch: argument map node with label '" + label + "' has annotation_ids="
                        + idRefs + ", but the corresponding proposition element with id=" + ref
                        + " in the annotation has a different argument_label" + (other == null ? "" : ": " + other) + ".");
                }
            }
        }
        return CheckResult.fromMessages(getName(), List.of(first.getId(), second.getId()), msgs, " ");
    }
}
