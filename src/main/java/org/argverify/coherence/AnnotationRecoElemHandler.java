package org.argverify.coherence;

import org.argverify.core.Segments;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.model.PcsItem;
import org.argverify.model.Proposition;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;
import java.util.function.Predicate;

/**
 * Cross references between an annotation and the argument reconstructions must resolve in
 * both directions: segment labels name existing arguments and items, and the annotation_ids
 * of reconstructed propositions name existing segments.
 */
public class AnnotationRecoElemHandler extends CoherenceHandler {

    public AnnotationRecoElemHandler(String name, Predicate<ArtifactRecord> recoRole, Predicate<ArtifactRecord> annotationRole) {
        super(name, recoRole, annotationRole);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord first, ArtifactRecord second, VerificationContext ctx) {
        ArgumentGraph reco = first.graph();
        Document annotation = second.annotation();
        if (reco == null || annotation == null) return null;
        SegmentLinks links = SegmentLinks.toArguments(reco, annotation);
        List<String> msgs = new ArrayList<>();

        for (Element segment : Segments.all(annotation)) {
            String label = Segments.attr(segment, Segments.ARGUMENT_LABEL);
            String id = Segments.attr(segment, Segments.ID);
            String refReco = Segments.attr(segment, Segments.REF_RECO_LABEL);
            if (label == null || !links.argumentLabels.contains(label)) {
                msgs.add("Illegal 'argument_label' reference of proposition element with id=" + id
                    + ": No argument with label '" + label + "' in the Argdown snippet.");
                continue;
            }
            if (id == null || refReco == null) continue;
            Argument argument = reco.getArgument(label);
            if (argument.getPcs().isEmpty()) continue;
            Optional<PcsItem> item = argument.findItem(refReco);
            if (item.isEmpty()) {
                msgs.add("Illegal 'ref_reco_label' reference of proposition element with id=" + id
                    + ": No premise or conclusion with label '" + refReco + "' in argument '" + label + "'.");
                continue;
            }
            Proposition proposition = reco.getProposition(item.get().getPropositionLabel());
            List<String> idRefs = proposition == null ? null : SegmentLinks.annotationIdsOf(proposition.getData());
            if (idRefs == null || !idRefs.contains(id)) {
                msgs.add("Label reference mismatch: proposition element with id=" + id + " in the annotation references"
                    + " (via ref_reco) the proposition '" + refReco + "' of argument '" + label + "', but the annotation_ids="
                    + (idRefs == null ? "[]" : idRefs) + " of that proposition do not include the id=" + id + ".");
            }
        }

        Collection<String> linkedArguments = links.argumentLabel.values();
        for (Argument argument : reco.getArguments()) {
            if (!linkedArguments.contains(argument.getLabel())) {
                msgs.add("Free floating argument: Argument '" + argument.getLabel()
                    + "' does not have any corresponding elements in the annotation.");
            }
            for (PcsItem item : argument.getPcs()) {
                Proposition proposition = reco.getProposition(item.getPropositionLabel());
                List<String> idRefs = proposition == null ? null : SegmentLinks.annotationIdsOf(proposition.getData());
                if (idRefs == null) {
                    msgs.add("Missing 'annotation_ids' attribute in proposition '" + item.getLabel()
                        + "' of argument '" + argument.getLabel() + "'.");
                    continue;
                }
                for (String ref : idRefs) {
                    if (!links.annotationIds.contains(ref)) {
                        msgs.add("Illegal 'annotation_ids' reference in proposition '" + item.getLabel() + "' of argument '"
                            + argument.getLabel() + "': No proposition element with id='" + ref + "' in the annotation.");
                    }
                }
            }
        }

        List<Proposition> props = reco.getPropositions();
        for (int i = 0; i < props.size(); i++) {
            List<String> ids1 = SegmentLinks.annotationIdsOf(props.get(i).getData());
            if (ids1 == null) continue;
            for (int j = i + 1; j < props.size(); j++) {
                List<String> ids2 = SegmentLinks.annotationIdsOf(props.get(j).getData());
                if (ids2 == null) continue;
                List<String> shared = new ArrayList<>();
                for (String x : ids1) if (ids2.contains(x)) shared.add("'" + x + "'");
                if (!shared.isEmpty()) {
                    msgs.add("Label reference mismatch: annotation text segment(s) " + String.join(", ", shared)
                        + " are referenced by distinct propositions in the Argdown argument reconstruction ('"
                        + props.get(i).getLabel() + "', '" + props.get(j).getLabel() + "').");
                }
            }
        }
        return result(first, second, msgs);
    }
}
