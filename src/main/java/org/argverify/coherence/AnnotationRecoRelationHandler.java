package org.argverify.coherence;

import org.argverify.core.Segments;
import org.argverify.model.Argument;
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
 * Annotated support and attack relations must be matched by the reconstructions. Support
 * between segments of one argument is matched by the inference chain of that argument;
 * everything else by a dialectical relation between the corresponding arguments or
 * propositions.
 */
public class AnnotationRecoRelationHandler extends CoherenceHandler {

    private final String fromKey;

    public AnnotationRecoRelationHandler(String name, Predicate<ArtifactRecord> recoRole,
                                         Predicate<ArtifactRecord> annotationRole, String fromKey) {
        super(name, recoRole, annotationRole);
        this.fromKey = Objects.requireNonNull(fromKey, "fromKey");
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord first, ArtifactRecord second, VerificationContext ctx) {
        ArgumentGraph reco = first.graph();
        Document annotation = second.annotation();
        if (reco == null || annotation == null) return null;
        SegmentLinks links = SegmentLinks.toArguments(reco, annotation);
        List<String> msgs = new ArrayList<>();

        for (String[] rel : links.relations(annotation, Segments.SUPPORTS)) {
            String argFrom = links.argumentLabel.get(rel[0]);
            String argTo = links.argumentLabel.get(rel[1]);
            if (argFrom == null || argTo == null) {
                msgs.add("Annotated support relation " + rel[0] + " -> " + rel[1] + " is not matched by any relation"
                    + " in the reconstruction (illegal argument_labels).");
                continue;
            }
            if (!argFrom.equals(argTo)) {
                String propFrom = links.propositionLabel.get(rel[0]);
                String propTo = links.propositionLabel.get(rel[1]);
                if (!anyRelation(reco, argFrom, propFrom, argTo, propTo, Valence.SUPPORT)) {
                    msgs.add("Proposition elements " + rel[0] + " and " + rel[1] + " are annotated to support each other,"
                        + " but none of the corresponding Argdown elements <" + argFrom + ">/[" + propFrom + "] supports <"
                        + argTo + "> or [" + propTo + "].");
                }
                continue;
            }
            Argument argument = reco.getArgument(argFrom);
            String itemFrom = links.refRecoLabel.get(rel[0]);
            String itemTo = links.refRecoLabel.get(rel[1]);
            if (argument == null || itemFrom == null || itemTo == null) continue;
            if (!SegmentLinks.usedInInference(argument, itemTo, fromKey).contains(itemFrom)) {
                msgs.add("Annotated support relation " + rel[0] + " -> " + rel[1] + " is not matched by the"
                    + " inferential relations in the argument '" + argument.getLabel() + "'.");
            }
        }

        for (String[] rel : links.relations(annotation, Segments.ATTACKS)) {
            String argFrom = links.argumentLabel.get(rel[0]);
            String argTo = links.argumentLabel.get(rel[1]);
            if (argFrom == null || argTo == null) {
                msgs.add("Annotated attack relation from " + rel[0] + " to " + rel[1] + " is not matched by any relation"
                    + " in the reconstruction (illegal argument_labels).");
                continue;
            }
            if (argFrom.equals(argTo)) {
                msgs.add("Text segments assigned to the same argument cannot attack each other (" + rel[0] + " attacks "
                    + rel[1] + " while both are assigned to " + argFrom + ").");
                continue;
            }
            String propFrom = links.propositionLabel.get(rel[0]);
            String propTo = links.propositionLabel.get(rel[1]);
            if (!anyRelation(reco, argFrom, propFrom, argTo, propTo, Valence.ATTACK)) {
                msgs.add("Proposition elements " + rel[0] + " and " + rel[1] + " are annotated to attack each other,"
                    + " but none of the corresponding Argdown elements <" + argFrom + ">/[" + propFrom + "] attacks <"
                    + argTo + "> or [" + propTo + "].");
            }
        }
        return result(first, second, msgs);
    }

    private static boolean anyRelation(ArgumentGraph reco, String argFrom, String propFrom, String argTo, String propTo,
                                       Valence valence) {
        List<DialecticalRelation> drels = new ArrayList<>(reco.getRelations(argFrom, argTo));
        drels.addAll(reco.getRelations(argFrom, propTo));
        drels.addAll(reco.getRelations(propFrom, argTo));
        drels.addAll(reco.getRelations(propFrom, propTo));
        for (DialecticalRelation r : drels) {
            if (r.getValence() == valence) return true;
        }
        return false;
    }
}
