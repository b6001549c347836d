package org.argverify.coherence;

import org.argverify.model.*;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.*;
import java.util.function.Predicate;

/**
 * Sketched relations of the map must be grounded in the informal reconstructions: a
 * supporting argument's conclusion figures as premise of the supported argument, an attacking
 * one contradicts such a premise, and so on for claims.
 */
public class MapInfrecoRelationHandler extends CoherenceHandler {

    public MapInfrecoRelationHandler(String name, Predicate<ArtifactRecord> mapRole, Predicate<ArtifactRecord> recoRole) {
        super(name, mapRole, recoRole);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord first, ArtifactRecord second, VerificationContext ctx) {
        ArgumentGraph map = first.graph();
        ArgumentGraph reco = second.graph();
        if (map == null || reco == null) return null;

        List<String> msgs = new ArrayList<>();
        for (DialecticalRelation drel : map.getRelations()) {
            if (!drel.is(Dialectics.SKETCHED) || drel.getValence() == Valence.CONTRADICT) continue;
            boolean support = drel.getValence() == Valence.SUPPORT;
            String s = drel.getSource();
            String t = drel.getTarget();

            if (map.isArgumentLabel(s) && map.isArgumentLabel(t)) {
                Argument src = reco.getArgument(s);
                Argument tgt = reco.getArgument(t);
                if (src == null || tgt == null || src.getPcs().isEmpty() || tgt.getPcs().isEmpty()) continue;
                Proposition conclusion = lastProposition(reco, src);
                if (matchesPremise(reco, tgt, conclusion, support)) continue;
                msgs.add("Sketched " + kind(support) + " relation from <" + s + "> to <" + t + "> in argument map"
                    + " is not grounded in the argument reconstruction, conclusion of <" + s + "> does not "
                    + (support ? "figure as premise in" : "contradict any premise in") + " <" + t + ">.");
            } else if (!map.isArgumentLabel(s) && map.isArgumentLabel(t)) {
                Proposition src = reco.getProposition(s);
                Argument tgt = reco.getArgument(t);
                if (src == null || tgt == null || tgt.getPcs().isEmpty()) continue;
                if (matchesPremise(reco, tgt, src, support)) continue;
                msgs.add("Sketched " + kind(support) + " relation from [" + s + "] to <" + t + "> in argument map"
                    + " is not grounded in the argument reconstruction, proposition [" + s + "] does not "
                    + (support ? "figure as premise in" : "contradict any premise in") + " <" + t + ">.");
            } else if (map.isArgumentLabel(s) && !map.isArgumentLabel(t)) {
                Argument src = reco.getArgument(s);
                Proposition tgt = reco.getProposition(t);
                if (src == null || tgt == null || src.getPcs().isEmpty()) continue;
                Proposition conclusion = lastProposition(reco, src);
                boolean ok = support ? DialecticsUtil.areIdentical(conclusion, tgt)
                    : DialecticsUtil.areContradictory(conclusion, tgt, reco);
                if (ok) continue;
                msgs.add("Sketched " + kind(support) + " relation from <" + s + "> to [" + t + "] in argument map"
                    + " is not grounded in the argument reconstruction, proposition [" + t + "] does not "
                    + (support ? "figure as conclusion in" : "contradict the conclusion of") + " <" + s + ">.");
            }
        }
        return result(first, second, msgs);
    }

    private static String kind(boolean support) {
        return support ? "support" : "attack";
    }

    private static Proposition lastProposition(ArgumentGraph reco, Argument argument) {
        List<PcsItem> pcs = argument.getPcs();
        return reco.getProposition(pcs.get(pcs.size() - 1).getPropositionLabel());
    }

    private static boolean matchesPremise(ArgumentGraph reco, Argument target, Proposition node, boolean support) {
        for (PcsItem item : target.premises()) {
            Proposition premise = reco.getProposition(item.getPropositionLabel());
            boolean ok = support ? DialecticsUtil.areIdentical(premise, node)
                : DialecticsUtil.areContradictory(premise, node, reco);
            if (ok) return true;
        }
        return false;
    }
}
