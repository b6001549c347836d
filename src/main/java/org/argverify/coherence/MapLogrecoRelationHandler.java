package org.argverify.coherence;

import org.argverify.model.ArgumentGraph;
import org.argverify.model.DialecticalRelation;
import org.argverify.model.Dialectics;
import org.argverify.model.Valence;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.*;
import java.util.function.Predicate;

/**
 * Sketched map relations must be matched by grounded relations of the same valence in the
 * logical reconstructions, and grounded reconstruction relations between map nodes must be
 * captured, directly or through one intermediate claim, by the map.
 */
public class MapLogrecoRelationHandler extends CoherenceHandler {

    public MapLogrecoRelationHandler(String name, Predicate<ArtifactRecord> mapRole, Predicate<ArtifactRecord> recoRole) {
        super(name, mapRole, recoRole);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord first, ArtifactRecord second, VerificationContext ctx) {
        ArgumentGraph map = first.graph();
        ArgumentGraph reco = second.graph();
        if (map == null || reco == null) return null;

        Set<String> mapNodes = nodes(map);
        Set<String> recoNodes = nodes(reco);
        List<String> msgs = new ArrayList<>();

        for (DialecticalRelation drel : map.getRelations()) {
            if (!recoNodes.contains(drel.getSource()) || !recoNodes.contains(drel.getTarget())) continue;
            if (!drel.is(Dialectics.SKETCHED)) continue;
            List<DialecticalRelation> matches = reco.getRelations(drel.getSource(), drel.getTarget());
            boolean sameValence = false;
            boolean grounded = false;
            for (DialecticalRelation m : matches) {
                if (m.getValence() != drel.getValence()) continue;
                sameValence = true;
                if (m.is(Dialectics.GROUNDED)) grounded = true;
            }
            if (grounded) continue;
            String head = "Dialectical " + drel.getValence().name() + " relation from node '" + drel.getSource()
                + "' to node '" + drel.getTarget() + "' in argument map is not ";
            msgs.add(sameValence
                ? head + "grounded in logical argument reconstructions."
                : head + "matched by any relation in the argument reconstruction.");
        }

        for (DialecticalRelation drel : reco.getRelations()) {
            if (!mapNodes.contains(drel.getSource()) || !mapNodes.contains(drel.getTarget())) continue;
            if (!drel.is(Dialectics.GROUNDED)) continue;
            if (drel.getValence() == Valence.SUPPORT
                && !DialecticsUtil.indirectlySupports(drel.getSource(), drel.getTarget(), map)) {
                msgs.add(notCaptured(drel, "supports"));
            } else if (drel.getValence() == Valence.ATTACK
                && !DialecticsUtil.indirectlyAttacks(drel.getSource(), drel.getTarget(), map)) {
                msgs.add(notCaptured(drel, "attacks"));
            }
        }
        return result(first, second, msgs);
    }

    private static String notCaptured(DialecticalRelation drel, String verb) {
        return "According to the argument reconstructions, item '" + drel.getSource() + "' " + verb + " item '"
            + drel.getTarget() + "', but this dialectical relation is not captured in the argument map.";
    }

    private static Set<String> nodes(ArgumentGraph graph) {
        Set<String> out = new HashSet<>(graph.argumentLabels());
        out.addAll(graph.propositionLabels());
        return out;
    }
}
