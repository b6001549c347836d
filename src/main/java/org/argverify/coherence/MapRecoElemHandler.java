package org.argverify.coherence;

import org.argverify.model.ArgumentGraph;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.*;
import java.util.function.Predicate;

/**
 * Every argument of the map is reconstructed and vice versa; every claim of the map has a
 * proposition with the same label in the reconstructions.
 */
public class MapRecoElemHandler extends CoherenceHandler {

    public MapRecoElemHandler(String name, Predicate<ArtifactRecord> mapRole, Predicate<ArtifactRecord> recoRole) {
        super(name, mapRole, recoRole);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord first, ArtifactRecord second, VerificationContext ctx) {
        ArgumentGraph map = first.graph();
        ArgumentGraph reco = second.graph();
        if (map == null || reco == null) return null;

        Set<String> mapArgs = new LinkedHashSet<>(map.argumentLabels());
        Set<String> recoArgs = new LinkedHashSet<>(reco.argumentLabels());
        Set<String> recoProps = new HashSet<>(reco.propositionLabels());

        List<String> msgs = new ArrayList<>();
        for (String label : mapArgs) {
            if (!recoArgs.contains(label)) {
                msgs.add("Argument <" + label + "> in map is not reconstructed (argument label mismatch).");
            }
        }
        for (String label : recoArgs) {
            if (!mapArgs.contains(label)) {
                msgs.add("Reconstructed argument <" + label + "> is not in the map (argument label mismatch).");
            }
        }
        for (String label : new LinkedHashSet<>(map.propositionLabels())) {
            if (!recoProps.contains(label)) {
                msgs.add("Claim [" + label + "] in argument map has no corresponding proposition in reconstructions"
                    + " (proposition label mismatch).");
            }
        }
        return result(first, second, msgs);
    }
}
