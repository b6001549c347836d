package org.argverify.core;

import org.argverify.handler.ArgumentGraphHandler;
import org.argverify.model.ArgumentGraph;
import org.argverify.model.Proposition;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.*;
import java.util.function.Predicate;

/** Every claim in an argument map needs a label. */
public class CompleteClaimsHandler extends ArgumentGraphHandler {

    public CompleteClaimsHandler(String name, Predicate<ArtifactRecord> filter) {
        super(name, filter);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, ArgumentGraph graph, VerificationContext ctx) {
        List<String> incomplete = new ArrayList<>();
        for (Proposition claim : graph.getPropositions()) {
            if (!claim.isUnlabeled()) continue;
            if (claim.getTexts().isEmpty() || claim.getTexts().get(0).isBlank()) {
                incomplete.add("Empty claim");
            } else {
                incomplete.add(Segments.shorten(claim.getTexts().get(0), 40));
            }
        }
        if (incomplete.isEmpty()) return CheckResult.pass(getName(), List.of(record.getId()));
        return CheckResult.fail(getName(), List.of(record.getId()), "Missing labels for nodes: " + String.join(", ", incomplete));
    }
}
