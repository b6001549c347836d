package org.argverify.core;

import org.argverify.handler.ArgumentGraphHandler;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.model.Proposition;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.*;
import java.util.function.Predicate;

/**
 * A label used for two different texts (claims) or gists (arguments) is a duplicate.
 */
public class NoDuplicateLabelsHandler extends ArgumentGraphHandler {

    public NoDuplicateLabelsHandler(String name, Predicate<ArtifactRecord> filter) {
        super(name, filter);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, ArgumentGraph graph, VerificationContext ctx) {
        List<String> dups = new ArrayList<>();
        for (Proposition claim : graph.getPropositions()) {
            if (claim.getTexts().size() > 1 && !claim.isUnlabeled()) dups.add(claim.getLabel());
        }
        for (Argument a : graph.getArguments()) {
            if (a.getGists().size() > 1 && !a.isUnlabeled()) dups.add(a.getLabel());
        }
        if (dups.isEmpty()) return CheckResult.pass(getName(), List.of(record.getId()));
        return CheckResult.fail(getName(), List.of(record.getId()), "Duplicate labels: " + String.join(", ", dups));
    }
}
