package org.argverify.core;

import org.argverify.handler.ArgumentGraphHandler;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.*;
import java.util.function.Predicate;

/** Argument maps sketch arguments; they must not reconstruct them in standard form. */
public class NoPcsHandler extends ArgumentGraphHandler {

    public NoPcsHandler(String name, Predicate<ArtifactRecord> filter) {
        super(name, filter);
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, ArgumentGraph graph, VerificationContext ctx) {
        List<String> withPcs = new ArrayList<>();
        for (Argument a : graph.getArguments()) {
            if (!a.getPcs().isEmpty()) withPcs.add(a.isUnlabeled() ? "<unlabeled_argument>" : "<" + a.getLabel() + ">");
        }
        if (withPcs.isEmpty()) return CheckResult.pass(getName(), List.of(record.getId()));
        return CheckResult.fail(getName(), List.of(record.getId()),
            "Found detailed reconstruction of individual argument(s) " + String.join(", ", withPcs)
                + " as premise-conclusion-structures.");
    }
}
