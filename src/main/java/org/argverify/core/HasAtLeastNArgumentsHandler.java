package org.argverify.core;

import org.argverify.handler.ArgumentGraphHandler;
import org.argverify.model.ArgumentGraph;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.List;
import java.util.function.Predicate;

/** A reconstruction must contain at least {@code n} arguments. */
public class HasAtLeastNArgumentsHandler extends ArgumentGraphHandler {

    private final int n;

    public HasAtLeastNArgumentsHandler(String name, Predicate<ArtifactRecord> filter, int n) {
        super(name, filter);
        this.n = n;
    }

    @Override
    protected CheckResult evaluate(ArtifactRecord record, ArgumentGraph graph, VerificationContext ctx) {
        int size = graph.getArguments().size();
        if (size >= n) return CheckResult.pass(getName(), List.of(record.getId()));
        return CheckResult.fail(getName(), List.of(record.getId()),
            "Not enough arguments (found " + size + ", expected at least " + n + ").");
    }
}
