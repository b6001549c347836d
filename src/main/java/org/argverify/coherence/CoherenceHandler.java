package org.argverify.coherence;

import org.argverify.handler.Handler;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.*;
import java.util.function.Predicate;

/**
 * Compares two artifacts that describe the same argumentation. The first and second role
 * predicates pick the artifacts; only the last artifact matching each role is compared, and
 * only when both are parsed.
 */
public abstract class CoherenceHandler extends Handler {

    /** Separator between the messages of one coherence result. */
    protected static final String SEPARATOR = " - ";

    private final Predicate<ArtifactRecord> firstRole;
    private final Predicate<ArtifactRecord> secondRole;

    protected CoherenceHandler(String name, Predicate<ArtifactRecord> firstRole, Predicate<ArtifactRecord> secondRole) {
        super(name);
        this.firstRole = Objects.requireNonNull(firstRole, "firstRole");
        this.secondRole = Objects.requireNonNull(secondRole, "secondRole");
    }

    /** @return the result for this pair, or null to record nothing */
    protected abstract CheckResult evaluate(ArtifactRecord first, ArtifactRecord second, VerificationContext ctx);

    @Override
    protected VerificationContext handle(VerificationContext ctx) {
        ArtifactRecord first = last(ctx.getRecords(), firstRole);
        ArtifactRecord second = last(ctx.getRecords(), secondRole);
        if (first == null || second == null || first == second) return ctx;
        if (!first.isParsed() || !second.isParsed()) return ctx;
        CheckResult result = evaluate(first, second, ctx);
        if (result != null) ctx.addResult(result);
        return ctx;
    }

    protected CheckResult result(ArtifactRecord first, ArtifactRecord second, List<String> msgs) {
        return CheckResult.fromMessages(getName(), List.of(first.getId(), second.getId()), msgs, SEPARATOR);
    }

    private static ArtifactRecord last(List<ArtifactRecord> records, Predicate<ArtifactRecord> role) {
        ArtifactRecord found = null;
        for (ArtifactRecord r : records) {
            if (role.test(r)) found = r;
        }
        return found;
    }
}
