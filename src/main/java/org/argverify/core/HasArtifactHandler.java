package org.argverify.core;

import org.argverify.handler.ArtifactFilters;
import org.argverify.handler.Handler;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;

import java.util.*;
import java.util.function.Predicate;

/**
 * Fails when no artifact of the given role was submitted, or when the last one could not be
 * parsed.
 */
public class HasArtifactHandler extends Handler {

    private final Predicate<ArtifactRecord> filter;
    private final String description;

    public HasArtifactHandler(String name, Predicate<ArtifactRecord> filter, String description) {
        super(name);
        this.filter = filter == null ? ArtifactFilters.any() : filter;
        this.description = description;
    }

    @Override
    protected VerificationContext handle(VerificationContext ctx) {
        ArtifactRecord last = null;
        for (ArtifactRecord r : ctx.getRecords()) {
            if (filter.test(r)) last = r;
        }
        if (last == null) {
            ctx.addResult(CheckResult.fail(getName(), List.of(), "Please provide " + description + "."));
        } else if (!last.isParsed()) {
            ctx.addResult(CheckResult.fail(getName(), List.of(last.getId()),
                "Failed to parse " + description + " (" + last.getId() + ")."));
        } else {
            ctx.addResult(CheckResult.pass(getName(), List.of(last.getId())));
        }
        return ctx;
    }
}
