package org.argverify.handler;

import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Link in a chain of checks. {@link #process} records the handler's name, runs
 * {@link #handle} and hands the context to the next link while processing may continue.
 * Exceptions thrown by {@code handle} are recorded as failing results and never propagate.
 *
 * Handlers keep no per-run state, so one instance can serve many runs one after another.
 */
public abstract class Handler {

    private static final Logger LOG = LoggerFactory.getLogger(Handler.class);

    private final String name;
    private Handler next;

    protected Handler(String name) {
        this.name = (name == null || name.isBlank()) ? getClass().getSimpleName() : name;
    }

    public String getName() {
        return name;
    }

    /**
     * Links {@code next} after this handler and returns it, so chains read
     * {@code a.setNext(b).setNext(c)}.
     */
    public Handler setNext(Handler next) {
        this.next = next;
        return next;
    }

    public VerificationContext process(VerificationContext ctx) {
        if (!ctx.isContinueProcessing()) return ctx;
        ctx.getExecutedChecks().add(name);
        VerificationContext out = ctx;
        try {
            VerificationContext handled = handle(ctx);
            if (handled != null) out = handled;
        } catch (Exception e) {
            LOG.error("Handler {} failed: {}", name, e.toString(), e);
            String text = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            out.addResult(CheckResult.fail(name, List.of(), "Processing error: " + text));
        }
        if (next != null && out.isContinueProcessing()) {
            return next.process(out);
        }
        return out;
    }

    protected abstract VerificationContext handle(VerificationContext ctx);
}
