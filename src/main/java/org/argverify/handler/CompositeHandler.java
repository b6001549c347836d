package org.argverify.handler;

import org.argverify.request.VerificationContext;

import java.util.*;

/**
 * Runs an ordered list of child handlers against the same context, stopping early once a
 * child clears {@code continueProcessing}.
 */
public class CompositeHandler extends Handler {

    private final List<Handler> handlers = new ArrayList<>();

    public CompositeHandler(String name, List<? extends Handler> handlers) {
        super(name);
        if (handlers != null) this.handlers.addAll(handlers);
    }

    public CompositeHandler(String name) {
        this(name, null);
    }

    public CompositeHandler add(Handler handler) {
        handlers.add(Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public List<Handler> getHandlers() {
        return Collections.unmodifiableList(handlers);
    }

    @Override
    protected VerificationContext handle(VerificationContext ctx) {
        for (Handler h : handlers) {
            h.process(ctx);
            if (!ctx.isContinueProcessing()) break;
        }
        return ctx;
    }
}
