package org.argverify.logic;

import java.util.*;

/**
 * Memoizes decided answers (sat/unsat) of a delegate backend. Unknown and error outcomes are
 * never cached since they may depend on the timeout or on transient faults.
 */
public class CachingSolverBackend implements SolverBackend {

    private final SolverBackend delegate;
    private final Map<String, SolverOutcome> cache;

    public CachingSolverBackend(SolverBackend delegate, int maxEntries) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Collections.synchronizedMap(new LinkedHashMap<String, SolverOutcome>(maxEntries + 1, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SolverOutcome> eldest) {
                return size() > maxEntries;
            }
        });
    }

    @Override
    public SolverOutcome check(String program, long timeoutMillis) {
        SolverOutcome cached = cache.get(program);
        if (cached != null) return cached;
        SolverOutcome outcome = delegate.check(program, timeoutMillis);
        if (outcome.isDecided()) cache.put(program, outcome);
        return outcome;
    }

    public int size() {
        return cache.size();
    }
}
