package org.argverify.logic;

/**
 * Decision procedure for SMT-LIB programs. Implementations must not throw: faults and
 * timeouts come back as {@link SolverOutcome.Status#ERROR} / {@link SolverOutcome.Status#UNKNOWN}.
 */
public interface SolverBackend {

    SolverOutcome check(String program, long timeoutMillis);
}
