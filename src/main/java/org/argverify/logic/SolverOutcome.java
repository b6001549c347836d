package org.argverify.logic;

/**
 * Raw answer of a {@link SolverBackend}.
 */
public final class SolverOutcome {

    public enum Status { SAT, UNSAT, UNKNOWN, ERROR }

    private final Status status;
    private final String detail;

    private SolverOutcome(Status status, String detail) {
        this.status = status;
        this.detail = detail;
    }

    public static SolverOutcome sat() { return new SolverOutcome(Status.SAT, null); }
    public static SolverOutcome unsat() { return new SolverOutcome(Status.UNSAT, null); }
    public static SolverOutcome unknown(String reason) { return new SolverOutcome(Status.UNKNOWN, reason); }
    public static SolverOutcome error(String message) { return new SolverOutcome(Status.ERROR, message); }

    public Status status() { return status; }
    public String detail() { return detail; }

    public boolean isDecided() {
        return status == Status.SAT || status == Status.UNSAT;
    }

    @Override
    public String toString() {
        return detail == null ? status.name().toLowerCase() : status.name().toLowerCase() + " (" + detail + ")";
    }
}
