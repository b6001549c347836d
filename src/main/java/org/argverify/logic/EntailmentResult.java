package org.argverify.logic;

/**
 * Answer of an entailment query together with the program that was sent to the solver.
 * UNDECIDED covers solver timeouts, unknown answers and faults; it is never a proof either way.
 */
public final class EntailmentResult {

    public enum Verdict { ENTAILED, NOT_ENTAILED, UNDECIDED }

    private final Verdict verdict;
    private final String program;
    private final String detail;

    private EntailmentResult(Verdict verdict, String program, String detail) {
        this.verdict = verdict;
        this.program = program;
        this.detail = detail;
    }

    public static EntailmentResult entailed(String program) {
        return new EntailmentResult(Verdict.ENTAILED, program, null);
    }

    public static EntailmentResult notEntailed(String program) {
        return new EntailmentResult(Verdict.NOT_ENTAILED, program, null);
    }

    public static EntailmentResult undecided(String program, String detail) {
        return new EntailmentResult(Verdict.UNDECIDED, program, detail);
    }

    public Verdict verdict() { return verdict; }
    public String program() { return program; }
    public String detail() { return detail; }

    public boolean isEntailed() { return verdict == Verdict.ENTAILED; }
    public boolean isUndecided() { return verdict == Verdict.UNDECIDED; }

    @Override
    public String toString() {
        return verdict + (detail == null ? "" : " (" + detail + ")");
    }
}
