package org.argverify.logic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Decides whether a set of premises entails a set of conclusions by asking the solver
 * whether premises together with the negated conclusions are unsatisfiable.
 */
public class EntailmentChecker {

    private static final Logger LOG = LoggerFactory.getLogger(EntailmentChecker.class);

    private final SolverBackend backend;
    private final long timeoutMillis;

    public EntailmentChecker(SolverBackend backend, long timeoutMillis) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.timeoutMillis = timeoutMillis;
    }

    public EntailmentResult check(Map<String, Formula> premises, Map<String, Formula> conclusions,
                                  Map<String, String> declarations) {
        String program;
        try {
            program = SmtProgram.entailment(premises, conclusions, declarations);
        } catch (IllegalArgumentException e) {
            return EntailmentResult.undecided(null, "formulas cannot be encoded: " + e.getMessage());
        }
        SolverOutcome outcome = backend.check(program, timeoutMillis);
        switch (outcome.status()) {
            case UNSAT:
                return EntailmentResult.entailed(program);
            case SAT:
                return EntailmentResult.notEntailed(program);
            case UNKNOWN:
                LOG.warn("Entailment undecided after {} ms: {}", timeoutMillis, outcome.detail());
                return EntailmentResult.undecided(program, "solver answered unknown"
                    + (outcome.detail() == null ? "" : ": " + outcome.detail()));
            default:
                return EntailmentResult.undecided(program, "solver error: " + outcome.detail());
        }
    }

    /** Convenience for a single premise and a single conclusion. */
    public EntailmentResult entails(String premiseLabel, Formula premise, String conclusionLabel, Formula conclusion,
                                    Map<String, String> declarations) {
        Map<String, Formula> ps = new LinkedHashMap<>();
        ps.put(premiseLabel, premise);
        Map<String, Formula> cs = new LinkedHashMap<>();
        cs.put(conclusionLabel, conclusion);
        return check(ps, cs, declarations);
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
