package org.argverify.rules;

import org.argverify.logic.EntailmentChecker;
import org.argverify.logic.Formalizations;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.request.VerifierSettings;

/**
 * What a rule sees: the graph, the argument under test (null for graph-scoped rules) and the
 * shared session state.
 */
public final class RuleInput {
    private final RuleSession session;
    private final Argument argument;

    RuleInput(RuleSession session, Argument argument) {
        this.session = session;
        this.argument = argument;
    }

    public ArgumentGraph graph() { return session.graph(); }
    public Argument argument() { return argument; }
    public VerifierSettings settings() { return session.settings(); }
    public String fromKey() { return session.settings().fromKey(); }
    public Formalizations formalizations() { return session.formalizations(); }
    public EntailmentChecker entailment() { return session.entailment(); }
    public RuleSession session() { return session; }
}
