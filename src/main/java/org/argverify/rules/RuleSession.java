package org.argverify.rules;

import org.argverify.logic.EntailmentChecker;
import org.argverify.logic.EntailmentResult;
import org.argverify.logic.Formalizations;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.request.VerifierSettings;

import java.util.*;
import java.util.function.Supplier;

/**
 * State shared by all rules applied to one graph during one battery run: lazily read
 * formalizations and memoized outcomes, so a rule listed in several dimensions or a solver
 * query needed by several rules runs once.
 */
public final class RuleSession {
    private final ArgumentGraph graph;
    private final VerifierSettings settings;
    private final EntailmentChecker entailment;
    private Formalizations formalizations;
    private final Map<String, RuleOutcome> graphOutcomes = new HashMap<>();
    private final Map<Argument, Map<String, RuleOutcome>> argumentOutcomes = new IdentityHashMap<>();
    private final Map<String, EntailmentResult> queries = new HashMap<>();

    public RuleSession(ArgumentGraph graph, VerifierSettings settings, EntailmentChecker entailment) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.entailment = entailment;
    }

    public ArgumentGraph graph() { return graph; }
    public VerifierSettings settings() { return settings; }

    public EntailmentChecker entailment() {
        if (entailment == null) throw new IllegalStateException("No solver backend configured for logical checks");
        return entailment;
    }

    public Formalizations formalizations() {
        if (formalizations == null) {
            formalizations = Formalizations.read(graph, settings.formalizationKey(), settings.declarationsKey());
        }
        return formalizations;
    }

    public RuleInput inputFor(Argument argument) {
        return new RuleInput(this, argument);
    }

    RuleOutcome apply(RuleDefinition def, Argument argument) {
        Map<String, RuleOutcome> memo = argument == null
            ? graphOutcomes
            : argumentOutcomes.computeIfAbsent(argument, a -> new HashMap<>());
        RuleOutcome cached = memo.get(def.id());
        if (cached != null) return cached;
        RuleOutcome outcome = def.rule().apply(inputFor(argument));
        memo.put(def.id(), outcome);
        return outcome;
    }

    /** Runs {@code query} once per key within this session. */
    public EntailmentResult memoQuery(String key, Supplier<EntailmentResult> query) {
        return queries.computeIfAbsent(key, k -> query.get());
    }
}
