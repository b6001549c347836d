package org.argverify.rules;

import java.util.Objects;

public final class RuleDefinition {
    private final String id;
    private final RuleScope scope;
    private final Rule rule;

    public RuleDefinition(String id, RuleScope scope, Rule rule) {
        this.id = Objects.requireNonNull(id, "id");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.rule = Objects.requireNonNull(rule, "rule");
    }

    public String id() { return id; }
    public RuleScope scope() { return scope; }
    public Rule rule() { return rule; }

    @Override
    public String toString() {
        return id + "[" + scope + "]";
    }
}
