package org.argverify.rules;

@FunctionalInterface
public interface Rule {
    RuleOutcome apply(RuleInput input);
}
