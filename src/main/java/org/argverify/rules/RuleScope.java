package org.argverify.rules;

/** Whether a rule judges each argument of a graph or the graph as a whole. */
public enum RuleScope {
    ARGUMENT,
    GRAPH
}
