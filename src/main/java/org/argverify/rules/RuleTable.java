package org.argverify.rules;

import java.util.*;

/**
 * Registry of rules by stable identifier. Dimensions refer to rules only through these ids.
 */
public final class RuleTable {

    public static final RuleTable DEFAULT = buildDefault();

    private final Map<String, RuleDefinition> rules;

    private RuleTable(Map<String, RuleDefinition> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    private static RuleTable buildDefault() {
        Builder b = builder();
        InformalRules.register(b);
        LogicalRules.register(b);
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @throws IllegalArgumentException for an unknown id */
    public RuleDefinition get(String id) {
        RuleDefinition def = rules.get(id);
        if (def == null) throw new IllegalArgumentException("Unknown rule id: '" + id + "'");
        return def;
    }

    public boolean contains(String id) {
        return rules.containsKey(id);
    }

    public Set<String> ids() {
        return rules.keySet();
    }

    public static final class Builder {
        private final Map<String, RuleDefinition> rules = new LinkedHashMap<>();

        public Builder register(String id, RuleScope scope, Rule rule) {
            if (rules.containsKey(id)) throw new IllegalArgumentException("Rule registered twice: '" + id + "'");
            rules.put(id, new RuleDefinition(id, scope, rule));
            return this;
        }

        public RuleTable build() {
            return new RuleTable(rules);
        }
    }
}
