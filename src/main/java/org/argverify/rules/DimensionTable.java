package org.argverify.rules;

import java.util.*;

import static org.argverify.rules.InformalRules.*;
import static org.argverify.rules.LogicalRules.*;

/**
 * Immutable mapping from evaluation dimension to the rule ids it aggregates. This is the one
 * place where a rule gets attached to a dimension.
 */
public final class DimensionTable {

    public static final String MALFORMED_ARGUMENT = "malformed_argument";
    public static final String MISSING_LABEL_GIST = "missing_label_gist";
    public static final String MISSING_INFERENCE_DATA = "missing_inference_data";
    public static final String DANGLING_REFERENCE = "dangling_reference";
    public static final String UNUSED_PROPOSITIONS = "unused_propositions";
    public static final String DISALLOWED_MATERIAL = "disallowed_material";
    public static final String FLAWED_FORMALIZATIONS = "flawed_formalizations";
    public static final String INVALID_INFERENCE = "invalid_inference";
    public static final String REDUNDANT_PREMISES = "redundant_premises";
    public static final String INCONSISTENT_PREMISES = "inconsistent_premises";
    public static final String UNGROUNDED_RELATIONS = "ungrounded_relations";

    /** Informal reconstruction of exactly one argument, nothing else in the snippet. */
    public static final DimensionTable INFRECO_DEFAULT = builder()
        .dimension(MALFORMED_ARGUMENT, HAS_PCS, STARTS_WITH_PREMISE, ENDS_WITH_CONCLUSION, NO_DUPLICATE_PCS_LABELS)
        .dimension(MISSING_LABEL_GIST, HAS_LABEL, HAS_GIST, NOT_MULTIPLE_GISTS)
        .dimension(MISSING_INFERENCE_DATA, HAS_INFERENCE_DATA)
        .dimension(DANGLING_REFERENCE, PROP_REFS_EXIST)
        .dimension(UNUSED_PROPOSITIONS, USES_ALL_PROPS)
        .dimension(DISALLOWED_MATERIAL, HAS_UNIQUE_ARGUMENT, NO_EXTRA_PROPOSITIONS,
            ONLY_GROUNDED_DIALECTICAL_RELATIONS, NO_PROP_INLINE_DATA, NO_ARG_INLINE_DATA)
        .build();

    /** Informal reconstructions of several arguments; propositions may carry inline data. */
    public static final DimensionTable INFRECO_MULTI = INFRECO_DEFAULT
        .with(DISALLOWED_MATERIAL, HAS_ARGUMENTS, NO_EXTRA_PROPOSITIONS, NO_ARG_INLINE_DATA);

    /** Logical reconstruction of exactly one argument. */
    public static final DimensionTable LOGRECO_DEFAULT = INFRECO_DEFAULT
        .with(DISALLOWED_MATERIAL, HAS_UNIQUE_ARGUMENT, NO_EXTRA_PROPOSITIONS, NO_ARG_INLINE_DATA)
        .with(FLAWED_FORMALIZATIONS, HAS_FLAWLESS_FORMALIZATIONS)
        .with(INVALID_INFERENCE, IS_GLOBALLY_DEDUCTIVELY_VALID, IS_LOCALLY_DEDUCTIVELY_VALID)
        .with(REDUNDANT_PREMISES, ALL_PREMISES_RELEVANT)
        .with(INCONSISTENT_PREMISES, PREMISES_CONSISTENT)
        .with(UNGROUNDED_RELATIONS, FORMALLY_GROUNDED_RELATIONS);

    /** Logical reconstructions of several arguments. */
    public static final DimensionTable LOGRECO_MULTI = LOGRECO_DEFAULT
        .with(DISALLOWED_MATERIAL, HAS_ARGUMENTS, NO_EXTRA_PROPOSITIONS, NO_ARG_INLINE_DATA);

    private final Map<String, List<String>> dimensions;

    private DimensionTable(Map<String, List<String>> dimensions) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        dimensions.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.dimensions = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy with {@code dimension} added, or replaced in place if present. */
    public DimensionTable with(String dimension, String... ruleIds) {
        Map<String, List<String>> copy = new LinkedHashMap<>(dimensions);
        copy.put(dimension, Arrays.asList(ruleIds));
        return new DimensionTable(copy);
    }

    public Set<String> dimensions() {
        return dimensions.keySet();
    }

    public List<String> rulesOf(String dimension) {
        List<String> ids = dimensions.get(dimension);
        if (ids == null) throw new IllegalArgumentException("Unknown dimension: '" + dimension + "'");
        return ids;
    }

    /** @throws IllegalArgumentException if a dimension lists a rule the table does not know */
    public void validate(RuleTable rules) {
        for (Map.Entry<String, List<String>> e : dimensions.entrySet()) {
            for (String id : e.getValue()) {
                if (!rules.contains(id)) {
                    throw new IllegalArgumentException("Dimension '" + e.getKey() + "' lists unknown rule '" + id + "'");
                }
            }
        }
    }

    public static final class Builder {
        private final Map<String, List<String>> dimensions = new LinkedHashMap<>();

        public Builder dimension(String name, String... ruleIds) {
            if (ruleIds.length == 0) throw new IllegalArgumentException("Dimension '" + name + "' lists no rules");
            dimensions.put(name, Arrays.asList(ruleIds));
            return this;
        }

        public DimensionTable build() {
            return new DimensionTable(dimensions);
        }
    }
}
