package org.argverify.rules;

import org.argverify.model.*;

import java.util.*;

/**
 * Structural well-formedness rules for premise-conclusion reconstructions.
 */
public final class InformalRules {

    public static final String HAS_ARGUMENTS = "has_arguments";
    public static final String HAS_UNIQUE_ARGUMENT = "has_unique_argument";
    public static final String HAS_PCS = "has_pcs";
    public static final String STARTS_WITH_PREMISE = "starts_with_premise";
    public static final String ENDS_WITH_CONCLUSION = "ends_with_conclusion";
    public static final String NOT_MULTIPLE_GISTS = "not_multiple_gists";
    public static final String NO_DUPLICATE_PCS_LABELS = "no_duplicate_pcs_labels";
    public static final String HAS_LABEL = "has_label";
    public static final String HAS_GIST = "has_gist";
    public static final String HAS_INFERENCE_DATA = "has_inference_data";
    public static final String PROP_REFS_EXIST = "prop_refs_exist";
    public static final String USES_ALL_PROPS = "uses_all_props";
    public static final String NO_EXTRA_PROPOSITIONS = "no_extra_propositions";
    public static final String ONLY_GROUNDED_DIALECTICAL_RELATIONS = "only_grounded_dialectical_relations";
    public static final String NO_PROP_INLINE_DATA = "no_prop_inline_data";
    public static final String NO_ARG_INLINE_DATA = "no_arg_inline_data";

    private InformalRules() {}

    static void register(RuleTable.Builder b) {
        b.register(HAS_ARGUMENTS, RuleScope.GRAPH, InformalRules::hasArguments);
        b.register(HAS_UNIQUE_ARGUMENT, RuleScope.GRAPH, InformalRules::hasUniqueArgument);
        b.register(HAS_PCS, RuleScope.ARGUMENT, InformalRules::hasPcs);
        b.register(STARTS_WITH_PREMISE, RuleScope.ARGUMENT, InformalRules::startsWithPremise);
        b.register(ENDS_WITH_CONCLUSION, RuleScope.ARGUMENT, InformalRules::endsWithConclusion);
        b.register(NOT_MULTIPLE_GISTS, RuleScope.ARGUMENT, InformalRules::notMultipleGists);
        b.register(NO_DUPLICATE_PCS_LABELS, RuleScope.ARGUMENT, InformalRules::noDuplicatePcsLabels);
        b.register(HAS_LABEL, RuleScope.ARGUMENT, InformalRules::hasLabel);
        b.register(HAS_GIST, RuleScope.ARGUMENT, InformalRules::hasGist);
        b.register(HAS_INFERENCE_DATA, RuleScope.ARGUMENT, InformalRules::hasInferenceData);
        b.register(PROP_REFS_EXIST, RuleScope.ARGUMENT, InformalRules::propRefsExist);
        b.register(USES_ALL_PROPS, RuleScope.ARGUMENT, InformalRules::usesAllProps);
        b.register(NO_EXTRA_PROPOSITIONS, RuleScope.GRAPH, InformalRules::noExtraPropositions);
        b.register(ONLY_GROUNDED_DIALECTICAL_RELATIONS, RuleScope.GRAPH, InformalRules::onlyGroundedDialecticalRelations);
        b.register(NO_PROP_INLINE_DATA, RuleScope.GRAPH, InformalRules::noPropInlineData);
        b.register(NO_ARG_INLINE_DATA, RuleScope.GRAPH, InformalRules::noArgInlineData);
    }

    static RuleOutcome hasArguments(RuleInput in) {
        if (in.graph().getArguments().isEmpty()) return RuleOutcome.fail("No arguments found in the argdown snippet.");
        return RuleOutcome.pass();
    }

    static RuleOutcome hasUniqueArgument(RuleInput in) {
        int n = in.graph().getArguments().size();
        if (n > 1) return RuleOutcome.fail("More than one argument in argdown snippet.");
        if (n == 0) return RuleOutcome.fail("No argument in argdown snippet.");
        return RuleOutcome.pass();
    }

    static RuleOutcome hasPcs(RuleInput in) {
        if (in.argument().getPcs().isEmpty()) {
            return RuleOutcome.fail("Argument lacks premise conclusion structure, i.e., is not reconstructed in standard form.");
        }
        return RuleOutcome.pass();
    }

    static RuleOutcome startsWithPremise(RuleInput in) {
        List<PcsItem> pcs = in.argument().getPcs();
        if (pcs.isEmpty()) return RuleOutcome.notApplicable();
        if (pcs.get(0).isConclusion()) return RuleOutcome.fail("Argument does not start with a premise.");
        return RuleOutcome.pass();
    }

    static RuleOutcome endsWithConclusion(RuleInput in) {
        List<PcsItem> pcs = in.argument().getPcs();
        if (pcs.isEmpty()) return RuleOutcome.notApplicable();
        if (!pcs.get(pcs.size() - 1).isConclusion()) return RuleOutcome.fail("Argument does not end with a conclusion.");
        return RuleOutcome.pass();
    }

    static RuleOutcome notMultipleGists(RuleInput in) {
        if (in.argument().getGists().size() > 1) return RuleOutcome.fail("Argument has more than one gist.");
        return RuleOutcome.pass();
    }

    static RuleOutcome noDuplicatePcsLabels(RuleInput in) {
        List<PcsItem> pcs = in.argument().getPcs();
        if (pcs.isEmpty()) return RuleOutcome.notApplicable();
        Set<String> seen = new HashSet<>();
        Set<String> dups = new LinkedHashSet<>();
        for (PcsItem item : pcs) {
            if (!seen.add(item.getLabel())) dups.add("(" + item.getLabel() + ")");
        }
        if (!dups.isEmpty()) {
            return RuleOutcome.fail("Duplicate labels in the argument's standard form: " + String.join(", ", dups) + ".");
        }
        return RuleOutcome.pass();
    }

    static RuleOutcome hasLabel(RuleInput in) {
        if (in.argument().isUnlabeled()) return RuleOutcome.fail("Argument lacks a label / title.");
        return RuleOutcome.pass();
    }

    static RuleOutcome hasGist(RuleInput in) {
        if (in.argument().getGists().isEmpty()) return RuleOutcome.fail("Argument lacks a gist / summary.");
        return RuleOutcome.pass();
    }

    static RuleOutcome hasInferenceData(RuleInput in) {
        List<PcsItem> pcs = in.argument().getPcs();
        if (pcs.isEmpty()) return RuleOutcome.notApplicable();
        String key = in.fromKey();
        List<String> msgs = new ArrayList<>();
        for (PcsItem c : pcs) {
            if (!c.isConclusion()) continue;
            Map<String, Object> inf = c.getInferenceData();
            if (inf.isEmpty()) {
                msgs.add("Conclusion " + c.getLabel() + " lacks yaml inference information.");
                continue;
            }
            Object from = inf.get(key);
            if (from == null) {
                msgs.add("Conclusion " + c.getLabel() + " inference information lacks '" + key + "' key.");
            } else if (!(from instanceof List)) {
                msgs.add("Conclusion " + c.getLabel() + " inference information '" + key + "' value is not a list.");
            } else if (((List<?>) from).isEmpty()) {
                msgs.add("Conclusion " + c.getLabel() + " inference information '" + key + "' value is empty.");
            }
        }
        return RuleOutcome.failIfAny(msgs, " ");
    }

    /** Every "from" reference must name an item strictly before the conclusion. */
    static RuleOutcome propRefsExist(RuleInput in) {
        List<PcsItem> pcs = in.argument().getPcs();
        if (pcs.isEmpty()) return RuleOutcome.notApplicable();
        List<String> msgs = new ArrayList<>();
        Set<String> earlier = new HashSet<>();
        for (PcsItem item : pcs) {
            if (item.isConclusion()) {
                for (String ref : item.inferenceRefs(in.fromKey())) {
                    if (!earlier.contains(ref)) {
                        msgs.add("Item '" + ref + "' in inference information of conclusion " + item.getLabel()
                            + " does not refer to a previously introduced premise or conclusion.");
                    }
                }
            }
            earlier.add(item.getLabel());
        }
        return RuleOutcome.failIfAny(msgs, " ");
    }

    static RuleOutcome usesAllProps(RuleInput in) {
        List<PcsItem> pcs = in.argument().getPcs();
        if (pcs.isEmpty()) return RuleOutcome.notApplicable();
        Set<String> used = new HashSet<>();
        for (PcsItem item : pcs) {
            if (item.isConclusion()) used.addAll(item.inferenceRefs(in.fromKey()));
        }
        List<String> unused = new ArrayList<>();
        for (PcsItem item : pcs.subList(0, pcs.size() - 1)) {
            if (!used.contains(item.getLabel())) unused.add("(" + item.getLabel() + ")");
        }
        if (!unused.isEmpty()) {
            return RuleOutcome.fail("Some propositions are not explicitly used in any of the argument's inferences: "
                + String.join(", ", unused) + ".");
        }
        return RuleOutcome.pass();
    }

    static RuleOutcome noExtraPropositions(RuleInput in) {
        Set<String> stated = new HashSet<>();
        for (Argument a : in.graph().getArguments()) {
            for (PcsItem item : a.getPcs()) stated.add(item.getPropositionLabel());
        }
        List<String> extra = new ArrayList<>();
        for (Proposition p : in.graph().getPropositions()) {
            if (p.isUnlabeled()) {
                extra.add(p.getTexts().isEmpty() ? "[unlabeled]" : "'" + shorten(p.getTexts().get(0), 40) + "'");
            } else if (!stated.contains(p.getLabel())) {
                extra.add("[" + p.getLabel() + "]");
            }
        }
        if (!extra.isEmpty()) {
            return RuleOutcome.fail("Argdown snippet contains propositions not used in any argument: "
                + String.join(", ", extra) + ".");
        }
        return RuleOutcome.pass();
    }

    static RuleOutcome onlyGroundedDialecticalRelations(RuleInput in) {
        for (DialecticalRelation r : in.graph().getRelations()) {
            if (!r.getDialectics().equals(EnumSet.of(Dialectics.GROUNDED))) {
                return RuleOutcome.fail("Argdown snippet defines dialectical relations.");
            }
        }
        return RuleOutcome.pass();
    }

    static RuleOutcome noPropInlineData(RuleInput in) {
        for (Proposition p : in.graph().getPropositions()) {
            if (!p.getData().isEmpty()) return RuleOutcome.fail("Some propositions contain yaml inline data.");
        }
        return RuleOutcome.pass();
    }

    static RuleOutcome noArgInlineData(RuleInput in) {
        for (Argument a : in.graph().getArguments()) {
            if (!a.getData().isEmpty()) return RuleOutcome.fail("Some arguments contain yaml inline data.");
        }
        return RuleOutcome.pass();
    }

    static String shorten(String text, int width) {
        String t = text.replaceAll("\\s+", " ").trim();
        return t.length() <= width ? t : t.substring(0, width - 3) + "...";
    }
}
