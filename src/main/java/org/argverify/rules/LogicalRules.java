package org.argverify.rules;

import org.argverify.logic.EntailmentResult;
import org.argverify.logic.Formalizations;
import org.argverify.logic.Formula;
import org.argverify.model.*;

import java.util.*;

/**
 * Rules over formalized reconstructions. Validity, relevance, consistency and relation checks
 * are not applicable when the formalizations they need are missing or broken; that failure
 * is reported once, by {@link #HAS_FLAWLESS_FORMALIZATIONS}.
 */
public final class LogicalRules {

    public static final String HAS_FLAWLESS_FORMALIZATIONS = "has_flawless_formalizations";
    public static final String IS_GLOBALLY_DEDUCTIVELY_VALID = "is_globally_deductively_valid";
    public static final String IS_LOCALLY_DEDUCTIVELY_VALID = "is_locally_deductively_valid";
    public static final String ALL_PREMISES_RELEVANT = "all_premises_relevant";
    public static final String PREMISES_CONSISTENT = "premises_consistent";
    public static final String FORMALLY_GROUNDED_RELATIONS = "formally_grounded_relations";

    private LogicalRules() {}

    static void register(RuleTable.Builder b) {
        b.register(HAS_FLAWLESS_FORMALIZATIONS, RuleScope.ARGUMENT, LogicalRules::hasFlawlessFormalizations);
        b.register(IS_GLOBALLY_DEDUCTIVELY_VALID, RuleScope.ARGUMENT, LogicalRules::isGloballyDeductivelyValid);
        b.register(IS_LOCALLY_DEDUCTIVELY_VALID, RuleScope.ARGUMENT, LogicalRules::isLocallyDeductivelyValid);
        b.register(ALL_PREMISES_RELEVANT, RuleScope.ARGUMENT, LogicalRules::allPremisesRelevant);
        b.register(PREMISES_CONSISTENT, RuleScope.ARGUMENT, LogicalRules::premisesConsistent);
        b.register(FORMALLY_GROUNDED_RELATIONS, RuleScope.GRAPH, LogicalRules::formallyGroundedRelations);
    }

    static RuleOutcome hasFlawlessFormalizations(RuleInput in) {
        Argument a = in.argument();
        if (a.getPcs().isEmpty()) return RuleOutcome.notApplicable();
        Formalizations fs = in.formalizations();
        List<String> problems = fs.problems(a);
        Map<String, String> parsed = new LinkedHashMap<>();
        Map<String, Map<String, String>> declared = new LinkedHashMap<>();
        for (PcsItem item : a.getPcs()) {
            Formula f = fs.formula(item);
            if (f != null) parsed.put(item.getPropositionLabel(), f.toString());
            Map<String, String> decl = fs.declarations(item.getPropositionLabel());
            if (!decl.isEmpty()) declared.put(item.getPropositionLabel(), new LinkedHashMap<>(decl));
        }
        return RuleOutcome.failIfAny(problems, " ")
            .withDetail("formalizations", parsed)
            .withDetail("declarations", declared);
    }

    static RuleOutcome isGloballyDeductivelyValid(RuleInput in) {
        Argument a = in.argument();
        if (!in.formalizations().isUsable(a) || a.finalConclusion().isEmpty() || a.premises().isEmpty()) {
            return RuleOutcome.notApplicable();
        }
        EntailmentResult r = globalEntailment(in, a);
        if (r.isEntailed()) return RuleOutcome.pass().withDetail("smtlib.global", r.program());
        if (r.isUndecided()) {
            return RuleOutcome.fail("Could not decide global deductive validity (" + r.detail()
                + "); this is not a proof of invalidity." + programSuffix(r)).withDetail("smtlib.global", r.program());
        }
        return RuleOutcome.fail("According to the provided formalizations, the argument is not deductively valid."
            + programSuffix(r)).withDetail("smtlib.global", r.program());
    }

    static RuleOutcome isLocallyDeductivelyValid(RuleInput in) {
        Argument a = in.argument();
        Formalizations fs = in.formalizations();
        if (!fs.isUsable(a)) return RuleOutcome.notApplicable();

        List<String> msgs = new ArrayList<>();
        Map<String, PcsItem> earlier = new LinkedHashMap<>();
        int checked = 0;
        for (PcsItem c : a.getPcs()) {
            if (c.isConclusion()) {
                List<String> refs = c.inferenceRefs(in.fromKey());
                Map<String, Formula> premises = new LinkedHashMap<>();
                for (String ref : refs) {
                    PcsItem p = earlier.get(ref);
                    if (p != null) premises.put(ref, fs.formula(p));
                }
                // missing or dangling inference data is reported by the structural rules
                if (!refs.isEmpty() && premises.size() == refs.size()) {
                    checked++;
                    Map<String, Formula> conclusion = Map.of(c.getLabel(), fs.formula(c));
                    EntailmentResult r = in.entailment().check(premises, conclusion, fs.declarations());
                    if (r.isUndecided()) {
                        msgs.add("Could not decide deductive validity of the sub-inference to (" + c.getLabel() + ") ("
                            + r.detail() + "); this is not a proof of invalidity." + programSuffix(r));
                    } else if (!r.isEntailed()) {
                        msgs.add("According to the provided formalizations and inference info, the sub-inference to "
                            + "conclusion (" + c.getLabel() + ") is not deductively valid." + programSuffix(r));
                    }
                }
            }
            earlier.put(c.getLabel(), c);
        }
        if (checked == 0) return RuleOutcome.notApplicable();
        return RuleOutcome.failIfAny(msgs, "\n");
    }

    /**
     * Flags premises whose removal keeps the argument valid. Arguments with a single premise
     * always pass: dropping it would only be "valid" if the conclusion were a tautology, which
     * this check does not try to detect.
     */
    static RuleOutcome allPremisesRelevant(RuleInput in) {
        Argument a = in.argument();
        Formalizations fs = in.formalizations();
        if (!fs.isUsable(a) || a.finalConclusion().isEmpty() || a.premises().isEmpty()) {
            return RuleOutcome.notApplicable();
        }
        List<PcsItem> premises = a.premises();
        if (premises.size() == 1) return RuleOutcome.pass();
        if (!globalEntailment(in, a).isEntailed()) return RuleOutcome.notApplicable();

        PcsItem last = a.finalConclusion().get();
        Map<String, Formula> conclusion = Map.of(last.getLabel(), fs.formula(last));
        List<String> msgs = new ArrayList<>();
        for (PcsItem dropped : premises) {
            Map<String, Formula> rest = new LinkedHashMap<>();
            for (PcsItem p : premises) {
                if (p != dropped) rest.put(p.getLabel(), fs.formula(p));
            }
            EntailmentResult r = in.entailment().check(rest, conclusion, fs.declarations());
            if (r.isEntailed()) {
                msgs.add("According to the provided formalizations, premise (" + dropped.getLabel()
                    + ") is not required to logically infer the final conclusion.");
            } else if (r.isUndecided()) {
                msgs.add("Could not decide whether premise (" + dropped.getLabel() + ") is required ("
                    + r.detail() + ")." + programSuffix(r));
            }
        }
        return RuleOutcome.failIfAny(msgs, " ");
    }

    /** The premises are inconsistent iff they entail the negation of one of them. */
    static RuleOutcome premisesConsistent(RuleInput in) {
        Argument a = in.argument();
        Formalizations fs = in.formalizations();
        if (!fs.isUsable(a) || a.premises().isEmpty()) return RuleOutcome.notApplicable();

        List<PcsItem> premises = a.premises();
        Map<String, Formula> ps = new LinkedHashMap<>();
        for (PcsItem p : premises) ps.put(p.getLabel(), fs.formula(p));
        PcsItem first = premises.get(0);
        Map<String, Formula> negated = Map.of("not " + first.getLabel(), Formula.not(fs.formula(first)));
        EntailmentResult r = in.entailment().check(ps, negated, fs.declarations());
        if (r.isEntailed()) {
            return RuleOutcome.fail("According to the provided formalizations, the argument's premises are NOT logically "
                + "consistent: they are not jointly satisfiable." + programSuffix(r));
        }
        if (r.isUndecided()) {
            return RuleOutcome.fail("Could not decide whether the argument's premises are consistent ("
                + r.detail() + "); this is not a proof of inconsistency." + programSuffix(r));
        }
        return RuleOutcome.pass();
    }

    /**
     * Axiomatic relations between formalized propositions must hold logically: support means
     * the source entails the target, attack means it entails the target's negation, and
     * contradiction means each entails the other's negation.
     */
    static RuleOutcome formallyGroundedRelations(RuleInput in) {
        ArgumentGraph g = in.graph();
        Formalizations fs = in.formalizations();
        Set<String> inArguments = new HashSet<>();
        for (Argument a : g.getArguments()) {
            for (PcsItem item : a.getPcs()) inArguments.add(item.getPropositionLabel());
        }

        List<String> msgs = new ArrayList<>();
        int checked = 0;
        for (DialecticalRelation rel : g.getRelations()) {
            if (!rel.is(Dialectics.AXIOMATIC)) continue;
            String s = rel.getSource();
            String t = rel.getTarget();
            // propositions outside any argument are not checked
            if (!inArguments.contains(s) || !inArguments.contains(t)) continue;
            Formula fsrc = fs.formula(s);
            Formula ftgt = fs.formula(t);
            if (fsrc == null || ftgt == null) continue;
            checked++;
            Map<String, String> decl = fs.declarations();
            switch (rel.getValence()) {
                case SUPPORT: {
                    EntailmentResult r = in.entailment().entails(s, fsrc, t, ftgt, decl);
                    if (r.isUndecided()) {
                        msgs.add(undecidedRelation(rel, r));
                    } else if (!r.isEntailed()) {
                        msgs.add("According to the provided formalizations, proposition '" + s + "' does not entail "
                            + "the supported proposition '" + t + "'." + programSuffix(r));
                    }
                    break;
                }
                case ATTACK: {
                    EntailmentResult r = in.entailment().entails(s, fsrc, "not " + t, Formula.not(ftgt), decl);
                    if (r.isUndecided()) {
                        msgs.add(undecidedRelation(rel, r));
                    } else if (!r.isEntailed()) {
                        msgs.add("According to the provided formalizations, proposition '" + s + "' does not entail "
                            + "the negation of the attacked proposition '" + t + "'." + programSuffix(r));
                    }
                    break;
                }
                default: {
                    EntailmentResult r1 = in.entailment().entails(s, fsrc, "not " + t, Formula.not(ftgt), decl);
                    EntailmentResult r2 = in.entailment().entails(t, ftgt, "not " + s, Formula.not(fsrc), decl);
                    if (r1.isUndecided() || r2.isUndecided()) {
                        msgs.add(undecidedRelation(rel, r1.isUndecided() ? r1 : r2));
                    } else if (!r1.isEntailed() || !r2.isEntailed()) {
                        msgs.add("According to the provided formalizations, proposition '" + s + "' is not the "
                            + "negation of the proposition '" + t + "', despite both being declared as contradictory."
                            + programSuffix(r1.isEntailed() ? r2 : r1));
                    }
                }
            }
        }
        if (checked == 0) return RuleOutcome.notApplicable();
        return RuleOutcome.failIfAny(msgs, "\n");
    }

    private static EntailmentResult globalEntailment(RuleInput in, Argument a) {
        return in.session().memoQuery("global@" + a.getLabel() + "#" + System.identityHashCode(a), () -> {
            Formalizations fs = in.formalizations();
            Map<String, Formula> premises = new LinkedHashMap<>();
            for (PcsItem p : a.premises()) premises.put(p.getLabel(), fs.formula(p));
            PcsItem last = a.finalConclusion().get();
            return in.entailment().check(premises, Map.of(last.getLabel(), fs.formula(last)), fs.declarations());
        });
    }

    private static String undecidedRelation(DialecticalRelation rel, EntailmentResult r) {
        return "Could not decide whether the " + rel.getValence().name().toLowerCase() + " relation from '"
            + rel.getSource() + "' to '" + rel.getTarget() + "' holds (" + r.detail() + ")." + programSuffix(r);
    }

    private static String programSuffix(EntailmentResult r) {
        if (r.program() == null) return "";
        return " SMT2LIB program used to check entailment:\n" + r.program();
    }
}
