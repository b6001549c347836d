package org.argverify.coherence;

import org.argverify.model.ArgumentGraph;
import org.argverify.model.DialecticalRelation;
import org.argverify.model.Proposition;
import org.argverify.model.Valence;

import java.util.*;

/**
 * Comparisons between propositions and relations of argument graphs.
 */
public final class DialecticsUtil {

    private static final List<String> NEGATION_PREFIXES = List.of("NOT: ", "Not: ", "NOT ", "Not ");

    private DialecticsUtil() {}

    /** Same label, or some text in common. */
    public static boolean areIdentical(Proposition a, Proposition b) {
        if (a == null || b == null) return false;
        if (a.getLabel() != null && a.getLabel().equals(b.getLabel())) return true;
        for (String text : a.getTexts()) {
            if (b.getTexts().contains(text)) return true;
        }
        return false;
    }

    /**
     * Distinct propositions that attack or contradict each other in {@code graph} (when given),
     * or one of which states the other with a negation prefix.
     */
    public static boolean areContradictory(Proposition a, Proposition b, ArgumentGraph graph) {
        if (a == null || b == null) return false;
        if (Objects.equals(a.getLabel(), b.getLabel())) return false;
        if (graph != null) {
            for (DialecticalRelation r : graph.getRelations()) {
                boolean between = (Objects.equals(r.getSource(), a.getLabel()) && Objects.equals(r.getTarget(), b.getLabel()))
                    || (Objects.equals(r.getSource(), b.getLabel()) && Objects.equals(r.getTarget(), a.getLabel()));
                if (between && r.getValence() != Valence.SUPPORT) return true;
            }
        }
        return negates(a, b) || negates(b, a);
    }

    private static boolean negates(Proposition a, Proposition b) {
        for (String text : a.getTexts()) {
            for (String other : b.getTexts()) {
                for (String prefix : NEGATION_PREFIXES) {
                    if (text.equals(prefix + other)) return true;
                }
            }
        }
        return false;
    }

    /** Direct support, or a support/support or attack/attack chain through one proposition. */
    public static boolean indirectlySupports(String from, String to, ArgumentGraph graph) {
        if (Objects.equals(from, to)) return true;
        if (hasRelation(graph, from, to, true)) return true;
        for (String mid : graph.propositionLabels()) {
            if (mid.equals(from) || mid.equals(to)) continue;
            for (DialecticalRelation r1 : graph.getRelations(from, mid)) {
                for (DialecticalRelation r2 : graph.getRelations(mid, to)) {
                    if (isSupport(r1) == isSupport(r2)) return true;
                }
            }
        }
        return false;
    }

    /** Direct attack, or a chain through one proposition mixing support and attack. */
    public static boolean indirectlyAttacks(String from, String to, ArgumentGraph graph) {
        if (Objects.equals(from, to)) return false;
        if (hasRelation(graph, from, to, false)) return true;
        for (String mid : graph.propositionLabels()) {
            if (mid.equals(from) || mid.equals(to)) continue;
            for (DialecticalRelation r1 : graph.getRelations(from, mid)) {
                for (DialecticalRelation r2 : graph.getRelations(mid, to)) {
                    if (isSupport(r1) != isSupport(r2)) return true;
                }
            }
        }
        return false;
    }

    private static boolean hasRelation(ArgumentGraph graph, String from, String to, boolean support) {
        for (DialecticalRelation r : graph.getRelations(from, to)) {
            if (support ? r.getValence() == Valence.SUPPORT : r.getValence() == Valence.ATTACK) return true;
        }
        return false;
    }

    private static boolean isSupport(DialecticalRelation r) {
        return r.getValence() == Valence.SUPPORT;
    }
}
