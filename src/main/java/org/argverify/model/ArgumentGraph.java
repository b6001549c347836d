package org.argverify.model;

import java.util.*;

/**
 * Parsed argument graph: propositions, arguments and the dialectical relations between them.
 * Produced by the markup parser upstream (or {@link org.argverify.io.ArtifactJsonReader}).
 */
public class ArgumentGraph {
    private final List<Proposition> propositions = new ArrayList<>();
    private final List<Argument> arguments = new ArrayList<>();
    private final List<DialecticalRelation> relations = new ArrayList<>();

    public ArgumentGraph addProposition(Proposition p) {
        propositions.add(p);
        return this;
    }

    public ArgumentGraph addArgument(Argument a) {
        arguments.add(a);
        return this;
    }

    public ArgumentGraph addRelation(DialecticalRelation r) {
        relations.add(r);
        return this;
    }

    public List<Proposition> getPropositions() { return Collections.unmodifiableList(propositions); }
    public List<Argument> getArguments() { return Collections.unmodifiableList(arguments); }
    public List<DialecticalRelation> getRelations() { return Collections.unmodifiableList(relations); }

    /** First proposition with the given label, or null. */
    public Proposition getProposition(String label) {
        if (label == null) return null;
        for (Proposition p : propositions) {
            if (label.equals(p.getLabel())) return p;
        }
        return null;
    }

    /** First argument with the given label, or null. */
    public Argument getArgument(String label) {
        if (label == null) return null;
        for (Argument a : arguments) {
            if (label.equals(a.getLabel())) return a;
        }
        return null;
    }

    public boolean isArgumentLabel(String label) {
        return getArgument(label) != null;
    }

    /** All relations from source to target; empty when either label is null. */
    public List<DialecticalRelation> getRelations(String source, String target) {
        if (source == null || target == null) return List.of();
        List<DialecticalRelation> out = new ArrayList<>();
        for (DialecticalRelation r : relations) {
            if (source.equals(r.getSource()) && target.equals(r.getTarget())) out.add(r);
        }
        return out;
    }

    public List<String> argumentLabels() {
        List<String> out = new ArrayList<>();
        for (Argument a : arguments) if (!a.isUnlabeled()) out.add(a.getLabel());
        return out;
    }

    public List<String> propositionLabels() {
        List<String> out = new ArrayList<>();
        for (Proposition p : propositions) if (!p.isUnlabeled()) out.add(p.getLabel());
        return out;
    }
}
