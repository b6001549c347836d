package org.argverify.logic;

import java.util.*;

/**
 * Free symbols of one or more formulas: propositional variables, predicates and function
 * symbols with arity, and individual constants. Role or arity clashes are collected as conflicts.
 */
public final class Signature {
    private final Set<String> propVars = new TreeSet<>();
    private final Map<String, Integer> predicates = new TreeMap<>();
    private final Map<String, Integer> functions = new TreeMap<>();
    private final Set<String> constants = new TreeSet<>();
    private final List<String> conflicts = new ArrayList<>();

    private Signature() {}

    public static Signature of(Formula f) {
        Signature s = new Signature();
        s.collect(f);
        return s;
    }

    public static Signature of(Collection<Formula> formulas) {
        Signature s = new Signature();
        for (Formula f : formulas) s.collect(f);
        return s;
    }

    private void collect(Formula f) {
        f.accept(new FormulaVisitor<Void>() {
            @Override
            public Void visitPropVar(Formula.PropVar p) {
                addPropVar(p.name());
                return null;
            }

            @Override
            public Void visitPredication(Formula.Predication p) {
                addPredicate(p.predicate(), p.args().size());
                for (Formula.Term t : p.args()) addTerm(t);
                return null;
            }

            @Override
            public Void visitEquality(Formula.Equality e) {
                addTerm(e.left());
                addTerm(e.right());
                return null;
            }

            @Override
            public Void visitNot(Formula.Not n) {
                return n.operand().accept(this);
            }

            @Override
            public Void visitBinary(Formula.Binary b) {
                b.left().accept(this);
                return b.right().accept(this);
            }

            @Override
            public Void visitQuantified(Formula.Quantified q) {
                return q.body().accept(this);
            }
        });
    }

    private void addTerm(Formula.Term t) {
        if (t.isApplication()) {
            addFunction(t.name(), t.args().size());
            for (Formula.Term arg : t.args()) addTerm(arg);
        } else if (!t.isBound()) {
            addConstant(t.name());
        }
    }

    private void addPropVar(String name) {
        if (predicates.containsKey(name) || functions.containsKey(name) || constants.contains(name)) {
            conflict("Symbol '" + name + "' is used both as a sentence and as " + roleOf(name));
            return;
        }
        propVars.add(name);
    }

    private void addPredicate(String name, int arity) {
        if (propVars.contains(name) || functions.containsKey(name) || constants.contains(name)) {
            conflict("Symbol '" + name + "' is used both as a predicate and as " + roleOf(name));
            return;
        }
        Integer known = predicates.get(name);
        if (known != null && known != arity) {
            conflict("Inconsistent arity of predicate '" + name + "' (" + known + " vs " + arity + ")");
            return;
        }
        predicates.put(name, arity);
    }

    private void addFunction(String name, int arity) {
        if (propVars.contains(name) || predicates.containsKey(name) || constants.contains(name)) {
            conflict("Symbol '" + name + "' is used both as a function and as " + roleOf(name));
            return;
        }
        Integer known = functions.get(name);
        if (known != null && known != arity) {
            conflict("Inconsistent arity of function '" + name + "' (" + known + " vs " + arity + ")");
            return;
        }
        functions.put(name, arity);
    }

    private void addConstant(String name) {
        if (propVars.contains(name) || predicates.containsKey(name) || functions.containsKey(name)) {
            conflict("Symbol '" + name + "' is used both as an individual constant and as " + roleOf(name));
            return;
        }
        constants.add(name);
    }

    private String roleOf(String name) {
        if (propVars.contains(name)) return "a sentence";
        if (predicates.containsKey(name)) return "a predicate";
        if (functions.containsKey(name)) return "a function";
        return "an individual constant";
    }

    private void conflict(String msg) {
        if (!conflicts.contains(msg)) conflicts.add(msg);
    }

    public Set<String> propositionalVariables() { return Collections.unmodifiableSet(propVars); }
    public Map<String, Integer> predicates() { return Collections.unmodifiableMap(predicates); }
    public Map<String, Integer> functions() { return Collections.unmodifiableMap(functions); }
    public Set<String> constants() { return Collections.unmodifiableSet(constants); }
    public List<String> conflicts() { return Collections.unmodifiableList(conflicts); }

    /** Every free symbol, in sorted order. */
    public Set<String> symbols() {
        Set<String> all = new TreeSet<>(propVars);
        all.addAll(predicates.keySet());
        all.addAll(functions.keySet());
        all.addAll(constants);
        return all;
    }
}
