package org.argverify.logic;

import java.util.*;

/**
 * First-order formula as produced by {@link FormulaParser}. Nodes are immutable;
 * {@link #toString()} prints them back in the input syntax.
 */
public abstract class Formula {

    public abstract <R> R accept(FormulaVisitor<R> visitor);

    public enum Connective {
        AND("&"), OR("|"), IMPLIES("->"), IFF("<->");

        private final String symbol;

        Connective(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    public enum Quantifier {
        ALL("all"), EXISTS("exists");

        private final String keyword;

        Quantifier(String keyword) { this.keyword = keyword; }

        public String keyword() { return keyword; }
    }

    /**
     * Individual term: a quantifier-bound variable, a free constant, or a function symbol
     * applied to argument terms.
     */
    public static final class Term {
        private final String name;
        private final boolean bound;
        private final List<Term> args;

        public Term(String name, boolean bound) {
            this.name = name;
            this.bound = bound;
            this.args = List.of();
        }

        public Term(String function, List<Term> args) {
            if (args.isEmpty()) throw new IllegalArgumentException("Function term '" + function + "' needs arguments");
            this.name = function;
            this.bound = false;
            this.args = List.copyOf(args);
        }

        public String name() { return name; }
        public boolean isBound() { return bound; }
        public List<Term> args() { return args; }
        public boolean isApplication() { return !args.isEmpty(); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Term)) return false;
            Term t = (Term) o;
            return t.name.equals(name) && t.bound == bound && t.args.equals(args);
        }

        @Override
        public int hashCode() { return Objects.hash(name, bound, args); }

        @Override
        public String toString() {
            if (args.isEmpty()) return name;
            StringJoiner j = new StringJoiner(",", name + "(", ")");
            for (Term t : args) j.add(t.toString());
            return j.toString();
        }
    }

    public static final class PropVar extends Formula {
        private final String name;

        public PropVar(String name) { this.name = name; }

        public String name() { return name; }

        @Override
        public <R> R accept(FormulaVisitor<R> v) { return v.visitPropVar(this); }

        @Override
        public String toString() { return name; }
    }

    public static final class Predication extends Formula {
        private final String predicate;
        private final List<Term> args;

        public Predication(String predicate, List<Term> args) {
            this.predicate = predicate;
            this.args = List.copyOf(args);
        }

        public String predicate() { return predicate; }
        public List<Term> args() { return args; }

        @Override
        public <R> R accept(FormulaVisitor<R> v) { return v.visitPredication(this); }

        @Override
        public String toString() {
            StringJoiner j = new StringJoiner(",", predicate + "(", ")");
            for (Term t : args) j.add(t.toString());
            return j.toString();
        }
    }

    public static final class Equality extends Formula {
        private final Term left;
        private final Term right;

        public Equality(Term left, Term right) {
            this.left = left;
            this.right = right;
        }

        public Term left() { return left; }
        public Term right() { return right; }

        @Override
        public <R> R accept(FormulaVisitor<R> v) { return v.visitEquality(this); }

        @Override
        public String toString() { return left + " = " + right; }
    }

    public static final class Not extends Formula {
        private final Formula operand;

        public Not(Formula operand) { this.operand = operand; }

        public Formula operand() { return operand; }

        @Override
        public <R> R accept(FormulaVisitor<R> v) { return v.visitNot(this); }

        @Override
        public String toString() { return "-" + wrap(operand); }
    }

    public static final class Binary extends Formula {
        private final Connective connective;
        private final Formula left;
        private final Formula right;

        public Binary(Connective connective, Formula left, Formula right) {
            this.connective = connective;
            this.left = left;
            this.right = right;
        }

        public Connective connective() { return connective; }
        public Formula left() { return left; }
        public Formula right() { return right; }

        @Override
        public <R> R accept(FormulaVisitor<R> v) { return v.visitBinary(this); }

        @Override
        public String toString() { return "(" + left + " " + connective.symbol() + " " + right + ")"; }
    }

    public static final class Quantified extends Formula {
        private final Quantifier quantifier;
        private final String variable;
        private final Formula body;

        public Quantified(Quantifier quantifier, String variable, Formula body) {
            this.quantifier = quantifier;
            this.variable = variable;
            this.body = body;
        }

        public Quantifier quantifier() { return quantifier; }
        public String variable() { return variable; }
        public Formula body() { return body; }

        @Override
        public <R> R accept(FormulaVisitor<R> v) { return v.visitQuantified(this); }

        @Override
        public String toString() { return quantifier.keyword() + " " + variable + "." + wrap(body); }
    }

    public static Formula not(Formula f) {
        return new Not(f);
    }

    private static String wrap(Formula f) {
        String s = f.toString();
        if (f instanceof Binary || s.startsWith("(")) return s;
        if (f instanceof Equality) return "(" + s + ")";
        return s;
    }
}
