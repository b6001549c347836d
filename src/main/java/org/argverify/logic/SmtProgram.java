package org.argverify.logic;

import java.util.*;

/**
 * Renders entailment queries as SMT-LIB 2 programs. Individuals live in one uninterpreted
 * sort {@code Universal}; sentences are Bool constants, predicates are Bool-valued functions,
 * and function symbols map individuals to individuals.
 * The program asserts the negation of "premises imply conclusions", so the premises entail
 * the conclusions iff the solver answers unsat.
 */
public final class SmtProgram {

    static final String SORT = "Universal";

    private static final Set<String> RESERVED = Set.of(
        "and", "or", "not", "xor", "ite", "true", "false", "distinct", "let", "forall", "exists",
        "match", "par", "as", "assert", "Bool", "Int", "Real", SORT);

    private SmtProgram() {}

    /**
     * @param premises     label to formula, in order
     * @param conclusions  label to formula, in order; must not be empty
     * @param declarations symbol to plain-text meaning, rendered as comments
     * @throws IllegalArgumentException if the formulas use a symbol inconsistently
     */
    public static String entailment(Map<String, Formula> premises, Map<String, Formula> conclusions,
                                    Map<String, String> declarations) {
        if (conclusions.isEmpty()) throw new IllegalArgumentException("No conclusion to check");
        List<Formula> all = new ArrayList<>(premises.values());
        all.addAll(conclusions.values());
        Signature sig = Signature.of(all);
        if (!sig.conflicts().isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", sig.conflicts()));
        }

        StringBuilder sb = new StringBuilder();
        if (declarations != null) {
            for (String sym : sig.symbols()) {
                String meaning = declarations.get(sym);
                if (meaning != null) {
                    sb.append("; ").append(sym).append(": ").append(meaning.replaceAll("\\s+", " ").trim()).append('\n');
                }
            }
        }
        sb.append("(declare-sort ").append(SORT).append(" 0)\n");
        for (String p : sig.propositionalVariables()) {
            sb.append("(declare-fun ").append(symbol(p)).append(" () Bool)\n");
        }
        for (String c : sig.constants()) {
            sb.append("(declare-const ").append(symbol(c)).append(' ').append(SORT).append(")\n");
        }
        for (Map.Entry<String, Integer> e : sig.functions().entrySet()) {
            sb.append("(declare-fun ").append(symbol(e.getKey())).append(' ')
                .append(domain(e.getValue())).append(' ').append(SORT).append(")\n");
        }
        for (Map.Entry<String, Integer> e : sig.predicates().entrySet()) {
            sb.append("(declare-fun ").append(symbol(e.getKey())).append(' ').append(domain(e.getValue())).append(" Bool)\n");
        }

        List<String> premiseNames = new ArrayList<>();
        int i = 1;
        for (Map.Entry<String, Formula> e : premises.entrySet()) {
            String name = "$premise" + i++;
            premiseNames.add(name);
            sb.append("; ").append(name).append(": (").append(e.getKey()).append(")\n");
            sb.append("(define-fun ").append(name).append(" () Bool ").append(render(e.getValue())).append(")\n");
        }
        List<String> conclusionNames = new ArrayList<>();
        i = 1;
        for (Map.Entry<String, Formula> e : conclusions.entrySet()) {
            String name = "$conclusion" + i++;
            conclusionNames.add(name);
            sb.append("; ").append(name).append(": (").append(e.getKey()).append(")\n");
            sb.append("(define-fun ").append(name).append(" () Bool ").append(render(e.getValue())).append(")\n");
        }

        sb.append("(define-fun $argument () Bool (=> ")
            .append(conjunction(premiseNames)).append(' ')
            .append(conjunction(conclusionNames)).append("))\n");
        sb.append("(assert (not $argument))\n");
        sb.append("(check-sat)\n");
        return sb.toString();
    }

    private static String domain(int arity) {
        StringJoiner args = new StringJoiner(" ", "(", ")");
        for (int i = 0; i < arity; i++) args.add(SORT);
        return args.toString();
    }

    private static String conjunction(List<String> names) {
        if (names.isEmpty()) return "true";
        if (names.size() == 1) return names.get(0);
        return "(and " + String.join(" ", names) + ")";
    }

    /** SMT-LIB term for a single formula. */
    public static String render(Formula f) {
        return f.accept(new FormulaVisitor<String>() {
            @Override
            public String visitPropVar(Formula.PropVar p) {
                return symbol(p.name());
            }

            @Override
            public String visitPredication(Formula.Predication p) {
                StringBuilder sb = new StringBuilder("(").append(symbol(p.predicate()));
                for (Formula.Term t : p.args()) sb.append(' ').append(term(t));
                return sb.append(')').toString();
            }

            @Override
            public String visitEquality(Formula.Equality e) {
                return "(= " + term(e.left()) + " " + term(e.right()) + ")";
            }

            @Override
            public String visitNot(Formula.Not n) {
                return "(not " + n.operand().accept(this) + ")";
            }

            @Override
            public String visitBinary(Formula.Binary b) {
                String op;
                switch (b.connective()) {
                    case AND: op = "and"; break;
                    case OR: op = "or"; break;
                    case IMPLIES: op = "=>"; break;
                    default: op = "="; break;
                }
                return "(" + op + " " + b.left().accept(this) + " " + b.right().accept(this) + ")";
            }

            @Override
            public String visitQuantified(Formula.Quantified q) {
                String kw = q.quantifier() == Formula.Quantifier.ALL ? "forall" : "exists";
                return "(" + kw + " ((" + symbol(q.variable()) + " " + SORT + ")) " + q.body().accept(this) + ")";
            }
        });
    }

    private static String term(Formula.Term t) {
        if (!t.isApplication()) return symbol(t.name());
        StringBuilder sb = new StringBuilder("(").append(symbol(t.name()));
        for (Formula.Term arg : t.args()) sb.append(' ').append(term(arg));
        return sb.append(')').toString();
    }

    static String symbol(String name) {
        if (name.matches("[A-Za-z][A-Za-z0-9_]*") && !RESERVED.contains(name)) return name;
        return "|" + name.replace('|', '_').replace('\\', '_') + "|";
    }
}
