package org.argverify.logic;

import java.util.*;

/**
 * Parser for first-order formulas written like
 * {@code all x.(F(x) -> G(x))}, {@code exists x.F(x)}, {@code p & -q}, {@code f(a) = b}.
 *
 * <p>Accepted operators, each with its word and symbol spellings:
 * <ul>
 *   <li>negation: {@code not}, {@code -}, {@code !}</li>
 *   <li>conjunction: {@code and}, {@code &}, {@code ^}</li>
 *   <li>disjunction: {@code or}, {@code |}</li>
 *   <li>implication: {@code implies}, {@code ->}, {@code =>}</li>
 *   <li>biconditional: {@code iff}, {@code <->}, {@code <=>}</li>
 *   <li>equality: {@code =}, {@code ==}, and {@code !=} for its negation</li>
 *   <li>quantifiers: {@code all}, {@code forall}, {@code exists}, {@code exist}, {@code some}</li>
 * </ul>
 *
 * <p>Binding strength, tightest first: negation, equality, quantifiers, {@code &}, {@code |},
 * {@code ->}, {@code <->}. All binary connectives associate to the left, so
 * {@code p -> q -> r} reads {@code (p -> q) -> r}, and a quantifier only takes the next
 * atom, negation, equation or parenthesized group as its body: {@code all x.F(x) & G(a)} reads
 * {@code (all x.F(x)) & G(a)}. The dot after the quantified variables may be omitted.
 *
 * <p>A name applied to arguments is a predicate in formula position and a function in term
 * position. A bare name in formula position is a propositional variable, and a bare name in
 * term position is a variable if a quantifier binds it and a constant otherwise.
 */
public final class FormulaParser {

    private FormulaParser() {}

    public static Formula parse(String text) throws FormulaParseException {
        if (text == null || text.isBlank()) throw new FormulaParseException("Empty formula", -1);
        List<Token> tokens = tokenize(text);
        Formula f = new Parser(tokens).parseAll();
        Signature sig = Signature.of(f);
        if (!sig.conflicts().isEmpty()) {
            throw new FormulaParseException(String.join("; ", sig.conflicts()), -1);
        }
        return f;
    }

    private enum Kind { IDENT, LPAREN, RPAREN, COMMA, DOT, NOT, AND, OR, IMPLIES, IFF, EQ, NEQ, ALL, EXISTS, EOF }

    private static final Map<String, Kind> KEYWORDS = Map.of(
        "not", Kind.NOT,
        "and", Kind.AND,
        "or", Kind.OR,
        "implies", Kind.IMPLIES,
        "iff", Kind.IFF,
        "all", Kind.ALL,
        "forall", Kind.ALL,
        "exists", Kind.EXISTS,
        "exist", Kind.EXISTS,
        "some", Kind.EXISTS);

    // longest spelling first
    private static final List<Map.Entry<String, Kind>> OPERATORS = List.of(
        Map.entry("<->", Kind.IFF),
        Map.entry("<=>", Kind.IFF),
        Map.entry("->", Kind.IMPLIES),
        Map.entry("=>", Kind.IMPLIES),
        Map.entry("==", Kind.EQ),
        Map.entry("!=", Kind.NEQ),
        Map.entry("=", Kind.EQ),
        Map.entry("!", Kind.NOT),
        Map.entry("-", Kind.NOT),
        Map.entry("&", Kind.AND),
        Map.entry("^", Kind.AND),
        Map.entry("|", Kind.OR),
        Map.entry("(", Kind.LPAREN),
        Map.entry(")", Kind.RPAREN),
        Map.entry(",", Kind.COMMA),
        Map.entry(".", Kind.DOT));

    private static final class Token {
        final Kind kind;
        final String text;
        final int pos;

        Token(Kind kind, String text, int pos) {
            this.kind = kind;
            this.text = text;
            this.pos = pos;
        }

        boolean isEquality() {
            return kind == Kind.EQ || kind == Kind.NEQ;
        }

        @Override
        public String toString() {
            return kind == Kind.EOF ? "end of input" : "'" + text + "'";
        }
    }

    static List<Token> tokenize(String s) throws FormulaParseException {
        List<Token> out = new ArrayList<>();
        int i = 0;
        scan:
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) { i++; continue; }
            if (Character.isLetterOrDigit(c) || c == '_') {
                int start = i;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
                String word = s.substring(start, i);
                out.add(new Token(KEYWORDS.getOrDefault(word, Kind.IDENT), word, start));
                continue;
            }
            for (Map.Entry<String, Kind> op : OPERATORS) {
                if (s.startsWith(op.getKey(), i)) {
                    out.add(new Token(op.getValue(), op.getKey(), i));
                    i += op.getKey().length();
                    continue scan;
                }
            }
            throw new FormulaParseException("Unexpected character '" + c + "'", i);
        }
        out.add(new Token(Kind.EOF, "", s.length()));
        return out;
    }

    // recursive descent over the token list, one method per binding level
    private static final class Parser {
        private final List<Token> tokens;
        private int pos = 0;
        private final Deque<String> bound = new ArrayDeque<>();

        Parser(List<Token> tokens) { this.tokens = tokens; }

        Formula parseAll() throws FormulaParseException {
            Formula f = parseIff();
            if (peek().kind != Kind.EOF) {
                throw new FormulaParseException("Unexpected " + peek() + " after complete formula", peek().pos);
            }
            return f;
        }

        Formula parseIff() throws FormulaParseException {
            Formula left = parseImplies();
            while (peek().kind == Kind.IFF) {
                pos++;
                left = new Formula.Binary(Formula.Connective.IFF, left, parseImplies());
            }
            return left;
        }

        Formula parseImplies() throws FormulaParseException {
            Formula left = parseOr();
            while (peek().kind == Kind.IMPLIES) {
                pos++;
                left = new Formula.Binary(Formula.Connective.IMPLIES, left, parseOr());
            }
            return left;
        }

        Formula parseOr() throws FormulaParseException {
            Formula left = parseAnd();
            while (peek().kind == Kind.OR) {
                pos++;
                left = new Formula.Binary(Formula.Connective.OR, left, parseAnd());
            }
            return left;
        }

        Formula parseAnd() throws FormulaParseException {
            Formula left = parseEquation();
            while (peek().kind == Kind.AND) {
                pos++;
                left = new Formula.Binary(Formula.Connective.AND, left, parseEquation());
            }
            return left;
        }

        /** An equation between two terms, or any tighter-binding formula. */
        Formula parseEquation() throws FormulaParseException {
            if (peek().kind != Kind.IDENT) {
                Formula f = parseOperand();
                if (peek().isEquality()) {
                    throw new FormulaParseException("Left side of " + peek() + " must be a term", peek().pos);
                }
                return f;
            }
            Token name = next();
            List<Formula.Term> args = peek().kind == Kind.LPAREN ? parseArguments(name) : List.of();
            if (!peek().isEquality()) return atom(name, args);

            boolean negated = next().kind == Kind.NEQ;
            Formula.Term left = args.isEmpty() ? variableOrConstant(name) : new Formula.Term(name.text, args);
            Formula.Term right = parseTerm();
            if (peek().isEquality()) {
                throw new FormulaParseException("Chained equation at " + peek(), peek().pos);
            }
            Formula eq = new Formula.Equality(left, right);
            return negated ? new Formula.Not(eq) : eq;
        }

        /** Negation, quantification, parenthesized formula or atom. */
        Formula parseOperand() throws FormulaParseException {
            Token t = peek();
            switch (t.kind) {
                case NOT:
                    pos++;
                    return new Formula.Not(parseOperand());
                case ALL:
                case EXISTS:
                    return parseQuantified();
                case LPAREN: {
                    pos++;
                    Formula inner = parseIff();
                    expect(Kind.RPAREN, "')'");
                    return inner;
                }
                case IDENT: {
                    pos++;
                    List<Formula.Term> args = peek().kind == Kind.LPAREN ? parseArguments(t) : List.of();
                    return atom(t, args);
                }
                default:
                    throw new FormulaParseException("Expected a formula but found " + t, t.pos);
            }
        }

        Formula parseQuantified() throws FormulaParseException {
            Token q = next();
            Formula.Quantifier quantifier = q.kind == Kind.ALL ? Formula.Quantifier.ALL : Formula.Quantifier.EXISTS;
            List<String> vars = new ArrayList<>();
            while (peek().kind == Kind.IDENT) vars.add(next().text);
            if (vars.isEmpty()) {
                throw new FormulaParseException("Quantifier '" + q.text + "' needs a variable", peek().pos);
            }
            if (peek().kind == Kind.DOT) pos++;
            for (String v : vars) bound.push(v);
            Formula body;
            try {
                body = parseEquation();
            } finally {
                for (int i = 0; i < vars.size(); i++) bound.pop();
            }
            for (int i = vars.size() - 1; i >= 0; i--) {
                body = new Formula.Quantified(quantifier, vars.get(i), body);
            }
            return body;
        }

        Formula atom(Token name, List<Formula.Term> args) throws FormulaParseException {
            if (bound.contains(name.text)) {
                String role = args.isEmpty() ? "a formula" : "a predicate";
                throw new FormulaParseException("Bound variable '" + name.text + "' used as " + role, name.pos);
            }
            return args.isEmpty() ? new Formula.PropVar(name.text) : new Formula.Predication(name.text, args);
        }

        /** Parenthesized, comma-separated argument terms following {@code name}. */
        List<Formula.Term> parseArguments(Token name) throws FormulaParseException {
            if (bound.contains(name.text)) {
                throw new FormulaParseException("Bound variable '" + name.text + "' applied to arguments", name.pos);
            }
            expect(Kind.LPAREN, "'('");
            List<Formula.Term> args = new ArrayList<>();
            args.add(parseTerm());
            while (peek().kind == Kind.COMMA) {
                pos++;
                args.add(parseTerm());
            }
            expect(Kind.RPAREN, "')' closing the arguments of " + name.text);
            return args;
        }

        Formula.Term parseTerm() throws FormulaParseException {
            Token t = peek();
            if (t.kind != Kind.IDENT) {
                throw new FormulaParseException("Expected a term but found " + t, t.pos);
            }
            pos++;
            if (peek().kind == Kind.LPAREN) {
                return new Formula.Term(t.text, parseArguments(t));
            }
            return variableOrConstant(t);
        }

        Formula.Term variableOrConstant(Token t) {
            return new Formula.Term(t.text, bound.contains(t.text));
        }

        Token peek() { return tokens.get(pos); }

        Token next() { return tokens.get(pos++); }

        void expect(Kind kind, String what) throws FormulaParseException {
            Token t = peek();
            if (t.kind != kind) throw new FormulaParseException("Expected " + what + " but found " + t, t.pos);
            pos++;
        }
    }
}
