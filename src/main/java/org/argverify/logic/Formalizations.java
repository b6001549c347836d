package org.argverify.logic;

import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.model.PcsItem;
import org.argverify.model.Proposition;

import java.util.*;

/**
 * Formulas and symbol declarations attached to the propositions of one argument graph.
 * Every proposition is parsed once; problems are reported per argument, naming items by
 * their label in that argument.
 */
public final class Formalizations {

    private static final class Entry {
        boolean hasData;
        String raw;
        Formula formula;
        String parseError;
        boolean declarationsMalformed;
        final Map<String, String> declarations = new LinkedHashMap<>();
    }

    private final ArgumentGraph graph;
    private final String formalizationKey;
    private final String declarationsKey;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, String> declarations = new LinkedHashMap<>();

    private Formalizations(ArgumentGraph graph, String formalizationKey, String declarationsKey) {
        this.graph = graph;
        this.formalizationKey = formalizationKey;
        this.declarationsKey = declarationsKey;
    }

    public static Formalizations read(ArgumentGraph graph, String formalizationKey, String declarationsKey) {
        Formalizations fs = new Formalizations(graph, formalizationKey, declarationsKey);
        for (Proposition p : graph.getPropositions()) {
            if (p.isUnlabeled() || fs.entries.containsKey(p.getLabel())) continue;
            Entry e = fs.parse(p);
            fs.entries.put(p.getLabel(), e);
            e.declarations.forEach(fs.declarations::putIfAbsent);
        }
        return fs;
    }

    private Entry parse(Proposition p) {
        Entry e = new Entry();
        Map<String, Object> data = p.getData();
        e.hasData = !data.isEmpty();
        Object raw = data.get(formalizationKey);
        if (raw != null && !String.valueOf(raw).isBlank()) {
            e.raw = String.valueOf(raw).trim();
            try {
                e.formula = FormulaParser.parse(e.raw);
            } catch (FormulaParseException ex) {
                e.parseError = ex.getMessage();
            }
        }
        Object decl = data.get(declarationsKey);
        if (decl instanceof Map) {
            for (Map.Entry<?, ?> d : ((Map<?, ?>) decl).entrySet()) {
                e.declarations.put(String.valueOf(d.getKey()), String.valueOf(d.getValue()));
            }
        } else if (decl != null) {
            e.declarationsMalformed = true;
        }
        return e;
    }

    /** Parsed formula of a proposition, or null. */
    public Formula formula(String propositionLabel) {
        Entry e = entries.get(propositionLabel);
        return e == null ? null : e.formula;
    }

    /** Parsed formula stated by an argument item, or null. */
    public Formula formula(PcsItem item) {
        return formula(item.getPropositionLabel());
    }

    /** Symbols declared in the inline data of one proposition, in declaration order. */
    public Map<String, String> declarations(String propositionLabel) {
        Entry e = entries.get(propositionLabel);
        return e == null ? Map.of() : Collections.unmodifiableMap(e.declarations);
    }

    /** Symbol to meaning; the first declaration of a symbol wins. */
    public Map<String, String> declarations() {
        return Collections.unmodifiableMap(declarations);
    }

    /** Whether every item of the argument has a formula and the formulas agree on their symbols. */
    public boolean isUsable(Argument argument) {
        if (argument.getPcs().isEmpty()) return false;
        List<Formula> fs = new ArrayList<>();
        for (PcsItem item : argument.getPcs()) {
            Formula f = formula(item);
            if (f == null) return false;
            fs.add(f);
        }
        return Signature.of(fs).conflicts().isEmpty();
    }

    /** Everything wrong with the formalizations of this argument; empty if flawless. */
    public List<String> problems(Argument argument) {
        List<String> msgs = new ArrayList<>();
        Map<String, String> seen = new LinkedHashMap<>();
        List<Formula> parsed = new ArrayList<>();
        Map<String, Formula> byItem = new LinkedHashMap<>();

        for (PcsItem item : argument.getPcs()) {
            String label = item.getLabel();
            Entry e = entries.get(item.getPropositionLabel());
            if (e == null) {
                msgs.add("Item (" + label + ") does not refer to a known proposition.");
                continue;
            }
            if (!e.hasData) {
                msgs.add("Proposition (" + label + ") lacks inline yaml data with formalization info.");
                continue;
            }
            if (e.raw == null) {
                msgs.add("Inline yaml of proposition (" + label + ") lacks " + formalizationKey + " key.");
            }
            if (e.declarationsMalformed) {
                msgs.add("'" + declarationsKey + "' of proposition (" + label + ") is not a dict.");
            }
            for (Map.Entry<String, String> d : e.declarations.entrySet()) {
                if (seen.containsKey(d.getKey())) {
                    msgs.add("Duplicate declaration: Variable '" + d.getKey() + "' in the inline yaml of proposition ("
                        + label + ") has been declared before.");
                } else {
                    seen.put(d.getKey(), label);
                }
            }
            if (e.parseError != null) {
                msgs.add("Formalization " + e.raw + " of proposition (" + label + ") is not a well-formed "
                    + "first-order logic formula. Parser error: " + e.parseError);
            }
            if (e.formula != null) {
                parsed.add(e.formula);
                byItem.put(label, e.formula);
            }
        }

        Signature sig = Signature.of(parsed);
        for (String c : sig.conflicts()) {
            msgs.add("Formalizations of the argument use symbols inconsistently: " + c + ".");
        }
        Set<String> used = sig.symbols();
        for (Map.Entry<String, String> d : seen.entrySet()) {
            if (!used.contains(d.getKey())) {
                msgs.add("Variable '" + d.getKey() + "' declared with proposition (" + d.getValue()
                    + ") is not used in any formalization of the argument.");
            }
        }
        for (Map.Entry<String, Formula> f : byItem.entrySet()) {
            for (String sym : Signature.of(f.getValue()).symbols()) {
                if (!seen.containsKey(sym)) {
                    msgs.add("Variable '" + sym + "' in formalization of proposition (" + f.getKey()
                        + ") is not declared anywhere.");
                }
            }
        }
        return msgs;
    }

    public ArgumentGraph graph() {
        return graph;
    }
}
