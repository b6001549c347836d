package org.argverify;

import org.argverify.model.*;

import java.util.*;

/**
 * Small builders for argument graphs used across tests.
 */
public final class GraphFixtures {

    private GraphFixtures() {}

    public static Proposition prop(String label, String text) {
        return new Proposition(label, text);
    }

    /** Proposition with a formalization and, optionally, declarations ("sym", "meaning", ...). */
    public static Proposition formalized(String label, String formula, String... declarations) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("formalization", formula);
        if (declarations.length > 0) {
            Map<String, Object> decl = new LinkedHashMap<>();
            for (int i = 0; i + 1 < declarations.length; i += 2) decl.put(declarations[i], declarations[i + 1]);
            data.put("declarations", decl);
        }
        return new Proposition(label, List.of(label + " text"), data);
    }

    public static Proposition withAnnotationIds(String label, String text, String... ids) {
        return new Proposition(label, List.of(text), Map.of("annotation_ids", List.of(ids)));
    }

    public static Argument argument(String label, PcsItem... items) {
        return new Argument(label, List.of("Gist of " + label), List.of(items), null);
    }

    public static PcsItem premise(String label, String prop) {
        return PcsItem.premise(label, prop);
    }

    public static PcsItem conclusion(String label, String prop, String... from) {
        return PcsItem.conclusionFrom(label, prop, "from", from);
    }
}
