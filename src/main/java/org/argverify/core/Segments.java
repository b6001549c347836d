package org.argverify.core;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.*;

/**
 * Helpers for reading {@code <proposition>} segments of an annotation tree.
 */
public final class Segments {

    public static final String TAG = "proposition";
    public static final String ID = "id";
    public static final String SUPPORTS = "supports";
    public static final String ATTACKS = "attacks";
    public static final String ARGUMENT_LABEL = "argument_label";
    public static final String REF_RECO_LABEL = "ref_reco_label";

    public static final Set<String> ALLOWED_ATTRIBUTES = Set.of(ID, SUPPORTS, ATTACKS, ARGUMENT_LABEL, REF_RECO_LABEL);

    private Segments() {}

    public static Elements all(Document doc) {
        return doc.getElementsByTag(TAG);
    }

    /** Attribute value or null if the attribute is absent. */
    public static String attr(Element e, String name) {
        return e.hasAttr(name) ? e.attr(name) : null;
    }

    /** Whitespace separated id list of a supports/attacks attribute. */
    public static List<String> idList(Element e, String name) {
        String v = e.attr(name).trim();
        if (v.isEmpty()) return List.of();
        return Arrays.asList(v.split("\\s+"));
    }

    /** Ids of all segments that carry a non-empty id. */
    public static List<String> ids(Document doc) {
        List<String> out = new ArrayList<>();
        for (Element e : all(doc)) {
            String id = e.attr(ID);
            if (!id.isEmpty()) out.add(id);
        }
        return out;
    }

    public static String shorten(String text, int width) {
        String t = text.replaceAll("\\s+", " ").trim();
        return t.length() <= width ? t : t.substring(0, Math.max(0, width - 3)) + "...";
    }

    public static String describe(Element e, int width) {
        return "'" + shorten(e.outerHtml(), width) + "'";
    }
}
