package org.argverify.model;

import java.util.*;

/**
 * A labeled claim. A proposition may be stated with several texts and may carry inline data
 * (formalization, declarations, annotation_ids, ...).
 */
public class Proposition {
    private final String label;
    private final List<String> texts;
    private final Map<String, Object> data;

    public Proposition(String label, List<String> texts, Map<String, Object> data) {
        this.label = label;
        this.texts = texts == null ? List.of() : List.copyOf(texts);
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Proposition(String label, String text) {
        this(label, text == null ? List.of() : List.of(text), null);
    }

    public String getLabel() { return label; }
    public List<String> getTexts() { return texts; }
    public Map<String, Object> getData() { return data; }

    public boolean isUnlabeled() {
        return label == null || label.isBlank();
    }

    @Override
    public String toString() {
        return "[" + label + "]" + (texts.isEmpty() ? "" : ": " + texts.get(0));
    }
}
