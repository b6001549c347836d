package org.argverify.model;

import java.util.*;

/**
 * One step in an argument's premise-conclusion structure. The item label is local to the
 * argument, the proposition label points to the proposition it states.
 */
public class PcsItem {
    private final String label;
    private final String propositionLabel;
    private final boolean conclusion;
    private final Map<String, Object> inferenceData;

    private PcsItem(String label, String propositionLabel, boolean conclusion, Map<String, Object> inferenceData) {
        this.label = label;
        this.propositionLabel = propositionLabel;
        this.conclusion = conclusion;
        this.inferenceData = inferenceData == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(inferenceData));
    }

    public static PcsItem premise(String label, String propositionLabel) {
        return new PcsItem(label, propositionLabel, false, null);
    }

    public static PcsItem conclusion(String label, String propositionLabel, Map<String, Object> inferenceData) {
        return new PcsItem(label, propositionLabel, true, inferenceData);
    }

    /** Shorthand for a conclusion whose inference data is {fromKey: refs}. */
    public static PcsItem conclusionFrom(String label, String propositionLabel, String fromKey, String... refs) {
        Map<String, Object> inf = new LinkedHashMap<>();
        inf.put(fromKey, new ArrayList<>(Arrays.asList(refs)));
        return conclusion(label, propositionLabel, inf);
    }

    public String getLabel() { return label; }
    public String getPropositionLabel() { return propositionLabel; }
    public boolean isConclusion() { return conclusion; }
    public Map<String, Object> getInferenceData() { return inferenceData; }

    /**
     * Labels listed under the given key, or an empty list when the key is absent or its value
     * is not a list.
     */
    public List<String> inferenceRefs(String fromKey) {
        Object v = inferenceData.get(fromKey);
        if (!(v instanceof List)) return List.of();
        List<String> refs = new ArrayList<>();
        for (Object o : (List<?>) v) refs.add(String.valueOf(o));
        return refs;
    }

    @Override
    public String toString() {
        return "(" + label + ")" + (conclusion ? " conclusion " + inferenceData : " premise");
    }
}
