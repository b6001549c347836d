package org.argverify.model;

import java.util.*;

public class Argument {
    private final String label;
    private final List<String> gists;
    private final List<PcsItem> pcs;
    private final Map<String, Object> data;

    public Argument(String label, List<String> gists, List<PcsItem> pcs, Map<String, Object> data) {
        this.label = label;
        this.gists = gists == null ? List.of() : List.copyOf(gists);
        this.pcs = pcs == null ? List.of() : List.copyOf(pcs);
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public String getLabel() { return label; }
    public List<String> getGists() { return gists; }
    public List<PcsItem> getPcs() { return pcs; }
    public Map<String, Object> getData() { return data; }

    public boolean isUnlabeled() {
        return label == null || label.isBlank();
    }

    public Optional<PcsItem> findItem(String itemLabel) {
        for (PcsItem item : pcs) {
            if (item.getLabel() != null && item.getLabel().equals(itemLabel)) return Optional.of(item);
        }
        return Optional.empty();
    }

    /** The final item if it is a conclusion. */
    public Optional<PcsItem> finalConclusion() {
        if (pcs.isEmpty()) return Optional.empty();
        PcsItem last = pcs.get(pcs.size() - 1);
        return last.isConclusion() ? Optional.of(last) : Optional.empty();
    }

    public List<PcsItem> premises() {
        List<PcsItem> out = new ArrayList<>();
        for (PcsItem item : pcs) if (!item.isConclusion()) out.add(item);
        return out;
    }

    @Override
    public String toString() {
        return "<" + label + ">";
    }
}
