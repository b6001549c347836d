package org.argverify.request;

import java.util.*;

/**
 * Mutable request object threaded through a handler chain. Created once per run, mutated by
 * every handler, read by the caller at the end.
 */
public class VerificationContext {
    private final List<String> sources;
    private final List<ArtifactRecord> records;
    private final List<CheckResult> results = new ArrayList<>();
    private final List<String> executedChecks = new ArrayList<>();
    private boolean continueProcessing = true;

    public VerificationContext(List<String> sources, List<ArtifactRecord> records) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.records = records == null ? new ArrayList<>() : new ArrayList<>(records);
    }

    public VerificationContext(String source, List<ArtifactRecord> records) {
        this(source == null ? List.of() : List.of(source), records);
    }

    public List<String> getSources() { return sources; }

    /** All sources joined by blank lines; null when there is none. */
    public String getSourceText() {
        if (sources.isEmpty()) return null;
        return String.join("\n\n", sources);
    }

    public List<ArtifactRecord> getRecords() { return Collections.unmodifiableList(records); }

    public void addRecord(ArtifactRecord record) {
        records.add(record);
    }

    public List<CheckResult> getResults() { return Collections.unmodifiableList(results); }

    public void addResult(CheckResult result) {
        results.add(Objects.requireNonNull(result, "result"));
    }

    public List<String> getExecutedChecks() { return executedChecks; }

    public boolean isContinueProcessing() { return continueProcessing; }

    public void setContinueProcessing(boolean continueProcessing) {
        this.continueProcessing = continueProcessing;
    }

    /** A run is valid iff every recorded result is valid. */
    public boolean isValid() {
        for (CheckResult r : results) if (!r.isValid()) return false;
        return true;
    }

    /** Check id to its last recorded result, in first-seen order. */
    public Map<String, CheckResult> resultsById() {
        Map<String, CheckResult> out = new LinkedHashMap<>();
        for (CheckResult r : results) out.put(r.getCheckId(), r);
        return out;
    }

    /** Check id to (valid, message), last write wins. */
    public Map<String, Map.Entry<Boolean, String>> resultsAsMap() {
        Map<String, Map.Entry<Boolean, String>> out = new LinkedHashMap<>();
        for (CheckResult r : results) {
            out.put(r.getCheckId(), new AbstractMap.SimpleImmutableEntry<>(r.isValid(), r.getMessage()));
        }
        return out;
    }

    public Optional<CheckResult> lastResult(String checkId) {
        for (int i = results.size() - 1; i >= 0; i--) {
            if (results.get(i).getCheckId().equals(checkId)) return Optional.of(results.get(i));
        }
        return Optional.empty();
    }
}
