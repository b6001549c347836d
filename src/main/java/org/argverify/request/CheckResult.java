package org.argverify.request;

import java.util.*;

/**
 * Immutable outcome of one check. A failing result always carries a message.
 */
public class CheckResult {
    private final String checkId;
    private final List<String> artifactRefs;
    private final boolean valid;
    private final String message;
    private final Map<String, Object> details;

    public CheckResult(String checkId, List<String> artifactRefs, boolean valid, String message, Map<String, Object> details) {
        this.checkId = Objects.requireNonNull(checkId, "checkId");
        this.artifactRefs = artifactRefs == null ? List.of() : List.copyOf(artifactRefs);
        this.valid = valid;
        if (!valid && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("failing result for " + checkId + " needs a message");
        }
        this.message = message;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static CheckResult pass(String checkId, List<String> refs) {
        return new CheckResult(checkId, refs, true, null, null);
    }

    public static CheckResult fail(String checkId, List<String> refs, String message) {
        return new CheckResult(checkId, refs, false, message, null);
    }

    /** Valid iff {@code messages} is empty; messages are joined with {@code separator}. */
    public static CheckResult fromMessages(String checkId, List<String> refs, List<String> messages, String separator) {
        if (messages.isEmpty()) return pass(checkId, refs);
        return fail(checkId, refs, String.join(separator, messages));
    }

    public String getCheckId() { return checkId; }
    public List<String> getArtifactRefs() { return artifactRefs; }
    public boolean isValid() { return valid; }
    public String getMessage() { return message; }
    public Map<String, Object> getDetails() { return details; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CheckResult)) return false;
        CheckResult that = (CheckResult) o;
        return valid == that.valid
            && checkId.equals(that.checkId)
            && artifactRefs.equals(that.artifactRefs)
            && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkId, artifactRefs, valid, message);
    }

    @Override
    public String toString() {
        return checkId + artifactRefs + (valid ? " OK" : " FAILED: " + message);
    }
}
