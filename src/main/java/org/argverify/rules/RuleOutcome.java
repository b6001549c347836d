package org.argverify.rules;

import java.util.*;

/**
 * Result of applying one rule: pass, fail with a message, or not applicable.
 */
public final class RuleOutcome {

    public enum Status { PASS, FAIL, NOT_APPLICABLE }

    private static final RuleOutcome PASS = new RuleOutcome(Status.PASS, null, Map.of());
    private static final RuleOutcome NOT_APPLICABLE = new RuleOutcome(Status.NOT_APPLICABLE, null, Map.of());

    private final Status status;
    private final String message;
    private final Map<String, Object> details;

    private RuleOutcome(Status status, String message, Map<String, Object> details) {
        this.status = status;
        this.message = message;
        this.details = details;
    }

    public static RuleOutcome pass() { return PASS; }

    public static RuleOutcome notApplicable() { return NOT_APPLICABLE; }

    public static RuleOutcome fail(String message) {
        if (message == null || message.isBlank()) throw new IllegalArgumentException("failure needs a message");
        return new RuleOutcome(Status.FAIL, message, Map.of());
    }

    /** Fails with the messages joined by {@code separator}, passes if there are none. */
    public static RuleOutcome failIfAny(List<String> messages, String separator) {
        return messages.isEmpty() ? PASS : fail(String.join(separator, messages));
    }

    public RuleOutcome withDetail(String key, Object value) {
        Map<String, Object> d = new LinkedHashMap<>(details);
        d.put(key, value);
        return new RuleOutcome(status, message, Collections.unmodifiableMap(d));
    }

    public Status status() { return status; }
    public String message() { return message; }
    public Map<String, Object> details() { return details; }

    public boolean isFail() { return status == Status.FAIL; }
    public boolean isPass() { return status == Status.PASS; }

    @Override
    public String toString() {
        return status == Status.FAIL ? "FAIL: " + message : status.name();
    }
}
