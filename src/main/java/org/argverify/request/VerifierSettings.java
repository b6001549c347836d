package org.argverify.request;

import org.argverify.Config;

import java.util.Objects;

/**
 * Key names and solver limits used by a verification run.
 */
public final class VerifierSettings {

    public static final VerifierSettings DEFAULT = new VerifierSettings(
        Config.FROM_KEY, Config.FORMALIZATION_KEY, Config.DECLARATIONS_KEY, Config.SOLVER_TIMEOUT_MS);

    private final String fromKey;
    private final String formalizationKey;
    private final String declarationsKey;
    private final long solverTimeoutMillis;

    public VerifierSettings(String fromKey, String formalizationKey, String declarationsKey, long solverTimeoutMillis) {
        this.fromKey = Objects.requireNonNull(fromKey, "fromKey");
        this.formalizationKey = Objects.requireNonNull(formalizationKey, "formalizationKey");
        this.declarationsKey = Objects.requireNonNull(declarationsKey, "declarationsKey");
        if (solverTimeoutMillis <= 0) throw new IllegalArgumentException("solver timeout must be positive");
        this.solverTimeoutMillis = solverTimeoutMillis;
    }

    public String fromKey() { return fromKey; }
    public String formalizationKey() { return formalizationKey; }
    public String declarationsKey() { return declarationsKey; }
    public long solverTimeoutMillis() { return solverTimeoutMillis; }
}
