package org.argverify.model;

public enum Valence {
    SUPPORT,
    ATTACK,
    CONTRADICT;

    /** Parses "support", "ATTACK", "contradict" etc; unknown values raise IllegalArgumentException. */
    public static Valence parse(String value) {
        if (value == null) throw new IllegalArgumentException("valence is missing");
        return Valence.valueOf(value.trim().toUpperCase());
    }
}
