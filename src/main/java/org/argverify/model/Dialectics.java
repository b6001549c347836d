package org.argverify.model;

/**
 * How a dialectical relation is established.
 * GROUNDED relations follow from an inference, AXIOMATIC ones are declared on their own
 * authority, SKETCHED ones come from an argument map without detailed reconstruction.
 */
public enum Dialectics {
    GROUNDED,
    AXIOMATIC,
    SKETCHED;

    public static Dialectics parse(String value) {
        if (value == null) throw new IllegalArgumentException("dialectics is missing");
        return Dialectics.valueOf(value.trim().toUpperCase());
    }
}
