package org.argverify.model;

import java.util.*;

public class DialecticalRelation {
    private final String source;
    private final String target;
    private final Valence valence;
    private final Set<Dialectics> dialectics;

    public DialecticalRelation(String source, String target, Valence valence, Set<Dialectics> dialectics) {
        this.source = source;
        this.target = target;
        this.valence = Objects.requireNonNull(valence, "valence");
        this.dialectics = dialectics == null || dialectics.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(Dialectics.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(dialectics));
    }

    public DialecticalRelation(String source, String target, Valence valence, Dialectics first, Dialectics... rest) {
        this(source, target, valence, EnumSet.of(first, rest));
    }

    public String getSource() { return source; }
    public String getTarget() { return target; }
    public Valence getValence() { return valence; }
    public Set<Dialectics> getDialectics() { return dialectics; }

    public boolean is(Dialectics d) {
        return dialectics.contains(d);
    }

    @Override
    public String toString() {
        return source + " -" + valence.name().toLowerCase() + dialectics + "-> " + target;
    }
}
