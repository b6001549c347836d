package org.argverify.handler;

import org.argverify.request.ArtifactKind;
import org.argverify.request.ArtifactRecord;

import java.util.function.Predicate;

/**
 * Role predicates over artifact records.
 */
public final class ArtifactFilters {

    private ArtifactFilters() {}

    public static Predicate<ArtifactRecord> any() {
        return r -> true;
    }

    public static Predicate<ArtifactRecord> ofKind(ArtifactKind kind) {
        return r -> r.getKind() == kind;
    }

    public static Predicate<ArtifactRecord> graphs() {
        return ofKind(ArtifactKind.ARGUMENT_GRAPH);
    }

    public static Predicate<ArtifactRecord> annotations() {
        return ofKind(ArtifactKind.ANNOTATION_TREE);
    }

    public static Predicate<ArtifactRecord> filenameStartsWith(String prefix) {
        return r -> r.filename().startsWith(prefix);
    }

    /** Argument graph whose filename starts with "map". */
    public static Predicate<ArtifactRecord> mapGraphs() {
        return graphs().and(filenameStartsWith("map"));
    }

    /** Argument graph whose filename starts with "reconstruction" (singular or plural). */
    public static Predicate<ArtifactRecord> reconstructionGraphs() {
        return graphs().and(filenameStartsWith("reconstruction"));
    }
}
