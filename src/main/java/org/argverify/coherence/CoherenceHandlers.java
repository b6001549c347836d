package org.argverify.coherence;

import org.argverify.handler.CompositeHandler;
import org.argverify.request.ArtifactRecord;

import java.util.List;
import java.util.function.Predicate;

/**
 * Composite coherence checks, one element-level and one relation-level handler per pair of
 * artifact roles.
 */
public final class CoherenceHandlers {

    private CoherenceHandlers() {}

    public static CompositeHandler argmapInfreco(Predicate<ArtifactRecord> map, Predicate<ArtifactRecord> reco) {
        return new CompositeHandler("ArgmapInfrecoCoherenceHandler", List.of(
            new MapRecoElemHandler("ArgmapInfrecoElemCohereHandler", map, reco),
            new MapInfrecoRelationHandler("ArgmapInfrecoRelationCohereHandler", map, reco)));
    }

    public static CompositeHandler argmapLogreco(Predicate<ArtifactRecord> map, Predicate<ArtifactRecord> reco) {
        return new CompositeHandler("ArgmapLogrecoCoherenceHandler", List.of(
            new MapRecoElemHandler("ArgmapLogrecoElemCohereHandler", map, reco),
            new MapLogrecoRelationHandler("ArgmapLogrecoRelationCohereHandler", map, reco)));
    }

    public static CompositeHandler argannoInfreco(Predicate<ArtifactRecord> reco, Predicate<ArtifactRecord> annotation,
                                                  String fromKey) {
        return annotationReco("ArgannoInfreco", reco, annotation, fromKey);
    }

    /** Same checks as {@link #argannoInfreco}. */
    public static CompositeHandler argannoLogreco(Predicate<ArtifactRecord> reco, Predicate<ArtifactRecord> annotation,
                                                  String fromKey) {
        return annotationReco("ArgannoLogreco", reco, annotation, fromKey);
    }

    public static CompositeHandler argannoArgmap(Predicate<ArtifactRecord> map, Predicate<ArtifactRecord> annotation) {
        return new CompositeHandler("ArgannoArgmapCoherenceHandler", List.of(
            new AnnotationMapElemHandler("ArgannoArgmapElemCohereHandler", map, annotation),
            new AnnotationMapRelationHandler("ArgannoArgmapDRelCohereHandler", map, annotation)));
    }

    /** Annotation against map, then map against logical reconstructions. */
    public static CompositeHandler argannoArgmapLogreco(Predicate<ArtifactRecord> annotation, Predicate<ArtifactRecord> map,
                                                        Predicate<ArtifactRecord> reco) {
        return new CompositeHandler("ArgannoArgmapLogrecoCoherenceHandler", List.of(
            argannoArgmap(map, annotation),
            argmapLogreco(map, reco)));
    }

    private static CompositeHandler annotationReco(String prefix, Predicate<ArtifactRecord> reco,
                                                   Predicate<ArtifactRecord> annotation, String fromKey) {
        return new CompositeHandler(prefix + "CoherenceHandler", List.of(
            new AnnotationRecoElemHandler(prefix + "ElemCohereHandler", reco, annotation),
            new AnnotationRecoRelationHandler(prefix + "RelationCohereHandler", reco, annotation, fromKey)));
    }
}
