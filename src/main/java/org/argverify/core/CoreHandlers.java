package org.argverify.core;

import org.argverify.handler.CompositeHandler;
import org.argverify.request.ArtifactRecord;

import java.util.*;
import java.util.function.Predicate;

/**
 * Composite checks for argument maps and annotations on their own.
 */
public final class CoreHandlers {

    private CoreHandlers() {}

    public static CompositeHandler argmap(Predicate<ArtifactRecord> filter) {
        return new CompositeHandler("ArgMapCompositeHandler", List.of(
            new CompleteClaimsHandler("ArgMap.CompleteClaimsHandler", filter),
            new NoDuplicateLabelsHandler("ArgMap.NoDuplicateLabelsHandler", filter),
            new NoPcsHandler("ArgMap.NoPCSHandler", filter)));
    }

    /**
     * @param legalArgumentLabels labels allowed in argument_label attributes; empty to skip
     * @param legalRefRecoLabels labels allowed in ref_reco_label attributes; empty to skip
     */
    public static CompositeHandler arganno(Predicate<ArtifactRecord> filter, Collection<String> legalArgumentLabels,
                                           Collection<String> legalRefRecoLabels) {
        return new CompositeHandler("ArgannoCompositeHandler", List.of(
            new SourceTextIntegrityHandler("Arganno.SourceTextIntegrityHandler", filter),
            new NestedPropositionHandler("Arganno.NestedPropositionHandler", filter),
            new PropositionIdHandler("Arganno.PropositionIdPresenceHandler", filter, PropositionIdHandler.Mode.PRESENCE),
            new PropositionIdHandler("Arganno.PropositionIdUniquenessHandler", filter, PropositionIdHandler.Mode.UNIQUENESS),
            new ReferenceValidityHandler("Arganno.SupportReferenceValidityHandler", filter, Segments.SUPPORTS),
            new ReferenceValidityHandler("Arganno.AttackReferenceValidityHandler", filter, Segments.ATTACKS),
            new MarkupValidityHandler("Arganno.AttributeValidityHandler", filter, MarkupValidityHandler.Target.ATTRIBUTES),
            new MarkupValidityHandler("Arganno.ElementValidityHandler", filter, MarkupValidityHandler.Target.ELEMENTS),
            new LabelValidityHandler("Arganno.ArgumentLabelValidityHandler", filter, Segments.ARGUMENT_LABEL, legalArgumentLabels),
            new LabelValidityHandler("Arganno.RefRecoLabelValidityHandler", filter, Segments.REF_RECO_LABEL, legalRefRecoLabels)));
    }

    public static CompositeHandler arganno(Predicate<ArtifactRecord> filter) {
        return arganno(filter, List.of(), List.of());
    }
}
