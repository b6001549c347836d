package org.argverify.pipeline;

import org.argverify.coherence.CoherenceHandlers;
import org.argverify.core.CoreHandlers;
import org.argverify.core.HasArtifactHandler;
import org.argverify.core.HasAtLeastNArgumentsHandler;
import org.argverify.handler.ArtifactFilters;
import org.argverify.handler.CompositeHandler;
import org.argverify.handler.Handler;
import org.argverify.logic.EntailmentChecker;
import org.argverify.logic.SolverBackend;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.VerifierSettings;
import org.argverify.rules.DimensionBatteryHandler;
import org.argverify.rules.DimensionTable;
import org.argverify.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/**
 * Builds the handler chain of a named pipeline.
 *
 * Single-artifact pipelines: "infreco", "logreco", "argmap", "arganno". Coherence pipelines
 * combine them and add the coherence checks between the roles: "argmap_infreco",
 * "argmap_logreco", "arganno_infreco", "arganno_logreco", "arganno_argmap",
 * "arganno_argmap_logreco". Where two argument graphs take part, maps are told apart from
 * reconstructions by their filename ("map..." vs "reconstruction...").
 */
public class PipelineFactory {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineFactory.class);

    public static final List<String> PIPELINES = List.of(
        "infreco", "logreco", "argmap", "arganno",
        "argmap_infreco", "argmap_logreco",
        "arganno_infreco", "arganno_logreco",
        "arganno_argmap", "arganno_argmap_logreco");

    private final VerifierSettings settings;
    private final EntailmentChecker entailment;
    private final RuleTable rules;

    public PipelineFactory(VerifierSettings settings, SolverBackend backend, RuleTable rules) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.entailment = new EntailmentChecker(Objects.requireNonNull(backend, "backend"), settings.solverTimeoutMillis());
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public PipelineFactory(VerifierSettings settings, SolverBackend backend) {
        this(settings, backend, RuleTable.DEFAULT);
    }

    public VerifierSettings getSettings() {
        return settings;
    }

    public Handler create(String name) {
        return create(name, PipelineOptions.DEFAULT);
    }

    /**
     * @throws IllegalArgumentException for an unknown pipeline name
     */
    public Handler create(String name, PipelineOptions options) {
        String pipeline = name == null ? "" : name.trim().toLowerCase();
        PipelineOptions opts = options == null ? PipelineOptions.DEFAULT : options;
        LOG.debug("Creating pipeline: {}", pipeline);

        Predicate<ArtifactRecord> graphs = ArtifactFilters.graphs();
        Predicate<ArtifactRecord> annotations = ArtifactFilters.annotations();
        Predicate<ArtifactRecord> maps = ArtifactFilters.mapGraphs();
        Predicate<ArtifactRecord> recos = ArtifactFilters.reconstructionGraphs();
        List<Handler> chain = new ArrayList<>();

        switch (pipeline) {
            case "infreco":
                chain.add(hasGraph("HasArgdownHandler", graphs));
                chain.add(battery("InfRecoCompositeHandler", graphs, DimensionTable.INFRECO_DEFAULT));
                break;

            case "logreco":
                chain.add(hasGraph("HasArgdownHandler", graphs));
                chain.add(battery("LogRecoCompositeHandler", graphs, DimensionTable.LOGRECO_DEFAULT));
                break;

            case "argmap":
                chain.add(hasGraph("HasArgdownHandler", graphs));
                chain.add(CoreHandlers.argmap(graphs));
                break;

            case "arganno":
                chain.add(hasAnnotation(annotations));
                chain.add(arganno(annotations, opts));
                break;

            case "argmap_infreco":
                chain.add(hasGraph("HasArgdownHandler.map", maps));
                chain.add(hasGraph("HasArgdownHandler.reco", recos));
                chain.add(CoreHandlers.argmap(maps));
                chain.add(battery("InfRecoCompositeHandler", recos, DimensionTable.INFRECO_MULTI));
                chain.add(CoherenceHandlers.argmapInfreco(maps, recos));
                break;

            case "argmap_logreco":
                chain.add(hasGraph("HasArgdownHandler.map", maps));
                chain.add(hasGraph("HasArgdownHandler.reco", recos));
                chain.add(CoreHandlers.argmap(maps));
                chain.add(enoughArguments(recos, opts));
                chain.add(battery("LogRecoCompositeHandler", recos, DimensionTable.LOGRECO_MULTI));
                chain.add(CoherenceHandlers.argmapInfreco(maps, recos));
                chain.add(CoherenceHandlers.argmapLogreco(maps, recos));
                break;

            case "arganno_infreco":
                chain.add(hasAnnotation(annotations));
                chain.add(hasGraph("HasArgdownHandler", graphs));
                chain.add(arganno(annotations, opts));
                chain.add(battery("InfRecoCompositeHandler", graphs, DimensionTable.INFRECO_MULTI));
                chain.add(CoherenceHandlers.argannoInfreco(graphs, annotations, settings.fromKey()));
                break;

            case "arganno_logreco":
                chain.add(hasAnnotation(annotations));
                chain.add(hasGraph("HasArgdownHandler", graphs));
                chain.add(arganno(annotations, opts));
                chain.add(battery("LogRecoCompositeHandler", graphs, DimensionTable.LOGRECO_MULTI));
                chain.add(CoherenceHandlers.argannoLogreco(graphs, annotations, settings.fromKey()));
                break;

            case "arganno_argmap":
                chain.add(hasAnnotation(annotations));
                chain.add(hasGraph("HasArgdownHandler", graphs));
                chain.add(arganno(annotations, opts));
                chain.add(CoreHandlers.argmap(graphs));
                chain.add(CoherenceHandlers.argannoArgmap(graphs, annotations));
                break;

            case "arganno_argmap_logreco":
                chain.add(hasAnnotation(annotations));
                chain.add(hasGraph("HasArgdownHandler.map", maps));
                chain.add(hasGraph("HasArgdownHandler.reco", recos));
                chain.add(arganno(annotations, opts));
                chain.add(CoreHandlers.argmap(maps));
                chain.add(enoughArguments(recos, opts));
                chain.add(battery("LogRecoCompositeHandler", recos, DimensionTable.LOGRECO_MULTI));
                chain.add(CoherenceHandlers.argannoLogreco(recos, annotations, settings.fromKey()));
                chain.add(CoherenceHandlers.argmapInfreco(maps, recos));
                chain.add(CoherenceHandlers.argannoArgmapLogreco(annotations, maps, recos));
                break;

            default:
                throw new IllegalArgumentException("Unknown pipeline '" + name + "', expected one of " + PIPELINES);
        }
        return new CompositeHandler(pipeline, chain);
    }

    private DimensionBatteryHandler battery(String name, Predicate<ArtifactRecord> filter, DimensionTable table) {
        return new DimensionBatteryHandler(name, filter, table, rules, settings, entailment);
    }

    private static HasArtifactHandler hasGraph(String name, Predicate<ArtifactRecord> filter) {
        return new HasArtifactHandler(name, filter, "an argument graph");
    }

    private static HasAtLeastNArgumentsHandler enoughArguments(Predicate<ArtifactRecord> filter, PipelineOptions opts) {
        return new HasAtLeastNArgumentsHandler("HasAtLeastNArgumentsHandler.reco", filter, opts.getMinArguments());
    }

    private static HasArtifactHandler hasAnnotation(Predicate<ArtifactRecord> filter) {
        return new HasArtifactHandler("HasAnnotationsHandler", filter, "an annotation");
    }

    private static CompositeHandler arganno(Predicate<ArtifactRecord> filter, PipelineOptions opts) {
        return CoreHandlers.arganno(filter, opts.getLegalArgumentLabels(), opts.getLegalRefRecoLabels());
    }
}
