package org.argverify.rules;

import org.argverify.handler.ArtifactFilters;
import org.argverify.handler.Handler;
import org.argverify.logic.EntailmentChecker;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.CheckResult;
import org.argverify.request.VerificationContext;
import org.argverify.request.VerifierSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/**
 * Applies a {@link DimensionTable} to every matching argument graph and records one result
 * per dimension. Argument-scoped failures are prefixed with the argument they concern.
 */
public class DimensionBatteryHandler extends Handler {

    private static final Logger LOG = LoggerFactory.getLogger(DimensionBatteryHandler.class);

    private final Predicate<ArtifactRecord> filter;
    private final DimensionTable dimensions;
    private final RuleTable rules;
    private final VerifierSettings settings;
    private final EntailmentChecker entailment;

    public DimensionBatteryHandler(String name, Predicate<ArtifactRecord> filter, DimensionTable dimensions,
                                   RuleTable rules, VerifierSettings settings, EntailmentChecker entailment) {
        super(name);
        this.filter = filter == null ? ArtifactFilters.graphs() : filter;
        this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.entailment = entailment;
        dimensions.validate(rules);
    }

    @Override
    protected VerificationContext handle(VerificationContext ctx) {
        for (ArtifactRecord record : ctx.getRecords()) {
            ArgumentGraph graph = record.graph();
            if (graph == null || !filter.test(record)) continue;
            RuleSession session = new RuleSession(graph, settings, entailment);
            for (String dimension : dimensions.dimensions()) {
                ctx.addResult(evaluateDimension(dimension, record, session));
            }
        }
        return ctx;
    }

    private CheckResult evaluateDimension(String dimension, ArtifactRecord record, RuleSession session) {
        List<String> msgs = new ArrayList<>();
        Map<String, Object> details = new LinkedHashMap<>();
        for (String id : dimensions.rulesOf(dimension)) {
            RuleDefinition def = rules.get(id);
            if (def.scope() == RuleScope.GRAPH) {
                RuleOutcome o = session.apply(def, null);
                collect(o, null, id, msgs, details);
            } else {
                for (Argument a : session.graph().getArguments()) {
                    RuleOutcome o = session.apply(def, a);
                    collect(o, a, id, msgs, details);
                }
            }
        }
        LOG.debug("Dimension {} on {}: {} failure(s)", dimension, record.getId(), msgs.size());
        return new CheckResult(dimension, List.of(record.getId()), msgs.isEmpty(),
            msgs.isEmpty() ? null : String.join(" ", msgs), details);
    }

    private static void collect(RuleOutcome o, Argument a, String ruleId, List<String> msgs, Map<String, Object> details) {
        String prefix = a == null ? "" : "<" + (a.isUnlabeled() ? "unlabeled argument" : a.getLabel()) + ">";
        if (o.isFail()) {
            msgs.add(a == null ? o.message() : "Error in argument " + prefix + ": " + o.message());
        }
        for (Map.Entry<String, Object> d : o.details().entrySet()) {
            Object known = details.get(d.getKey());
            if (d.getValue() instanceof Map && (known == null || known instanceof Map)) {
                // label-keyed maps from several arguments are merged
                Map<Object, Object> merged = new LinkedHashMap<>();
                if (known != null) merged.putAll((Map<?, ?>) known);
                merged.putAll((Map<?, ?>) d.getValue());
                details.put(d.getKey(), merged);
            } else {
                details.put(a == null ? d.getKey() : d.getKey() + prefix, d.getValue());
            }
        }
    }
}
