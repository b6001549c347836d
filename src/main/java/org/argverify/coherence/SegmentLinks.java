package org.argverify.coherence;

import org.argverify.Config;
import org.argverify.core.Segments;
import org.argverify.model.Argument;
import org.argverify.model.ArgumentGraph;
import org.argverify.model.PcsItem;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;

/**
 * Links between annotated segments and the nodes of an argument graph: segment id to argument
 * label, to ref-reco item label and to the proposition label behind that item.
 */
final class SegmentLinks {

    final List<String> argumentLabels;
    final Set<String> annotationIds;
    final Map<String, String> argumentLabel = new HashMap<>();
    final Map<String, String> refRecoLabel = new HashMap<>();
    final Map<String, String> propositionLabel = new HashMap<>();

    private SegmentLinks(List<String> argumentLabels, Set<String> annotationIds) {
        this.argumentLabels = argumentLabels;
        this.annotationIds = annotationIds;
    }

    /** Links segments whose argument_label names an argument of {@code graph}. */
    static SegmentLinks toArguments(ArgumentGraph graph, Document annotation) {
        SegmentLinks links = new SegmentLinks(graph.argumentLabels(), new LinkedHashSet<>(Segments.ids(annotation)));
        for (Element segment : Segments.all(annotation)) {
            String label = Segments.attr(segment, Segments.ARGUMENT_LABEL);
            String id = Segments.attr(segment, Segments.ID);
            if (id == null || label == null || !links.argumentLabels.contains(label)) continue;
            links.argumentLabel.put(id, label);
            String refReco = Segments.attr(segment, Segments.REF_RECO_LABEL);
            if (refReco == null) continue;
            links.refRecoLabel.put(id, refReco);
            Argument argument = graph.getArgument(label);
            argument.findItem(refReco).ifPresent(item -> links.propositionLabel.put(id, item.getPropositionLabel()));
        }
        return links;
    }

    /** Links segments whose argument_label names any node (claim or argument) of {@code graph}. */
    static SegmentLinks toNodes(ArgumentGraph graph, Document annotation) {
        List<String> nodes = new ArrayList<>(graph.propositionLabels());
        nodes.addAll(graph.argumentLabels());
        SegmentLinks links = new SegmentLinks(nodes, new LinkedHashSet<>(Segments.ids(annotation)));
        for (Element segment : Segments.all(annotation)) {
            String label = Segments.attr(segment, Segments.ARGUMENT_LABEL);
            if (label != null && nodes.contains(label)) links.argumentLabel.put(segment.attr(Segments.ID), label);
        }
        return links;
    }

    /** Annotated relations (from id, to id) whose target segment exists. */
    List<String[]> relations(Document annotation, String attribute) {
        List<String[]> out = new ArrayList<>();
        for (Element segment : Segments.all(annotation)) {
            for (String to : Segments.idList(segment, attribute)) {
                if (annotationIds.contains(to)) out.add(new String[] {segment.attr(Segments.ID), to});
            }
        }
        return out;
    }

    /** The annotation_ids listed in a node's inline data, or null when there are none. */
    static List<String> annotationIdsOf(Map<String, Object> data) {
        Object v = data.get(Config.ANNOTATION_IDS_KEY);
        if (!(v instanceof List)) return null;
        List<String> out = new ArrayList<>();
        for (Object o : (List<?>) v) out.add(String.valueOf(o));
        return out;
    }

    /** Labels used directly or indirectly to infer the item {@code itemLabel} of {@code argument}. */
    static Set<String> usedInInference(Argument argument, String itemLabel, String fromKey) {
        Set<String> used = new LinkedHashSet<>();
        Deque<String> todo = new ArrayDeque<>();
        todo.push(itemLabel);
        Set<String> visited = new HashSet<>();
        while (!todo.isEmpty()) {
            String label = todo.pop();
            if (!visited.add(label)) continue;
            Optional<PcsItem> item = argument.findItem(label);
            if (item.isEmpty() || !item.get().isConclusion()) continue;
            for (String ref : item.get().inferenceRefs(fromKey)) {
                used.add(ref);
                todo.push(ref);
            }
        }
        return used;
    }
}
