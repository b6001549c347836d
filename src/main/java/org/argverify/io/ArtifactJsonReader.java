package org.argverify.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.argverify.dto.ArtifactPayload;
import org.argverify.dto.VerifyRequest;
import org.argverify.model.*;
import org.argverify.request.ArtifactKind;
import org.argverify.request.ArtifactRecord;
import org.argverify.request.VerificationContext;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;

import java.util.*;

/**
 * Reads verification requests and their artifacts from JSON.
 *
 * Argument graph layout:
 * <pre>
 * { "propositions": [ {"label", "texts": [...], "data": {...}} ],
 *   "arguments":    [ {"label", "gists": [...], "data": {...},
 *                      "pcs": [ {"label", "proposition", "conclusion": bool, "inference": {...}} ]} ],
 *   "relations":    [ {"source", "target", "valence", "dialectics": [...]} ] }
 * </pre>
 * Annotations are XML strings with {@code <proposition>} segments.
 */
public class ArtifactJsonReader {

    private static final TypeReference<LinkedHashMap<String, Object>> DATA_MAP = new TypeReference<>() {};

    private final ObjectMapper M = new ObjectMapper();

    public VerificationContext readRequest(String json) {
        try {
            return toContext(M.readValue(json, VerifyRequest.class));
        } catch (JsonProcessingException e) {
            throw new ArtifactFormatException("Malformed request JSON: " + e.getOriginalMessage(), e);
        }
    }

    public VerificationContext toContext(VerifyRequest request) {
        if (request == null) throw new ArtifactFormatException("Request body is missing");
        List<ArtifactRecord> records = new ArrayList<>();
        List<ArtifactPayload> artifacts = request.getArtifacts() == null ? List.of() : request.getArtifacts();
        for (int i = 0; i < artifacts.size(); i++) {
            records.add(readArtifact(artifacts.get(i), "artifact-" + (i + 1)));
        }
        return new VerificationContext(request.getSource(), records);
    }

    public ArtifactRecord readArtifact(ArtifactPayload payload, String defaultId) {
        String id = payload.getId() == null || payload.getId().isBlank() ? defaultId : payload.getId();
        ArtifactKind kind;
        try {
            kind = ArtifactKind.parse(payload.getKind());
        } catch (IllegalArgumentException e) {
            throw new ArtifactFormatException("Artifact " + id + ": " + e.getMessage(), e);
        }
        if (kind == ArtifactKind.ANNOTATION_TREE) {
            if (!(payload.getData() instanceof String)) {
                throw new ArtifactFormatException("Artifact " + id + ": annotation data must be an XML string");
            }
            String xml = (String) payload.getData();
            return new ArtifactRecord(id, kind, parseAnnotation(xml), xml, payload.getMetadata());
        }
        ArgumentGraph graph = readGraph(M.valueToTree(payload.getData()), id);
        return ArtifactRecord.graph(id, graph, payload.getMetadata());
    }

    public ArgumentGraph readGraph(String json) {
        try {
            return readGraph(M.readTree(json), "graph");
        } catch (JsonProcessingException e) {
            throw new ArtifactFormatException("Malformed argument graph JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ArgumentGraph readGraph(JsonNode root, String id) {
        if (root == null || !root.isObject()) {
            throw new ArtifactFormatException("Artifact " + id + ": argument graph must be a JSON object");
        }
        ArgumentGraph graph = new ArgumentGraph();
        for (JsonNode p : array(root, "propositions", id)) {
            graph.addProposition(new Proposition(text(p, "label"), strings(p.get("texts")), map(p.get("data"))));
        }
        for (JsonNode a : array(root, "arguments", id)) {
            List<PcsItem> pcs = new ArrayList<>();
            for (JsonNode item : array(a, "pcs", id)) {
                String label = text(item, "label");
                String prop = text(item, "proposition");
                if (item.path("conclusion").asBoolean(false)) {
                    pcs.add(PcsItem.conclusion(label, prop, map(item.get("inference"))));
                } else {
                    pcs.add(PcsItem.premise(label, prop));
                }
            }
            graph.addArgument(new Argument(text(a, "label"), strings(a.get("gists")), pcs, map(a.get("data"))));
        }
        for (JsonNode r : array(root, "relations", id)) {
            Set<Dialectics> dialectics = EnumSet.noneOf(Dialectics.class);
            try {
                for (String d : strings(r.get("dialectics"))) dialectics.add(Dialectics.parse(d));
                graph.addRelation(new DialecticalRelation(text(r, "source"), text(r, "target"),
                    Valence.parse(text(r, "valence")), dialectics));
            } catch (IllegalArgumentException e) {
                throw new ArtifactFormatException("Artifact " + id + ": bad relation " + r + ": " + e.getMessage(), e);
            }
        }
        return graph;
    }

    public static Document parseAnnotation(String xml) {
        return Jsoup.parse(xml, "", Parser.xmlParser());
    }

    private static Iterable<JsonNode> array(JsonNode node, String field, String id) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return List.of();
        if (!v.isArray()) throw new ArtifactFormatException("Artifact " + id + ": '" + field + "' must be an array");
        return v;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (node.isArray()) {
            for (JsonNode n : node) out.add(n.asText());
        } else {
            out.add(node.asText());
        }
        return out;
    }

    private Map<String, Object> map(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) return null;
        return M.convertValue(node, DATA_MAP);
    }
}
