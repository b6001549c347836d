package org.argverify.request;

import org.argverify.model.ArgumentGraph;
import org.jsoup.nodes.Document;

import java.util.*;

/**
 * One artifact submitted for verification. Only {@code parsedData} may be attached after
 * construction.
 */
public class ArtifactRecord {
    private final String id;
    private final ArtifactKind kind;
    private final String rawSnippet;
    private final Map<String, Object> frontMatter;
    private Object parsedData;

    public ArtifactRecord(String id, ArtifactKind kind, Object parsedData, String rawSnippet, Map<String, Object> frontMatter) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.parsedData = parsedData;
        this.rawSnippet = rawSnippet;
        this.frontMatter = frontMatter == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(frontMatter));
    }

    public static ArtifactRecord graph(String id, ArgumentGraph graph, Map<String, Object> frontMatter) {
        return new ArtifactRecord(id, ArtifactKind.ARGUMENT_GRAPH, graph, null, frontMatter);
    }

    public static ArtifactRecord graph(String id, ArgumentGraph graph) {
        return graph(id, graph, null);
    }

    public static ArtifactRecord annotation(String id, Document doc, String rawSnippet) {
        return new ArtifactRecord(id, ArtifactKind.ANNOTATION_TREE, doc, rawSnippet, null);
    }

    public String getId() { return id; }
    public ArtifactKind getKind() { return kind; }
    public Object getParsedData() { return parsedData; }
    public String getRawSnippet() { return rawSnippet; }
    public Map<String, Object> getFrontMatter() { return frontMatter; }

    public void attachParsedData(Object parsedData) {
        this.parsedData = parsedData;
    }

    public boolean isParsed() {
        return parsedData != null;
    }

    /** The parsed graph, or null if this is not a parsed argument graph. */
    public ArgumentGraph graph() {
        return kind == ArtifactKind.ARGUMENT_GRAPH && parsedData instanceof ArgumentGraph ? (ArgumentGraph) parsedData : null;
    }

    /** The parsed annotation tree, or null if this is not a parsed annotation. */
    public Document annotation() {
        return kind == ArtifactKind.ANNOTATION_TREE && parsedData instanceof Document ? (Document) parsedData : null;
    }

    /** The "filename" front matter entry, or an empty string. */
    public String filename() {
        Object f = frontMatter.get("filename");
        return f == null ? "" : String.valueOf(f);
    }

    @Override
    public String toString() {
        return "ArtifactRecord{" + id + ", " + kind + (filename().isEmpty() ? "" : ", " + filename()) + "}";
    }
}
