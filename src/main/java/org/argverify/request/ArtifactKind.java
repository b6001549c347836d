package org.argverify.request;

public enum ArtifactKind {
    ARGUMENT_GRAPH,
    ANNOTATION_TREE;

    /** Accepts "argdown"/"argument-graph" and "xml"/"annotation-tree" spellings. */
    public static ArtifactKind parse(String value) {
        String v = value == null ? "" : value.trim().toLowerCase().replace('_', '-');
        switch (v) {
            case "argdown":
            case "argument-graph":
            case "graph":
                return ARGUMENT_GRAPH;
            case "xml":
            case "annotation-tree":
            case "annotation":
                return ANNOTATION_TREE;
            default:
                throw new IllegalArgumentException("Unknown artifact kind: '" + value + "'");
        }
    }
}
