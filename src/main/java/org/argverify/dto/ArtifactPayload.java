package org.argverify.dto;

import java.util.Map;

/**
 * One submitted artifact: an argument graph as JSON object, or an annotation as XML string.
 */
public class ArtifactPayload {

    private String id;
    private String kind;
    private Object data;
    private Map<String, Object> metadata;

    public ArtifactPayload() {
    }

    public ArtifactPayload(String id, String kind, Object data, Map<String, Object> metadata) {
        this.id = id;
        this.kind = kind;
        this.data = data;
        this.metadata = metadata;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public Object getData() {
        return data;
    }

    public void setData(Object data) {
        this.data = data;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }
}
