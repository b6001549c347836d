package org.argverify.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for the /api/v1/verify/{pipeline} endpoint.
 */
public class VerifyRequest {

    private String source;
    private List<ArtifactPayload> artifacts;

    @JsonProperty("argument_labels")
    private List<String> argumentLabels;

    @JsonProperty("ref_reco_labels")
    private List<String> refRecoLabels;

    @JsonProperty("min_arguments")
    private Integer minArguments;

    public VerifyRequest() {
    }

    public VerifyRequest(String source, List<ArtifactPayload> artifacts) {
        this.source = source;
        this.artifacts = artifacts;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public List<ArtifactPayload> getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(List<ArtifactPayload> artifacts) {
        this.artifacts = artifacts;
    }

    public List<String> getArgumentLabels() {
        return argumentLabels;
    }

    public void setArgumentLabels(List<String> argumentLabels) {
        this.argumentLabels = argumentLabels;
    }

    public List<String> getRefRecoLabels() {
        return refRecoLabels;
    }

    public void setRefRecoLabels(List<String> refRecoLabels) {
        this.refRecoLabels = refRecoLabels;
    }

    public Integer getMinArguments() {
        return minArguments;
    }

    public void setMinArguments(Integer minArguments) {
        this.minArguments = minArguments;
    }
}
