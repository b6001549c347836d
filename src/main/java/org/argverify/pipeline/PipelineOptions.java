package org.argverify.pipeline;

import org.argverify.Config;

import java.util.*;

/**
 * Per-request options of a pipeline. Empty label lists switch the corresponding label
 * validity checks off. {@code minArguments} is how many arguments a reconstruction that is
 * checked against a map must contain.
 */
public final class PipelineOptions {

    public static final PipelineOptions DEFAULT = new PipelineOptions(List.of(), List.of());

    private final List<String> legalArgumentLabels;
    private final List<String> legalRefRecoLabels;
    private final int minArguments;

    public PipelineOptions(List<String> legalArgumentLabels, List<String> legalRefRecoLabels, Integer minArguments) {
        this.legalArgumentLabels = legalArgumentLabels == null ? List.of() : List.copyOf(legalArgumentLabels);
        this.legalRefRecoLabels = legalRefRecoLabels == null ? List.of() : List.copyOf(legalRefRecoLabels);
        this.minArguments = minArguments == null ? Config.MIN_RECONSTRUCTED_ARGUMENTS : minArguments;
        if (this.minArguments < 0) throw new IllegalArgumentException("min_arguments must not be negative");
    }

    public PipelineOptions(List<String> legalArgumentLabels, List<String> legalRefRecoLabels) {
        this(legalArgumentLabels, legalRefRecoLabels, null);
    }

    public List<String> getLegalArgumentLabels() { return legalArgumentLabels; }
    public List<String> getLegalRefRecoLabels() { return legalRefRecoLabels; }
    public int getMinArguments() { return minArguments; }
}
