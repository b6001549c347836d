package org.argverify.request;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.*;

/**
 * Caller-facing summary of a finished run: overall validity plus the check id to
 * (valid, message) mapping.
 */
public class VerificationReport {
    private static final Gson GSON = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    private final String pipeline;
    private final boolean valid;
    private final List<CheckResult> results;
    private final List<String> executedChecks;

    public VerificationReport(String pipeline, VerificationContext ctx) {
        this.pipeline = pipeline;
        this.valid = ctx.isValid();
        this.results = new ArrayList<>(ctx.getResults());
        this.executedChecks = new ArrayList<>(ctx.getExecutedChecks());
    }

    public String getPipeline() { return pipeline; }
    public boolean isValid() { return valid; }
    public List<CheckResult> getResults() { return Collections.unmodifiableList(results); }
    public List<String> getExecutedChecks() { return Collections.unmodifiableList(executedChecks); }

    /** Plain map form, used by the REST layer. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("pipeline", pipeline);
        out.put("valid", valid);
        List<Map<String, Object>> rs = new ArrayList<>();
        for (CheckResult r : results) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("check", r.getCheckId());
            m.put("artifacts", r.getArtifactRefs());
            m.put("valid", r.isValid());
            m.put("message", r.getMessage());
            rs.add(m);
        }
        out.put("results", rs);
        out.put("executed_checks", executedChecks);
        return out;
    }

    public JsonObject toJsonObject() {
        JsonObject root = new JsonObject();
        root.addProperty("pipeline", pipeline);
        root.addProperty("valid", valid);
        JsonArray arr = new JsonArray();
        for (CheckResult r : results) {
            JsonObject o = new JsonObject();
            o.addProperty("check", r.getCheckId());
            JsonArray refs = new JsonArray();
            r.getArtifactRefs().forEach(refs::add);
            o.add("artifacts", refs);
            o.addProperty("valid", r.isValid());
            o.addProperty("message", r.getMessage());
            arr.add(o);
        }
        root.add("results", arr);
        JsonArray exec = new JsonArray();
        executedChecks.forEach(exec::add);
        root.add("executed_checks", exec);
        return root;
    }

    public String toJson() {
        return GSON.toJson(toJsonObject());
    }
}
