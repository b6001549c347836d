package org.argverify.request;

import com.google.gson.JsonObject;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class VerificationReportTest {

    @Test
    public void testReportReflectsContext() {
        VerificationContext ctx = new VerificationContext((String) null, List.of());
        ctx.getExecutedChecks().add("infreco");
        ctx.addResult(CheckResult.pass("a", List.of("r1")));
        ctx.addResult(CheckResult.fail("b", List.of("r1", "r2"), "broken"));

        VerificationReport report = new VerificationReport("infreco", ctx);

        assertFalse(report.isValid());
        JsonObject json = report.toJsonObject();
        assertEquals("infreco", json.get("pipeline").getAsString());
        assertEquals(2, json.getAsJsonArray("results").size());
        assertEquals("broken", json.getAsJsonArray("results").get(1).getAsJsonObject().get("message").getAsString());
        assertTrue("null messages are kept", json.getAsJsonArray("results").get(0).getAsJsonObject().get("message").isJsonNull());

        Map<String, Object> map = report.toMap();
        assertEquals(List.of("infreco"), map.get("executed_checks"));
    }

    @Test
    public void testEmptyRunIsValid() {
        assertTrue(new VerificationReport("argmap", new VerificationContext((String) null, List.of())).isValid());
    }
}
