package com.falkordb.problog.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TracingUtil class.
 */
public class TracingUtilTest {

    @Test
    @DisplayName("Test scope constants are defined correctly")
    public void testScopeConstants() {
        assertEquals("com.falkordb.problog.ProblogToCypherConverter",
            TracingUtil.SCOPE_CONVERTER);
        assertEquals("com.falkordb.problog.runner.CypherScriptRunner",
            TracingUtil.SCOPE_RUNNER);
        assertEquals("com.falkordb.redis",
            TracingUtil.SCOPE_FALKORDB_DRIVER);
    }

    @Test
    @DisplayName("Test getOpenTelemetry returns the same instance")
    public void testGetOpenTelemetrySingleton() {
        OpenTelemetry first = TracingUtil.getOpenTelemetry();
        assertNotNull(first);
        assertSame(first, TracingUtil.getOpenTelemetry());
    }

    @Test
    @DisplayName("Test getTracer returns non-null tracers")
    public void testGetTracer() {
        Tracer tracer = TracingUtil.getTracer(TracingUtil.SCOPE_CONVERTER);
        assertNotNull(tracer);
        assertNotNull(TracingUtil.getTracer(TracingUtil.SCOPE_RUNNER));
    }

    @Test
    @DisplayName("Test tracing follows OTEL_TRACING_ENABLED and defaults off")
    public void testTracingEnabledFlag() {
        String env = System.getenv("OTEL_TRACING_ENABLED");
        boolean expected = env != null && !env.isEmpty()
            && Boolean.parseBoolean(env);
        assertEquals(expected, TracingUtil.isTracingEnabled());
    }
}
