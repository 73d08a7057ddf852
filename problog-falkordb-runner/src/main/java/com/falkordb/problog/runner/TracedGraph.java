package com.falkordb.problog.runner;

import com.falkordb.Graph;
import com.falkordb.ResultSet;
import com.falkordb.problog.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * A wrapper around a FalkorDB {@link Graph} that traces every query.
 */
public final class TracedGraph {
    /** The wrapped graph instance. */
    private final Graph delegate;

    /** The graph name for tracing attributes. */
    private final String graphName;

    /** Tracer for creating spans. */
    private final Tracer tracer;

    /** Attribute key for Cypher query. */
    private static final AttributeKey<String> ATTR_DB_STATEMENT =
        AttributeKey.stringKey("db.statement");

    /** Attribute key for database system. */
    private static final AttributeKey<String> ATTR_DB_SYSTEM =
        AttributeKey.stringKey("db.system");

    /** Attribute key for database name. */
    private static final AttributeKey<String> ATTR_DB_NAME =
        AttributeKey.stringKey("db.name");

    /**
     * Create a traced graph wrapper.
     *
     * @param delegate the underlying Graph to wrap
     * @param graphName the graph name for attributes
     */
    public TracedGraph(final Graph delegate, final String graphName) {
        this.delegate = delegate;
        this.graphName = graphName;
        this.tracer = TracingUtil.getTracer(TracingUtil.SCOPE_FALKORDB_DRIVER);
    }

    /**
     * Execute a Cypher query with tracing.
     *
     * @param cypher the Cypher query
     * @return the result set
     */
    public ResultSet query(final String cypher) {
        if (!TracingUtil.isTracingEnabled()) {
            return delegate.query(cypher);
        }

        Span span = tracer.spanBuilder("FalkorDB.query")
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute(ATTR_DB_SYSTEM, "falkordb")
            .setAttribute(ATTR_DB_NAME, graphName)
            .setAttribute(ATTR_DB_STATEMENT, cypher)
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            ResultSet result = delegate.query(cypher);
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Get the underlying graph.
     *
     * @return the underlying Graph
     */
    public Graph getDelegate() {
        return delegate;
    }

    /**
     * Name of the graph queries run against.
     *
     * @return the graph name
     */
    public String getGraphName() {
        return graphName;
    }
}
