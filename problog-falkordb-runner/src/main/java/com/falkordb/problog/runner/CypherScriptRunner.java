package com.falkordb.problog.runner;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.problog.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies converter output to a FalkorDB graph.
 *
 * <p>Statements are executed one after another through the JFalkorDB
 * driver. There is no transaction spanning the script: if a statement fails,
 * the statements before it stay applied and the failure is rethrown. The
 * emitted statements are all {@code MERGE}/{@code SET}, so re-running the
 * whole script after a partial failure is safe.</p>
 *
 * <pre>{@code
 * try (CypherScriptRunner runner = CypherScriptRunner.builder()
 *         .host("localhost")
 *         .port(6379)
 *         .graphName("facts")
 *         .build()) {
 *     runner.run(ProblogToCypherConverter.convert(source));
 * }
 * }</pre>
 */
public final class CypherScriptRunner implements Closeable {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        CypherScriptRunner.class);

    /** Default FalkorDB host. */
    public static final String DEFAULT_HOST = "localhost";

    /** Default FalkorDB port. */
    public static final int DEFAULT_PORT = 6379;

    /** Default graph name. */
    public static final String DEFAULT_GRAPH_NAME = "facts";

    /** Attribute key for graph name. */
    private static final AttributeKey<String> ATTR_GRAPH_NAME =
        AttributeKey.stringKey("falkordb.graph_name");

    /** Attribute key for statement count. */
    private static final AttributeKey<Long> ATTR_STATEMENT_COUNT =
        AttributeKey.longKey("cypher.statement_count");

    /** Attribute key for statements applied before a failure. */
    private static final AttributeKey<Long> ATTR_EXECUTED_COUNT =
        AttributeKey.longKey("cypher.executed_count");

    /** Driver the graph was obtained from. */
    private final Driver driver;

    /** Whether this runner opened the driver and must close it. */
    private final boolean ownsDriver;

    /** Traced graph that statements run against. */
    private final TracedGraph graph;

    /** Tracer for script runs. */
    private final Tracer tracer;

    /**
     * Create a runner on an existing graph wrapper.
     *
     * @param graph the graph to run statements against
     */
    public CypherScriptRunner(final TracedGraph graph) {
        this(null, false, graph);
    }

    private CypherScriptRunner(final Driver driver, final boolean ownsDriver,
            final TracedGraph graph) {
        this.driver = driver;
        this.ownsDriver = ownsDriver;
        this.graph = graph;
        this.tracer = TracingUtil.getTracer(TracingUtil.SCOPE_RUNNER);
    }

    /**
     * Execute every statement of a script.
     *
     * @param script converter output
     * @return the number of statements executed
     */
    public int run(final String script) {
        List<String> statements = StatementGrouper.group(script);
        Span span = tracer.spanBuilder("CypherScriptRunner.run")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_GRAPH_NAME, graph.getGraphName())
            .setAttribute(ATTR_STATEMENT_COUNT, (long) statements.size())
            .startSpan();

        int executed = 0;
        try (Scope scope = span.makeCurrent()) {
            for (String statement : statements) {
                graph.query(statement);
                executed++;
            }
            span.setStatus(StatusCode.OK);
        } catch (RuntimeException e) {
            if (LOGGER.isErrorEnabled()) {
                LOGGER.error("Statement {} of {} failed on graph {}: {}",
                    executed + 1, statements.size(), graph.getGraphName(),
                    e.getMessage());
            }
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.setAttribute(ATTR_EXECUTED_COUNT, (long) executed);
            span.end();
        }

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Executed {} statements on graph {}",
                executed, graph.getGraphName());
        }
        return executed;
    }

    /**
     * Read a script file as UTF-8 and execute it.
     *
     * @param file the script file
     * @return the number of statements executed
     * @throws IOException if the file cannot be read
     */
    public int runFile(final Path file) throws IOException {
        return run(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * The graph statements run against.
     *
     * @return the traced graph
     */
    public TracedGraph getGraph() {
        return graph;
    }

    /** Close the driver if this runner opened it. */
    @Override
    public void close() {
        if (!ownsDriver || driver == null) {
            return;
        }
        try {
            driver.close();
        } catch (Exception e) {
            if (LOGGER.isErrorEnabled()) {
                LOGGER.error("Error closing FalkorDB driver: {}",
                    e.getMessage());
            }
        }
    }

    /**
     * Obtain a {@link Builder} to configure and create a runner.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link CypherScriptRunner} instances.
     */
    public static class Builder {
        /** FalkorDB host to connect to. */
        private String host = DEFAULT_HOST;
        /** FalkorDB port to connect to. */
        private int port = DEFAULT_PORT;
        /** Name of the graph to write to. */
        private String graphName = DEFAULT_GRAPH_NAME;
        /** Custom FalkorDB driver instance (optional). */
        private Driver driver = null;

        /**
         * Creates a new Builder with default settings.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Set the FalkorDB host to connect to.
         *
         * @param value the FalkorDB host
         * @return this builder
         */
        public Builder host(final String value) {
            this.host = value;
            return this;
        }

        /**
         * Set the FalkorDB port to connect to.
         *
         * @param value the FalkorDB port
         * @return this builder
         */
        public Builder port(final int value) {
            this.port = value;
            return this;
        }

        /**
         * Set the graph to write to.
         *
         * @param name the graph name
         * @return this builder
         */
        public Builder graphName(final String name) {
            this.graphName = name;
            return this;
        }

        /**
         * Set a custom FalkorDB driver instance to use.
         * If set, host and port are ignored and the driver is left open
         * when the runner is closed.
         *
         * @param value the FalkorDB driver instance
         * @return this builder
         */
        public Builder driver(final Driver value) {
            this.driver = value;
            return this;
        }

        /**
         * Build the runner.
         *
         * @return a runner connected to the configured graph
         */
        public CypherScriptRunner build() {
            boolean owns = driver == null;
            Driver d = owns ? FalkorDB.driver(host, port) : driver;
            TracedGraph traced = new TracedGraph(d.graph(graphName), graphName);
            return new CypherScriptRunner(d, owns, traced);
        }
    }
}
