package com.falkordb.problog;

import com.falkordb.problog.cypher.CypherEmitter;
import com.falkordb.problog.parse.CommentStripper;
import com.falkordb.problog.parse.Fact;
import com.falkordb.problog.parse.FactParser;
import com.falkordb.problog.parse.FactSplitter;
import com.falkordb.problog.parse.FactSyntaxException;
import com.falkordb.problog.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts ProbLog-style ground facts into Cypher statements.
 *
 * <p>Supported facts:</p>
 * <pre>{@code
 * unary_predicate(instance).
 * binary_predicate(subject, object).
 * }</pre>
 *
 * <p>Unary predicates become node labels and binary predicates become
 * relationships. Conversion is all-or-nothing: the first malformed fact
 * aborts the call and nothing is returned. Calls share no state and may run
 * concurrently.</p>
 *
 * @see CypherEmitter
 */
public final class ProblogToCypherConverter {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        ProblogToCypherConverter.class);

    /** Tracer for conversion calls. */
    private static final Tracer TRACER =
        TracingUtil.getTracer(TracingUtil.SCOPE_CONVERTER);

    /** Attribute key for input size in characters. */
    private static final AttributeKey<Long> ATTR_INPUT_LENGTH =
        AttributeKey.longKey("problog.input.length");

    /** Attribute key for parsed fact count. */
    private static final AttributeKey<Long> ATTR_FACT_COUNT =
        AttributeKey.longKey("problog.fact_count");

    /** Attribute key for emitted statement count. */
    private static final AttributeKey<Long> ATTR_STATEMENT_COUNT =
        AttributeKey.longKey("cypher.statement_count");

    /** Private constructor to prevent instantiation. */
    private ProblogToCypherConverter() {
        // Utility class
    }

    /**
     * Convert fact source text to Cypher.
     *
     * @param sourceText the fact source; null is treated as empty
     * @return newline-terminated statements, or the empty string when the
     *     source holds no facts
     * @throws FactSyntaxException if any fact is malformed
     */
    public static String convert(final String sourceText)
            throws FactSyntaxException {
        String text = sourceText == null ? "" : sourceText;
        Span span = TRACER.spanBuilder("ProblogToCypherConverter.convert")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_INPUT_LENGTH, (long) text.length())
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            List<Fact> facts = parseFacts(text);
            List<String> lines = new CypherEmitter().emit(facts);

            span.setAttribute(ATTR_FACT_COUNT, (long) facts.size());
            span.setAttribute(ATTR_STATEMENT_COUNT, (long) lines.size());
            span.setStatus(StatusCode.OK);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Converted {} facts into {} statements",
                    facts.size(), lines.size());
            }
            return joinLines(lines);
        } catch (FactSyntaxException | RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Parse fact source text without emitting Cypher.
     *
     * @param sourceText the fact source; null is treated as empty
     * @return the facts in source order
     * @throws FactSyntaxException if any fact is malformed
     */
    public static List<Fact> parseFacts(final String sourceText)
            throws FactSyntaxException {
        String cleaned = CommentStripper.strip(sourceText);
        List<Fact> facts = new ArrayList<>();
        for (String fragment : FactSplitter.split(cleaned)) {
            Optional<Fact> fact = FactParser.parse(fragment);
            fact.ifPresent(facts::add);
        }
        return facts;
    }

    private static String joinLines(final List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }
}
