package com.falkordb.problog.cypher;

import com.falkordb.problog.parse.Fact;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns parsed facts into Cypher statements.
 *
 * <h2>Translation Strategy:</h2>
 * <ul>
 *   <li>Unary facts become a label on an {@code :Entity} node keyed by
 *       its {@code id} property</li>
 *   <li>Binary facts become a relationship between two such nodes, the
 *       predicate being the relationship type</li>
 *   <li>All label statements are emitted before any relationship
 *       statement, whatever the order of the facts</li>
 *   <li>A repeated (instance, label) pair is emitted once; relationships
 *       are emitted for every fact</li>
 * </ul>
 *
 * <h2>Example:</h2>
 * <pre>{@code
 * // Facts:
 * // knows(alice, bob).
 * // person(alice).
 *
 * // Emitted Cypher:
 * // MERGE (n:Entity {id: 'alice'})
 * // SET n:`person`
 * // MERGE (s:Entity {id: 'alice'})
 * // MERGE (o:Entity {id: 'bob'})
 * // MERGE (s)-[:`knows`]->(o)
 * }</pre>
 *
 * <p>An emitter keeps the label de-duplication set of one conversion.
 * Use a new instance for every conversion.</p>
 */
public final class CypherEmitter {

    /** Label every generated node carries. */
    public static final String ENTITY_LABEL = "Entity";

    /** Label assignments already emitted, in first-seen order. */
    private final Set<EntityKey> seen = new LinkedHashSet<>();

    /**
     * Emit statements for all facts, label statements first.
     *
     * @param facts the facts in source order
     * @return the statements, one per line of output
     */
    public List<String> emit(final List<Fact> facts) {
        List<String> lines = new ArrayList<>();
        lines.addAll(emitNodes(facts));
        lines.addAll(emitRelationships(facts));
        return lines;
    }

    /**
     * Emit a {@code MERGE}/{@code SET} pair for each new unary fact.
     *
     * @param facts the facts in source order; non-unary facts are skipped
     * @return the label statements
     */
    List<String> emitNodes(final List<Fact> facts) {
        List<String> lines = new ArrayList<>();
        for (Fact fact : facts) {
            if (!fact.isUnary()) {
                continue;
            }
            String instance = fact.args().get(0);
            String label = CypherEscaper.escapeIdentifier(fact.predicate());
            if (!seen.add(new EntityKey(instance, label))) {
                continue;
            }
            lines.add(mergeEntity("n", CypherEscaper.escapeLiteral(instance)));
            lines.add("SET n:" + label);
        }
        return lines;
    }

    /**
     * Emit a subject/object/relationship triple for each binary fact.
     *
     * @param facts the facts in source order; non-binary facts are skipped
     * @return the relationship statements
     */
    List<String> emitRelationships(final List<Fact> facts) {
        List<String> lines = new ArrayList<>();
        for (Fact fact : facts) {
            if (!fact.isBinary()) {
                continue;
            }
            String relType = CypherEscaper.escapeIdentifier(fact.predicate());
            lines.add(mergeEntity("s",
                CypherEscaper.escapeLiteral(fact.args().get(0))));
            lines.add(mergeEntity("o",
                CypherEscaper.escapeLiteral(fact.args().get(1))));
            lines.add("MERGE (s)-[:" + relType + "]->(o)");
        }
        return lines;
    }

    /**
     * Number of distinct label assignments emitted so far.
     *
     * @return the de-duplication set size
     */
    int distinctLabelCount() {
        return seen.size();
    }

    private static String mergeEntity(final String variable,
            final String literal) {
        return "MERGE (" + variable + ":" + ENTITY_LABEL
            + " {id: " + literal + "})";
    }
}
