package com.falkordb.problog.runner;

import com.falkordb.Graph;
import com.falkordb.ResultSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TracedGraph class.
 */
public class TracedGraphTest {

    private Graph mockGraph;
    private TracedGraph tracedGraph;
    private static final String GRAPH_NAME = "test_graph";

    @BeforeEach
    public void setUp() {
        mockGraph = mock(Graph.class);
        tracedGraph = new TracedGraph(mockGraph, GRAPH_NAME);
    }

    @Test
    @DisplayName("Test TracedGraph wraps delegate graph")
    public void testGetDelegate() {
        assertSame(mockGraph, tracedGraph.getDelegate());
        assertEquals(GRAPH_NAME, tracedGraph.getGraphName());
    }

    @Test
    @DisplayName("Test query delegates to wrapped graph")
    public void testQuery() {
        String cypher = "MERGE (n:Entity {id: 'a'})\nSET n:`p`";
        ResultSet mockResult = mock(ResultSet.class);
        when(mockGraph.query(cypher)).thenReturn(mockResult);

        ResultSet result = tracedGraph.query(cypher);

        verify(mockGraph).query(cypher);
        assertSame(mockResult, result);
    }

    @Test
    @DisplayName("Test query exception is propagated")
    public void testQueryException() {
        String cypher = "INVALID";
        when(mockGraph.query(cypher))
            .thenThrow(new RuntimeException("Query failed"));

        RuntimeException e = assertThrows(RuntimeException.class,
            () -> tracedGraph.query(cypher));
        assertEquals("Query failed", e.getMessage());
    }
}
