/**
 * Execution of converted Cypher against FalkorDB.
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link com.falkordb.problog.runner.StatementGrouper} - Groups
 *       output lines into executable statements</li>
 *   <li>{@link com.falkordb.problog.runner.CypherScriptRunner} - Executes
 *       statements through the JFalkorDB driver</li>
 *   <li>{@link com.falkordb.problog.runner.TracedGraph} - Traces driver
 *       calls</li>
 *   <li>{@link com.falkordb.problog.runner.RunnerMain} - Command-line
 *       shell</li>
 * </ul>
 */
package com.falkordb.problog.runner;
