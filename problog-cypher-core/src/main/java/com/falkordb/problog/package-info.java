/**
 * Conversion of ground ProbLog-style facts into Cypher.
 *
 * <p>Key components:</p>
 * <ul>
 *   <li>{@link com.falkordb.problog.ProblogToCypherConverter} - the
 *       {@code convert} entry point</li>
 *   <li>{@link com.falkordb.problog.parse} - comment stripping, fact and
 *       argument splitting, fact validation</li>
 *   <li>{@link com.falkordb.problog.cypher} - escaping and statement
 *       emission</li>
 *   <li>{@link com.falkordb.problog.Main} - command-line shell</li>
 * </ul>
 */
package com.falkordb.problog;
