/**
 * Parsing of fact source text into {@link com.falkordb.problog.parse.Fact}
 * values.
 */
package com.falkordb.problog.parse;
