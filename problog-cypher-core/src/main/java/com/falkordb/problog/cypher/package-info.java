/**
 * Cypher generation for parsed facts.
 */
package com.falkordb.problog.cypher;
