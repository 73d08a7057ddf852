package com.falkordb.problog.cypher;

/**
 * De-duplication key for label assignments within one conversion.
 *
 * @param instanceId the instance argument as written in the source
 * @param escapedLabel the label after identifier escaping
 */
record EntityKey(String instanceId, String escapedLabel) {
}
