/**
 * OpenTelemetry setup shared by the converter and the FalkorDB runner.
 */
package com.falkordb.problog.tracing;
