/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

/**
 * Phases reported by the compressor while it runs.
 */
public enum ProgressPhase {

	PARSING, CLUSTERING, FINALIZING

}
