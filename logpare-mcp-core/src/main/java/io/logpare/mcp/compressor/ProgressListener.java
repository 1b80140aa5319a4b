/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

/**
 * Receives progress events from a running compression.
 */
@FunctionalInterface
public interface ProgressListener {

	ProgressListener NOOP = event -> {
	};

	void onProgress(ProgressEvent event);

}
