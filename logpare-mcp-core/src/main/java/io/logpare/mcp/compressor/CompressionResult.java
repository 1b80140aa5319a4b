/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

import java.util.List;

/**
 * Output of {@link LogCompressor#compress}.
 *
 * @param templates extracted templates, most frequent first
 * @param stats aggregate statistics
 * @param formatted the compressor's own rendering in the requested format
 */
public record CompressionResult(List<LogTemplate> templates, CompressionStats stats, String formatted) {

	public CompressionResult {
		templates = templates != null ? List.copyOf(templates) : List.of();
		formatted = formatted != null ? formatted : "";
	}

}
