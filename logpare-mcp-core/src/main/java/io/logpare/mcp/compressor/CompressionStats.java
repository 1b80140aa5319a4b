/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate figures for one compression run.
 *
 * @param inputLines number of non-empty lines processed
 * @param uniqueTemplates number of distinct templates found
 * @param compressionRatio compressed size relative to the input, between 0 and 1
 * @param estimatedTokenReduction estimated fraction of tokens saved, between 0 and 1
 */
public record CompressionStats( // @formatter:off
	@JsonProperty("inputLines") int inputLines,
	@JsonProperty("uniqueTemplates") int uniqueTemplates,
	@JsonProperty("compressionRatio") double compressionRatio,
	@JsonProperty("estimatedTokenReduction") double estimatedTokenReduction) { // @formatter:on
}
