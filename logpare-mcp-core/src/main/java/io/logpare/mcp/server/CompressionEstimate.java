/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured reply of {@code estimate_compression}. Token counts are estimated at four
 * characters per token.
 */
public record CompressionEstimate( // @formatter:off
	@JsonProperty("inputLines") int inputLines,
	@JsonProperty("uniqueTemplates") int uniqueTemplates,
	@JsonProperty("compressionRatio") double compressionRatio,
	@JsonProperty("estimatedTokenReduction") double estimatedTokenReduction,
	@JsonProperty("originalTokensEstimate") long originalTokensEstimate,
	@JsonProperty("compressedTokensEstimate") long compressedTokensEstimate,
	@JsonProperty("tokensSavedEstimate") long tokensSavedEstimate,
	@JsonProperty("recommendation") String recommendation) { // @formatter:on
}
