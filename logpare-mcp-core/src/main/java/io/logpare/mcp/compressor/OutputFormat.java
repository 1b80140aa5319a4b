/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output formats accepted by the {@code compress_logs} tool.
 */
public enum OutputFormat {

	// @formatter:off
	/**
	 * Severity-grouped output tailored for language models. Rendered from the
	 * {@link #DETAILED} compressor output.
	 */
	@JsonProperty("smart") SMART,
	@JsonProperty("summary") SUMMARY,
	@JsonProperty("detailed") DETAILED,
	@JsonProperty("json") JSON;
	// @formatter:on

	/**
	 * Returns the format the compressor itself is asked to produce.
	 * @return {@link #DETAILED} for {@link #SMART}, this format otherwise
	 */
	public OutputFormat compressorFormat() {
		return this == SMART ? DETAILED : this;
	}

}
