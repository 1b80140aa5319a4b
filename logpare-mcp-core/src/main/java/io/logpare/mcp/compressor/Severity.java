/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Severity {

	// @formatter:off
	@JsonProperty("error") ERROR,
	@JsonProperty("warning") WARNING,
	@JsonProperty("info") INFO;
	// @formatter:on

}
