/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;

/**
 * Arguments of the {@code estimate_compression} tool.
 *
 * @param logs raw log content to estimate compression for
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EstimateCompressionRequest(@JsonProperty("logs") String logs) {

	public EstimateCompressionRequest validate() {
		if (this.logs == null) {
			throw McpError.builder(ErrorCodes.INVALID_PARAMS).message("logs is required").build();
		}
		return this;
	}

}
