/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import reactor.util.annotation.Nullable;

/**
 * Arguments of the {@code analyze_log_patterns} tool.
 *
 * @param logs raw log content to analyze
 * @param maxTemplates maximum number of templates to return (1..100, default 20)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzeLogPatternsRequest( // @formatter:off
	@JsonProperty("logs") String logs,
	@JsonProperty("max_templates") @Nullable Integer maxTemplates) { // @formatter:on

	public static final int DEFAULT_MAX_TEMPLATES = 20;

	public static final int MAX_TEMPLATES_LIMIT = 100;

	public AnalyzeLogPatternsRequest validate() {
		if (this.logs == null) {
			throw McpError.builder(ErrorCodes.INVALID_PARAMS).message("logs is required").build();
		}
		if (this.maxTemplates != null && (this.maxTemplates < 1 || this.maxTemplates > MAX_TEMPLATES_LIMIT)) {
			throw McpError.builder(ErrorCodes.INVALID_PARAMS)
				.message("max_templates must be between 1 and " + MAX_TEMPLATES_LIMIT)
				.build();
		}
		return this;
	}

	@JsonIgnore
	public int effectiveMaxTemplates() {
		return this.maxTemplates != null ? this.maxTemplates : DEFAULT_MAX_TEMPLATES;
	}

}
