/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.report.CompressionReport;

/**
 * Result of a completed task: the rendered text plus the structured report.
 */
public record TaskResult( // @formatter:off
	@JsonProperty("content") List<TextContent> content,
	@JsonProperty("structuredContent") CompressionReport structuredContent) { // @formatter:on

	public TaskResult {
		content = content != null ? List.copyOf(content) : List.of();
	}

	public TaskResult(String text, CompressionReport structuredContent) {
		this(List.of(new TextContent(text)), structuredContent);
	}

}
