/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A text content item of a tool or task result.
 */
public record TextContent( // @formatter:off
	@JsonProperty("type") String type,
	@JsonProperty("text") String text) { // @formatter:on

	public TextContent(String text) {
		this("text", text);
	}

}
