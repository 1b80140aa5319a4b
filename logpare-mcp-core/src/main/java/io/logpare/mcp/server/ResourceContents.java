/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Text contents of a read resource.
 */
public record ResourceContents( // @formatter:off
	@JsonProperty("uri") String uri,
	@JsonProperty("mimeType") String mimeType,
	@JsonProperty("text") String text) { // @formatter:on
}
