/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.tasks.TextContent;
import reactor.util.annotation.Nullable;

/**
 * The result of a tool call.
 *
 * @param content the text shown to the client
 * @param structuredContent machine-readable companion of the text, if any
 * @param isError whether the call failed; failures are reported in the content
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult( // @formatter:off
	@JsonProperty("content") List<TextContent> content,
	@JsonProperty("structuredContent") @Nullable Object structuredContent,
	@JsonProperty("isError") @Nullable Boolean isError) { // @formatter:on

	public ToolResult {
		content = content != null ? List.copyOf(content) : List.of();
	}

	public static ToolResult of(String text, @Nullable Object structuredContent) {
		return new ToolResult(List.of(new TextContent(text)), structuredContent, null);
	}

	public static ToolResult text(String text) {
		return of(text, null);
	}

	public static ToolResult error(String text) {
		return new ToolResult(List.of(new TextContent(text)), null, true);
	}

	/**
	 * Returns the text of the first content item.
	 * @return the text, or an empty string without content
	 */
	public String firstText() {
		return this.content.isEmpty() ? "" : this.content.get(0).text();
	}

}
