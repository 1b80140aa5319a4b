/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import reactor.util.annotation.Nullable;

/**
 * Progress snapshot of a working task.
 *
 * @param percent percentage complete, 0 to 100
 * @param statusMessage human readable status line
 * @param currentPhase current processing phase
 * @param processedLines lines processed so far
 * @param totalLines total lines, when known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskProgress( // @formatter:off
	@JsonProperty("percent") int percent,
	@JsonProperty("statusMessage") String statusMessage,
	@JsonProperty("currentPhase") TaskPhase currentPhase,
	@JsonProperty("processedLines") @Nullable Integer processedLines,
	@JsonProperty("totalLines") @Nullable Integer totalLines) { // @formatter:on
}
