/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.tasks.TaskStatus;

/**
 * Structured reply of {@code compress_logs} when the work was handed to a background
 * task.
 */
public record AsyncTaskStarted( // @formatter:off
	@JsonProperty("taskId") String taskId,
	@JsonProperty("status") TaskStatus status,
	@JsonProperty("createdAt") String createdAt,
	@JsonProperty("pollInterval") long pollInterval) { // @formatter:on
}
