/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error attached to a failed or cancelled task.
 *
 * @param code one of the {@link TaskErrorCodes}
 * @param message description of the failure
 */
public record TaskError( // @formatter:off
	@JsonProperty("code") String code,
	@JsonProperty("message") String message) { // @formatter:on

	static final TaskError CANCELLED_BY_USER = new TaskError(TaskErrorCodes.CANCELLED, "Task was cancelled by user");

}
