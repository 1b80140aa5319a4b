/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status of an asynchronous task. A task starts in {@link #WORKING} and moves to exactly
 * one terminal status.
 */
public enum TaskStatus {

	// @formatter:off
	/**
	 * The job is scheduled or running.
	 */
	@JsonProperty("working") WORKING,
	/**
	 * The job finished and its result is available.
	 */
	@JsonProperty("completed") COMPLETED,
	/**
	 * The job raised an error.
	 */
	@JsonProperty("failed") FAILED,
	/**
	 * The task was cancelled before the job finished.
	 */
	@JsonProperty("cancelled") CANCELLED;
	// @formatter:on

	/**
	 * Checks if this status represents a terminal state.
	 * @return true for COMPLETED, FAILED and CANCELLED
	 */
	public boolean isTerminal() {
		return this != WORKING;
	}

	/**
	 * Returns the wire name of this status.
	 * @return the lower-case status name
	 */
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

}
