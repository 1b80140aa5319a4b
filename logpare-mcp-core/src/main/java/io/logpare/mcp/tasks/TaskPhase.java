/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.compressor.ProgressPhase;

/**
 * Processing phase reported in {@link TaskProgress}.
 */
public enum TaskPhase {

	// @formatter:off
	@JsonProperty("parsing") PARSING,
	@JsonProperty("clustering") CLUSTERING,
	@JsonProperty("categorizing") CATEGORIZING,
	@JsonProperty("formatting") FORMATTING,
	@JsonProperty("finalizing") FINALIZING;
	// @formatter:on

	public static TaskPhase of(ProgressPhase phase) {
		return switch (phase) {
			case PARSING -> PARSING;
			case CLUSTERING -> CLUSTERING;
			case FINALIZING -> FINALIZING;
		};
	}

}
