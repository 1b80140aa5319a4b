/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Range of the numeric values sampled for a template, e.g. request durations.
 */
public record NumericRange( // @formatter:off
	@JsonProperty("min") double min,
	@JsonProperty("max") double max,
	@JsonProperty("avg") double avg,
	@JsonProperty("unit") String unit) { // @formatter:on
}
