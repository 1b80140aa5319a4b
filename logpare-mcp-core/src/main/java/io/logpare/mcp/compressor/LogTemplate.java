/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import reactor.util.annotation.Nullable;

/**
 * A log template extracted by the compressor: a pattern with {@code <*>} placeholders
 * and the samples observed for its variable parts.
 */
public record LogTemplate( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("pattern") String pattern,
	@JsonProperty("occurrences") int occurrences,
	@JsonProperty("severity") Severity severity,
	@JsonProperty("isStackFrame") boolean stackFrame,
	@JsonProperty("sampleVariables") List<List<String>> sampleVariables,
	@JsonProperty("urlSamples") List<String> urlSamples,
	@JsonProperty("fullUrlSamples") List<String> fullUrlSamples,
	@JsonProperty("statusCodeSamples") List<Integer> statusCodeSamples,
	@JsonProperty("correlationIdSamples") List<String> correlationIdSamples,
	@JsonProperty("durationSamples") List<String> durationSamples,
	@JsonProperty("firstSeen") @Nullable Integer firstSeen,
	@JsonProperty("lastSeen") @Nullable Integer lastSeen) { // @formatter:on

	public LogTemplate {
		sampleVariables = sampleVariables != null ? sampleVariables : List.of();
		urlSamples = urlSamples != null ? urlSamples : List.of();
		fullUrlSamples = fullUrlSamples != null ? fullUrlSamples : List.of();
		statusCodeSamples = statusCodeSamples != null ? statusCodeSamples : List.of();
		correlationIdSamples = correlationIdSamples != null ? correlationIdSamples : List.of();
		durationSamples = durationSamples != null ? durationSamples : List.of();
		severity = severity != null ? severity : Severity.INFO;
	}

	/**
	 * Shorthand for templates that only carry a pattern, its count and variable samples.
	 */
	public LogTemplate(String id, String pattern, int occurrences, Severity severity, boolean stackFrame,
			List<List<String>> sampleVariables) {
		this(id, pattern, occurrences, severity, stackFrame, sampleVariables, null, null, null, null, null, null,
				null);
	}

}
