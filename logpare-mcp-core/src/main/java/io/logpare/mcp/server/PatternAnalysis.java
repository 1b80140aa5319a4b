/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.compressor.LogTemplate;
import reactor.util.annotation.Nullable;

/**
 * Structured reply of {@code analyze_log_patterns}.
 */
public record PatternAnalysis( // @formatter:off
	@JsonProperty("inputLines") int inputLines,
	@JsonProperty("uniqueTemplates") int uniqueTemplates,
	@JsonProperty("estimatedTokenReduction") double estimatedTokenReduction,
	@JsonProperty("templates") List<Pattern> templates) { // @formatter:on

	/**
	 * One template without the enrichment of a full compression report.
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Pattern( // @formatter:off
		@JsonProperty("id") String id,
		@JsonProperty("pattern") String pattern,
		@JsonProperty("occurrences") int occurrences,
		@JsonProperty("sampleVariables") List<List<String>> sampleVariables,
		@JsonProperty("firstSeen") @Nullable Integer firstSeen,
		@JsonProperty("lastSeen") @Nullable Integer lastSeen) { // @formatter:on

		static Pattern from(LogTemplate template) {
			return new Pattern(template.id(), template.pattern(), template.occurrences(), template.sampleVariables(),
					template.firstSeen(), template.lastSeen());
		}

	}

}
