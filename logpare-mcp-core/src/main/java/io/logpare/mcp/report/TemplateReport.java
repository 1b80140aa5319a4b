/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.report;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.compressor.LogTemplate;
import io.logpare.mcp.compressor.Severity;

/**
 * A template enriched with the diagnostic fields exposed to clients.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemplateReport( // @formatter:off
	@JsonProperty("id") String id,
	@JsonProperty("pattern") String pattern,
	@JsonProperty("occurrences") int occurrences,
	@JsonProperty("severity") Severity severity,
	@JsonProperty("isStackFrame") boolean stackFrame,
	@JsonProperty("hydratedExample") String hydratedExample,
	@JsonProperty("isExpectedFailure") boolean expectedFailure,
	@JsonProperty("isPerformanceViolation") boolean performanceViolation,
	@JsonProperty("urlSamples") List<String> urlSamples,
	@JsonProperty("fullUrlSamples") List<String> fullUrlSamples,
	@JsonProperty("statusCodeSamples") List<Integer> statusCodeSamples,
	@JsonProperty("correlationIdSamples") List<String> correlationIdSamples,
	@JsonProperty("durationSamples") List<String> durationSamples,
	@JsonProperty("numericRange") NumericRange numericRange,
	@JsonProperty("sampleVariables") List<List<String>> sampleVariables,
	@JsonProperty("firstSeen") Integer firstSeen,
	@JsonProperty("lastSeen") Integer lastSeen) { // @formatter:on

	public static TemplateReport from(LogTemplate t) {
		List<String> firstSample = t.sampleVariables().isEmpty() ? List.of() : t.sampleVariables().get(0);
		return new TemplateReport(t.id(), t.pattern(), t.occurrences(), t.severity(), t.stackFrame(),
				TemplateInsights.hydratePattern(t.pattern(), firstSample), TemplateInsights.isExpectedFailure(t),
				TemplateInsights.isPerformanceViolation(t), t.urlSamples(), t.fullUrlSamples(),
				t.statusCodeSamples(), t.correlationIdSamples(), t.durationSamples(),
				TemplateInsights.extractNumericRange(t.sampleVariables()), t.sampleVariables(), t.firstSeen(),
				t.lastSeen());
	}

}
