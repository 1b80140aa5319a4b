/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.report;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.compressor.LogTemplate;
import io.logpare.mcp.compressor.Severity;

/**
 * Template counts per diagnostic category. Stack frame templates are only counted in
 * {@code stackTracePatterns}.
 */
public record SeveritySummary( // @formatter:off
	@JsonProperty("userImpactingErrors") int userImpactingErrors,
	@JsonProperty("expectedFailures") int expectedFailures,
	@JsonProperty("performanceViolations") int performanceViolations,
	@JsonProperty("otherWarnings") int otherWarnings,
	@JsonProperty("infoPatterns") int infoPatterns,
	@JsonProperty("stackTracePatterns") int stackTracePatterns) { // @formatter:on

	public static SeveritySummary of(List<LogTemplate> templates) {
		int userImpacting = 0;
		int expected = 0;
		int violations = 0;
		int warnings = 0;
		int info = 0;
		int stackFrames = 0;
		for (LogTemplate t : templates) {
			if (t.stackFrame()) {
				stackFrames++;
			}
			else if (t.severity() == Severity.ERROR) {
				if (TemplateInsights.isExpectedFailure(t)) {
					expected++;
				}
				else {
					userImpacting++;
				}
			}
			else if (t.severity() == Severity.WARNING) {
				if (TemplateInsights.isPerformanceViolation(t)) {
					violations++;
				}
				else {
					warnings++;
				}
			}
			else if (t.severity() == Severity.INFO) {
				info++;
			}
		}
		return new SeveritySummary(userImpacting, expected, violations, warnings, info, stackFrames);
	}

}
