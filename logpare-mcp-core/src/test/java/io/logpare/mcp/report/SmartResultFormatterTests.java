/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.report;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import io.logpare.mcp.compressor.CompressionFixtures;
import io.logpare.mcp.compressor.CompressionResult;
import io.logpare.mcp.compressor.CompressionStats;
import io.logpare.mcp.compressor.LogTemplate;
import io.logpare.mcp.compressor.OutputFormat;
import io.logpare.mcp.compressor.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Tests for {@link SmartResultFormatter}.
 */
class SmartResultFormatterTests {

	private static final CompressionStats STATS = new CompressionStats(1234, 6, 0.125, 0.9);

	private final SmartResultFormatter formatter = new SmartResultFormatter();

	private static LogTemplate template(String pattern, int occurrences, Severity severity, List<String> urls,
			List<Integer> statusCodes, List<String> correlationIds, List<String> durations) {
		return new LogTemplate("t", pattern, occurrences, severity, false, List.of(), urls, List.of(), statusCodes,
				correlationIds, durations, null, null);
	}

	private static LogTemplate frame(String pattern, int occurrences) {
		return new LogTemplate("f", pattern, occurrences, Severity.INFO, true, List.of());
	}

	@Test
	void testRendersSampleResultGroupedBySeverity() {
		String text = formatter.format(CompressionFixtures.sampleResult(), OutputFormat.SMART);

		assertThat(text).isEqualTo("""
				=== Log Analysis ===
				Source: 5 lines → 4 unique patterns

				## ERRORS (User-Impacting)
				[1x] ERROR Payment gateway timeout for order 17
				        Samples:
				          - 17
				        Stack (first occurrence):
				          at com.example.Checkout.pay(Checkout.java:<*>)

				## PERFORMANCE VIOLATIONS
				[1x] WARN [Violation] 'click' handler took 250-250ms
				        Samples: 250ms

				## INFO (Noise)
				   1 patterns, 2 total occurrences

				## STACK TRACES
				   1 frame patterns, 1 total occurrences

				---
				Compression: 80.0% | Token reduction: ~35%""");
	}

	@ParameterizedTest
	@EnumSource(value = OutputFormat.class, names = { "SUMMARY", "DETAILED", "JSON" })
	void testOtherFormatsKeepCompressorOutput(OutputFormat format) {
		assertThat(formatter.format(CompressionFixtures.sampleResult(), format))
			.isEqualTo("=== Compressed ===\n4 templates");
	}

	@Test
	void testNoErrorsIsStated() {
		String text = formatter.format(new CompressionResult(List.of(), new CompressionStats(0, 0, 0, 0), ""),
				OutputFormat.SMART);

		assertThat(text).contains("## ERRORS (User-Impacting)\n   None detected\n")
			.doesNotContain("## INFO")
			.endsWith("Compression: 0.0% | Token reduction: ~0%");
	}

	@Test
	void testExpectedFailuresAreSeparatedFromUserImpactingErrors() {
		LogTemplate blocked = template("GET <*> net::ERR_BLOCKED_BY_CLIENT", 4, Severity.ERROR,
				List.of("www.google-analytics.com"), List.of(), List.of(), List.of());
		LogTemplate real = template("Checkout failed", 2, Severity.ERROR, List.of(), List.of(), List.of(), List.of());

		String text = formatter.formatSmart(List.of(blocked, real), STATS);

		assertThat(text).contains("""
				## ERRORS (User-Impacting)
				[2x] Checkout failed

				## EXPECTED FAILURES (Ad Blocker / Network)
				   [4 total across 1 patterns]

				[4x] GET <*> net::ERR_BLOCKED_BY_CLIENT
				        Domains: www.google-analytics.com

				   Action: Expected behavior for users with ad blockers. No fix needed.
				""");
		assertThat(text).startsWith("=== Log Analysis ===\nSource: 1,234 lines → 6 unique patterns\n");
		assertThat(text).endsWith("Compression: 12.5% | Token reduction: ~90%");
	}

	@Test
	void testErrorsBeyondTenAreCounted() {
		List<LogTemplate> errors = new ArrayList<>();
		for (int i = 0; i < 13; i++) {
			errors.add(template("Error number " + i, 1, Severity.ERROR, List.of(), List.of(), List.of(), List.of()));
		}

		String text = formatter.formatSmart(errors, STATS);

		assertThat(text).contains("[1x] Error number 9\n   ... and 3 more errors\n").doesNotContain("Error number 10");
	}

	@Test
	void testErrorDetailsAndRelatedStackFrames() {
		LogTemplate error = new LogTemplate("e", "TypeError in app.bundle.js:<*> for <*>", 3, Severity.ERROR, false,
				List.of(List.of("12", "user-1"), List.of("14", "user-2")), List.of(),
				List.of("https://shop.test/a", "https://shop.test/b"), List.of(500), List.of("abcdef123456", "98765432xyz"),
				List.of(), null, null);
		LogTemplate related = frame("at render (app.bundle.js:<*>)", 2);
		LogTemplate unrelated = frame("at vendor.js:<*>", 9);

		String text = formatter.formatSmart(List.of(error, related, unrelated), STATS);

		assertThat(text).contains("""
				[3x] TypeError in app.bundle.js:12 for user-1 [ID: abcdef12]
				        URL: https://shop.test/a
				             (and 1 more URLs)
				        Status: 500
				        Additional IDs: 98765432
				        Samples:
				          - 12, user-1
				          - 14, user-2
				        Stack (first occurrence):
				          at render (app.bundle.js:<*>)
				""");
		assertThat(text).contains("## STACK TRACES\n   2 frame patterns, 11 total occurrences\n");
		assertThat(text).contains("## FILES BY ACTIVITY\n   vendor.js: 9 entries\n   bundle.js: 5 entries\n");
		assertThat(text).contains("## HTTP STATUS CODES\n   500 Internal Server Error: 3 occurrences\n");
		assertThat(text).contains("## CORRELATION IDS\n   abcdef123456, 98765432xyz\n");
	}

	@Test
	void testStackFramesFallBackToMostFrequent() {
		LogTemplate error = template("Unhandled rejection", 1, Severity.ERROR, List.of(), List.of(), List.of(),
				List.of());

		List<LogTemplate> related = SmartResultFormatter.relatedStackFrames(error,
				List.of(frame("at a", 1), frame("at b", 7), frame("at c", 3)), 2);

		assertThat(related).extracting(LogTemplate::pattern).containsExactly("at b", "at c");
		assertThat(SmartResultFormatter.relatedStackFrames(error, List.of(), 5)).isEmpty();
	}

	@Test
	void testSuccessSignalsAreSeparatedFromNoise() {
		LogTemplate completed = template("Payment completed for order <*>", 1500, Severity.INFO, List.of(),
				List.of(), List.of(), List.of());
		LogTemplate ready = template("Worker ready", 2, Severity.INFO, List.of(), List.of(), List.of(), List.of());
		LogTemplate debug = template("Cache lookup <*>", 40, Severity.INFO, List.of(), List.of(), List.of(),
				List.of());

		String text = formatter.formatSmart(List.of(completed, ready, debug), STATS);

		assertThat(text).contains("""
				## SUCCESS SIGNALS
				   [1,502 occurrences showing system is working]
				   [1500x] Payment completed for order <*>
				   [2x] Worker ready

				## INFO (Noise)
				   1 patterns, 40 total occurrences
				""");
	}

	@Test
	void testPerformanceRangeFromDurationSamples() {
		LogTemplate violation = template("[Violation] 'click' handler took <*>", 3, Severity.WARNING, List.of(),
				List.of(), List.of(), List.of("120ms", "80ms", "120ms"));

		assertThat(SmartResultFormatter.formatPerformanceTemplate(violation))
			.isEqualTo("[3x] [Violation] 'click' handler took 80-120ms\n        Durations: 120ms, 80ms, 120ms");

		LogTemplate single = template("Long task took <*>", 1, Severity.WARNING, List.of(), List.of(), List.of(),
				List.of("1.5s"));
		assertThat(SmartResultFormatter.formatPerformanceTemplate(single))
			.isEqualTo("[1x] Long task took 1.5s\n        Durations: 1.5s");
	}

	@Test
	void testPerformanceWithoutNumericSamplesUsesPlaceholder() {
		LogTemplate violation = new LogTemplate("v", "Forced reflow took <*>", 2, Severity.WARNING, false,
				List.of(List.of("slow")));

		assertThat(SmartResultFormatter.formatPerformanceTemplate(violation))
			.isEqualTo("[2x] Forced reflow took <N>ms\n        Samples: slow");
	}

	@Test
	void testWarningsAndDurationsSections() {
		LogTemplate warning = template("Deprecated API <*> used", 5, Severity.WARNING, List.of(), List.of(),
				List.of(), List.of("12ms", "40ms", "12ms"));

		String text = formatter.formatSmart(List.of(warning), STATS);

		assertThat(text).contains("## WARNINGS (Review)\n[5x] Deprecated API <*> used\n");
		assertThat(text).contains("## DURATIONS\n   12ms, 40ms\n");
		assertThat(text).doesNotContain("## PERFORMANCE VIOLATIONS");
	}

}
