/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import io.logpare.mcp.compressor.LogTemplate;
import reactor.util.annotation.Nullable;

/**
 * Heuristics that classify extracted templates for the structured report.
 */
public final class TemplateInsights {

	private static final String PLACEHOLDER = "<*>";

	// Ad blockers, blocked analytics and flaky client networks
	private static final List<Pattern> EXPECTED_FAILURE_PATTERNS = List.of(
			Pattern.compile("ERR_BLOCKED_BY_CLIENT", Pattern.CASE_INSENSITIVE),
			Pattern.compile("net::ERR_", Pattern.CASE_INSENSITIVE),
			Pattern.compile("Failed to fetch", Pattern.CASE_INSENSITIVE),
			Pattern.compile("NetworkError", Pattern.CASE_INSENSITIVE),
			Pattern.compile("blocked by client", Pattern.CASE_INSENSITIVE));

	private static final List<String> EXPECTED_FAILURE_DOMAINS = List.of("monorail-edge.shopifysvc.com",
			"api.amplitude.com", "connect.facebook.net", "kameleoon.io", "cdn.attn.tv", "ping.fastsimon.com",
			"www.google-analytics.com", "stats.g.doubleclick.net", "www.googletagmanager.com", "analytics",
			"tracking", "pixel", "beacon");

	private static final List<Pattern> PERFORMANCE_VIOLATION_PATTERNS = List.of(
			Pattern.compile("\\[Violation\\]", Pattern.CASE_INSENSITIVE),
			Pattern.compile("handler took", Pattern.CASE_INSENSITIVE),
			Pattern.compile("Forced reflow", Pattern.CASE_INSENSITIVE),
			Pattern.compile("Long task", Pattern.CASE_INSENSITIVE));

	private static final Pattern NUMERIC_SAMPLE = Pattern.compile("^(\\d+(?:\\.\\d+)?)(ms|s|KB|MB|GB|%|px)?$");

	private TemplateInsights() {
	}

	/**
	 * Whether the template describes a failure that is expected for some users and not
	 * actionable, such as a request blocked by an ad blocker.
	 * @param template the template
	 * @return {@code true} for expected failures
	 */
	public static boolean isExpectedFailure(LogTemplate template) {
		if (EXPECTED_FAILURE_PATTERNS.stream().anyMatch(p -> p.matcher(template.pattern()).find())) {
			return true;
		}
		return Stream.concat(template.urlSamples().stream(), template.fullUrlSamples().stream())
			.map(url -> url.toLowerCase(Locale.ROOT))
			.anyMatch(url -> EXPECTED_FAILURE_DOMAINS.stream().anyMatch(url::contains));
	}

	public static boolean isPerformanceViolation(LogTemplate template) {
		return PERFORMANCE_VIOLATION_PATTERNS.stream().anyMatch(p -> p.matcher(template.pattern()).find());
	}

	/**
	 * Replaces the {@code <*>} placeholders of a pattern with sample values, left to
	 * right.
	 * @param pattern the template pattern
	 * @param samples one sample value per placeholder, may be shorter or empty
	 * @return the hydrated example line
	 */
	public static String hydratePattern(String pattern, @Nullable List<String> samples) {
		if (samples == null || samples.isEmpty()) {
			return pattern;
		}
		StringBuilder result = new StringBuilder(pattern);
		for (String value : samples) {
			int index = result.indexOf(PLACEHOLDER);
			if (index < 0) {
				break;
			}
			result.replace(index, index + PLACEHOLDER.length(), value);
		}
		return result.toString();
	}

	/**
	 * Computes the range of numeric sample values, keeping the last unit seen.
	 * @param sampleVariables the template's sample variable sets
	 * @return the range, or {@code null} when no sample is numeric
	 */
	@Nullable
	public static NumericRange extractNumericRange(List<List<String>> sampleVariables) {
		List<Double> values = new ArrayList<>();
		String unit = "";
		for (List<String> sampleSet : sampleVariables) {
			for (String sample : sampleSet) {
				Matcher matcher = NUMERIC_SAMPLE.matcher(sample);
				if (matcher.matches()) {
					values.add(Double.parseDouble(matcher.group(1)));
					if (matcher.group(2) != null) {
						unit = matcher.group(2);
					}
				}
			}
		}
		if (values.isEmpty()) {
			return null;
		}
		double min = values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
		double max = values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
		double avg = values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
		return new NumericRange(min, max, Math.round(avg * 10) / 10.0, unit);
	}

}
