/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import io.logpare.mcp.compressor.CompressionResult;
import io.logpare.mcp.compressor.CompressionStats;
import io.logpare.mcp.compressor.LogTemplate;
import io.logpare.mcp.compressor.OutputFormat;
import io.logpare.mcp.compressor.ResultFormatter;
import io.logpare.mcp.compressor.Severity;
import io.logpare.mcp.util.Assert;

/**
 * Renders {@link OutputFormat#SMART} results as a severity-grouped digest for language
 * models. Every other format is returned as the compressor rendered it.
 *
 * <p>
 * The digest opens with user-impacting errors, each of the first three followed by the
 * stack frames that mention the same files or URLs. Then come expected failures,
 * performance violations, other warnings, success signals and summary sections for
 * noise, stack traces, files, HTTP status codes, correlation ids and durations.
 * Sections with nothing to show are left out, except the errors section.
 */
public class SmartResultFormatter implements ResultFormatter {

	private static final String PLACEHOLDER = "<*>";

	private static final int MAX_ERRORS = 10;

	private static final int ERRORS_WITH_STACK = 3;

	private static final int MAX_EXPECTED_FAILURES = 5;

	private static final int MAX_WARNINGS = 10;

	private static final int MAX_SUCCESS_SIGNALS = 5;

	private static final int MAX_SUMMARY_ENTRIES = 5;

	private static final int MAX_DURATIONS = 10;

	private static final List<Pattern> SUCCESS_PATTERNS = List.of(Pattern.compile("\\b200\\b"),
			Pattern.compile("\\bOK\\b"), Pattern.compile("\\bsuccess", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\bcomplete[d]?\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\bloaded\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\bconnected\\b", Pattern.CASE_INSENSITIVE),
			Pattern.compile("\\bready\\b", Pattern.CASE_INSENSITIVE));

	private static final Pattern STACK_FILE = Pattern
		.compile("([a-zA-Z0-9_-]+(?:[-.]\\w+)*\\.(?:js|ts|jsx|tsx|mjs|cjs))");

	private static final Pattern ACTIVITY_FILE = Pattern.compile("([a-zA-Z0-9_-]+\\.(?:js|ts|jsx|tsx|mjs|cjs))(?::\\d+)?");

	private static final Pattern TOOK_PLACEHOLDER = Pattern.compile("took <\\*>");

	private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+(?:\\.\\d+)?)");

	private static final Pattern TRAILING_UNIT = Pattern.compile("[a-zA-Zµμ]+$");

	private static final Map<Integer, String> STATUS_LABELS = Map.ofEntries(Map.entry(200, "OK"),
			Map.entry(201, "Created"), Map.entry(204, "No Content"), Map.entry(301, "Moved Permanently"),
			Map.entry(302, "Found"), Map.entry(304, "Not Modified"), Map.entry(400, "Bad Request"),
			Map.entry(401, "Unauthorized"), Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
			Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
			Map.entry(429, "Too Many Requests"), Map.entry(500, "Internal Server Error"),
			Map.entry(502, "Bad Gateway"), Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

	@Override
	public String format(CompressionResult result, OutputFormat format) {
		Assert.notNull(result, "result must not be null");
		if (format != OutputFormat.SMART) {
			return result.formatted();
		}
		Assert.notNull(result.stats(), "result stats must not be null");
		return formatSmart(result.templates(), result.stats());
	}

	String formatSmart(List<LogTemplate> templates, CompressionStats stats) {
		List<String> lines = new ArrayList<>();
		lines.add("=== Log Analysis ===");
		lines.add("Source: " + count(stats.inputLines()) + " lines → " + stats.uniqueTemplates() + " unique patterns");
		lines.add("");

		List<LogTemplate> errors = filter(templates, t -> !t.stackFrame() && t.severity() == Severity.ERROR);
		List<LogTemplate> userImpacting = filter(errors, t -> !TemplateInsights.isExpectedFailure(t));
		List<LogTemplate> expectedFailures = filter(errors, TemplateInsights::isExpectedFailure);
		List<LogTemplate> warnings = filter(templates, t -> !t.stackFrame() && t.severity() == Severity.WARNING);
		List<LogTemplate> violations = filter(warnings, TemplateInsights::isPerformanceViolation);
		List<LogTemplate> otherWarnings = filter(warnings, t -> !TemplateInsights.isPerformanceViolation(t));
		List<LogTemplate> info = filter(templates, t -> !t.stackFrame() && t.severity() == Severity.INFO);
		List<LogTemplate> stackFrames = filter(templates, LogTemplate::stackFrame);

		lines.add("## ERRORS (User-Impacting)");
		if (userImpacting.isEmpty()) {
			lines.add("   None detected");
		}
		else {
			for (int i = 0; i < Math.min(userImpacting.size(), MAX_ERRORS); i++) {
				LogTemplate error = userImpacting.get(i);
				lines.add(formatTemplate(error));
				if (i < ERRORS_WITH_STACK) {
					appendStack(lines, relatedStackFrames(error, stackFrames, 5));
				}
			}
			appendRemainder(lines, userImpacting.size(), MAX_ERRORS, "errors");
		}
		lines.add("");

		if (!expectedFailures.isEmpty()) {
			lines.add("## EXPECTED FAILURES (Ad Blocker / Network)");
			lines.add("   [" + occurrences(expectedFailures) + " total across " + expectedFailures.size()
					+ " patterns]");
			lines.add("");
			LogTemplate first = expectedFailures.get(0);
			lines.add(formatTemplate(first));
			appendStack(lines, relatedStackFrames(first, stackFrames, 3));
			for (LogTemplate t : expectedFailures.subList(1, Math.min(expectedFailures.size(), MAX_EXPECTED_FAILURES))) {
				lines.add(formatTemplate(t));
			}
			appendRemainder(lines, expectedFailures.size(), MAX_EXPECTED_FAILURES, "expected failures");
			lines.add("");
			lines.add("   Action: Expected behavior for users with ad blockers. No fix needed.");
			lines.add("");
		}

		if (!violations.isEmpty()) {
			lines.add("## PERFORMANCE VIOLATIONS");
			for (LogTemplate t : head(violations, MAX_WARNINGS)) {
				lines.add(formatPerformanceTemplate(t));
			}
			appendRemainder(lines, violations.size(), MAX_WARNINGS, "violations");
			lines.add("");
		}

		if (!otherWarnings.isEmpty()) {
			lines.add("## WARNINGS (Review)");
			for (LogTemplate t : head(otherWarnings, MAX_WARNINGS)) {
				lines.add(formatTemplate(t));
			}
			appendRemainder(lines, otherWarnings.size(), MAX_WARNINGS, "warnings");
			lines.add("");
		}

		List<LogTemplate> successSignals = filter(info, SmartResultFormatter::isSuccessSignal);
		if (!successSignals.isEmpty()) {
			lines.add("## SUCCESS SIGNALS");
			lines.add("   [" + count(occurrences(successSignals)) + " occurrences showing system is working]");
			for (LogTemplate t : head(successSignals, MAX_SUCCESS_SIGNALS)) {
				lines.add("   [" + t.occurrences() + "x] " + t.pattern());
			}
			appendRemainder(lines, successSignals.size(), MAX_SUCCESS_SIGNALS, "success patterns");
			lines.add("");
		}

		List<LogTemplate> noise = filter(info, t -> !isSuccessSignal(t));
		if (!noise.isEmpty()) {
			lines.add("## INFO (Noise)");
			lines.add("   " + noise.size() + " patterns, " + count(occurrences(noise)) + " total occurrences");
			lines.add("");
		}

		if (!stackFrames.isEmpty()) {
			lines.add("## STACK TRACES");
			lines.add("   " + stackFrames.size() + " frame patterns, " + count(occurrences(stackFrames))
					+ " total occurrences");
			lines.add("");
		}

		List<Map.Entry<String, Long>> fileActivity = fileActivity(templates);
		if (!fileActivity.isEmpty()) {
			lines.add("## FILES BY ACTIVITY");
			for (Map.Entry<String, Long> entry : head(fileActivity, MAX_SUMMARY_ENTRIES)) {
				lines.add("   " + entry.getKey() + ": " + count(entry.getValue()) + " entries");
			}
			lines.add("");
		}

		List<Map.Entry<Integer, Long>> statusCodes = statusCodes(templates);
		if (!statusCodes.isEmpty()) {
			lines.add("## HTTP STATUS CODES");
			for (Map.Entry<Integer, Long> entry : head(statusCodes, MAX_SUMMARY_ENTRIES)) {
				lines.add("   " + entry.getKey() + " " + STATUS_LABELS.getOrDefault(entry.getKey(), "") + ": "
						+ count(entry.getValue()) + " occurrences");
			}
			lines.add("");
		}

		Set<String> correlationIds = new LinkedHashSet<>();
		templates.forEach(t -> correlationIds.addAll(t.correlationIdSamples()));
		if (!correlationIds.isEmpty()) {
			lines.add("## CORRELATION IDS");
			lines.add("   " + String.join(", ", head(new ArrayList<>(correlationIds), MAX_SUMMARY_ENTRIES)));
			if (correlationIds.size() > MAX_SUMMARY_ENTRIES) {
				lines.add("   ... and " + (correlationIds.size() - MAX_SUMMARY_ENTRIES) + " more");
			}
			lines.add("");
		}

		Set<String> durations = new LinkedHashSet<>();
		templates.forEach(t -> durations.addAll(t.durationSamples()));
		if (!durations.isEmpty()) {
			lines.add("## DURATIONS");
			lines.add("   " + String.join(", ", head(new ArrayList<>(durations), MAX_DURATIONS)));
			if (durations.size() > MAX_DURATIONS) {
				lines.add("   ... and " + (durations.size() - MAX_DURATIONS) + " more");
			}
			lines.add("");
		}

		lines.add("---");
		lines.add(String.format(Locale.ROOT, "Compression: %.1f%% | Token reduction: ~%.0f%%",
				stats.compressionRatio() * 100, stats.estimatedTokenReduction() * 100));
		return String.join("\n", lines);
	}

	/**
	 * Hydrated pattern with occurrence count and its URL, status, id and sample lines.
	 */
	static String formatTemplate(LogTemplate t) {
		List<String> parts = new ArrayList<>();
		List<String> allSamples = t.sampleVariables()
			.stream()
			.flatMap(List::stream)
			.filter(SmartResultFormatter::isConcreteSample)
			.collect(Collectors.toList());
		String hydrated = TemplateInsights.hydratePattern(t.pattern(), allSamples);

		List<String> ids = t.correlationIdSamples();
		String idSuffix = ids.isEmpty() ? "" : " [ID: " + shortId(ids.get(0)) + "]";
		parts.add("[" + t.occurrences() + "x] " + hydrated + idSuffix);

		if (!t.fullUrlSamples().isEmpty()) {
			parts.add("        URL: " + t.fullUrlSamples().get(0));
			if (t.fullUrlSamples().size() > 1) {
				parts.add("             (and " + (t.fullUrlSamples().size() - 1) + " more URLs)");
			}
		}
		else if (!t.urlSamples().isEmpty()) {
			parts.add("        Domains: " + String.join(", ", head(t.urlSamples(), 3)));
		}

		if (!t.statusCodeSamples().isEmpty()) {
			parts.add("        Status: "
					+ t.statusCodeSamples().stream().map(String::valueOf).collect(Collectors.joining(", ")));
		}

		if (ids.size() > 1) {
			parts.add("        Additional IDs: " + ids.subList(1, Math.min(ids.size(), 3))
				.stream()
				.map(SmartResultFormatter::shortId)
				.collect(Collectors.joining(", ")));
		}

		List<String> sampleLines = t.sampleVariables()
			.stream()
			.map(vars -> vars.stream()
				.filter(v -> isConcreteSample(v) && v.length() < 80)
				.collect(Collectors.joining(", ")))
			.filter(s -> !s.isEmpty())
			.collect(Collectors.toList());
		if (!sampleLines.isEmpty()) {
			parts.add("        Samples:");
			for (String sample : head(sampleLines, 3)) {
				parts.add("          - " + truncate(sample, 70));
			}
		}
		return String.join("\n", parts);
	}

	/**
	 * Performance template with its {@code took <*>} placeholder replaced by the observed
	 * range, taken from duration samples when present and numeric samples otherwise.
	 */
	static String formatPerformanceTemplate(LogTemplate t) {
		List<String> durations = t.durationSamples();
		if (!durations.isEmpty()) {
			List<Double> values = new ArrayList<>();
			for (String duration : durations) {
				Matcher matcher = LEADING_NUMBER.matcher(duration);
				double value = matcher.find() ? Double.parseDouble(matcher.group(1)) : 0;
				if (value > 0) {
					values.add(value);
				}
			}
			if (!values.isEmpty()) {
				double min = values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
				double max = values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
				Matcher unitMatcher = TRAILING_UNIT.matcher(durations.get(0));
				String unit = unitMatcher.find() ? unitMatcher.group() : "ms";
				String range = (min == max) ? number(min) + unit : number(min) + "-" + number(max) + unit;
				return "[" + t.occurrences() + "x] " + replaceTook(t.pattern(), "took " + range) + "\n"
						+ "        Durations: " + String.join(", ", head(durations, 5));
			}
		}

		List<String> parts = new ArrayList<>();
		NumericRange range = TemplateInsights.extractNumericRange(t.sampleVariables());
		if (range != null) {
			String took = "took " + number(range.min()) + "-" + number(range.max()) + range.unit();
			parts.add("[" + t.occurrences() + "x] " + replaceTook(t.pattern(), took));
		}
		else {
			parts.add("[" + t.occurrences() + "x] " + replaceTook(t.pattern(), "took <N>ms"));
		}
		List<String> samples = t.sampleVariables()
			.stream()
			.flatMap(List::stream)
			.filter(SmartResultFormatter::isConcreteSample)
			.collect(Collectors.toList());
		if (!samples.isEmpty()) {
			parts.add("        Samples: " + String.join(", ", head(samples, 5)));
		}
		return String.join("\n", parts);
	}

	/**
	 * Stack frames mentioning the same script files or URLs as the error, most frequent
	 * first. Falls back to the most frequent frames when none match.
	 */
	static List<LogTemplate> relatedStackFrames(LogTemplate error, List<LogTemplate> stackFrames, int maxFrames) {
		if (stackFrames.isEmpty()) {
			return List.of();
		}
		Set<String> files = new LinkedHashSet<>();
		Matcher matcher = STACK_FILE.matcher(error.pattern());
		while (matcher.find()) {
			files.add(matcher.group(1).toLowerCase(Locale.ROOT));
		}
		List<String> urls = new ArrayList<>(error.urlSamples());
		urls.addAll(error.fullUrlSamples());

		List<LogTemplate> related = filter(stackFrames, frame -> {
			String framePattern = frame.pattern().toLowerCase(Locale.ROOT);
			return files.stream().anyMatch(framePattern::contains)
					|| urls.stream().anyMatch(url -> framePattern.contains(url.toLowerCase(Locale.ROOT)));
		});
		List<LogTemplate> candidates = related.isEmpty() ? new ArrayList<>(stackFrames) : related;
		candidates.sort(Comparator.comparingInt(LogTemplate::occurrences).reversed());
		return head(candidates, maxFrames);
	}

	private static void appendStack(List<String> lines, List<LogTemplate> frames) {
		if (frames.isEmpty()) {
			return;
		}
		lines.add("        Stack (first occurrence):");
		for (LogTemplate frame : frames) {
			lines.add("          " + frame.pattern());
		}
	}

	private static void appendRemainder(List<String> lines, int total, int shown, String noun) {
		if (total > shown) {
			lines.add("   ... and " + (total - shown) + " more " + noun);
		}
	}

	private static List<Map.Entry<String, Long>> fileActivity(List<LogTemplate> templates) {
		Map<String, Long> counts = new LinkedHashMap<>();
		for (LogTemplate t : templates) {
			Matcher matcher = ACTIVITY_FILE.matcher(t.pattern());
			while (matcher.find()) {
				counts.merge(matcher.group(1), (long) t.occurrences(), Long::sum);
			}
		}
		return sortedByCountDescending(counts);
	}

	private static List<Map.Entry<Integer, Long>> statusCodes(List<LogTemplate> templates) {
		Map<Integer, Long> counts = new LinkedHashMap<>();
		for (LogTemplate t : templates) {
			for (Integer code : t.statusCodeSamples()) {
				counts.merge(code, (long) t.occurrences(), Long::sum);
			}
		}
		return sortedByCountDescending(counts);
	}

	private static <K> List<Map.Entry<K, Long>> sortedByCountDescending(Map<K, Long> counts) {
		List<Map.Entry<K, Long>> entries = new ArrayList<>(counts.entrySet());
		entries.sort(Map.Entry.<K, Long>comparingByValue().reversed());
		return entries;
	}

	private static boolean isSuccessSignal(LogTemplate t) {
		return SUCCESS_PATTERNS.stream().anyMatch(p -> p.matcher(t.pattern()).find());
	}

	private static boolean isConcreteSample(String sample) {
		return !sample.isEmpty() && !sample.contains(PLACEHOLDER);
	}

	private static String replaceTook(String pattern, String replacement) {
		return TOOK_PLACEHOLDER.matcher(pattern).replaceFirst(Matcher.quoteReplacement(replacement));
	}

	private static long occurrences(List<LogTemplate> templates) {
		return templates.stream().mapToLong(LogTemplate::occurrences).sum();
	}

	private static List<LogTemplate> filter(List<LogTemplate> templates, Predicate<LogTemplate> predicate) {
		return templates.stream().filter(predicate).collect(Collectors.toList());
	}

	private static <T> List<T> head(List<T> list, int max) {
		return list.subList(0, Math.min(list.size(), max));
	}

	private static String shortId(String id) {
		return id.length() > 8 ? id.substring(0, 8) : id;
	}

	private static String truncate(String value, int maxLength) {
		return value.length() <= maxLength ? value : value.substring(0, maxLength - 3) + "...";
	}

	private static String count(long value) {
		return String.format(Locale.US, "%,d", value);
	}

	private static String number(double value) {
		return value == Math.rint(value) && !Double.isInfinite(value) ? String.valueOf((long) value)
				: String.valueOf(value);
	}

}
