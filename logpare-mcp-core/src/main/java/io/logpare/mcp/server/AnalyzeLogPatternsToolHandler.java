/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import io.logpare.mcp.compressor.CompressionOptions;
import io.logpare.mcp.compressor.CompressionResult;
import io.logpare.mcp.compressor.LogCompressor;
import io.logpare.mcp.compressor.LogTemplate;
import io.logpare.mcp.compressor.OutputFormat;
import io.logpare.mcp.util.Assert;
import io.logpare.mcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Handles the {@code analyze_log_patterns} tool: extracts templates with their counts
 * and sample values, without producing compressed output.
 */
public class AnalyzeLogPatternsToolHandler {

	private static final Logger logger = LoggerFactory.getLogger(AnalyzeLogPatternsToolHandler.class);

	public static final String NAME = "analyze_log_patterns";

	private static final int SAMPLE_ROWS = 3;

	private final LogCompressor compressor;

	public AnalyzeLogPatternsToolHandler(LogCompressor compressor) {
		Assert.notNull(compressor, "compressor must not be null");
		this.compressor = compressor;
	}

	public Mono<ToolResult> handle(AnalyzeLogPatternsRequest request) {
		return Mono.fromCallable(() -> analyze(request.validate()));
	}

	private ToolResult analyze(AnalyzeLogPatternsRequest request) {
		if (Utils.nonBlankLines(request.logs()).isEmpty()) {
			return ToolResult.text("No log lines found to analyze.");
		}
		int maxTemplates = request.effectiveMaxTemplates();
		try {
			CompressionResult result = this.compressor.compress(request.logs(),
					CompressionOptions.builder().format(OutputFormat.DETAILED).maxTemplates(maxTemplates).build());
			List<LogTemplate> shown = result.templates().stream().limit(maxTemplates).toList();
			PatternAnalysis analysis = new PatternAnalysis(result.stats().inputLines(),
					result.stats().uniqueTemplates(), result.stats().estimatedTokenReduction(),
					shown.stream().map(PatternAnalysis.Pattern::from).toList());
			return ToolResult.of(render(result, shown, maxTemplates), analysis);
		}
		catch (RuntimeException e) {
			logger.debug("Pattern analysis failed", e);
			return ToolResult.error("Error analyzing logs: " + CompressLogsToolHandler.messageOf(e));
		}
	}

	private static String render(CompressionResult result, List<LogTemplate> shown, int maxTemplates) {
		List<String> entries = new ArrayList<>();
		for (int i = 0; i < shown.size(); i++) {
			LogTemplate template = shown.get(i);
			String samples = template.sampleVariables()
				.stream()
				.limit(SAMPLE_ROWS)
				.map(values -> String.join(", ", values))
				.collect(Collectors.joining(" | "));
			entries.add((i + 1) + ". [" + template.occurrences() + "x] " + template.pattern()
					+ (samples.isEmpty() ? "" : "\n   Sample values: " + samples));
		}
		int hidden = result.templates().size() - maxTemplates;
		return String.join("\n", List.of("=== Log Pattern Analysis ===", "",
				"Lines analyzed: " + result.stats().inputLines(),
				"Unique templates found: " + result.stats().uniqueTemplates(),
				"Potential token reduction: " + percent(result.stats().estimatedTokenReduction()), "",
				"Top templates by frequency:", "", String.join("\n\n", entries),
				hidden > 0 ? "\n... and " + hidden + " more templates" : ""));
	}

	static String percent(double fraction) {
		return String.format(Locale.ROOT, "%.1f%%", fraction * 100);
	}

}
