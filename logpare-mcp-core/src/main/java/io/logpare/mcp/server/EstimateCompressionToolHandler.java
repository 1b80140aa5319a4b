/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import java.util.Locale;

import io.logpare.mcp.compressor.CompressionOptions;
import io.logpare.mcp.compressor.CompressionResult;
import io.logpare.mcp.compressor.CompressionStats;
import io.logpare.mcp.compressor.LogCompressor;
import io.logpare.mcp.compressor.OutputFormat;
import io.logpare.mcp.util.Assert;
import io.logpare.mcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Handles the {@code estimate_compression} tool: compresses to JSON and reports the
 * expected savings without returning the compressed output.
 */
public class EstimateCompressionToolHandler {

	private static final Logger logger = LoggerFactory.getLogger(EstimateCompressionToolHandler.class);

	public static final String NAME = "estimate_compression";

	static final String GOOD = "Good candidate for compression: high repetition detected";

	static final String MODERATE = "Moderate compression potential";

	static final String LIMITED = "Limited compression potential: logs have low repetition";

	private final LogCompressor compressor;

	public EstimateCompressionToolHandler(LogCompressor compressor) {
		Assert.notNull(compressor, "compressor must not be null");
		this.compressor = compressor;
	}

	public Mono<ToolResult> handle(EstimateCompressionRequest request) {
		return Mono.fromCallable(() -> estimate(request.validate()));
	}

	private ToolResult estimate(EstimateCompressionRequest request) {
		if (Utils.nonBlankLines(request.logs()).isEmpty()) {
			return ToolResult.text("No log lines found.");
		}
		try {
			CompressionResult result = this.compressor.compress(request.logs(),
					CompressionOptions.builder().format(OutputFormat.JSON).build());
			CompressionStats stats = result.stats();
			long originalTokens = estimateTokens(request.logs());
			long compressedTokens = estimateTokens(result.formatted());
			long tokensSaved = originalTokens - compressedTokens;
			String recommendation = recommend(stats.estimatedTokenReduction());
			String text = String.join("\n", "=== Compression Estimate ===", "",
					"Input: " + grouped(stats.inputLines()) + " lines",
					"Templates: " + stats.uniqueTemplates() + " unique patterns",
					"Compression ratio: " + AnalyzeLogPatternsToolHandler.percent(stats.compressionRatio()), "",
					"Estimated tokens:", "  Original: ~" + grouped(originalTokens),
					"  Compressed: ~" + grouped(compressedTokens),
					"  Savings: ~" + grouped(tokensSaved) + " tokens ("
							+ AnalyzeLogPatternsToolHandler.percent((double) tokensSaved / originalTokens) + ")",
					"", marker(recommendation) + " " + recommendation);
			return ToolResult.of(text,
					new CompressionEstimate(stats.inputLines(), stats.uniqueTemplates(), stats.compressionRatio(),
							stats.estimatedTokenReduction(), originalTokens, compressedTokens, tokensSaved,
							recommendation));
		}
		catch (RuntimeException e) {
			logger.debug("Compression estimate failed", e);
			return ToolResult.error("Error estimating compression: " + CompressLogsToolHandler.messageOf(e));
		}
	}

	static long estimateTokens(String text) {
		return (text.length() + 3L) / 4;
	}

	static String recommend(double estimatedTokenReduction) {
		if (estimatedTokenReduction > 0.5) {
			return GOOD;
		}
		if (estimatedTokenReduction > 0.2) {
			return MODERATE;
		}
		return LIMITED;
	}

	private static String marker(String recommendation) {
		if (GOOD.equals(recommendation)) {
			return "✓";
		}
		return MODERATE.equals(recommendation) ? "△" : "✗";
	}

	private static String grouped(long value) {
		return String.format(Locale.ROOT, "%,d", value);
	}

}
