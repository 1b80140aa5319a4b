/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.report;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.compressor.CompressionResult;
import io.logpare.mcp.compressor.CompressionStats;
import reactor.util.annotation.Nullable;

/**
 * Structured content returned alongside the rendered text of a compression.
 *
 * @param compressionRatio compressed size relative to the input
 * @param inputLines number of lines processed
 * @param uniqueTemplates number of distinct templates
 * @param estimatedTokenReduction estimated fraction of tokens saved
 * @param summary counts per diagnostic category over all templates
 * @param templates enriched templates, limited to the requested maximum
 * @param processingTimeMs wall time of an asynchronous run, {@code null} for inline runs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompressionReport( // @formatter:off
	@JsonProperty("compressionRatio") double compressionRatio,
	@JsonProperty("inputLines") int inputLines,
	@JsonProperty("uniqueTemplates") int uniqueTemplates,
	@JsonProperty("estimatedTokenReduction") double estimatedTokenReduction,
	@JsonProperty("summary") SeveritySummary summary,
	@JsonProperty("templates") List<TemplateReport> templates,
	@JsonProperty("processingTimeMs") @Nullable Long processingTimeMs) { // @formatter:on

	public CompressionReport {
		templates = templates != null ? List.copyOf(templates) : List.of();
	}

	/**
	 * Builds the report for a compression result.
	 * @param result the compressor output
	 * @param maxTemplates maximum number of templates to include
	 * @param processingTimeMs processing time to record, or {@code null}
	 * @return the report
	 */
	public static CompressionReport of(CompressionResult result, int maxTemplates, @Nullable Long processingTimeMs) {
		CompressionStats stats = result.stats();
		List<TemplateReport> templates = result.templates()
			.stream()
			.limit(maxTemplates)
			.map(TemplateReport::from)
			.toList();
		return new CompressionReport(stats.compressionRatio(), stats.inputLines(), stats.uniqueTemplates(),
				stats.estimatedTokenReduction(), SeveritySummary.of(result.templates()), templates, processingTimeMs);
	}

}
