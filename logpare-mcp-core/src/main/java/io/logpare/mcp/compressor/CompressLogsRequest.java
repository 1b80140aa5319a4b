/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import reactor.util.annotation.Nullable;

/**
 * Arguments of the {@code compress_logs} tool.
 *
 * @param logs raw log content as a multi-line string
 * @param format output format, {@link OutputFormat#SMART} when absent
 * @param maxTemplates maximum number of templates in the output (1..500, default 50)
 * @param depth parse tree depth (2..6), compressor default when absent
 * @param threshold similarity threshold (0..1), compressor default when absent
 * @param useTask forces asynchronous task-based processing
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompressLogsRequest( // @formatter:off
	@JsonProperty("logs") String logs,
	@JsonProperty("format") @Nullable OutputFormat format,
	@JsonProperty("max_templates") @Nullable Integer maxTemplates,
	@JsonProperty("depth") @Nullable Integer depth,
	@JsonProperty("threshold") @Nullable Double threshold,
	@JsonProperty("use_task") @Nullable Boolean useTask) { // @formatter:on

	public static final int DEFAULT_MAX_TEMPLATES = 50;

	public static final int MAX_TEMPLATES_LIMIT = 500;

	public CompressLogsRequest(String logs) {
		this(logs, null, null, null, null, null);
	}

	/**
	 * Checks the argument ranges.
	 * @return this request
	 * @throws McpError with {@link ErrorCodes#INVALID_PARAMS} if an argument is out of
	 * range
	 */
	public CompressLogsRequest validate() {
		if (this.logs == null) {
			throw invalid("logs is required");
		}
		if (this.maxTemplates != null && (this.maxTemplates < 1 || this.maxTemplates > MAX_TEMPLATES_LIMIT)) {
			throw invalid("max_templates must be between 1 and " + MAX_TEMPLATES_LIMIT);
		}
		if (this.depth != null && (this.depth < 2 || this.depth > 6)) {
			throw invalid("depth must be between 2 and 6");
		}
		if (this.threshold != null && (this.threshold < 0 || this.threshold > 1)) {
			throw invalid("threshold must be between 0 and 1");
		}
		return this;
	}

	@JsonIgnore
	public OutputFormat effectiveFormat() {
		return this.format != null ? this.format : OutputFormat.SMART;
	}

	@JsonIgnore
	public int effectiveMaxTemplates() {
		return this.maxTemplates != null ? this.maxTemplates : DEFAULT_MAX_TEMPLATES;
	}

	/**
	 * Returns the size of {@link #logs()} in UTF-8 bytes.
	 * @return the byte length
	 */
	@JsonIgnore
	public int byteLength() {
		return this.logs.getBytes(StandardCharsets.UTF_8).length;
	}

	/**
	 * Derives the compressor options for this request.
	 * @param progressListener receives progress events, {@link ProgressListener#NOOP}
	 * for none
	 * @return the options
	 */
	public CompressionOptions toOptions(ProgressListener progressListener) {
		return CompressionOptions.builder()
			.format(effectiveFormat().compressorFormat())
			.maxTemplates(effectiveMaxTemplates())
			.depth(this.depth)
			.threshold(this.threshold)
			.progressListener(progressListener)
			.build();
	}

	private static McpError invalid(String message) {
		return McpError.builder(ErrorCodes.INVALID_PARAMS).message(message).build();
	}

}
