/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

import io.logpare.mcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Options handed to {@link LogCompressor#compress}.
 */
public final class CompressionOptions {

	private final OutputFormat format;

	private final int maxTemplates;

	private final Integer depth;

	private final Double threshold;

	private final ProgressListener progressListener;

	private CompressionOptions(Builder builder) {
		this.format = builder.format;
		this.maxTemplates = builder.maxTemplates;
		this.depth = builder.depth;
		this.threshold = builder.threshold;
		this.progressListener = builder.progressListener;
	}

	public OutputFormat format() {
		return this.format;
	}

	public int maxTemplates() {
		return this.maxTemplates;
	}

	/**
	 * Parse tree depth, or {@code null} for the compressor's default.
	 * @return the depth
	 */
	@Nullable
	public Integer depth() {
		return this.depth;
	}

	/**
	 * Similarity threshold, or {@code null} for the compressor's default.
	 * @return the threshold
	 */
	@Nullable
	public Double threshold() {
		return this.threshold;
	}

	public ProgressListener progressListener() {
		return this.progressListener;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private OutputFormat format = OutputFormat.DETAILED;

		private int maxTemplates = 50;

		private Integer depth;

		private Double threshold;

		private ProgressListener progressListener = ProgressListener.NOOP;

		public Builder format(OutputFormat format) {
			Assert.notNull(format, "format must not be null");
			this.format = format;
			return this;
		}

		public Builder maxTemplates(int maxTemplates) {
			Assert.isTrue(maxTemplates > 0, "maxTemplates must be positive");
			this.maxTemplates = maxTemplates;
			return this;
		}

		public Builder depth(@Nullable Integer depth) {
			this.depth = depth;
			return this;
		}

		public Builder threshold(@Nullable Double threshold) {
			this.threshold = threshold;
			return this;
		}

		public Builder progressListener(ProgressListener progressListener) {
			Assert.notNull(progressListener, "progressListener must not be null");
			this.progressListener = progressListener;
			return this;
		}

		public CompressionOptions build() {
			return new CompressionOptions(this);
		}

	}

}
