/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

/**
 * Renders a compression result as the text returned to the client.
 */
@FunctionalInterface
public interface ResultFormatter {

	/**
	 * Renders the result.
	 * @param result the compressor output
	 * @param format the format requested by the client, which may differ from the one
	 * the compressor produced (see {@link OutputFormat#compressorFormat()})
	 * @return the text
	 */
	String format(CompressionResult result, OutputFormat format);

}
