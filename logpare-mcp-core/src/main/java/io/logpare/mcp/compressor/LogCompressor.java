/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.compressor;

/**
 * The log template extraction algorithm. Implementations group similar log lines into
 * templates and report statistics about the achieved reduction.
 *
 * <p>
 * Implementations must be safe to invoke from a scheduler thread other than the one
 * that accepted the request. Progress is reported through
 * {@link CompressionOptions#progressListener()} zero or more times before
 * {@link #compress} returns; the listener call is the only point at which a running
 * job can observe cancellation.
 */
@FunctionalInterface
public interface LogCompressor {

	/**
	 * Compresses the given log text.
	 * @param text raw, multi-line log content
	 * @param options compression options, never {@code null}
	 * @return the compression result
	 * @throws RuntimeException when the input cannot be processed; the message is used
	 * to classify the failure
	 */
	CompressionResult compress(String text, CompressionOptions options);

}
