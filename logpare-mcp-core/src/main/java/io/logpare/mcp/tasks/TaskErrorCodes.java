/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

/**
 * Codes stored in {@link TaskError#code()}.
 */
public final class TaskErrorCodes {

	private TaskErrorCodes() {
	}

	public static final String CANCELLED = "CANCELLED";

	/**
	 * The input was empty or could not be parsed.
	 */
	public static final String INVALID_INPUT = "INVALID_INPUT";

	/**
	 * The job ran out of memory or another resource.
	 */
	public static final String INPUT_TOO_LARGE = "INPUT_TOO_LARGE";

	public static final String COMPRESSION_FAILED = "COMPRESSION_FAILED";

}
