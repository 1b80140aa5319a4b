/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

/**
 * Default constants for task-related operations.
 */
public final class TaskDefaults {

	private TaskDefaults() {
		// Utility class - no instantiation
	}

	/**
	 * Default time-to-live in milliseconds for tasks (5 minutes). Tasks older than their
	 * TTL are removed by the next cleanup run, whatever their status.
	 */
	public static final long DEFAULT_TTL_MS = 5 * 60 * 1000L;

	/**
	 * Default poll interval in milliseconds suggested to clients.
	 */
	public static final long DEFAULT_POLL_INTERVAL_MS = 1_000L;

	/**
	 * Interval in milliseconds between expired-task cleanup runs.
	 */
	public static final long CLEANUP_INTERVAL_MS = 30_000L;

	/**
	 * Inputs of at least this many UTF-8 bytes (1 MiB) are compressed asynchronously.
	 */
	public static final int ASYNC_THRESHOLD_BYTES = 1024 * 1024;

	/**
	 * Timeout in seconds for awaiting termination of the cleanup executor on shutdown.
	 */
	public static final long TASK_STORE_SHUTDOWN_TIMEOUT_SECONDS = 5L;

}
