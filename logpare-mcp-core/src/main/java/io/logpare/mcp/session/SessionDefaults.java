/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

/**
 * Default constants for session handling.
 */
public final class SessionDefaults {

	private SessionDefaults() {
	}

	/**
	 * Inactivity after which a session is evicted (30 minutes).
	 */
	public static final long SESSION_TIMEOUT_MS = 30 * 60 * 1000L;

	/**
	 * Interval between idle-session sweeps (1 minute).
	 */
	public static final long SWEEP_INTERVAL_MS = 60_000L;

	public static final long SHUTDOWN_TIMEOUT_SECONDS = 5L;

	/**
	 * Header carrying the session id on HTTP requests and replies.
	 */
	public static final String SESSION_ID_HEADER = "Mcp-Session-Id";

}
